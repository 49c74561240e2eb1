package spml;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SpmlOptionsTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void defaults() throws SpmlOptionException {
		SpmlOptions opts = new SpmlOptions(new String[]{"pages"});
		assertTrue(opts.parse());
		assertThat(opts.inputPath, is("pages"));
		assertThat(opts.outputFormat, is(SpmlOptions.Format.TEXT));
		assertThat(opts.extensions, is(Collections.singletonList("spml")));
		assertTrue(opts.exclude.isEmpty());
		assertTrue(opts.includeSyntaxErrors);
	}

	@Test
	public void jsonFormat() throws SpmlOptionException {
		SpmlOptions opts = new SpmlOptions(new String[]{"-f", "json", "dir"});
		assertTrue(opts.parse());
		assertThat(opts.outputFormat, is(SpmlOptions.Format.JSON));
		assertThat(opts.inputPath, is("dir"));
	}

	@Test
	public void unknownFormat() {
		SpmlOptions opts = new SpmlOptions(new String[]{"-f", "xml", "dir"});
		try {
			opts.parse();
			fail("expected the format to be rejected");
		} catch (SpmlOptionException e) {
			assertThat(e.getMessage(), is("unknown output format \"xml\", expected text or json"));
		}
	}

	@Test(expected = SpmlOptionException.class)
	public void missingInput() throws SpmlOptionException {
		new SpmlOptions(new String[0]).parse();
	}

	@Test(expected = SpmlOptionException.class)
	public void tooManyInputs() throws SpmlOptionException {
		new SpmlOptions(new String[]{"a", "b"}).parse();
	}

	@Test
	public void applyConfiguration() throws SpmlOptionException {
		SpmlOptions opts = new SpmlOptions(new String[]{"dir"});
		opts.applyConfiguration("{\"extensions\": [\"spml\", \"jsp\"], \"exclude\": [\"build\"], "
				+ "\"include_syntax_errors\": false}", "config.json");
		assertThat(opts.extensions, is(Arrays.asList("spml", "jsp")));
		assertThat(opts.exclude, is(Collections.singletonList("build")));
		assertFalse(opts.includeSyntaxErrors);
	}

	@Test
	public void invalidConfiguration() {
		SpmlOptions opts = new SpmlOptions(new String[]{"dir"});
		try {
			opts.applyConfiguration("{\"extensions\": 3}", "config.json");
			fail("expected the configuration to be rejected");
		} catch (SpmlOptionException e) {
			assertThat(e.getMessage(), startsWith("config.json: parsing error: "));
		}
	}

	@Test
	public void configurationFile() throws IOException, SpmlOptionException {
		File config = folder.newFile("spml.json");
		FileUtils.writeStringToFile(config, "{\"exclude\": [\"node_modules\"]}", StandardCharsets.UTF_8);
		SpmlOptions opts = new SpmlOptions(new String[]{"-c", config.getPath(), "dir"});
		assertTrue(opts.parse());
		assertThat(opts.exclude, is(Collections.singletonList("node_modules")));
		assertThat(opts.extensions, is(Collections.singletonList("spml")));
	}

	@Test(expected = SpmlOptionException.class)
	public void missingConfigurationFile() throws SpmlOptionException {
		new SpmlOptions(new String[]{"-c", new File(folder.getRoot(), "absent.json").getPath(), "dir"}).parse();
	}
}
