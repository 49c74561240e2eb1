package spml;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SpmlAnalyzeMainTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

	private int run(String... args) throws IOException {
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
		return new SpmlAnalyzeMain(args, out).run();
	}

	private String output() throws IOException {
		return bytes.toString(StandardCharsets.UTF_8.name());
	}

	private File write(String name, String text) throws IOException {
		File file = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void cleanFile() throws IOException {
		File file = write("clean.spml", "<div>hello</div>");
		assertThat(run("-q", file.getPath()), is(SpmlAnalyzeMain.EXIT_CLEAN));
		assertThat(output(), is(""));
	}

	@Test
	public void findingsAsText() throws IOException {
		File file = write("open.spml", "<sp:if name=\"_a\">\n  hello\n");
		assertThat(run("-q", file.getPath()), is(SpmlAnalyzeMain.EXIT_FINDINGS));
		assertThat(output(), containsString("Detected 1 issue(s):"));
		assertThat(output(), containsString("in file " + file.getPath()));
		assertThat(output(), containsString("missing \"</sp:if>\" at line 2 column 8"));
	}

	@Test
	public void findingsAsJson() throws IOException {
		write("open.spml", "<sp:if name=\"_a\">\n  hello\n");
		write("clean.spml", "<div>hello</div>");
		assertThat(run("-q", "-f", "json", folder.getRoot().getPath()), is(SpmlAnalyzeMain.EXIT_FINDINGS));
		JSONArray report = new JSONArray(output());
		assertThat(report.length(), is(1));
		assertThat(report.getJSONObject(0).getString("check_name"), is("spml-structure"));
		assertThat(report.getJSONObject(0).getJSONObject("location").getString("path"),
				endsWith("open.spml"));
	}

	@Test
	public void treeOutline() throws IOException {
		File file = write("clean.spml", "<div>hello</div>");
		assertThat(run("-q", "--tree", file.getPath()), is(SpmlAnalyzeMain.EXIT_CLEAN));
		assertThat(output(), containsString("== " + file.getPath()));
		assertThat(output(), containsString("html div"));
	}

	@Test
	public void missingInputIsReported() throws IOException {
		File absent = new File(folder.getRoot(), "absent");
		assertThat(run("-q", absent.getPath()), is(SpmlAnalyzeMain.EXIT_FINDINGS));
		assertThat(output(), containsString("IO Error"));
	}

	@Test
	public void noArguments() throws IOException {
		assertThat(run(), is(SpmlAnalyzeMain.EXIT_USAGE));
	}

	@Test
	public void findFilesHonorsExtensionsAndExclusions() throws IOException {
		write("a.spml", "");
		write("b.jsp", "");
		write("c.txt", "");
		write("build/d.spml", "");
		write("sub/e.spml", "");

		SpmlOptions opts = new SpmlOptions(new String[]{"dir"});
		opts.extensions = Arrays.asList("spml", "jsp");
		opts.exclude = Arrays.asList("build");
		List<File> files = SpmlAnalyzeMain.findFiles(folder.getRoot(), opts);
		assertThat(files, is(Arrays.asList(
				new File(folder.getRoot(), "a.spml"),
				new File(folder.getRoot(), "b.jsp"),
				new File(folder.getRoot(), "sub/e.spml"))));
	}
}
