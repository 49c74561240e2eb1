package spml;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public class SpmlOptions {
	public static final String VERSION = "0.1.0";

	public enum Format {
		TEXT,
		JSON,
	}

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-f Output format of the findings, text or json", aliases = {"-format"})
	public String format = "text";

	@Option(value = "Print the outline of every parsed document")
	public boolean tree = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public String inputPath;
	public Format outputFormat = Format.TEXT;

	// fields extracted from the JSON configuration file
	public List<String> extensions = Collections.singletonList("spml");
	public List<String> exclude = Collections.emptyList();
	public boolean includeSyntaxErrors = true;

	private final Options plumeOptions;
	private final String[] remainingArgs;

	public SpmlOptions(String[] args) {
		plumeOptions = new Options("spml-analyze [options] file-or-directory", this);
		// unknown flags print the usage and exit
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * Validates the flags and reads the configuration file.
	 *
	 * @return false if only the version or the usage was asked for
	 */
	public boolean parse() throws SpmlOptionException {
		if (version) {
			System.out.println("spml-analyze version " + VERSION);
			return false;
		}
		if (help) {
			printHelp();
			return false;
		}
		if (remainingArgs.length != 1) {
			throw new SpmlOptionException("expected exactly one file or directory, got " + remainingArgs.length);
		}
		inputPath = remainingArgs[0];

		try {
			outputFormat = Format.valueOf(format.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new SpmlOptionException("unknown output format \"" + format + "\", expected text or json");
		}

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new SpmlOptionException("Error reading configuration file: " + ex.getMessage());
			}
			applyConfiguration(s, configFilePath);
		}
		return true;
	}

	void applyConfiguration(String json, String origin) throws SpmlOptionException {
		try {
			JSONObject config = new JSONObject(json);
			if (config.has("extensions")) {
				extensions = strings(config.getJSONArray("extensions"));
			}
			if (config.has("exclude")) {
				exclude = strings(config.getJSONArray("exclude"));
			}
			if (config.has("include_syntax_errors")) {
				includeSyntaxErrors = config.getBoolean("include_syntax_errors");
			}
		} catch (JSONException e) {
			throw new SpmlOptionException(origin + ": parsing error: " + e.getMessage());
		}
	}

	private static List<String> strings(JSONArray array) {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			result.add(array.getString(i));
		}
		return result;
	}
}
