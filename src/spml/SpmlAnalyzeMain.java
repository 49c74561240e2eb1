package spml;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.io.filefilter.NameFileFilter;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import spml.errors.DocumentParseIssue;
import spml.errors.IOErrorIssue;
import spml.errors.InFile;
import spml.errors.IssueContext;
import spml.errors.TopLevelIssueContext;
import spml.formatters.CodeQualityFormatter;
import spml.formatters.DocumentFormattingVisitor;
import spml.model.document.Document;
import spml.model.schema.TagSchema;
import spml.parser.DocumentParser;
import spml.parser.SpmlParseException;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Parses SPML files and reports their structural findings. Exits with 0 if there are none, 1 if there are and 2
 * if the command line or configuration is unusable.
 */
public class SpmlAnalyzeMain {
	private static final Logger logger = Logger.getLogger(SpmlAnalyzeMain.class.getName());
	// parent of every logger in the project, held so that its level survives
	private static final Logger projectLogger = Logger.getLogger("spml");

	public static final int EXIT_CLEAN = 0;
	public static final int EXIT_FINDINGS = 1;
	public static final int EXIT_USAGE = 2;

	private final String[] cmdArgs;
	private final PrintStream out;

	public SpmlAnalyzeMain(String[] args, PrintStream out) {
		this.cmdArgs = args;
		this.out = out;
	}

	public static void main(String[] args) {
		System.exit(new SpmlAnalyzeMain(args, System.out).run());
	}

	public int run() {
		SpmlOptions opts = new SpmlOptions(cmdArgs);
		try {
			if (!opts.parse()) {
				return EXIT_CLEAN;
			}
		} catch (SpmlOptionException e) {
			System.err.println("unable to parse options: " + e.getMessage());
			opts.printHelp();
			return EXIT_USAGE;
		}
		setLogLevel(opts);

		TagSchema schema;
		try {
			schema = TagSchema.load();
		} catch (IOException e) {
			logger.severe("unable to load the tag schema: " + e.getMessage());
			return EXIT_USAGE;
		}

		TopLevelIssueContext ctx = new TopLevelIssueContext();
		File input = new File(opts.inputPath);
		if (!input.exists()) {
			ctx.withContext(new InFile(input.getPath())).error(new IOErrorIssue(
					new FileNotFoundException(input.getPath() + " does not exist")));
		}
		List<File> files = findFiles(input, opts);
		logger.info("Analyzing " + files.size() + " file(s)");
		for (File file : files) {
			analyze(ctx.withContext(new InFile(file.getPath())), file, schema, opts);
		}

		switch (opts.outputFormat) {
			case JSON:
				out.println(CodeQualityFormatter.format(ctx.getIssues()).toString(2));
				break;
			default:
				if (ctx.hasErrors()) {
					out.println(ctx.format());
				}
		}
		if (ctx.hasErrors()) {
			logger.info("Found " + ctx.issueCount() + " issue(s)");
			return EXIT_FINDINGS;
		}
		logger.info("Finished");
		return EXIT_CLEAN;
	}

	private void analyze(IssueContext ctx, File file, TagSchema schema, SpmlOptions opts) {
		logger.fine("Parsing " + file);
		String text;
		try {
			text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warning("unable to read " + file + ": " + e.getMessage());
			ctx.error(new IOErrorIssue(e));
			return;
		}
		Document document;
		try {
			document = DocumentParser.parse(text, schema);
		} catch (SpmlParseException e) {
			ctx.error(new DocumentParseIssue(e));
			return;
		}
		if (opts.tree) {
			out.println("== " + file.getPath());
			out.println(DocumentFormattingVisitor.format(document));
		}
		DocumentIssueCollector.collect(ctx, document, opts.includeSyntaxErrors);
	}

	static List<File> findFiles(File input, SpmlOptions opts) {
		if (input.isFile()) {
			return Collections.singletonList(input);
		}
		if (!input.isDirectory()) {
			return Collections.emptyList();
		}
		List<String> suffixes = opts.extensions.stream().map(e -> "." + e).collect(Collectors.toList());
		IOFileFilter fileFilter = new SuffixFileFilter(suffixes);
		IOFileFilter dirFilter = FileFilterUtils.notFileFilter(new NameFileFilter(opts.exclude));
		List<File> files = new ArrayList<>(FileUtils.listFiles(input, fileFilter, dirFilter));
		Collections.sort(files);
		return files;
	}

	private static void setLogLevel(SpmlOptions opts) {
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		projectLogger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
	}
}
