package rubysharp;

import rubysharp.config.StructurePolicy;
import rubysharp.config.TranspilerConfig;
import rubysharp.exception.TranspileException;
import rubysharp.print.KeywordTable;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * rubysharp [--strict] [--keywords table.properties] &lt;input&gt; &lt;output&gt;
 * </pre>
 *
 * A directory input is transpiled file by file into a parallel tree under the
 * output directory.
 */
public final class Main {
	private static final Logger log = Logger.getLogger(Main.class.getName());

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE =
			"usage: rubysharp [--strict] [--keywords <table.properties>] <input> <output>";

	private Main() {
	}

	public static void main(String[] args) {
		configureLogging();
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		var builder = TranspilerConfig.builder();
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.equals("--strict")) {
				builder.structurePolicy(StructurePolicy.STRICT);
				continue;
			}
			if (arg.equals("--keywords")) {
				if (i + 1 >= args.length) {
					err.println("--keywords requires a file argument");
					err.println(USAGE);
					return EXIT_USAGE;
				}
				try {
					builder.keywordTable(KeywordTable.load(Path.of(args[++i])));
				} catch (IOException | TranspileException e) {
					err.println("Cannot read keyword table: " + e.getMessage());
					return EXIT_FAILURE;
				}
				continue;
			}
			if (arg.startsWith("--")) {
				err.println("Unknown option: " + arg);
				err.println(USAGE);
				return EXIT_USAGE;
			}
			positional.add(arg);
		}

		if (positional.size() != 2) {
			err.println(USAGE);
			return EXIT_USAGE;
		}

		Path input = Path.of(positional.get(0));
		Path output = Path.of(positional.get(1));
		var project = new ProjectTranspiler(builder.build());
		try {
			if (Files.isDirectory(input)) {
				var written = project.transpileTree(input, output);
				out.println("Transpilation complete. " + written.size() + " C# file(s) written to " + output);
			} else {
				project.transpileFile(input, output);
				out.println("Transpilation complete. C# code written to " + output);
			}
			return EXIT_OK;
		} catch (TranspileException e) {
			err.println("Transpilation failed: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (IOException e) {
			err.println("I/O error: " + e);
			return EXIT_FAILURE;
		}
	}

	private static void configureLogging() {
		try (InputStream in = Main.class.getClassLoader().getResourceAsStream("rubysharp-logging.properties")) {
			if (in != null) {
				LogManager.getLogManager().readConfiguration(in);
			}
		} catch (IOException e) {
			log.warning(() -> "Could not load logging configuration: " + e.getMessage());
		}
	}
}
