package rubysharp;

import rubysharp.config.TranspilerConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Transpiles single files, or a tree of Ruby source files to a parallel tree
 * of C# files.
 *
 * Each input file produces one output file; files are never merged. An output
 * file is written only once its whole input has been transpiled.
 */
public final class ProjectTranspiler {
	private static final Logger log = Logger.getLogger(ProjectTranspiler.class.getName());

	private final TranspilerConfig config;
	private final Transpiler transpiler;

	public ProjectTranspiler() {
		this(TranspilerConfig.defaults());
	}

	public ProjectTranspiler(TranspilerConfig config) {
		this.config = config;
		this.transpiler = new Transpiler(config);
	}

	public List<Path> transpileTree(Path rubyRoot, Path outRoot) throws IOException {
		List<Path> written = new ArrayList<>();
		try (Stream<Path> paths = Files.walk(rubyRoot)) {
			paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(config.getSourceExtension()))
					.sorted()
					.forEach(p -> written.add(transpileOneUnchecked(rubyRoot, outRoot, p)));
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}
		log.info(() -> String.format("Transpiled %d file(s) from %s to %s", written.size(), rubyRoot, outRoot));
		return written;
	}

	public void transpileFile(Path rubyFile, Path outFile) throws IOException {
		String rubySource = Files.readString(rubyFile, StandardCharsets.UTF_8);
		String csharpSource = transpiler.transpile(rubySource);

		Path parent = outFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(outFile, csharpSource, StandardCharsets.UTF_8);
		log.fine(() -> "Wrote " + outFile);
	}

	Path targetFor(Path rubyRoot, Path outRoot, Path rubyFile) {
		Path rel = rubyRoot.relativize(rubyFile);
		String fileName = rel.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - config.getSourceExtension().length());
		String target = base + config.getTargetExtension();
		Path outRel = rel.getParent() == null ? Path.of(target) : rel.getParent().resolve(target);
		return outRoot.resolve(outRel);
	}

	private Path transpileOneUnchecked(Path rubyRoot, Path outRoot, Path rubyFile) {
		Path outFile = targetFor(rubyRoot, outRoot, rubyFile);
		try {
			transpileFile(rubyFile, outFile);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return outFile;
	}
}
