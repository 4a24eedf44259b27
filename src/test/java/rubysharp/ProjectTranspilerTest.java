package rubysharp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rubysharp.exception.UnbalancedBlockException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectTranspilerTest {
	@Test
	void transpilesMultipleFilesWithoutMerging(@TempDir Path dir) throws Exception {
		Path rubyRoot = dir.resolve("ruby");
		Path outRoot = dir.resolve("cs");

		Path greeterRb = rubyRoot.resolve(Path.of("app", "greeter.rb"));
		Path counterRb = rubyRoot.resolve(Path.of("lib", "util", "counter.rb"));
		Path readme = rubyRoot.resolve("README.md");
		Files.createDirectories(greeterRb.getParent());
		Files.createDirectories(counterRb.getParent());

		Files.writeString(greeterRb, "class Greeter\ndef hello\nputs\nend\nend\n");
		Files.writeString(counterRb, "class Counter\ndef tick\nnil\nend\nend\n");
		Files.writeString(readme, "class Ignored end");

		List<Path> written = new ProjectTranspiler().transpileTree(rubyRoot, outRoot);

		Path greeterCs = outRoot.resolve(Path.of("app", "greeter.cs"));
		Path counterCs = outRoot.resolve(Path.of("lib", "util", "counter.cs"));
		assertEquals(List.of(greeterCs, counterCs), written);
		assertTrue(Files.readString(greeterCs).startsWith("public class Greeter {\n"));
		assertEquals("public class Counter {\n    public void tick() {\n        null\n    }\n}\n",
				Files.readString(counterCs));
		assertFalse(Files.exists(outRoot.resolve("README.cs")));
	}

	@Test
	void failedFileIsNotWritten(@TempDir Path dir) throws Exception {
		Path rubyRoot = dir.resolve("ruby");
		Files.createDirectories(rubyRoot);
		Files.writeString(rubyRoot.resolve("broken.rb"), "class A end end");

		Path outRoot = dir.resolve("cs");
		assertThrows(UnbalancedBlockException.class,
				() -> new ProjectTranspiler().transpileTree(rubyRoot, outRoot));
		assertFalse(Files.exists(outRoot.resolve("broken.cs")));
	}

	@Test
	void missingRootIsAnIoError(@TempDir Path dir) {
		assertThrows(java.io.IOException.class,
				() -> new ProjectTranspiler().transpileTree(dir.resolve("absent"), dir.resolve("cs")));
	}

	@Test
	void missingInputIsAnIoError(@TempDir Path dir) {
		assertThrows(java.io.IOException.class,
				() -> new ProjectTranspiler().transpileFile(dir.resolve("nope.rb"), dir.resolve("nope.cs")));
	}
}
