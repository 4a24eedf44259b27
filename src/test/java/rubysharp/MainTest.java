package rubysharp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@Test
	void transpilesOneFile(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("greeter.rb");
		Path output = dir.resolve("out").resolve("Greeter.cs");
		Files.writeString(input, "class Greeter\ndef hello\nputs\nend\nend");

		assertEquals(Main.EXIT_OK, run(input.toString(), output.toString()));
		assertEquals("Transpilation complete. C# code written to " + output, text(out).strip());
		assertTrue(Files.readString(output).contains("    public void hello() {\n"));
	}

	@Test
	void transpilesDirectory(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("a.rb"), "class A end");
		Files.writeString(src.resolve("b.rb"), "class B end");

		assertEquals(Main.EXIT_OK, run(src.toString(), dir.resolve("gen").toString()));
		assertTrue(Files.exists(dir.resolve("gen").resolve("a.cs")));
		assertTrue(Files.exists(dir.resolve("gen").resolve("b.cs")));
		assertTrue(text(out).contains("2 C# file(s)"));
	}

	@Test
	void wrongArgumentCountPrintsUsage() {
		assertEquals(Main.EXIT_USAGE, run("only-one"));
		assertTrue(text(err).contains("usage:"));
	}

	@Test
	void unknownOptionPrintsUsage() {
		assertEquals(Main.EXIT_USAGE, run("--verbose", "a.rb", "a.cs"));
		assertTrue(text(err).contains("Unknown option: --verbose"));
	}

	@Test
	void strictFlagTurnsDropsIntoFailures(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("open.rb");
		Path output = dir.resolve("open.cs");
		Files.writeString(input, "class Foo def bar");

		assertEquals(Main.EXIT_FAILURE, run("--strict", input.toString(), output.toString()));
		assertTrue(text(err).contains("Unclosed 'def' block"));
		assertFalse(Files.exists(output));

		assertEquals(Main.EXIT_OK, run(input.toString(), output.toString()));
		assertEquals("", Files.readString(output));
	}

	@Test
	void keywordsFlagLoadsAlternateTable(@TempDir Path dir) throws Exception {
		Path table = dir.resolve("java.properties");
		Files.writeString(table, "class=final class\ndef=static void\n");
		Path input = dir.resolve("a.rb");
		Path output = dir.resolve("A.java");
		Files.writeString(input, "class A def run end end");

		assertEquals(Main.EXIT_OK, run("--keywords", table.toString(), input.toString(), output.toString()));
		assertEquals("final class A {\n    static void run() {\n    }\n}\n", Files.readString(output));
	}

	@Test
	void incompleteKeywordTableFailsCleanly(@TempDir Path dir) throws Exception {
		Path table = dir.resolve("partial.properties");
		Files.writeString(table, "class=public class\ndef=public void\n");
		Path input = dir.resolve("a.rb");
		Path output = dir.resolve("a.cs");
		Files.writeString(input, "class A def run if x y end end end");

		assertEquals(Main.EXIT_FAILURE, run("--keywords", table.toString(), input.toString(), output.toString()));
		assertTrue(text(err).contains("no entry for 'if'"));
		assertFalse(Files.exists(output));
	}

	@Test
	void malformedKeywordTableFailsCleanly(@TempDir Path dir) throws Exception {
		Path table = dir.resolve("broken.properties");
		Files.writeString(table, "nil=\\uZZZZ\n");

		assertEquals(Main.EXIT_FAILURE, run("--keywords", table.toString(), "a.rb", "a.cs"));
		assertTrue(text(err).startsWith("Cannot read keyword table: Malformed keyword table"));
	}

	@Test
	void missingInputFileFails(@TempDir Path dir) {
		assertEquals(Main.EXIT_FAILURE, run(dir.resolve("nope.rb").toString(), dir.resolve("nope.cs").toString()));
		assertTrue(text(err).startsWith("I/O error:"));
	}

	private int run(String... args) {
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private static String text(ByteArrayOutputStream stream) {
		return stream.toString(StandardCharsets.UTF_8);
	}
}
