package rubysharp;

import rubysharp.config.TranspilerConfig;
import rubysharp.parse.ruby.RubyBlockParser;
import rubysharp.parse.ruby.RubyLexer;
import rubysharp.print.CSharpPrinter;

import java.util.Objects;

/**
 * Public entrypoint for Ruby -> C# transpilation: lex, group into blocks,
 * print. Holds no state between calls.
 */
public final class Transpiler {
	private final RubyLexer lexer;
	private final RubyBlockParser parser;
	private final CSharpPrinter printer;

	public Transpiler() {
		this(TranspilerConfig.defaults());
	}

	public Transpiler(TranspilerConfig config) {
		Objects.requireNonNull(config, "config");
		this.lexer = new RubyLexer();
		this.parser = new RubyBlockParser(config.getStructurePolicy());
		this.printer = new CSharpPrinter(config.getKeywordTable(), config.getStructurePolicy());
	}

	public String transpile(String rubySource) {
		var tokens = lexer.lex(rubySource);
		var forest = parser.parse(tokens);
		return printer.print(forest);
	}
}
