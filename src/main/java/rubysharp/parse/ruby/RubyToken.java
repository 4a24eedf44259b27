package rubysharp.parse.ruby;

import rubysharp.ast.SourceSpan;

public record RubyToken(RubyTokenType type, String lexeme, SourceSpan span) {
	public boolean is(String text) {
		return lexeme.equals(text);
	}
}
