package rubysharp.parse.ruby;

public enum RubyTokenType {
	/** Maximal run of ASCII letters, digits and underscores. */
	WORD,
	/** Any other single non-whitespace character. */
	SYMBOL
}
