package rubysharp.parse.ruby;

import rubysharp.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Tiny lexer for the Ruby subset understood by the block parser.
 *
 * Notes:
 * - Skips whitespace, newlines and no-break spaces included.
 * - A word is a maximal run of ASCII letters, digits and '_'; it may start
 * with a digit.
 * - Every other character is a one-character symbol. String literals,
 * comments and multi-character operators are not recognised, so
 * {@code "hi!"} lexes as {@code " hi ! "}.
 */
public final class RubyLexer {
	private static final Logger log = Logger.getLogger(RubyLexer.class.getName());

	public List<RubyToken> lex(String input) {
		List<RubyToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (isSeparator(c)) {
				i++;
				continue;
			}

			if (isWordChar(c)) {
				int start = i;
				i++;
				while (i < input.length() && isWordChar(input.charAt(i))) {
					i++;
				}
				tokens.add(new RubyToken(RubyTokenType.WORD, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			// surrogate pairs stay together so a symbol is never half a code point
			int start = i;
			i += Character.charCount(input.codePointAt(i));
			tokens.add(new RubyToken(RubyTokenType.SYMBOL, input.substring(start, i), new SourceSpan(start, i)));
		}

		log.fine(() -> String.format("Lexed %d tokens from %d characters", tokens.size(), input.length()));
		return tokens;
	}

	static boolean isSeparator(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	static boolean isWordChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
	}
}
