package rubysharp.ast.ruby;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keywords that open a block. Every one of them is closed by {@code end}.
 */
public enum BlockKind {
	CLASS("class"),
	DEF("def"),
	IF("if"),
	WHILE("while"),
	ELSE("else"),
	ELSIF("elsif"),
	DO("do");

	public static final String END = "end";

	private static final Map<String, BlockKind> BY_KEYWORD = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(BlockKind::keyword, Function.identity()));

	private final String keyword;

	BlockKind(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	public static Optional<BlockKind> fromKeyword(String lexeme) {
		return Optional.ofNullable(BY_KEYWORD.get(lexeme));
	}
}
