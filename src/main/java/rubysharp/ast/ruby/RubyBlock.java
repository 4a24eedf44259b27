package rubysharp.ast.ruby;

import rubysharp.ast.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * A closed keyword-delimited block. The body is in append order and is never
 * modified once the parser has closed the block.
 */
public record RubyBlock(BlockKind kind, List<RubyNode> body, SourceSpan span) implements RubyNode {
	public RubyBlock {
		body = List.copyOf(body);
	}

	/**
	 * The first body element when it is a fragment. Class and method names, and
	 * if/while conditions, are read from here.
	 */
	public Optional<RubyFragment> head() {
		if (body.isEmpty() || !(body.get(0) instanceof RubyFragment fragment)) {
			return Optional.empty();
		}
		return Optional.of(fragment);
	}

	public List<RubyNode> rest() {
		return body.isEmpty() ? List.of() : body.subList(1, body.size());
	}
}
