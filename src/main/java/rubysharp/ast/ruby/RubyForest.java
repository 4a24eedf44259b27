package rubysharp.ast.ruby;

import java.util.List;

/**
 * Top-level nodes of a parsed program, in source order.
 */
public record RubyForest(List<RubyNode> nodes) {
	public RubyForest {
		nodes = List.copyOf(nodes);
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}
}
