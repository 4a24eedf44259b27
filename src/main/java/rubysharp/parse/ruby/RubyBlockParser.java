package rubysharp.parse.ruby;

import rubysharp.ast.SourceSpan;
import rubysharp.ast.ruby.BlockKind;
import rubysharp.ast.ruby.RubyBlock;
import rubysharp.ast.ruby.RubyForest;
import rubysharp.ast.ruby.RubyFragment;
import rubysharp.ast.ruby.RubyNode;
import rubysharp.config.StructurePolicy;
import rubysharp.exception.UnbalancedBlockException;
import rubysharp.exception.UnclosedBlockException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Groups a token list into nested blocks using a stack of open blocks.
 *
 * A block keyword opens a block; {@code end} closes the innermost one and
 * attaches it to its parent, or to the forest when nothing else is open.
 * Every other token becomes a fragment of the innermost open block. There is
 * no notion of expressions: {@code if x > 1} yields the fragments {@code x},
 * {@code >} and {@code 1}.
 */
public final class RubyBlockParser {
	private static final Logger log = Logger.getLogger(RubyBlockParser.class.getName());

	private final StructurePolicy policy;

	public RubyBlockParser() {
		this(StructurePolicy.LENIENT);
	}

	public RubyBlockParser(StructurePolicy policy) {
		this.policy = Objects.requireNonNull(policy, "policy");
	}

	public RubyForest parse(List<RubyToken> tokens) {
		Deque<OpenBlock> stack = new ArrayDeque<>();
		List<RubyNode> forest = new ArrayList<>();

		for (RubyToken token : tokens) {
			var kind = BlockKind.fromKeyword(token.lexeme());
			if (kind.isPresent()) {
				stack.push(new OpenBlock(kind.get(), token.span()));
				continue;
			}

			if (token.is(BlockKind.END)) {
				if (stack.isEmpty()) {
					throw new UnbalancedBlockException(token.span());
				}
				RubyBlock closed = stack.pop().close(token.span());
				attach(closed, stack, forest);
				continue;
			}

			attach(new RubyFragment(token.lexeme(), token.span()), stack, forest);
		}

		if (!stack.isEmpty()) {
			handleUnclosed(stack);
		}

		log.fine(() -> String.format("Parsed %d tokens into %d top-level nodes", tokens.size(), forest.size()));
		return new RubyForest(forest);
	}

	private static void attach(RubyNode node, Deque<OpenBlock> stack, List<RubyNode> forest) {
		if (stack.isEmpty()) {
			forest.add(node);
		} else {
			stack.peek().body.add(node);
		}
	}

	private void handleUnclosed(Deque<OpenBlock> stack) {
		OpenBlock innermost = stack.peek();
		if (policy == StructurePolicy.STRICT) {
			throw new UnclosedBlockException(innermost.kind, innermost.start, stack.size());
		}

		// the whole chain is lost, outermost included
		log.warning(() -> String.format("Discarding %d unclosed block(s) at end of input: %s",
				stack.size(), describe(stack)));
	}

	private static String describe(Deque<OpenBlock> stack) {
		Iterator<OpenBlock> outermostFirst = stack.descendingIterator();
		Iterable<OpenBlock> blocks = () -> outermostFirst;
		return StreamSupport.stream(blocks.spliterator(), false)
				.map(b -> b.kind.keyword() + "@" + b.start.startOffset())
				.collect(Collectors.joining(" > "));
	}

	private static final class OpenBlock {
		private final BlockKind kind;
		private final SourceSpan start;
		private final List<RubyNode> body = new ArrayList<>();

		OpenBlock(BlockKind kind, SourceSpan start) {
			this.kind = kind;
			this.start = start;
		}

		RubyBlock close(SourceSpan end) {
			return new RubyBlock(kind, body, start.to(end));
		}
	}
}
