package rubysharp.print;

import rubysharp.ast.ruby.BlockKind;
import rubysharp.ast.ruby.RubyBlock;
import rubysharp.ast.ruby.RubyForest;
import rubysharp.ast.ruby.RubyFragment;
import rubysharp.ast.ruby.RubyNode;
import rubysharp.config.StructurePolicy;
import rubysharp.exception.MalformedBlockException;
import rubysharp.exception.UnsupportedBlockKindException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Renders a parsed forest as C#-shaped text.
 *
 * Indentation is flat: class headers sit in column 0, method headers get one
 * level, and every statement gets one level, or two inside a method, however
 * deep the source nesting was. An if/while condition is the first token of the
 * block only.
 */
public final class CSharpPrinter {
	private static final Logger log = Logger.getLogger(CSharpPrinter.class.getName());

	private static final String NL = "\n";
	private static final String LEVEL = "    ";
	private static final String METHOD_BODY = LEVEL + LEVEL;

	private final KeywordTable keywords;
	private final StructurePolicy policy;

	public CSharpPrinter() {
		this(KeywordTable.csharp(), StructurePolicy.LENIENT);
	}

	public CSharpPrinter(KeywordTable keywords, StructurePolicy policy) {
		this.keywords = Objects.requireNonNull(keywords, "keywords");
		this.policy = Objects.requireNonNull(policy, "policy");
	}

	public String print(RubyForest forest) {
		StringBuilder out = new StringBuilder();
		for (RubyNode node : forest.nodes()) {
			printNode(node, false, out);
		}
		return out.toString();
	}

	private void printNode(RubyNode node, boolean inMethod, StringBuilder out) {
		if (node instanceof RubyFragment fragment) {
			out.append(statementIndent(inMethod)).append(keywords.translate(fragment.value())).append(NL);
			return;
		}

		RubyBlock block = (RubyBlock) node;
		switch (block.kind()) {
			case CLASS -> printClass(block, inMethod, out);
			case DEF -> printMethod(block, out);
			case IF, WHILE -> printConditional(block, inMethod, out);
			case ELSE, ELSIF, DO -> skipUnsupported(block);
		}
	}

	private void printClass(RubyBlock block, boolean inMethod, StringBuilder out) {
		String name = headOf(block, "class name");
		out.append(keywords.require(BlockKind.CLASS.keyword())).append(' ').append(name).append(" {").append(NL);
		printBody(block.rest(), inMethod, out);
		out.append("}").append(NL);
	}

	private void printMethod(RubyBlock block, StringBuilder out) {
		String name = headOf(block, "method name");
		out.append(LEVEL).append(keywords.require(BlockKind.DEF.keyword())).append(' ').append(name)
				.append("() {").append(NL);
		printBody(block.rest(), true, out);
		out.append(LEVEL).append("}").append(NL);
	}

	private void printConditional(RubyBlock block, boolean inMethod, StringBuilder out) {
		String condition = headOf(block, "condition");
		String indent = statementIndent(inMethod);
		out.append(indent).append(keywords.require(block.kind().keyword()))
				.append(" (").append(condition).append(") {").append(NL);
		printBody(block.rest(), inMethod, out);
		out.append(indent).append("}").append(NL);
	}

	private void printBody(List<RubyNode> body, boolean inMethod, StringBuilder out) {
		for (RubyNode child : body) {
			printNode(child, inMethod, out);
		}
	}

	private void skipUnsupported(RubyBlock block) {
		if (policy == StructurePolicy.STRICT) {
			throw new UnsupportedBlockKindException(block.kind(), block.span());
		}
		log.fine(() -> String.format("Dropping '%s' block at %s with %d child node(s)",
				block.kind().keyword(), block.span(), block.body().size()));
	}

	private static String headOf(RubyBlock block, String what) {
		return block.head()
				.map(RubyFragment::value)
				.orElseThrow(() -> new MalformedBlockException(block.kind(), what, block.span()));
	}

	private static String statementIndent(boolean inMethod) {
		return inMethod ? METHOD_BODY : LEVEL;
	}
}
