package rubysharp.exception;

import rubysharp.ast.SourceSpan;
import rubysharp.ast.ruby.BlockKind;

/**
 * Thrown under {@link rubysharp.config.StructurePolicy#STRICT} when input ends
 * while blocks are still open. Reports the innermost one.
 */
public class UnclosedBlockException extends TranspileException {
	private final BlockKind kind;
	private final SourceSpan span;
	private final int openCount;

	public UnclosedBlockException(BlockKind kind, SourceSpan span, int openCount) {
		super("Unclosed '" + kind.keyword() + "' block opened at " + span
				+ " (" + openCount + " block(s) still open at end of input)");
		this.kind = kind;
		this.span = span;
		this.openCount = openCount;
	}

	public BlockKind getKind() {
		return kind;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public int getOpenCount() {
		return openCount;
	}
}
