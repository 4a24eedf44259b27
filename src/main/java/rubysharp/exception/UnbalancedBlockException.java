package rubysharp.exception;

import rubysharp.ast.SourceSpan;

/**
 * Thrown when {@code end} is seen while no block is open.
 */
public class UnbalancedBlockException extends TranspileException {
	private final SourceSpan span;

	public UnbalancedBlockException(SourceSpan span) {
		super("Unbalanced 'end' at " + span + ": no block is open");
		this.span = span;
	}

	public SourceSpan getSpan() {
		return span;
	}
}
