package rubysharp.exception;

import rubysharp.ast.SourceSpan;
import rubysharp.ast.ruby.BlockKind;

/**
 * Thrown under {@link rubysharp.config.StructurePolicy#STRICT} when the printer
 * reaches a block kind it has no rendering rule for.
 */
public class UnsupportedBlockKindException extends TranspileException {
	private final BlockKind kind;

	public UnsupportedBlockKindException(BlockKind kind, SourceSpan span) {
		super("No rendering rule for '" + kind.keyword() + "' block at " + span);
		this.kind = kind;
	}

	public BlockKind getKind() {
		return kind;
	}
}
