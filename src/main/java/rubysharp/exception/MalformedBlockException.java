package rubysharp.exception;

import rubysharp.ast.SourceSpan;
import rubysharp.ast.ruby.BlockKind;

/**
 * Thrown when a block that needs a name or condition does not start with a
 * plain token, e.g. {@code class end} or {@code if while x end end}.
 */
public class MalformedBlockException extends TranspileException {
	public MalformedBlockException(BlockKind kind, String missing, SourceSpan span) {
		super("'" + kind.keyword() + "' block at " + span + " has no " + missing);
	}
}
