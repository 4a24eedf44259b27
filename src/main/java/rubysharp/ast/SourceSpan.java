package rubysharp.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text; the
 * end offset is exclusive.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(startOffset, end.endOffset());
	}

	@Override
	public String toString() {
		if (this.equals(NONE)) {
			return "<unknown>";
		}
		return "[" + startOffset + ", " + endOffset + ")";
	}
}
