package rubysharp.exception;

/**
 * Thrown when a keyword table cannot be read as properties, or lacks a
 * keyword the printer needs.
 */
public class KeywordTableException extends TranspileException {
	public KeywordTableException(String message) {
		super(message);
	}

	public KeywordTableException(String message, Throwable cause) {
		super(message, cause);
	}
}
