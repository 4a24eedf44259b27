package rubysharp.exception;

/**
 * Base class for every structural failure raised by the transpiler pipeline.
 * I/O failures are not wrapped; they reach the caller as {@link java.io.IOException}.
 */
public class TranspileException extends RuntimeException {
	public TranspileException(String message) {
		super(message);
	}

	public TranspileException(String message, Throwable cause) {
		super(message, cause);
	}
}
