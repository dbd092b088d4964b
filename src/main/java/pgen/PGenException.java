package pgen;

/**
 * Base class of all exceptions thrown by the grammar analysis.
 */
public class PGenException extends RuntimeException {

	public PGenException(String message) {
		super(message);
	}

	public PGenException(String message, Throwable cause) {
		super(message, cause);
	}
}
