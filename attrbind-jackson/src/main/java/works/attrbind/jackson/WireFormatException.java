package works.attrbind.jackson;

/**
 * The JSON text is well-formed but doesn't describe a valid wire type or value,
 * or a value can't be represented as JSON at all.
 */
public class WireFormatException extends RuntimeException {
	public WireFormatException(String message) {
		super(message);
	}

	public WireFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
