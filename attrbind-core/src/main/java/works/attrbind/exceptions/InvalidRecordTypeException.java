package works.attrbind.exceptions;

/**
 * A record class can't be mapped to schema attributes
 * because of the way it's declared.
 * <p>
 * This is a problem with the Java code, not with the data being converted.
 */
public class InvalidRecordTypeException extends Exception {
	public InvalidRecordTypeException(String message) {
		super(message);
	}

	public InvalidRecordTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
