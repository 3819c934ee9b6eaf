package works.attrbind.exceptions;

/**
 * An attribute type or value could not translate to or from its wire form.
 * <p>
 * Thrown by {@link works.attrbind.attr.AttrType#valueFromWire valueFromWire}
 * and {@link works.attrbind.attr.AttrValue#toWire toWire} implementations.
 * The marshaling engine never lets this escape;
 * it reports it as a diagnostic attributed to the offending path.
 */
public class ValueConversionException extends Exception {
	public ValueConversionException(String message) {
		super(message);
	}

	public ValueConversionException(String message, Throwable cause) {
		super(message, cause);
	}
}
