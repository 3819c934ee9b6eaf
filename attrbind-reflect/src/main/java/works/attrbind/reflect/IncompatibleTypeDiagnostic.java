package works.attrbind.reflect;

import java.lang.reflect.Type;
import works.attrbind.attr.AttrType;
import works.attrbind.diag.Diagnostic;
import works.attrbind.diag.Severity;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

/**
 * A value can't be converted because its shape doesn't fit the type it's being converted to.
 * This usually indicates that a record type doesn't agree with the schema.
 *
 * @param source describes the value being converted
 * @param target describes the type it's being converted to
 * @param reason what went wrong
 */
public record IncompatibleTypeDiagnostic(String source, String target, String reason) implements Diagnostic {
	public IncompatibleTypeDiagnostic {
		requireNonNull(source);
		requireNonNull(target);
		requireNonNull(reason);
	}

	/**
	 * For conversions of wire values into Java types.
	 */
	public static IncompatibleTypeDiagnostic into(WireValue value, Type target, String reason) {
		return new IncompatibleTypeDiagnostic(value.type() + " value", target.getTypeName(), reason);
	}

	/**
	 * For conversions of Java values into attribute types.
	 */
	public static IncompatibleTypeDiagnostic from(Object value, AttrType target, String reason) {
		String source = (value == null) ? "null" : value.getClass().getSimpleName() + " value";
		return new IncompatibleTypeDiagnostic(source, target.toString(), reason);
	}

	@Override
	public Severity severity() {
		return Severity.ERROR;
	}

	@Override
	public String summary() {
		return ConversionDiagnostics.VALUE_CONVERSION_ERROR;
	}

	@Override
	public String detail() {
		return "An unexpected error was encountered trying to convert " + source + " to " + target
			+ ". This is always an error in the record type or the schema definition.\n\n"
			+ reason;
	}
}
