package works.attrbind.reflect;

import java.lang.reflect.Type;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.diag.Diagnostic;
import works.attrbind.diag.ErrorDiagnostic;

/**
 * Diagnostics produced by the conversion engine itself, as opposed to
 * those produced by attribute types and validation hooks.
 */
public final class ConversionDiagnostics {
	private ConversionDiagnostics() { }

	public static final String VALUE_CONVERSION_ERROR = "Value Conversion Error";
	public static final String CONVERSION_CANCELLED = "Conversion Cancelled";
	public static final String NESTING_TOO_DEEP = "Nesting Too Deep";

	public static Diagnostic cancelled(ConversionContext ctx) {
		return new ErrorDiagnostic(CONVERSION_CANCELLED,
			"The conversion was stopped before it finished: " + ctx.reason());
	}

	public static Diagnostic depthExceeded(int maxDepth) {
		return new ErrorDiagnostic(NESTING_TOO_DEEP,
			"The value is nested more than " + maxDepth + " levels deep, which is the configured limit.");
	}

	public static Diagnostic unhandledNull(Type target) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"Received null value, however the target type cannot handle null values. "
				+ "Use a reference or Optional type, or enable unhandledNullAsEmpty.\n\n"
				+ "Target Type: " + target.getTypeName());
	}

	public static Diagnostic unhandledUnknown(Type target) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"Received unknown value, however the target type cannot handle unknown values. "
				+ "Use an attribute value type as the target, or enable unhandledUnknownAsEmpty.\n\n"
				+ "Target Type: " + target.getTypeName());
	}

	public static Diagnostic missingAttributeType(String name, AttrType type) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"Could not find type information for attribute \"" + name + "\" in " + type + ".");
	}

	public static Diagnostic toWireError(Exception e) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"An unexpected error was encountered trying to convert an attribute value to its wire form. "
				+ "This is always an error in the attribute type implementation.\n\n" + e.getMessage());
	}

	public static Diagnostic fromWireError(Exception e) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"An unexpected error was encountered trying to build an attribute value from its wire form. "
				+ "This is always an error in the attribute type implementation.\n\n" + e.getMessage());
	}

	public static Diagnostic constructionError(Class<?> recordClass, Exception e) {
		return new ErrorDiagnostic(VALUE_CONVERSION_ERROR,
			"Unable to construct " + recordClass.getSimpleName() + " from the converted attribute values.\n\n"
				+ e.getMessage());
	}
}
