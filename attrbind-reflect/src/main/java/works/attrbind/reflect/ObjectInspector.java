package works.attrbind.reflect;

import java.lang.reflect.Type;
import java.util.Map;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Result;
import works.attrbind.path.Path;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireValue;

/**
 * Extracts the attributes of an object-shaped wire value.
 */
public final class ObjectInspector {
	private ObjectInspector() { }

	/**
	 * @param target the Java type the attributes are destined for, for diagnostics
	 * @return the attribute values by name, or an {@link IncompatibleTypeDiagnostic}
	 * if {@code value} is not a known object
	 */
	public static Result<Map<String, WireValue>> attributesOf(WireValue value, Type target, Path path) {
		if (value instanceof WireObject object) {
			return Result.success(object.attributes());
		}
		String reason;
		if (value.isNull()) {
			reason = "cannot read attributes of a null value";
		} else if (!value.isKnown()) {
			reason = "cannot read attributes of an unknown value";
		} else {
			reason = "cannot convert " + value.type() + " into a record, must be an object";
		}
		return Result.failure(AttributeDiagnostic.withPath(path, IncompatibleTypeDiagnostic.into(value, target, reason)));
	}
}
