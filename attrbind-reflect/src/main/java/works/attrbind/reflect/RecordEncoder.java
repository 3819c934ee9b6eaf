package works.attrbind.reflect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithAttributeTypes;
import works.attrbind.attr.TypeWithValidate;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Diagnostic;
import works.attrbind.diag.Diagnostics;
import works.attrbind.diag.Result;
import works.attrbind.exceptions.InvalidRecordTypeException;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.path.Path;
import works.attrbind.wire.ObjectWireType;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

/**
 * Builds an object value from the components of a record.
 * <p>
 * The record's attribute names must match the attribute types declared by the schema exactly.
 * Conversion stops at the first component that fails.
 * If the schema type {@link TypeWithValidate validates} its values,
 * the assembled object is validated before the final value is built.
 */
@RequiredArgsConstructor
public final class RecordEncoder {
	private final ValueConverter converter;

	public Result<AttrValue> encode(ConversionContext ctx, AttrType type, Object record, Path path) {
		if (!(record instanceof Record)) {
			return failure(path, IncompatibleTypeDiagnostic.from(record, type, "expected a record"));
		}
		if (!(type instanceof TypeWithAttributeTypes typeWithAttributes)) {
			return failure(path, IncompatibleTypeDiagnostic.from(record, type,
				"cannot convert record using type information provided by " + type
					+ "; it must implement " + TypeWithAttributeTypes.class.getSimpleName()));
		}
		Class<?> recordClass = record.getClass();

		List<FieldDescriptor> fields;
		try {
			fields = RecordFields.of(recordClass);
		} catch (InvalidRecordTypeException e) {
			return failure(path, IncompatibleTypeDiagnostic.from(record, type, e.getMessage()));
		}
		Map<String, AttrType> attributeTypes = typeWithAttributes.attributeTypes();
		Optional<Reconciler.Mismatch> mismatch = Reconciler.reconcile(RecordFields.names(fields), attributeTypes.keySet(), Reconciler.Side.ATTRIBUTES);
		if (mismatch.isPresent()) {
			LOGGER.debug("Can't encode {} at \"{}\": {}", recordClass.getSimpleName(), path, mismatch.get());
			return failure(path, IncompatibleTypeDiagnostic.from(record, type, mismatch.get().message()));
		}

		Diagnostics diagnostics = new Diagnostics();
		Map<String, WireType> wireTypes = new LinkedHashMap<>();
		Map<String, WireValue> wireValues = new LinkedHashMap<>();
		for (FieldDescriptor field : fields) {
			if (ctx.isDone()) {
				return failure(diagnostics, path, ConversionDiagnostics.cancelled(ctx));
			}
			AttrType attributeType = attributeTypes.get(field.name());
			if (attributeType == null) {
				return failure(diagnostics, path, ConversionDiagnostics.missingAttributeType(field.name(), type));
			}
			Path fieldPath = path.atName(field.name());
			LOGGER.trace("Encoding {}", fieldPath);
			Result<AttrValue> converted = converter.encode(ctx, attributeType, field.read(record), fieldPath);
			diagnostics.appendAll(converted.diagnostics());
			if (diagnostics.hasError()) {
				LOGGER.debug("Encoding {} failed at \"{}\"", recordClass.getSimpleName(), fieldPath);
				return Result.failure(diagnostics);
			}

			WireValue wire;
			try {
				wire = converted.value().toWire(ctx);
			} catch (ValueConversionException e) {
				return failure(diagnostics, fieldPath, ConversionDiagnostics.toWireError(e));
			}
			if (!wire.type().equals(attributeType.wireType())) {
				return failure(diagnostics, fieldPath, IncompatibleTypeDiagnostic.from(field.read(record), attributeType,
					"converted value has wire type " + wire.type() + "; expected " + attributeType.wireType()));
			}
			wireTypes.put(field.name(), attributeType.wireType());
			wireValues.put(field.name(), wire);
		}

		WireObject object = new WireObject(new ObjectWireType(wireTypes), wireValues);
		if (type instanceof TypeWithValidate typeWithValidate) {
			diagnostics.appendAll(typeWithValidate.validate(ctx, object, path));
			if (diagnostics.hasError()) {
				LOGGER.debug("Validation of {} failed at \"{}\"", recordClass.getSimpleName(), path);
				return Result.failure(diagnostics);
			}
		}

		try {
			AttrValue result = typeWithAttributes.withAttributeTypes(attributeTypes).valueFromWire(ctx, object);
			return Result.of(result, diagnostics);
		} catch (ValueConversionException e) {
			return failure(diagnostics, path, ConversionDiagnostics.fromWireError(e));
		}
	}

	private static <T> Result<T> failure(Path path, Diagnostic diagnostic) {
		return failure(new Diagnostics(), path, diagnostic);
	}

	private static <T> Result<T> failure(Diagnostics diagnostics, Path path, Diagnostic diagnostic) {
		return Result.failure(diagnostics.append(AttributeDiagnostic.withPath(path, diagnostic)));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordEncoder.class);
}
