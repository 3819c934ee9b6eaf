package works.attrbind.reflect;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.TypeWithAttributeTypes;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Diagnostic;
import works.attrbind.diag.Diagnostics;
import works.attrbind.diag.Result;
import works.attrbind.exceptions.InvalidRecordTypeException;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.path.Path;
import works.attrbind.wire.WireValue;

/**
 * Builds a record from the attributes of an object value.
 * <p>
 * The record's attribute names must match the object's exactly.
 * Conversion stops at the first component that fails,
 * and no record is produced unless every component succeeds.
 */
@RequiredArgsConstructor
public final class RecordDecoder {
	private final ValueConverter converter;

	public <T> Result<T> decode(ConversionContext ctx, AttrType type, WireValue object, Class<T> recordClass, Path path) {
		if (!recordClass.isRecord()) {
			return failure(path, IncompatibleTypeDiagnostic.into(object, recordClass,
				"expected a record type, got " + recordClass.getName()));
		}
		Result<Map<String, WireValue>> inspected = ObjectInspector.attributesOf(object, recordClass, path);
		if (inspected.hasError()) {
			return Result.failure(inspected.diagnostics());
		}
		if (!(type instanceof TypeWithAttributeTypes typeWithAttributes)) {
			return failure(path, IncompatibleTypeDiagnostic.into(object, recordClass,
				"cannot convert object using type information provided by " + type
					+ "; it must implement " + TypeWithAttributeTypes.class.getSimpleName()));
		}
		Map<String, WireValue> attributes = inspected.value();

		List<FieldDescriptor> fields;
		try {
			fields = RecordFields.of(recordClass);
		} catch (InvalidRecordTypeException e) {
			return failure(path, IncompatibleTypeDiagnostic.into(object, recordClass, e.getMessage()));
		}
		Optional<Reconciler.Mismatch> mismatch = Reconciler.reconcile(RecordFields.names(fields), attributes.keySet(), Reconciler.Side.OBJECT);
		if (mismatch.isPresent()) {
			LOGGER.debug("Can't decode {} at \"{}\": {}", recordClass.getSimpleName(), path, mismatch.get());
			return failure(path, IncompatibleTypeDiagnostic.into(object, recordClass, mismatch.get().message()));
		}

		Map<String, AttrType> attributeTypes = typeWithAttributes.attributeTypes();
		Diagnostics diagnostics = new Diagnostics();
		RecordAssembler assembler = new RecordAssembler(recordClass);
		for (FieldDescriptor field : fields) {
			if (ctx.isDone()) {
				return failure(diagnostics, path, ConversionDiagnostics.cancelled(ctx));
			}
			AttrType attributeType = attributeTypes.get(field.name());
			if (attributeType == null) {
				return failure(diagnostics, path, ConversionDiagnostics.missingAttributeType(field.name(), type));
			}
			Path fieldPath = path.atName(field.name());
			LOGGER.trace("Decoding {}", fieldPath);
			Result<Object> converted = converter.decode(ctx, attributeType, attributes.get(field.name()), field.genericType(), fieldPath);
			diagnostics.appendAll(converted.diagnostics());
			if (diagnostics.hasError()) {
				LOGGER.debug("Decoding {} failed at \"{}\"", recordClass.getSimpleName(), fieldPath);
				return Result.failure(diagnostics);
			}
			assembler.set(field, converted.value());
		}

		try {
			return Result.of(recordClass.cast(assembler.build()), diagnostics);
		} catch (ValueConversionException e) {
			return failure(diagnostics, path, ConversionDiagnostics.constructionError(recordClass, e));
		}
	}

	private static <T> Result<T> failure(Path path, Diagnostic diagnostic) {
		return failure(new Diagnostics(), path, diagnostic);
	}

	private static <T> Result<T> failure(Diagnostics diagnostics, Path path, Diagnostic diagnostic) {
		return Result.failure(diagnostics.append(AttributeDiagnostic.withPath(path, diagnostic)));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordDecoder.class);
}
