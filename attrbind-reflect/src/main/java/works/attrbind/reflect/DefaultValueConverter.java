package works.attrbind.reflect;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithAttributeTypes;
import works.attrbind.attr.TypeWithElementType;
import works.attrbind.attr.TypeWithValidate;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Diagnostic;
import works.attrbind.diag.Diagnostics;
import works.attrbind.diag.Result;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.path.Path;
import works.attrbind.wire.ListWireType;
import works.attrbind.wire.MapWireType;
import works.attrbind.wire.SetWireType;
import works.attrbind.wire.WireBool;
import works.attrbind.wire.WireList;
import works.attrbind.wire.WireMap;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireSet;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static works.attrbind.reflect.ReflectionHelpers.rawClass;
import static works.attrbind.reflect.ReflectionHelpers.typeArgument;
import static works.attrbind.reflect.ReflectionHelpers.zeroValue;

/**
 * Converts values according to their Java type and wire type.
 * <p>
 * Supported Java types:
 * <ul>
 *     <li>{@link AttrValue} and its subtypes, which are produced by the schema type directly</li>
 *     <li>{@code String}, {@code char}, and enums (by {@link Enum#name() name})</li>
 *     <li>{@code boolean}</li>
 *     <li>the primitive numeric types, {@link BigInteger}, {@link BigDecimal}, and {@link Number},
 *         as long as the value fits exactly</li>
 *     <li>{@link List}, {@link Set}, {@link Collection}, and {@link Iterable},
 *         corresponding to list and set values</li>
 *     <li>{@link Map} with {@code String} keys, corresponding to map values</li>
 *     <li>{@link Optional}, where empty corresponds to null</li>
 *     <li>records, corresponding to object values, via {@link RecordDecoder} and {@link RecordEncoder}</li>
 *     <li>{@code Object}, which receives the most natural of the above types when decoding,
 *         and a {@code Map<String, Object>} in attribute name order for object values</li>
 * </ul>
 * Null values decode to null, or to {@link Optional#empty()}.
 * Null and unknown values can't be decoded into primitives
 * unless {@link Options} says to use zero values instead.
 */
public final class DefaultValueConverter implements ValueConverter {
	private final Options options;
	private final RecordDecoder recordDecoder;
	private final RecordEncoder recordEncoder;

	public DefaultValueConverter(Options options) {
		this.options = options;
		this.recordDecoder = new RecordDecoder(this);
		this.recordEncoder = new RecordEncoder(this);
	}

	public DefaultValueConverter() {
		this(Options.DEFAULT);
	}

	public Options options() {
		return options;
	}

	@Override
	public Result<Object> decode(ConversionContext ctx, AttrType type, WireValue value, Type target, Path path) {
		Optional<Diagnostic> stop = checkProgress(ctx, path);
		if (stop.isPresent()) {
			return failure(path, stop.get());
		}
		Class<?> targetClass = rawClass(target);
		LOGGER.trace("Decoding {} as {} at \"{}\"", value, target.getTypeName(), path);

		if (AttrValue.class.isAssignableFrom(targetClass)) {
			return decodeAttrValue(ctx, type, value, targetClass, path);
		}
		if (!value.isKnown()) {
			if (options.unhandledUnknownAsEmpty()) {
				return Result.success(zeroValue(targetClass));
			}
			return failure(path, ConversionDiagnostics.unhandledUnknown(target));
		}
		if (value.isNull()) {
			if (targetClass == Optional.class) {
				return Result.success(Optional.empty());
			} else if (!targetClass.isPrimitive()) {
				return Result.success(null);
			} else if (options.unhandledNullAsEmpty()) {
				return Result.success(zeroValue(targetClass));
			}
			return failure(path, ConversionDiagnostics.unhandledNull(target));
		}
		if (targetClass == Optional.class) {
			Result<Object> inner = decode(ctx, type, value, typeArgument(target, 0), path);
			if (inner.hasError()) {
				return inner;
			}
			return Result.of(Optional.ofNullable(inner.value()), inner.diagnostics());
		}

		if (value instanceof WireString s) {
			return decodeString(s, target, targetClass, path);
		} else if (value instanceof WireNumber n) {
			return decodeNumber(n, target, targetClass, path);
		} else if (value instanceof WireBool b) {
			if (targetClass == boolean.class || targetClass == Boolean.class || targetClass == Object.class) {
				return Result.success(b.value());
			}
		} else if (value instanceof WireList l) {
			if (targetClass.isAssignableFrom(ArrayList.class)) {
				return decodeElements(ctx, type, value, l.elements(), target, new ArrayList<>(), path, false);
			}
		} else if (value instanceof WireSet s) {
			if (targetClass.isAssignableFrom(LinkedHashSet.class)) {
				return decodeElements(ctx, type, value, s.elements(), target, new LinkedHashSet<>(), path, true);
			} else if (targetClass.isAssignableFrom(ArrayList.class)) {
				return decodeElements(ctx, type, value, s.elements(), target, new ArrayList<>(), path, true);
			}
		} else if (value instanceof WireMap m) {
			if (targetClass.isAssignableFrom(LinkedHashMap.class)) {
				return decodeMap(ctx, type, m, target, path);
			}
		} else if (value instanceof WireObject o) {
			if (targetClass.isRecord()) {
				Result<?> decoded = recordDecoder.decode(ctx, type, value, targetClass, path);
				return Result.of(decoded.value(), decoded.diagnostics());
			} else if (targetClass == Object.class) {
				return decodeObjectAsMap(ctx, type, o, target, path);
			}
		}
		return incompatible(value, target, path, "don't know how to reflect " + value.type() + " into " + target.getTypeName());
	}

	private Result<Object> decodeAttrValue(ConversionContext ctx, AttrType type, WireValue value, Class<?> targetClass, Path path) {
		AttrValue result;
		try {
			result = type.valueFromWire(ctx, value);
		} catch (ValueConversionException e) {
			return failure(path, ConversionDiagnostics.fromWireError(e));
		}
		if (!targetClass.isInstance(result)) {
			return incompatible(value, targetClass, path,
				"type " + type + " produces " + result.getClass().getSimpleName() + ", which can't be assigned to " + targetClass.getSimpleName());
		}
		return Result.success(result);
	}

	private static Result<Object> decodeString(WireString value, Type target, Class<?> targetClass, Path path) {
		String s = value.value();
		if (targetClass == String.class || targetClass == CharSequence.class || targetClass == Object.class) {
			return Result.success(s);
		} else if (targetClass == char.class || targetClass == Character.class) {
			if (s.length() != 1) {
				return incompatible(value, target, path, "string must have length 1 to convert to char");
			}
			return Result.success(s.charAt(0));
		} else if (targetClass.isEnum()) {
			for (Object constant : targetClass.getEnumConstants()) {
				if (((Enum<?>) constant).name().equals(s)) {
					return Result.success(constant);
				}
			}
			return incompatible(value, target, path, "no such constant: " + targetClass.getSimpleName() + "." + s);
		}
		return incompatible(value, target, path, "don't know how to reflect string into " + target.getTypeName());
	}

	private static Result<Object> decodeNumber(WireNumber value, Type target, Class<?> targetClass, Path path) {
		BigDecimal n = value.value();
		try {
			if (targetClass == BigDecimal.class || targetClass == Number.class || targetClass == Object.class) {
				return Result.success(n);
			} else if (targetClass == BigInteger.class) {
				if (!WireNumber.fitsPlain(n)) {
					return incompatible(value, target, path, "can't store " + value + " in " + target.getTypeName());
				}
				return Result.success(n.toBigIntegerExact());
			} else if (targetClass == long.class || targetClass == Long.class) {
				return Result.success(n.longValueExact());
			} else if (targetClass == int.class || targetClass == Integer.class) {
				return Result.success(n.intValueExact());
			} else if (targetClass == short.class || targetClass == Short.class) {
				return Result.success(n.shortValueExact());
			} else if (targetClass == byte.class || targetClass == Byte.class) {
				return Result.success(n.byteValueExact());
			}
		} catch (ArithmeticException e) {
			return incompatible(value, target, path, "can't store " + value + " in " + target.getTypeName());
		}
		if (targetClass == double.class || targetClass == Double.class) {
			double d = n.doubleValue();
			if (Double.isInfinite(d) || BigDecimal.valueOf(d).compareTo(n) != 0) {
				return incompatible(value, target, path, "can't store " + value + " in " + target.getTypeName());
			}
			return Result.success(d);
		} else if (targetClass == float.class || targetClass == Float.class) {
			float f = n.floatValue();
			if (Float.isInfinite(f) || new BigDecimal(Float.toString(f)).compareTo(n) != 0) {
				return incompatible(value, target, path, "can't store " + value + " in " + target.getTypeName());
			}
			return Result.success(f);
		}
		return incompatible(value, target, path, "don't know how to reflect number into " + target.getTypeName());
	}

	private Result<Object> decodeElements(
		ConversionContext ctx,
		AttrType type,
		WireValue collection,
		List<WireValue> elements,
		Type target,
		Collection<Object> result,
		Path path,
		boolean isSet
	) {
		if (!(type instanceof TypeWithElementType typeWithElements)) {
			return incompatible(collection, target, path,
				"cannot reflect " + collection.type() + " using type information provided by " + type
					+ "; it must implement " + TypeWithElementType.class.getSimpleName());
		}
		Type elementTarget = typeArgument(target, 0);
		Diagnostics diagnostics = new Diagnostics();
		for (int i = 0; i < elements.size(); i++) {
			WireValue element = elements.get(i);
			Path elementPath = isSet ? path.atSetValue(element) : path.atListIndex(i);
			Result<Object> converted = decode(ctx, typeWithElements.elementType(), element, elementTarget, elementPath);
			diagnostics.appendAll(converted.diagnostics());
			if (diagnostics.hasError()) {
				return Result.failure(diagnostics);
			}
			result.add(converted.value());
		}
		return Result.of(result, diagnostics);
	}

	private Result<Object> decodeMap(ConversionContext ctx, AttrType type, WireMap map, Type target, Path path) {
		if (rawClass(typeArgument(target, 0)) != String.class && rawClass(typeArgument(target, 0)) != Object.class) {
			return incompatible(map, target, path, "map keys must be strings");
		}
		if (!(type instanceof TypeWithElementType typeWithElements)) {
			return incompatible(map, target, path,
				"cannot reflect " + map.type() + " using type information provided by " + type
					+ "; it must implement " + TypeWithElementType.class.getSimpleName());
		}
		Type elementTarget = typeArgument(target, 1);
		Diagnostics diagnostics = new Diagnostics();
		Map<String, Object> result = new LinkedHashMap<>();
		for (var entry : map.elements().entrySet()) {
			Result<Object> converted = decode(ctx, typeWithElements.elementType(), entry.getValue(), elementTarget, path.atMapKey(entry.getKey()));
			diagnostics.appendAll(converted.diagnostics());
			if (diagnostics.hasError()) {
				return Result.failure(diagnostics);
			}
			result.put(entry.getKey(), converted.value());
		}
		return Result.of(result, diagnostics);
	}

	private Result<Object> decodeObjectAsMap(ConversionContext ctx, AttrType type, WireObject object, Type target, Path path) {
		if (!(type instanceof TypeWithAttributeTypes typeWithAttributes)) {
			return incompatible(object, target, path,
				"cannot reflect " + object.type() + " using type information provided by " + type
					+ "; it must implement " + TypeWithAttributeTypes.class.getSimpleName());
		}
		Map<String, AttrType> attributeTypes = typeWithAttributes.attributeTypes();
		Diagnostics diagnostics = new Diagnostics();
		Map<String, Object> result = new LinkedHashMap<>();
		for (var entry : new TreeMap<>(object.attributes()).entrySet()) {
			AttrType attributeType = attributeTypes.get(entry.getKey());
			if (attributeType == null) {
				return failure(diagnostics, path, ConversionDiagnostics.missingAttributeType(entry.getKey(), type));
			}
			Result<Object> converted = decode(ctx, attributeType, entry.getValue(), Object.class, path.atName(entry.getKey()));
			diagnostics.appendAll(converted.diagnostics());
			if (diagnostics.hasError()) {
				return Result.failure(diagnostics);
			}
			result.put(entry.getKey(), converted.value());
		}
		return Result.of(result, diagnostics);
	}

	@Override
	public Result<AttrValue> encode(ConversionContext ctx, AttrType type, @Nullable Object value, Path path) {
		Optional<Diagnostic> stop = checkProgress(ctx, path);
		if (stop.isPresent()) {
			return failure(path, stop.get());
		}
		LOGGER.trace("Encoding {} as {} at \"{}\"", value, type, path);

		if (value instanceof AttrValue attrValue) {
			return Result.success(attrValue);
		} else if (value == null) {
			return finish(ctx, type, WireValue.nullOf(type.wireType()), new Diagnostics(), path);
		} else if (value instanceof Optional<?> optional) {
			return encode(ctx, type, optional.orElse(null), path);
		} else if (value instanceof Record) {
			return recordEncoder.encode(ctx, type, value, path);
		}

		WireType wireType = type.wireType();
		if (value instanceof Iterable<?> iterable) {
			if (wireType instanceof ListWireType || wireType instanceof SetWireType) {
				return encodeElements(ctx, type, iterable, path);
			}
		} else if (value instanceof Map<?, ?> map) {
			if (wireType instanceof MapWireType) {
				return encodeMap(ctx, type, map, path);
			}
		} else {
			WireValue primitive = primitiveWireValue(value);
			if (primitive != null) {
				return finish(ctx, type, primitive, new Diagnostics(), path);
			}
		}
		return failure(path, IncompatibleTypeDiagnostic.from(value, type,
			"don't know how to convert " + value.getClass().getSimpleName() + " into " + wireType));
	}

	private static @Nullable WireValue primitiveWireValue(Object value) {
		if (value instanceof CharSequence || value instanceof Character) {
			return WireString.of(value.toString());
		} else if (value instanceof Enum<?> e) {
			return WireString.of(e.name());
		} else if (value instanceof Boolean b) {
			return WireBool.of(b);
		} else if (value instanceof BigDecimal d) {
			return WireNumber.of(d);
		} else if (value instanceof BigInteger i) {
			return WireNumber.of(i);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return WireNumber.of(((Number) value).longValue());
		} else if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return null;
			} else if (value instanceof Float) {
				return WireNumber.of(new BigDecimal(value.toString()));
			} else {
				return WireNumber.of(d);
			}
		}
		return null;
	}

	private Result<AttrValue> encodeElements(ConversionContext ctx, AttrType type, Iterable<?> iterable, Path path) {
		if (!(type instanceof TypeWithElementType typeWithElements)) {
			return failure(path, IncompatibleTypeDiagnostic.from(iterable, type,
				"cannot convert collection using type information provided by " + type
					+ "; it must implement " + TypeWithElementType.class.getSimpleName()));
		}
		AttrType elementType = typeWithElements.elementType();
		Diagnostics diagnostics = new Diagnostics();
		List<WireValue> wires = new ArrayList<>();
		int index = 0;
		for (Object element : iterable) {
			Path elementPath = path.atListIndex(index++);
			Optional<WireValue> wire = encodeToWire(ctx, elementType, element, elementPath, diagnostics);
			if (wire.isEmpty()) {
				return Result.failure(diagnostics);
			}
			wires.add(wire.get());
		}
		WireValue collection;
		if (type.wireType() instanceof SetWireType) {
			if (new HashSet<>(wires).size() != wires.size()) {
				return failure(diagnostics, path, IncompatibleTypeDiagnostic.from(iterable, type, "set contains duplicate elements"));
			}
			collection = WireSet.of(elementType.wireType(), wires);
		} else {
			collection = WireList.of(elementType.wireType(), wires);
		}
		return finish(ctx, type, collection, diagnostics, path);
	}

	private Result<AttrValue> encodeMap(ConversionContext ctx, AttrType type, Map<?, ?> map, Path path) {
		if (!(type instanceof TypeWithElementType typeWithElements)) {
			return failure(path, IncompatibleTypeDiagnostic.from(map, type,
				"cannot convert map using type information provided by " + type
					+ "; it must implement " + TypeWithElementType.class.getSimpleName()));
		}
		AttrType elementType = typeWithElements.elementType();
		Diagnostics diagnostics = new Diagnostics();
		Map<String, WireValue> wires = new LinkedHashMap<>();
		for (var entry : map.entrySet()) {
			if (!(entry.getKey() instanceof String key)) {
				return failure(diagnostics, path, IncompatibleTypeDiagnostic.from(map, type, "map keys must be strings"));
			}
			Optional<WireValue> wire = encodeToWire(ctx, elementType, entry.getValue(), path.atMapKey(key), diagnostics);
			if (wire.isEmpty()) {
				return Result.failure(diagnostics);
			}
			wires.put(key, wire.get());
		}
		return finish(ctx, type, WireMap.of(elementType.wireType(), wires), diagnostics, path);
	}

	/**
	 * Encodes a collection element and converts it to wire form,
	 * appending any diagnostics to {@code diagnostics}.
	 *
	 * @return the wire form, or empty if there was an error
	 */
	private Optional<WireValue> encodeToWire(ConversionContext ctx, AttrType elementType, @Nullable Object element, Path path, Diagnostics diagnostics) {
		Result<AttrValue> converted = encode(ctx, elementType, element, path);
		diagnostics.appendAll(converted.diagnostics());
		if (diagnostics.hasError()) {
			return Optional.empty();
		}
		WireValue wire;
		try {
			wire = converted.value().toWire(ctx);
		} catch (ValueConversionException e) {
			diagnostics.append(AttributeDiagnostic.withPath(path, ConversionDiagnostics.toWireError(e)));
			return Optional.empty();
		}
		if (!wire.type().equals(elementType.wireType())) {
			diagnostics.append(AttributeDiagnostic.withPath(path, IncompatibleTypeDiagnostic.from(element, elementType,
				"converted value has wire type " + wire.type() + "; expected " + elementType.wireType())));
			return Optional.empty();
		}
		return Optional.of(wire);
	}

	/**
	 * Validates {@code wire} if {@code type} supports validation,
	 * then builds the final attribute value.
	 */
	private static Result<AttrValue> finish(ConversionContext ctx, AttrType type, WireValue wire, Diagnostics diagnostics, Path path) {
		if (!wire.type().equals(type.wireType())) {
			return failure(diagnostics, path, new IncompatibleTypeDiagnostic(wire.type() + " value", type.toString(),
				"can't convert " + wire.type() + " into " + type.wireType()));
		}
		if (type instanceof TypeWithValidate typeWithValidate) {
			diagnostics.appendAll(typeWithValidate.validate(ctx, wire, path));
			if (diagnostics.hasError()) {
				return Result.failure(diagnostics);
			}
		}
		try {
			return Result.of(type.valueFromWire(ctx, wire), diagnostics);
		} catch (ValueConversionException e) {
			return failure(diagnostics, path, ConversionDiagnostics.fromWireError(e));
		}
	}

	private Optional<Diagnostic> checkProgress(ConversionContext ctx, Path path) {
		if (ctx.isDone()) {
			return Optional.of(ConversionDiagnostics.cancelled(ctx));
		} else if (path.length() > options.maxDepth()) {
			LOGGER.debug("Path \"{}\" exceeds maximum depth {}", path, options.maxDepth());
			return Optional.of(ConversionDiagnostics.depthExceeded(options.maxDepth()));
		} else {
			return Optional.empty();
		}
	}

	private static Result<Object> incompatible(WireValue value, Type target, Path path, String reason) {
		return failure(path, IncompatibleTypeDiagnostic.into(value, target, reason));
	}

	private static <T> Result<T> failure(Path path, Diagnostic diagnostic) {
		return failure(new Diagnostics(), path, diagnostic);
	}

	private static <T> Result<T> failure(Diagnostics diagnostics, Path path, Diagnostic diagnostic) {
		return Result.failure(diagnostics.append(AttributeDiagnostic.withPath(path, diagnostic)));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValueConverter.class);
}
