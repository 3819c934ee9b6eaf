package works.attrbind.reflect;

import java.lang.reflect.Type;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.diag.Result;
import works.attrbind.exceptions.InvalidRecordTypeException;
import works.attrbind.path.Path;
import works.attrbind.wire.WireValue;

/**
 * Entry point for converting between Java values and attribute values.
 * <p>
 * Each call is independent: nothing is cached, and conversions may proceed concurrently.
 * Problems are reported as diagnostics in the returned {@link Result}, never thrown.
 */
public final class Marshaller {
	private final ValueConverter converter;

	public Marshaller(ValueConverter converter) {
		this.converter = converter;
	}

	public Marshaller(Options options) {
		this(new DefaultValueConverter(options));
	}

	public Marshaller() {
		this(Options.DEFAULT);
	}

	/**
	 * @param type the schema type describing {@code value}
	 * @return the converted value; if the result has no error, its value is an instance of {@code target},
	 * or null if {@code value} is null
	 */
	@SuppressWarnings("unchecked")
	public <T> Result<T> decode(ConversionContext ctx, AttrType type, WireValue value, Class<T> target) {
		Result<Object> result = decode(ctx, type, value, (Type) target);
		return Result.of((T) result.value(), result.diagnostics());
	}

	/**
	 * Use this in preference to {@link #decode(ConversionContext, AttrType, WireValue, Class)}
	 * when {@code target} is a parameterized type such as {@code List<String>}.
	 */
	public Result<Object> decode(ConversionContext ctx, AttrType type, WireValue value, Type target) {
		return converter.decode(ctx, type, value, target, Path.empty());
	}

	public Result<AttrValue> encode(ConversionContext ctx, AttrType type, @Nullable Object value) {
		return converter.encode(ctx, type, value, Path.empty());
	}

	/**
	 * @return the attributes that {@code recordClass} corresponds to
	 */
	public List<FieldDescriptor> fieldsOf(Class<?> recordClass) throws InvalidRecordTypeException {
		return RecordFields.of(recordClass);
	}
}
