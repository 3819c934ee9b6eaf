package works.attrbind.reflect;

import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.diag.Result;
import works.attrbind.path.Path;
import works.attrbind.wire.WireValue;

/**
 * Converts a single value between its wire form and a Java object.
 * <p>
 * {@link RecordDecoder} and {@link RecordEncoder} delegate each record component to a converter,
 * which in turn may delegate nested records back to them.
 * <p>
 * Implementations report problems as diagnostics in the returned {@link Result},
 * attributed to {@code path} or a path extending it.
 * They should return promptly with an error once {@code ctx} {@link ConversionContext#isDone is done}.
 */
public interface ValueConverter {
	/**
	 * @param type the declared schema type of {@code value}
	 * @param target the Java type to produce
	 */
	Result<Object> decode(ConversionContext ctx, AttrType type, WireValue value, Type target, Path path);

	/**
	 * @param type the schema type to produce a value of
	 */
	Result<AttrValue> encode(ConversionContext ctx, AttrType type, @Nullable Object value, Path path);
}
