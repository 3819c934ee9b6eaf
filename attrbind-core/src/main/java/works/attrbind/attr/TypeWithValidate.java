package works.attrbind.attr;

import works.attrbind.ConversionContext;
import works.attrbind.diag.Diagnostics;
import works.attrbind.path.Path;
import works.attrbind.wire.WireValue;

/**
 * An {@link AttrType} with rules beyond those expressed by its {@link AttrType#wireType() wire type}.
 * <p>
 * When a Java value is converted into a value of this type,
 * the wire form is validated before {@link AttrType#valueFromWire valueFromWire} is called.
 * Any error in the returned diagnostics aborts the conversion.
 */
public interface TypeWithValidate extends AttrType {
	/**
	 * @param path the location of {@code value}, for attributing diagnostics
	 */
	Diagnostics validate(ConversionContext ctx, WireValue value, Path path);
}
