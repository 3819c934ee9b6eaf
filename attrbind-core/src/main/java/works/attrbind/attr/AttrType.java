package works.attrbind.attr;

import works.attrbind.ConversionContext;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

/**
 * The declared type of a schema attribute.
 * <p>
 * Implementations must be immutable, and must implement {@link Object#equals equals}
 * such that types describing the same values are equal.
 */
public interface AttrType {
	/**
	 * @return the shape of this type's values in wire form
	 */
	WireType wireType();

	/**
	 * Builds a value of this type from its wire form.
	 * Must accept {@link WireValue#nullOf null} and {@link WireValue#unknownOf unknown}
	 * values of {@link #wireType()}.
	 *
	 * @throws ValueConversionException if {@code value} can't be represented by this type
	 */
	AttrValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException;
}
