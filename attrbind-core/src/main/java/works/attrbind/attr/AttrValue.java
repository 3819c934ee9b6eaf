package works.attrbind.attr;

import works.attrbind.ConversionContext;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireValue;

/**
 * A value of some {@link AttrType}.
 */
public interface AttrValue {
	AttrType type();

	ValueState state();

	/**
	 * @throws ValueConversionException if this value has no valid wire form
	 */
	WireValue toWire(ConversionContext ctx) throws ValueConversionException;

	default boolean isNull() {
		return state() == ValueState.NULL;
	}

	default boolean isUnknown() {
		return state() == ValueState.UNKNOWN;
	}
}
