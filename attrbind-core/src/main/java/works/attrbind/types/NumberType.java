package works.attrbind.types;

import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record NumberType() implements AttrType {
	@Override
	public WireType wireType() {
		return WireType.NUMBER;
	}

	@Override
	public NumberValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return NumberValue.nullValue();
		} else if (!value.isKnown()) {
			return NumberValue.unknown();
		} else {
			return NumberValue.of(((WireNumber) value).value());
		}
	}

	@Override
	public String toString() {
		return "number";
	}
}
