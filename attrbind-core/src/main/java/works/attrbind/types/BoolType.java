package works.attrbind.types;

import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireBool;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record BoolType() implements AttrType {
	@Override
	public WireType wireType() {
		return WireType.BOOL;
	}

	@Override
	public BoolValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return BoolValue.nullValue();
		} else if (!value.isKnown()) {
			return BoolValue.unknown();
		} else {
			return BoolValue.of(((WireBool) value).value());
		}
	}

	@Override
	public String toString() {
		return "bool";
	}
}
