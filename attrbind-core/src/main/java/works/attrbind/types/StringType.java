package works.attrbind.types;

import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record StringType() implements AttrType {
	@Override
	public WireType wireType() {
		return WireType.STRING;
	}

	@Override
	public StringValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return StringValue.nullValue();
		} else if (!value.isKnown()) {
			return StringValue.unknown();
		} else {
			return StringValue.of(((WireString) value).value());
		}
	}

	@Override
	public String toString() {
		return "string";
	}
}
