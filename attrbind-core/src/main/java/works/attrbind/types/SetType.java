package works.attrbind.types;

import java.util.ArrayList;
import java.util.List;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithElementType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.SetWireType;
import works.attrbind.wire.WireSet;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

public record SetType(AttrType elementType) implements TypeWithElementType {
	public SetType {
		requireNonNull(elementType);
	}

	@Override
	public WireType wireType() {
		return new SetWireType(elementType.wireType());
	}

	@Override
	public SetValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return SetValue.nullValue(elementType);
		} else if (!value.isKnown()) {
			return SetValue.unknown(elementType);
		}
		List<AttrValue> elements = new ArrayList<>();
		for (WireValue element : ((WireSet) value).elements()) {
			elements.add(elementType.valueFromWire(ctx, element));
		}
		return SetValue.of(elementType, elements);
	}

	@Override
	public SetType withElementType(AttrType elementType) {
		return new SetType(elementType);
	}

	@Override
	public String toString() {
		return "set<" + elementType + ">";
	}
}
