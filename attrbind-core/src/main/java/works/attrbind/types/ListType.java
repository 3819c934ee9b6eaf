package works.attrbind.types;

import java.util.ArrayList;
import java.util.List;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithElementType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.ListWireType;
import works.attrbind.wire.WireList;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

public record ListType(AttrType elementType) implements TypeWithElementType {
	public ListType {
		requireNonNull(elementType);
	}

	@Override
	public WireType wireType() {
		return new ListWireType(elementType.wireType());
	}

	@Override
	public ListValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return ListValue.nullValue(elementType);
		} else if (!value.isKnown()) {
			return ListValue.unknown(elementType);
		}
		List<AttrValue> elements = new ArrayList<>();
		for (WireValue element : ((WireList) value).elements()) {
			elements.add(elementType.valueFromWire(ctx, element));
		}
		return ListValue.of(elementType, elements);
	}

	@Override
	public ListType withElementType(AttrType elementType) {
		return new ListType(elementType);
	}

	@Override
	public String toString() {
		return "list<" + elementType + ">";
	}
}
