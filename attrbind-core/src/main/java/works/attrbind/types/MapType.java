package works.attrbind.types;

import java.util.LinkedHashMap;
import java.util.Map;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithElementType;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.MapWireType;
import works.attrbind.wire.WireMap;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

/**
 * Maps from string keys to values of {@link #elementType}.
 */
public record MapType(AttrType elementType) implements TypeWithElementType {
	public MapType {
		requireNonNull(elementType);
	}

	@Override
	public WireType wireType() {
		return new MapWireType(elementType.wireType());
	}

	@Override
	public MapValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return MapValue.nullValue(elementType);
		} else if (!value.isKnown()) {
			return MapValue.unknown(elementType);
		}
		Map<String, AttrValue> elements = new LinkedHashMap<>();
		for (var entry : ((WireMap) value).elements().entrySet()) {
			elements.put(entry.getKey(), elementType.valueFromWire(ctx, entry.getValue()));
		}
		return MapValue.of(elementType, elements);
	}

	@Override
	public MapType withElementType(AttrType elementType) {
		return new MapType(elementType);
	}

	@Override
	public String toString() {
		return "map<" + elementType + ">";
	}
}
