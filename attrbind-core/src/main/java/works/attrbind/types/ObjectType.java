package works.attrbind.types;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.TypeWithAttributeTypes;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.ObjectWireType;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static java.util.stream.Collectors.joining;

public record ObjectType(Map<String, AttrType> attributeTypes) implements TypeWithAttributeTypes {
	public ObjectType {
		attributeTypes = Map.copyOf(attributeTypes);
	}

	@Override
	public WireType wireType() {
		Map<String, WireType> wireTypes = new LinkedHashMap<>();
		attributeTypes.forEach((name, type) -> wireTypes.put(name, type.wireType()));
		return new ObjectWireType(wireTypes);
	}

	@Override
	public ObjectValue valueFromWire(ConversionContext ctx, WireValue value) throws ValueConversionException {
		Values.checkWireType(this, value);
		if (value.isNull()) {
			return ObjectValue.nullValue(attributeTypes);
		} else if (!value.isKnown()) {
			return ObjectValue.unknown(attributeTypes);
		}
		Map<String, AttrValue> attributes = new LinkedHashMap<>();
		for (var entry : ((WireObject) value).attributes().entrySet()) {
			AttrType attributeType = attributeTypes.get(entry.getKey());
			attributes.put(entry.getKey(), attributeType.valueFromWire(ctx, entry.getValue()));
		}
		return ObjectValue.of(attributeTypes, attributes);
	}

	@Override
	public ObjectType withAttributeTypes(Map<String, AttrType> attributeTypes) {
		return new ObjectType(attributeTypes);
	}

	@Override
	public String toString() {
		return new TreeMap<>(attributeTypes).entrySet().stream()
			.map(e -> e.getKey() + ": " + e.getValue())
			.collect(joining(", ", "object{", "}"));
	}
}
