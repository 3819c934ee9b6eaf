package works.attrbind.types;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.ObjectWireType;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record ObjectValue(
	Map<String, AttrType> attributeTypes,
	ValueState state,
	@Nullable Map<String, AttrValue> attributes
) implements AttrValue {
	public ObjectValue {
		attributeTypes = Map.copyOf(attributeTypes);
		Values.checkState(state, attributes);
		if (attributes != null) {
			attributes = Map.copyOf(attributes);
			if (!attributes.keySet().equals(attributeTypes.keySet())) {
				throw new IllegalArgumentException("Attributes " + attributes.keySet()
					+ " don't match attribute types " + attributeTypes.keySet());
			}
			for (var entry : attributes.entrySet()) {
				AttrType expected = attributeTypes.get(entry.getKey());
				if (!entry.getValue().type().wireType().equals(expected.wireType())) {
					throw new IllegalArgumentException("Attribute \"" + entry.getKey() + "\" has type "
						+ entry.getValue().type() + "; expected " + expected);
				}
			}
		}
	}

	public static ObjectValue of(Map<String, ? extends AttrType> attributeTypes, Map<String, ? extends AttrValue> attributes) {
		return new ObjectValue(Map.copyOf(attributeTypes), ValueState.KNOWN, Map.copyOf(attributes));
	}

	public static ObjectValue nullValue(Map<String, ? extends AttrType> attributeTypes) {
		return new ObjectValue(Map.copyOf(attributeTypes), ValueState.NULL, null);
	}

	public static ObjectValue unknown(Map<String, ? extends AttrType> attributeTypes) {
		return new ObjectValue(Map.copyOf(attributeTypes), ValueState.UNKNOWN, null);
	}

	@Override
	public ObjectType type() {
		return new ObjectType(attributeTypes);
	}

	/**
	 * @return the named attribute
	 * @throws IllegalStateException if this value is not known
	 * @throws IllegalArgumentException if there's no such attribute
	 */
	public AttrValue attribute(String name) {
		if (attributes == null) {
			throw new IllegalStateException("Object is " + state);
		}
		AttrValue result = attributes.get(name);
		if (result == null) {
			throw new IllegalArgumentException("No such attribute: " + name);
		}
		return result;
	}

	@Override
	public WireValue toWire(ConversionContext ctx) throws ValueConversionException {
		WireType wireType = type().wireType();
		if (state != ValueState.KNOWN) {
			return Values.nonKnownWire(state, wireType);
		}
		Map<String, WireValue> wires = new LinkedHashMap<>();
		for (var entry : attributes.entrySet()) {
			wires.put(entry.getKey(), entry.getValue().toWire(ctx));
		}
		return new WireObject((ObjectWireType) wireType, wires);
	}

	@Override
	public String toString() {
		return Values.describe(state, attributes);
	}
}
