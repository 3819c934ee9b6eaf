package works.attrbind.types;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.MapWireType;
import works.attrbind.wire.WireMap;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

public record MapValue(AttrType elementType, ValueState state, @Nullable Map<String, AttrValue> elements) implements AttrValue {
	public MapValue {
		requireNonNull(elementType);
		Values.checkState(state, elements);
		if (elements != null) {
			elements = Map.copyOf(elements);
			Values.checkElementTypes(elementType, elements.values());
		}
	}

	public static MapValue of(AttrType elementType, Map<String, ? extends AttrValue> elements) {
		return new MapValue(elementType, ValueState.KNOWN, Map.copyOf(elements));
	}

	public static MapValue nullValue(AttrType elementType) {
		return new MapValue(elementType, ValueState.NULL, null);
	}

	public static MapValue unknown(AttrType elementType) {
		return new MapValue(elementType, ValueState.UNKNOWN, null);
	}

	@Override
	public MapType type() {
		return new MapType(elementType);
	}

	@Override
	public WireValue toWire(ConversionContext ctx) throws ValueConversionException {
		if (state != ValueState.KNOWN) {
			return Values.nonKnownWire(state, new MapWireType(elementType.wireType()));
		}
		Map<String, WireValue> wires = new LinkedHashMap<>();
		for (var entry : elements.entrySet()) {
			wires.put(entry.getKey(), entry.getValue().toWire(ctx));
		}
		return WireMap.of(elementType.wireType(), wires);
	}

	@Override
	public String toString() {
		return Values.describe(state, elements);
	}
}
