package works.attrbind.wire;

import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.joining;

public record WireMap(MapWireType type, Map<String, WireValue> elements) implements WireValue {
	public WireMap {
		elements = Map.copyOf(elements);
		WireValues.checkElementTypes(type.element(), elements.values());
	}

	public static WireMap of(WireType elementType, Map<String, ? extends WireValue> elements) {
		return new WireMap(new MapWireType(elementType), Map.copyOf(elements));
	}

	@Override
	public boolean isFullyKnown() {
		return elements.values().stream().allMatch(WireValue::isFullyKnown);
	}

	@Override
	public String toString() {
		return new TreeMap<>(elements).entrySet().stream()
			.map(e -> "\"" + e.getKey() + "\": " + e.getValue())
			.collect(joining(", ", "{", "}"));
	}
}
