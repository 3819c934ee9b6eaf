package works.attrbind.wire;

import java.util.List;

import static java.util.stream.Collectors.joining;

public record WireList(ListWireType type, List<WireValue> elements) implements WireValue {
	public WireList {
		elements = List.copyOf(elements);
		WireValues.checkElementTypes(type.element(), elements);
	}

	public static WireList of(WireType elementType, List<? extends WireValue> elements) {
		return new WireList(new ListWireType(elementType), List.copyOf(elements));
	}

	@Override
	public boolean isFullyKnown() {
		return elements.stream().allMatch(WireValue::isFullyKnown);
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Object::toString)
			.collect(joining(", ", "[", "]"));
	}
}
