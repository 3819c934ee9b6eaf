package works.attrbind.wire;

import java.util.HashSet;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Elements are distinct, and their order is not significant:
 * two sets with the same elements in a different order are equal.
 */
public record WireSet(SetWireType type, List<WireValue> elements) implements WireValue {
	public WireSet {
		elements = List.copyOf(elements);
		WireValues.checkElementTypes(type.element(), elements);
		if (new HashSet<>(elements).size() != elements.size()) {
			throw new IllegalArgumentException("Set elements must be distinct: " + elements);
		}
	}

	public static WireSet of(WireType elementType, List<? extends WireValue> elements) {
		return new WireSet(new SetWireType(elementType), List.copyOf(elements));
	}

	@Override
	public boolean isFullyKnown() {
		return elements.stream().allMatch(WireValue::isFullyKnown);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof WireSet other
			&& type.equals(other.type)
			&& new HashSet<>(elements).equals(new HashSet<>(other.elements));
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + new HashSet<>(elements).hashCode();
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Object::toString)
			.collect(joining(", ", "set[", "]"));
	}
}
