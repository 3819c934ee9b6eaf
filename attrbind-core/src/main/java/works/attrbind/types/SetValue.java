package works.attrbind.types;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.SetWireType;
import works.attrbind.wire.WireSet;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

/**
 * Elements are kept in the order given, but that order doesn't affect equality.
 */
public record SetValue(AttrType elementType, ValueState state, @Nullable List<AttrValue> elements) implements AttrValue {
	public SetValue {
		requireNonNull(elementType);
		Values.checkState(state, elements);
		if (elements != null) {
			elements = List.copyOf(elements);
			Values.checkElementTypes(elementType, elements);
		}
	}

	public static SetValue of(AttrType elementType, List<? extends AttrValue> elements) {
		return new SetValue(elementType, ValueState.KNOWN, List.copyOf(elements));
	}

	public static SetValue nullValue(AttrType elementType) {
		return new SetValue(elementType, ValueState.NULL, null);
	}

	public static SetValue unknown(AttrType elementType) {
		return new SetValue(elementType, ValueState.UNKNOWN, null);
	}

	@Override
	public SetType type() {
		return new SetType(elementType);
	}

	/**
	 * @throws ValueConversionException if two elements have the same wire form
	 */
	@Override
	public WireValue toWire(ConversionContext ctx) throws ValueConversionException {
		if (state != ValueState.KNOWN) {
			return Values.nonKnownWire(state, new SetWireType(elementType.wireType()));
		}
		List<WireValue> wires = new ArrayList<>(elements.size());
		for (AttrValue element : elements) {
			wires.add(element.toWire(ctx));
		}
		if (new HashSet<>(wires).size() != wires.size()) {
			throw new ValueConversionException("Set contains duplicate elements: " + wires);
		}
		return WireSet.of(elementType.wireType(), wires);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SetValue other
			&& elementType.equals(other.elementType)
			&& state == other.state
			&& Objects.equals(asSet(), other.asSet());
	}

	@Override
	public int hashCode() {
		return Objects.hash(elementType, state, asSet());
	}

	private @Nullable HashSet<AttrValue> asSet() {
		return (elements == null) ? null : new HashSet<>(elements);
	}

	@Override
	public String toString() {
		return Values.describe(state, elements);
	}
}
