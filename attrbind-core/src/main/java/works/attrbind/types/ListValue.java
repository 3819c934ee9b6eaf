package works.attrbind.types;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.ListWireType;
import works.attrbind.wire.WireList;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

public record ListValue(AttrType elementType, ValueState state, @Nullable List<AttrValue> elements) implements AttrValue {
	public ListValue {
		requireNonNull(elementType);
		Values.checkState(state, elements);
		if (elements != null) {
			elements = List.copyOf(elements);
			Values.checkElementTypes(elementType, elements);
		}
	}

	public static ListValue of(AttrType elementType, List<? extends AttrValue> elements) {
		return new ListValue(elementType, ValueState.KNOWN, List.copyOf(elements));
	}

	public static ListValue nullValue(AttrType elementType) {
		return new ListValue(elementType, ValueState.NULL, null);
	}

	public static ListValue unknown(AttrType elementType) {
		return new ListValue(elementType, ValueState.UNKNOWN, null);
	}

	@Override
	public ListType type() {
		return new ListType(elementType);
	}

	@Override
	public WireValue toWire(ConversionContext ctx) throws ValueConversionException {
		if (state != ValueState.KNOWN) {
			return Values.nonKnownWire(state, new ListWireType(elementType.wireType()));
		}
		List<WireValue> wires = new ArrayList<>(elements.size());
		for (AttrValue element : elements) {
			wires.add(element.toWire(ctx));
		}
		return WireList.of(elementType.wireType(), wires);
	}

	@Override
	public String toString() {
		return Values.describe(state, elements);
	}
}
