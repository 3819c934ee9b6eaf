package works.attrbind.types;

import java.util.Collection;
import works.attrbind.attr.AttrType;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.exceptions.ValueConversionException;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

/**
 * Checks shared by the built-in types and values.
 */
final class Values {
	private Values() { }

	static void checkWireType(AttrType type, WireValue value) throws ValueConversionException {
		if (!value.type().equals(type.wireType())) {
			throw new ValueConversionException("Can't use " + value.type() + " value as " + type
				+ "; expected " + type.wireType());
		}
	}

	static void checkState(ValueState state, Object value) {
		requireNonNull(state);
		if ((state == ValueState.KNOWN) != (value != null)) {
			throw new IllegalArgumentException("A " + state + " value must " + (state == ValueState.KNOWN ? "" : "not ") + "have contents");
		}
	}

	/**
	 * Elements may come from a different type than {@code elementType}
	 * as long as their wire form is the same.
	 */
	static void checkElementTypes(AttrType elementType, Collection<? extends AttrValue> elements) {
		for (AttrValue element : elements) {
			if (!element.type().wireType().equals(elementType.wireType())) {
				throw new IllegalArgumentException("Element has type " + element.type() + "; expected " + elementType);
			}
		}
	}

	static WireValue nonKnownWire(ValueState state, WireType type) {
		return switch (state) {
			case NULL -> WireValue.nullOf(type);
			case UNKNOWN -> WireValue.unknownOf(type);
			case KNOWN -> throw new IllegalStateException("Value is known");
		};
	}

	static String describe(ValueState state, Object value) {
		return switch (state) {
			case NULL -> "null";
			case UNKNOWN -> "<unknown>";
			case KNOWN -> String.valueOf(value);
		};
	}
}
