package works.attrbind.types;

import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record StringValue(ValueState state, @Nullable String value) implements AttrValue {
	public StringValue {
		Values.checkState(state, value);
	}

	public static StringValue of(String value) {
		return new StringValue(ValueState.KNOWN, value);
	}

	public static StringValue nullValue() {
		return new StringValue(ValueState.NULL, null);
	}

	public static StringValue unknown() {
		return new StringValue(ValueState.UNKNOWN, null);
	}

	@Override
	public StringType type() {
		return AttrTypes.STRING;
	}

	@Override
	public WireValue toWire(ConversionContext ctx) {
		if (state == ValueState.KNOWN) {
			return WireString.of(value);
		} else {
			return Values.nonKnownWire(state, WireType.STRING);
		}
	}

	@Override
	public String toString() {
		return state == ValueState.KNOWN ? "\"" + value + "\"" : Values.describe(state, value);
	}
}
