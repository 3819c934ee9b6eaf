package works.attrbind.types;

import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.wire.WireBool;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

public record BoolValue(ValueState state, @Nullable Boolean value) implements AttrValue {
	public BoolValue {
		Values.checkState(state, value);
	}

	public static BoolValue of(boolean value) {
		return new BoolValue(ValueState.KNOWN, value);
	}

	public static BoolValue nullValue() {
		return new BoolValue(ValueState.NULL, null);
	}

	public static BoolValue unknown() {
		return new BoolValue(ValueState.UNKNOWN, null);
	}

	@Override
	public BoolType type() {
		return AttrTypes.BOOL;
	}

	@Override
	public WireValue toWire(ConversionContext ctx) {
		if (state == ValueState.KNOWN) {
			return WireBool.of(value);
		} else {
			return Values.nonKnownWire(state, WireType.BOOL);
		}
	}

	@Override
	public String toString() {
		return Values.describe(state, value);
	}
}
