package works.attrbind.types;

import java.math.BigDecimal;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.attrbind.ConversionContext;
import works.attrbind.attr.AttrValue;
import works.attrbind.attr.ValueState;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

/**
 * Like {@link WireNumber}, compares numbers by value regardless of scale.
 */
public record NumberValue(ValueState state, @Nullable BigDecimal value) implements AttrValue {
	public NumberValue {
		Values.checkState(state, value);
	}

	public static NumberValue of(BigDecimal value) {
		return new NumberValue(ValueState.KNOWN, value);
	}

	public static NumberValue of(long value) {
		return of(BigDecimal.valueOf(value));
	}

	public static NumberValue nullValue() {
		return new NumberValue(ValueState.NULL, null);
	}

	public static NumberValue unknown() {
		return new NumberValue(ValueState.UNKNOWN, null);
	}

	@Override
	public NumberType type() {
		return AttrTypes.NUMBER;
	}

	@Override
	public WireValue toWire(ConversionContext ctx) {
		if (state == ValueState.KNOWN) {
			return WireNumber.of(value);
		} else {
			return Values.nonKnownWire(state, WireType.NUMBER);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof NumberValue other) || state != other.state) {
			return false;
		}
		return (value == null) ? other.value == null : other.value != null && value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(state, (value == null || value.signum() == 0) ? null : value.stripTrailingZeros());
	}

	@Override
	public String toString() {
		return state == ValueState.KNOWN ? WireNumber.format(value) : Values.describe(state, value);
	}
}
