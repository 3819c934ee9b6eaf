package works.attrbind.wire;

import java.math.BigDecimal;
import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/**
 * Numbers are compared by value, so {@code 30} and {@code 30.0} are equal.
 */
public record WireNumber(BigDecimal value) implements WireValue {
	/**
	 * Numbers whose plain decimal form would need more digits than this
	 * are {@link #format formatted} in scientific notation instead.
	 */
	public static final int MAX_PLAIN_DIGITS = 1000;

	public WireNumber {
		requireNonNull(value);
	}

	public static WireNumber of(long value) {
		return new WireNumber(BigDecimal.valueOf(value));
	}

	public static WireNumber of(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Wire numbers must be finite: " + value);
		}
		return new WireNumber(BigDecimal.valueOf(value));
	}

	public static WireNumber of(BigInteger value) {
		return new WireNumber(new BigDecimal(value));
	}

	public static WireNumber of(BigDecimal value) {
		return new WireNumber(value);
	}

	@Override
	public WireType type() {
		return WireType.NUMBER;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof WireNumber other && value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
	}

	/**
	 * @return true if the plain decimal form of {@code value} has at most {@link #MAX_PLAIN_DIGITS} digits
	 */
	public static boolean fitsPlain(BigDecimal value) {
		long integerDigits = Math.max((long) value.precision() - value.scale(), 1);
		long fractionDigits = Math.max(value.scale(), 0);
		return integerDigits + fractionDigits <= MAX_PLAIN_DIGITS;
	}

	/**
	 * @return the plain decimal form of {@code value} if it {@link #fitsPlain fits}, or scientific notation
	 */
	public static String format(BigDecimal value) {
		return fitsPlain(value) ? value.toPlainString() : value.toString();
	}

	@Override
	public String toString() {
		return format(value);
	}
}
