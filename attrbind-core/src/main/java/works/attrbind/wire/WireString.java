package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record WireString(String value) implements WireValue {
	public WireString {
		requireNonNull(value);
	}

	public static WireString of(String value) {
		return new WireString(value);
	}

	@Override
	public WireType type() {
		return WireType.STRING;
	}

	@Override
	public String toString() {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
