package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record WireNull(WireType type) implements WireValue {
	public WireNull {
		requireNonNull(type);
	}

	@Override
	public boolean isNull() {
		return true;
	}

	@Override
	public String toString() {
		return "null";
	}
}
