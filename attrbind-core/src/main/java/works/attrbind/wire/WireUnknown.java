package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record WireUnknown(WireType type) implements WireValue {
	public WireUnknown {
		requireNonNull(type);
	}

	@Override
	public boolean isKnown() {
		return false;
	}

	@Override
	public String toString() {
		return "<unknown>";
	}
}
