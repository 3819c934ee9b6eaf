package works.attrbind.wire;

public record WireBool(boolean value) implements WireValue {
	public static final WireBool TRUE = new WireBool(true);
	public static final WireBool FALSE = new WireBool(false);

	public static WireBool of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public WireType type() {
		return WireType.BOOL;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
