package works.attrbind.wire;

import java.util.Locale;

public enum PrimitiveWireType implements WireType {
	STRING,
	NUMBER,
	BOOL;

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}
}
