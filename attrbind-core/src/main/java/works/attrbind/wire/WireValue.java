package works.attrbind.wire;

/**
 * A value in its canonical wire form.
 * <p>
 * Besides ordinary known values, any type can be represented
 * by a {@link WireNull null} or {@link WireUnknown unknown} value.
 * Unknown values stand in for data that won't be available until later,
 * and can't be converted into ordinary Java values.
 * <p>
 * The {@link Object#toString() toString} method returns
 * a compact rendering suitable for diagnostics and log messages.
 */
public sealed interface WireValue permits
	WireString,
	WireNumber,
	WireBool,
	WireList,
	WireSet,
	WireMap,
	WireObject,
	WireNull,
	WireUnknown
{
	WireType type();

	default boolean isNull() {
		return false;
	}

	/**
	 * Note that a known collection may still contain unknown elements;
	 * see {@link #isFullyKnown()}.
	 */
	default boolean isKnown() {
		return true;
	}

	/**
	 * @return true if neither this value nor anything nested inside it is unknown
	 */
	default boolean isFullyKnown() {
		return isKnown();
	}

	static WireValue nullOf(WireType type) {
		return new WireNull(type);
	}

	static WireValue unknownOf(WireType type) {
		return new WireUnknown(type);
	}
}
