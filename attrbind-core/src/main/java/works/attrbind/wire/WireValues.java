package works.attrbind.wire;

import java.util.Collection;

final class WireValues {
	private WireValues() { }

	static void checkElementTypes(WireType elementType, Collection<WireValue> elements) {
		for (WireValue element : elements) {
			if (!element.type().equals(elementType)) {
				throw new IllegalArgumentException("Element " + element + " has type " + element.type()
					+ "; expected " + elementType);
			}
		}
	}
}
