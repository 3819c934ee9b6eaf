package works.attrbind.path;

import works.attrbind.wire.WireValue;

import static java.util.Objects.requireNonNull;

/**
 * One step from a value to something nested inside it.
 */
public sealed interface PathStep {
	/**
	 * @param first true if this is the first step of its {@link Path},
	 *              in which case attribute names have no leading dot
	 */
	String render(boolean first);

	/**
	 * An attribute of an object.
	 */
	record AttributeName(String name) implements PathStep {
		public AttributeName {
			requireNonNull(name);
		}

		@Override
		public String render(boolean first) {
			return first ? name : "." + name;
		}
	}

	/**
	 * A list element, by position.
	 */
	record ElementKeyInt(long index) implements PathStep {
		public ElementKeyInt {
			if (index < 0) {
				throw new IllegalArgumentException("Negative list index: " + index);
			}
		}

		@Override
		public String render(boolean first) {
			return "[" + index + "]";
		}
	}

	/**
	 * A map element, by key.
	 */
	record ElementKeyString(String key) implements PathStep {
		public ElementKeyString {
			requireNonNull(key);
		}

		@Override
		public String render(boolean first) {
			return "[\"" + key + "\"]";
		}
	}

	/**
	 * A set element, identified by its own value since sets have no other key.
	 */
	record ElementKeyValue(WireValue value) implements PathStep {
		public ElementKeyValue {
			requireNonNull(value);
		}

		@Override
		public String render(boolean first) {
			return "[Value(" + value + ")]";
		}
	}
}
