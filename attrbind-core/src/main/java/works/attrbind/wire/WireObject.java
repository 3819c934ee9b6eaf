package works.attrbind.wire;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static java.util.stream.Collectors.joining;

/**
 * An object's attribute names are always exactly those declared by its {@link ObjectWireType}.
 */
public record WireObject(ObjectWireType type, Map<String, WireValue> attributes) implements WireValue {
	public WireObject {
		attributes = Map.copyOf(attributes);
		Map<String, WireType> declared = type.attributeTypes();
		if (!attributes.keySet().equals(declared.keySet())) {
			Set<String> missing = new TreeSet<>(declared.keySet());
			missing.removeAll(attributes.keySet());
			Set<String> extra = new TreeSet<>(attributes.keySet());
			extra.removeAll(declared.keySet());
			throw new IllegalArgumentException("Object attributes don't match its type " + type
				+ "; missing " + missing + ", unexpected " + extra);
		}
		attributes.forEach((name, value) -> {
			if (!value.type().equals(declared.get(name))) {
				throw new IllegalArgumentException("Attribute \"" + name + "\" must have type "
					+ declared.get(name) + ", not " + value.type());
			}
		});
	}

	/**
	 * Infers the object's type from the types of the given attribute values.
	 */
	public static WireObject of(Map<String, ? extends WireValue> attributes) {
		Map<String, WireType> types = new LinkedHashMap<>();
		attributes.forEach((name, value) -> types.put(name, value.type()));
		return new WireObject(new ObjectWireType(types), Map.copyOf(attributes));
	}

	public Set<String> attributeNames() {
		return new HashSet<>(attributes.keySet());
	}

	@Override
	public boolean isFullyKnown() {
		return attributes.values().stream().allMatch(WireValue::isFullyKnown);
	}

	@Override
	public String toString() {
		return new TreeMap<>(attributes).entrySet().stream()
			.map(e -> e.getKey() + ": " + e.getValue())
			.collect(joining(", ", "{", "}"));
	}
}
