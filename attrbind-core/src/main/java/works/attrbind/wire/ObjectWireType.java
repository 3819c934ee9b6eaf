package works.attrbind.wire;

import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.joining;

/**
 * @param attributeTypes the type of each attribute, by name.
 *                       Every {@link WireObject} of this type has exactly these attributes.
 */
public record ObjectWireType(Map<String, WireType> attributeTypes) implements WireType {
	public ObjectWireType {
		attributeTypes = Map.copyOf(attributeTypes);
	}

	@Override
	public String toString() {
		return new TreeMap<>(attributeTypes).entrySet().stream()
			.map(e -> e.getKey() + ": " + e.getValue())
			.collect(joining(", ", "object{", "}"));
	}
}
