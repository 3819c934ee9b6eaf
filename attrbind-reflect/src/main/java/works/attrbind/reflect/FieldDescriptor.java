package works.attrbind.reflect;

import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.stream.Collectors.joining;

/**
 * Associates a schema attribute name with the record component that holds its value.
 *
 * @param name the attribute name
 * @param components the components leading from the root record to the one holding the value.
 *                   All but the last are {@link works.attrbind.annotations.Embedded embedded} records.
 */
public record FieldDescriptor(String name, List<RecordComponent> components) {
	public FieldDescriptor {
		components = List.copyOf(components);
		if (components.isEmpty()) {
			throw new IllegalArgumentException("Field \"" + name + "\" must have at least one component");
		}
	}

	public RecordComponent component() {
		return components.get(components.size() - 1);
	}

	public Type genericType() {
		return component().getGenericType();
	}

	/**
	 * @return the value of this field in the given record,
	 * or null if an embedded record along the way is null
	 */
	public @Nullable Object read(Object root) {
		Object current = root;
		for (RecordComponent c : components) {
			if (current == null) {
				return null;
			}
			current = ReflectionHelpers.readComponent(c, current);
		}
		return current;
	}

	@Override
	public String toString() {
		return name + " <- " + components.get(0).getDeclaringRecord().getSimpleName()
			+ components.stream().map(RecordComponent::getName).collect(joining(".", ".", ""));
	}
}
