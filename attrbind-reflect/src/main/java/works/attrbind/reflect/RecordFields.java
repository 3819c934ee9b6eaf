package works.attrbind.reflect;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.attrbind.annotations.Attr;
import works.attrbind.annotations.Embedded;
import works.attrbind.exceptions.InvalidComponentException;
import works.attrbind.exceptions.InvalidRecordTypeException;

/**
 * Determines which attribute each component of a record corresponds to.
 * <p>
 * Every component must be annotated with either {@link Attr} or {@link Embedded}.
 * Components annotated {@code @Attr(Attr.IGNORE)} are omitted.
 * The components of embedded records are included in place of the embedded component itself,
 * recursively, and share the enclosing record's attribute namespace.
 * <p>
 * Results are not cached; each call inspects the class afresh.
 */
public final class RecordFields {
	private RecordFields() { }

	/**
	 * @return the fields of {@code recordClass}, in component declaration order
	 * @throws InvalidRecordTypeException if {@code recordClass} isn't a record,
	 * or its components aren't annotated correctly
	 */
	public static List<FieldDescriptor> of(Class<?> recordClass) throws InvalidRecordTypeException {
		if (!recordClass.isRecord()) {
			throw new InvalidRecordTypeException("Expected a record type, got " + recordClass.getName());
		}
		Map<String, FieldDescriptor> fieldsByName = new LinkedHashMap<>();
		scan(recordClass, List.of(), new LinkedHashSet<>(), fieldsByName);
		List<FieldDescriptor> result = List.copyOf(fieldsByName.values());
		LOGGER.debug("Record {} has fields {}", recordClass.getSimpleName(), fieldsByName.keySet());
		return result;
	}

	/**
	 * @return the attribute names of {@code fields}, in order
	 */
	public static Set<String> names(List<FieldDescriptor> fields) {
		Set<String> result = new LinkedHashSet<>();
		fields.forEach(f -> result.add(f.name()));
		return result;
	}

	private static void scan(
		Class<?> recordClass,
		List<RecordComponent> prefix,
		Set<Class<?>> enclosing,
		Map<String, FieldDescriptor> fieldsByName
	) throws InvalidRecordTypeException {
		enclosing.add(recordClass);
		for (RecordComponent c : recordClass.getRecordComponents()) {
			Attr attr = c.getAnnotation(Attr.class);
			boolean embedded = c.isAnnotationPresent(Embedded.class);
			if (attr != null && embedded) {
				throw new InvalidComponentException(recordClass, c.getName(), "can't be both @Attr and @Embedded");
			} else if (attr == null && !embedded) {
				throw new InvalidComponentException(recordClass, c.getName(), "must be annotated with @Attr or @Embedded");
			}

			List<RecordComponent> path = new ArrayList<>(prefix);
			path.add(c);
			if (embedded) {
				Class<?> type = c.getType();
				if (!type.isRecord()) {
					throw new InvalidComponentException(recordClass, c.getName(), "@Embedded component must be a record, not " + type.getSimpleName());
				} else if (enclosing.contains(type)) {
					throw new InvalidComponentException(recordClass, c.getName(), "embedded record " + type.getSimpleName() + " contains itself");
				}
				scan(type, path, enclosing, fieldsByName);
			} else if (Attr.IGNORE.equals(attr.value())) {
				LOGGER.trace("Ignoring {}.{}", recordClass.getSimpleName(), c.getName());
			} else {
				String name = attr.value();
				if (name.isBlank()) {
					throw new InvalidComponentException(recordClass, c.getName(), "attribute name must not be blank");
				}
				FieldDescriptor existing = fieldsByName.putIfAbsent(name, new FieldDescriptor(name, path));
				if (existing != null) {
					throw new InvalidComponentException(recordClass, c.getName(),
						"attribute name \"" + name + "\" is already used by " + existing);
				}
			}
		}
		enclosing.remove(recordClass);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordFields.class);
}
