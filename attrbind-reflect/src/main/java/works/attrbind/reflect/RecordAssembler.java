package works.attrbind.reflect;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.RecordComponent;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.attrbind.annotations.Embedded;
import works.attrbind.exceptions.ValueConversionException;

/**
 * Collects component values for a record, and its embedded records,
 * so the record can be constructed once all values are known.
 * <p>
 * Every component starts at its zero value.
 * Components that are never {@link #set set}, such as ignored ones, keep it.
 */
final class RecordAssembler {
	private final Class<?> recordClass;
	private final Map<String, Integer> indexByName = new HashMap<>();
	private final Object[] slots;
	private final Map<Integer, RecordAssembler> embedded = new HashMap<>();

	RecordAssembler(Class<?> recordClass) {
		this.recordClass = recordClass;
		RecordComponent[] components = recordClass.getRecordComponents();
		this.slots = new Object[components.length];
		for (int i = 0; i < components.length; i++) {
			RecordComponent c = components[i];
			indexByName.put(c.getName(), i);
			slots[i] = ReflectionHelpers.zeroValue(c.getType());
			if (c.isAnnotationPresent(Embedded.class)) {
				embedded.put(i, new RecordAssembler(c.getType()));
			}
		}
	}

	void set(FieldDescriptor field, @Nullable Object value) {
		RecordAssembler target = this;
		var components = field.components();
		for (RecordComponent c : components.subList(0, components.size() - 1)) {
			target = target.embedded.get(target.indexOf(c));
		}
		target.slots[target.indexOf(field.component())] = value;
	}

	private int indexOf(RecordComponent c) {
		Integer result = indexByName.get(c.getName());
		if (result == null) {
			throw new IllegalArgumentException("Record " + recordClass.getSimpleName() + " has no component " + c.getName());
		}
		return result;
	}

	/**
	 * @throws ValueConversionException if the record's constructor rejects the values
	 */
	Object build() throws ValueConversionException {
		Object[] arguments = slots.clone();
		for (var entry : embedded.entrySet()) {
			arguments[entry.getKey()] = entry.getValue().build();
		}
		MethodHandle constructor = ReflectionHelpers.canonicalConstructor(recordClass);
		try {
			return constructor.invokeWithArguments(arguments);
		} catch (Error e) {
			throw e;
		} catch (Throwable e) {
			throw new ValueConversionException(recordClass.getSimpleName() + " constructor threw " + e, e);
		}
	}
}
