package works.attrbind.reflect;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class ReflectionHelpers {
	private ReflectionHelpers() { }

	private static final Map<Class<?>, Object> PRIMITIVE_ZEROS = Map.of(
		boolean.class, false,
		byte.class, (byte) 0,
		short.class, (short) 0,
		char.class, '\0',
		int.class, 0,
		long.class, 0L,
		float.class, 0.0f,
		double.class, 0.0d
	);

	static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return rawClass(p.getRawType());
		} else if (type instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else if (type instanceof TypeVariable<?> v) {
			return rawClass(v.getBounds()[0]);
		} else if (type instanceof GenericArrayType) {
			return Object[].class;
		} else {
			throw new IllegalArgumentException("Unexpected kind of type: " + type);
		}
	}

	/**
	 * @return the given type argument, or {@code Object} if {@code type} isn't parameterized
	 */
	static Type typeArgument(Type type, int index) {
		if (type instanceof ParameterizedType p) {
			Type result = p.getActualTypeArguments()[index];
			if (result instanceof WildcardType w) {
				return w.getUpperBounds()[0];
			}
			return result;
		} else {
			return Object.class;
		}
	}

	/**
	 * @return the value a field of the given type has before it's assigned
	 */
	static Object zeroValue(Class<?> type) {
		if (type == Optional.class) {
			return Optional.empty();
		}
		return PRIMITIVE_ZEROS.get(type);
	}

	/**
	 * Reflective handles are resolved once per class and reused by every conversion.
	 */
	private static final ClassValue<Lookup> LOOKUPS = new ClassValue<>() {
		@Override
		protected Lookup computeValue(Class<?> type) {
			return newLookup(type);
		}
	};

	private static final ClassValue<Map<String, MethodHandle>> ACCESSORS = new ClassValue<>() {
		@Override
		protected Map<String, MethodHandle> computeValue(Class<?> recordClass) {
			return newAccessors(recordClass);
		}
	};

	private static final ClassValue<MethodHandle> CONSTRUCTORS = new ClassValue<>() {
		@Override
		protected MethodHandle computeValue(Class<?> recordClass) {
			return newCanonicalConstructor(recordClass);
		}
	};

	static Lookup lookupFor(Class<?> c) {
		return LOOKUPS.get(c);
	}

	static MethodHandle canonicalConstructor(Class<?> recordClass) {
		return CONSTRUCTORS.get(recordClass);
	}

	static MethodHandle accessor(RecordComponent component) {
		return ACCESSORS.get(component.getDeclaringRecord()).get(component.getName());
	}

	static Object readComponent(RecordComponent component, Object record) {
		try {
			return accessor(component).invoke(record);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected exception from accessor for " + component, e);
		}
	}

	private static Lookup newLookup(Class<?> c) {
		try {
			return MethodHandles.privateLookupIn(c, MethodHandles.lookup());
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Unable to access members of " + c.getName(), e);
		}
	}

	private static Map<String, MethodHandle> newAccessors(Class<?> recordClass) {
		Lookup lookup = lookupFor(recordClass);
		Map<String, MethodHandle> result = new HashMap<>();
		for (RecordComponent component : recordClass.getRecordComponents()) {
			try {
				result.put(component.getName(), lookup.unreflect(component.getAccessor()));
			} catch (IllegalAccessException e) {
				throw new IllegalStateException("Unexpected error accessing record component accessor for " + component, e);
			}
		}
		return Map.copyOf(result);
	}

	private static MethodHandle newCanonicalConstructor(Class<?> recordClass) {
		Class<?>[] parameterTypes = Stream.of(recordClass.getRecordComponents())
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		try {
			return lookupFor(recordClass).unreflectConstructor(recordClass.getDeclaredConstructor(parameterTypes));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unexpected error accessing record constructor for " + recordClass, e);
		}
	}
}
