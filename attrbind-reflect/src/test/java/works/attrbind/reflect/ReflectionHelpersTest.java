package works.attrbind.reflect;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ReflectionHelpersTest {
	private record Secret(String code, int level) { }

	@Test
	void readComponent_readsPrivateRecord() {
		Secret secret = new Secret("xyzzy", 3);
		RecordComponent[] components = Secret.class.getRecordComponents();
		assertEquals("xyzzy", ReflectionHelpers.readComponent(components[0], secret));
		assertEquals(3, ReflectionHelpers.readComponent(components[1], secret));
	}

	@Test
	void accessor_isResolvedOncePerClass() {
		// Each call to getRecordComponents returns new RecordComponent objects
		RecordComponent first = Secret.class.getRecordComponents()[0];
		RecordComponent second = Secret.class.getRecordComponents()[0];
		assertSame(ReflectionHelpers.accessor(first), ReflectionHelpers.accessor(second));
		assertSame(ReflectionHelpers.canonicalConstructor(Secret.class), ReflectionHelpers.canonicalConstructor(Secret.class));
		assertSame(ReflectionHelpers.lookupFor(Secret.class), ReflectionHelpers.lookupFor(Secret.class));
	}

	@Test
	void canonicalConstructor_buildsRecord() throws Throwable {
		Object built = ReflectionHelpers.canonicalConstructor(Secret.class).invoke("plugh", 7);
		assertEquals(new Secret("plugh", 7), built);
	}

	record Generic(List<? extends CharSequence> names, Map<String, Integer> counts) { }

	@Test
	void typeArgument_usesUpperBoundOfWildcard() {
		RecordComponent[] components = Generic.class.getRecordComponents();
		assertEquals(CharSequence.class, ReflectionHelpers.typeArgument(components[0].getGenericType(), 0));
		assertEquals(Integer.class, ReflectionHelpers.typeArgument(components[1].getGenericType(), 1));
		assertEquals(Object.class, ReflectionHelpers.typeArgument(String.class, 0));
		assertEquals(List.class, ReflectionHelpers.rawClass(components[0].getGenericType()));
	}

	@Test
	void zeroValue_coversPrimitivesAndOptional() {
		assertEquals(0, ReflectionHelpers.zeroValue(int.class));
		assertEquals(false, ReflectionHelpers.zeroValue(boolean.class));
		assertEquals(Optional.empty(), ReflectionHelpers.zeroValue(Optional.class));
		assertNull(ReflectionHelpers.zeroValue(String.class));
	}
}
