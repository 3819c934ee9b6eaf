package works.attrbind.path;

import org.junit.jupiter.api.Test;
import works.attrbind.wire.WireString;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathTest {

	@Test
	void emptyPath_rendersAsEmptyString() {
		assertEquals("", Path.empty().toString());
		assertTrue(Path.empty().isEmpty());
	}

	@Test
	void mixedSteps_renderInOrder() {
		Path path = Path.root("a")
			.atName("b")
			.atListIndex(0)
			.atMapKey("key")
			.atSetValue(WireString.of("x"));
		assertEquals("a.b[0][\"key\"][Value(\"x\")]", path.toString());
		assertEquals(5, path.length());
	}

	@Test
	void pathStartingWithElement_hasNoLeadingDot() {
		assertEquals("[3].name", Path.empty().atListIndex(3).atName("name").toString());
	}

	@Test
	void extendingPath_leavesOriginalUnchanged() {
		Path base = Path.root("a");
		Path extended = base.atName("b");
		assertEquals("a", base.toString());
		assertEquals("a.b", extended.toString());
		assertEquals(base, extended.parent());
		assertNotEquals(base, extended);
	}

	@Test
	void lastStep_isMostRecentlyAdded() {
		assertEquals(new PathStep.ElementKeyString("k"), Path.root("m").atMapKey("k").lastStep());
	}

	@Test
	void emptyPath_hasNoParent() {
		assertThrows(IllegalStateException.class, () -> Path.empty().parent());
		assertThrows(IllegalStateException.class, () -> Path.empty().lastStep());
	}

	@Test
	void negativeIndex_throws() {
		assertThrows(IllegalArgumentException.class, () -> Path.empty().atListIndex(-1));
	}

}
