package works.attrbind.reflect;

import java.util.Map;
import org.junit.jupiter.api.Test;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Result;
import works.attrbind.path.Path;
import works.attrbind.wire.ObjectWireType;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class ObjectInspectorTest {

	@Test
	void object_yieldsAttributes() {
		WireObject object = WireObject.of(Map.of("name", WireString.of("Ana"), "age", WireNumber.of(30)));
		Result<Map<String, WireValue>> result = ObjectInspector.attributesOf(object, Object.class, Path.empty());
		assertFalse(result.hasError());
		assertEquals(Map.of("name", WireString.of("Ana"), "age", WireNumber.of(30)), result.get());
	}

	@Test
	void string_isIncompatible() {
		Result<Map<String, WireValue>> result = ObjectInspector.attributesOf(WireString.of("x"), Object.class, Path.root("p"));
		AttributeDiagnostic d = (AttributeDiagnostic) result.diagnostics().errors().get(0);
		assertEquals(Path.root("p"), d.path());
		IncompatibleTypeDiagnostic incompatible = assertInstanceOf(IncompatibleTypeDiagnostic.class, d.diagnostic());
		assertEquals("cannot convert string into a record, must be an object", incompatible.reason());
	}

	@Test
	void nullObject_isIncompatible() {
		WireValue nullObject = WireValue.nullOf(new ObjectWireType(Map.of("a", WireType.STRING)));
		Result<Map<String, WireValue>> result = ObjectInspector.attributesOf(nullObject, Object.class, Path.empty());
		AttributeDiagnostic d = (AttributeDiagnostic) result.diagnostics().errors().get(0);
		assertEquals("cannot read attributes of a null value", ((IncompatibleTypeDiagnostic) d.diagnostic()).reason());
	}

	@Test
	void unknownObject_isIncompatible() {
		WireValue unknown = WireValue.unknownOf(new ObjectWireType(Map.of()));
		Result<Map<String, WireValue>> result = ObjectInspector.attributesOf(unknown, Object.class, Path.empty());
		AttributeDiagnostic d = (AttributeDiagnostic) result.diagnostics().errors().get(0);
		assertEquals("cannot read attributes of an unknown value", ((IncompatibleTypeDiagnostic) d.diagnostic()).reason());
	}

}
