package works.attrbind.diag;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.attrbind.path.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTest {

	@Test
	void duplicateDiagnostic_isAppendedOnce() {
		Diagnostics diagnostics = new Diagnostics()
			.addError("Oops", "Something broke")
			.addError("Oops", "Something broke");
		assertEquals(1, diagnostics.size());
	}

	@Test
	void warningsOnly_isNotAnError() {
		Diagnostics diagnostics = new Diagnostics().addWarning("Hmm", "Looks odd");
		assertFalse(diagnostics.hasError());
		assertEquals(1, diagnostics.warnings().size());
		assertTrue(diagnostics.errors().isEmpty());
	}

	@Test
	void attributeError_carriesPath() {
		Path path = Path.root("a").atListIndex(1);
		Diagnostics diagnostics = new Diagnostics().addAttributeError(path, "Bad", "Very bad");
		AttributeDiagnostic d = (AttributeDiagnostic) diagnostics.asList().get(0);
		assertEquals(path, d.path());
		assertEquals(Severity.ERROR, d.severity());
		assertEquals("[a[1]] ErrorDiagnostic[summary=Bad, detail=Very bad]", d.toString());
	}

	@Test
	void withPath_replacesExistingPath() {
		Diagnostic inner = new AttributeDiagnostic(Path.root("old"), new ErrorDiagnostic("s", "d"));
		AttributeDiagnostic rewrapped = (AttributeDiagnostic) AttributeDiagnostic.withPath(Path.root("new"), inner);
		assertEquals(Path.root("new"), rewrapped.path());
		assertEquals(new ErrorDiagnostic("s", "d"), rewrapped.diagnostic());
	}

	@Test
	void nestedAttributeDiagnostic_throws() {
		Diagnostic inner = new AttributeDiagnostic(Path.root("a"), new ErrorDiagnostic("s", "d"));
		assertThrows(IllegalArgumentException.class, () -> new AttributeDiagnostic(Path.root("b"), inner));
	}

	@Test
	void appendAll_preservesOrder() {
		Diagnostic first = new ErrorDiagnostic("1", "");
		Diagnostic second = new WarningDiagnostic("2", "");
		Diagnostics diagnostics = new Diagnostics().appendAll(List.of(first, second, first));
		assertEquals(List.of(first, second), diagnostics.asList());
	}

	@Test
	void failure_hasNullValue() {
		Result<String> result = Result.failure(new ErrorDiagnostic("s", "d"));
		assertTrue(result.hasError());
		assertNull(result.value());
		assertThrows(IllegalStateException.class, result::get);
	}

	@Test
	void failureWithoutError_throws() {
		Diagnostics warnings = new Diagnostics().addWarning("w", "");
		assertThrows(IllegalArgumentException.class, () -> Result.failure(warnings));
	}

	@Test
	void successWithWarning_returnsValue() {
		Result<String> result = Result.of("ok", new Diagnostics().addWarning("w", ""));
		assertFalse(result.hasError());
		assertEquals("ok", result.get());
	}

}
