package works.attrbind.diag;

import static java.util.Objects.requireNonNull;

public record ErrorDiagnostic(String summary, String detail) implements Diagnostic {
	public ErrorDiagnostic {
		requireNonNull(summary);
		requireNonNull(detail);
	}

	@Override
	public Severity severity() {
		return Severity.ERROR;
	}
}
