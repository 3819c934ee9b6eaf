package works.attrbind.diag;

import static java.util.Objects.requireNonNull;

public record WarningDiagnostic(String summary, String detail) implements Diagnostic {
	public WarningDiagnostic {
		requireNonNull(summary);
		requireNonNull(detail);
	}

	@Override
	public Severity severity() {
		return Severity.WARNING;
	}
}
