package works.attrbind.diag;

import works.attrbind.path.Path;

import static java.util.Objects.requireNonNull;

/**
 * Attributes another {@link Diagnostic} to the value at a particular {@link Path}.
 */
public record AttributeDiagnostic(Path path, Diagnostic diagnostic) implements Diagnostic {
	public AttributeDiagnostic {
		requireNonNull(path);
		requireNonNull(diagnostic);
		if (diagnostic instanceof AttributeDiagnostic) {
			throw new IllegalArgumentException("Diagnostic is already attributed to a path: " + diagnostic);
		}
	}

	public static Diagnostic withPath(Path path, Diagnostic diagnostic) {
		if (diagnostic instanceof AttributeDiagnostic a) {
			return new AttributeDiagnostic(path, a.diagnostic());
		} else {
			return new AttributeDiagnostic(path, diagnostic);
		}
	}

	@Override
	public Severity severity() {
		return diagnostic.severity();
	}

	@Override
	public String summary() {
		return diagnostic.summary();
	}

	@Override
	public String detail() {
		return diagnostic.detail();
	}

	@Override
	public String toString() {
		return "[" + path + "] " + diagnostic;
	}
}
