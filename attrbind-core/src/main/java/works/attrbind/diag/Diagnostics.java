package works.attrbind.diag;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import works.attrbind.path.Path;

import static java.util.Collections.unmodifiableList;

/**
 * An ordered collection of {@link Diagnostic}s accumulated during a conversion.
 * <p>
 * The collection describes a failed operation if and only if {@link #hasError()};
 * warnings alone never indicate failure.
 * <p>
 * Not thread-safe. Each conversion accumulates into its own instance.
 */
public final class Diagnostics implements Iterable<Diagnostic> {
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public Diagnostics() {
	}

	public static Diagnostics of(Diagnostic... diagnostics) {
		Diagnostics result = new Diagnostics();
		for (Diagnostic d : diagnostics) {
			result.append(d);
		}
		return result;
	}

	/**
	 * Adds {@code diagnostic} unless an equal one is already present.
	 *
	 * @return this
	 */
	public Diagnostics append(Diagnostic diagnostic) {
		if (!diagnostics.contains(diagnostic)) {
			diagnostics.add(diagnostic);
		}
		return this;
	}

	/**
	 * @return this
	 */
	public Diagnostics appendAll(Iterable<? extends Diagnostic> other) {
		other.forEach(this::append);
		return this;
	}

	public Diagnostics addError(String summary, String detail) {
		return append(new ErrorDiagnostic(summary, detail));
	}

	public Diagnostics addWarning(String summary, String detail) {
		return append(new WarningDiagnostic(summary, detail));
	}

	public Diagnostics addAttributeError(Path path, String summary, String detail) {
		return append(new AttributeDiagnostic(path, new ErrorDiagnostic(summary, detail)));
	}

	public Diagnostics addAttributeWarning(Path path, String summary, String detail) {
		return append(new AttributeDiagnostic(path, new WarningDiagnostic(summary, detail)));
	}

	public boolean hasError() {
		return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
	}

	public List<Diagnostic> errors() {
		return ofSeverity(Severity.ERROR);
	}

	public List<Diagnostic> warnings() {
		return ofSeverity(Severity.WARNING);
	}

	private List<Diagnostic> ofSeverity(Severity severity) {
		return diagnostics.stream()
			.filter(d -> d.severity() == severity)
			.toList();
	}

	public List<Diagnostic> asList() {
		return unmodifiableList(diagnostics);
	}

	public int size() {
		return diagnostics.size();
	}

	public boolean isEmpty() {
		return diagnostics.isEmpty();
	}

	public Stream<Diagnostic> stream() {
		return diagnostics.stream();
	}

	@Override
	public Iterator<Diagnostic> iterator() {
		return asList().iterator();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Diagnostics other && diagnostics.equals(other.diagnostics);
	}

	@Override
	public int hashCode() {
		return diagnostics.hashCode();
	}

	@Override
	public String toString() {
		return diagnostics.toString();
	}
}
