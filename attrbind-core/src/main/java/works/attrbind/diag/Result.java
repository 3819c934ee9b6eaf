package works.attrbind.diag;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of a conversion: a value plus whatever diagnostics were produced along the way.
 * <p>
 * If {@link #hasError()}, the {@link #value} is meaningless and is normally null.
 * Otherwise, the value is the converted result, which may legitimately be null
 * when a null wire value was converted into a reference type.
 */
public record Result<T>(@Nullable T value, Diagnostics diagnostics) {
	public Result {
		requireNonNull(diagnostics);
	}

	public static <T> Result<T> success(@Nullable T value) {
		return new Result<>(value, new Diagnostics());
	}

	public static <T> Result<T> of(@Nullable T value, Diagnostics diagnostics) {
		return new Result<>(value, diagnostics);
	}

	public static <T> Result<T> failure(Diagnostics diagnostics) {
		if (!diagnostics.hasError()) {
			throw new IllegalArgumentException("Failure must have at least one error: " + diagnostics);
		}
		return new Result<>(null, diagnostics);
	}

	public static <T> Result<T> failure(Diagnostic error) {
		return failure(Diagnostics.of(error));
	}

	public boolean hasError() {
		return diagnostics.hasError();
	}

	/**
	 * @return the value, which is null only when null is the correctly converted result
	 * @throws IllegalStateException if this result {@link #hasError has an error}
	 */
	public @Nullable T get() {
		if (hasError()) {
			throw new IllegalStateException("Conversion failed: " + diagnostics);
		}
		return value;
	}
}
