package works.attrbind.diag;

/**
 * A problem found during a conversion, described for a human reader.
 * <p>
 * Diagnostics are returned, not thrown; see {@link Diagnostics}.
 * Implementations should be value objects,
 * because {@link Diagnostics#append} discards duplicates using {@link Object#equals equals}.
 */
public interface Diagnostic {
	Severity severity();

	/**
	 * @return a short description of the problem
	 */
	String summary();

	/**
	 * @return a longer explanation of the problem and, where possible, what to do about it
	 */
	String detail();
}
