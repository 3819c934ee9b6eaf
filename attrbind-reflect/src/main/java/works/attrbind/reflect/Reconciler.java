package works.attrbind.reflect;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that a record's attribute names are exactly those on the other side of a conversion.
 * Any difference, in either direction, is an error: a misspelled name must never
 * silently lose data.
 */
public final class Reconciler {
	private Reconciler() { }

	public enum Side {
		/**
		 * The attributes of the object being decoded.
		 */
		OBJECT("object", "Object defines"),

		/**
		 * The attribute types declared by the schema.
		 */
		ATTRIBUTES("attributes", "Attributes define");

		private final String noun;
		private final String subjectAndVerb;

		Side(String noun, String subjectAndVerb) {
			this.noun = noun;
			this.subjectAndVerb = subjectAndVerb;
		}
	}

	/**
	 * @param recordOnly names the record has but the other side lacks, sorted
	 * @param otherOnly names the other side has but the record lacks, sorted
	 */
	public record Mismatch(Side side, List<String> recordOnly, List<String> otherOnly) {
		public Mismatch {
			recordOnly = List.copyOf(recordOnly);
			otherOnly = List.copyOf(otherOnly);
		}

		public String message() {
			StringBuilder sb = new StringBuilder("mismatch between record and ").append(side.noun).append(":");
			if (!recordOnly.isEmpty()) {
				sb.append(" Record defines fields not found in ").append(side.noun).append(": ")
					.append(String.join(", ", recordOnly)).append(".");
			}
			if (!otherOnly.isEmpty()) {
				sb.append(" ").append(side.subjectAndVerb).append(" fields not found in record: ")
					.append(String.join(", ", otherOnly)).append(".");
			}
			return sb.toString();
		}

		@Override
		public String toString() {
			return message();
		}
	}

	/**
	 * @return a description of the differences, or empty if the names match exactly
	 */
	public static Optional<Mismatch> reconcile(Set<String> recordNames, Set<String> otherNames, Side side) {
		List<String> recordOnly = recordNames.stream()
			.filter(n -> !otherNames.contains(n))
			.sorted()
			.toList();
		List<String> otherOnly = otherNames.stream()
			.filter(n -> !recordNames.contains(n))
			.sorted()
			.toList();
		if (recordOnly.isEmpty() && otherOnly.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(new Mismatch(side, recordOnly, otherOnly));
		}
	}
}
