package works.attrbind.path;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.attrbind.path.PathStep.AttributeName;
import works.attrbind.path.PathStep.ElementKeyInt;
import works.attrbind.path.PathStep.ElementKeyString;
import works.attrbind.path.PathStep.ElementKeyValue;
import works.attrbind.wire.WireValue;

/**
 * Identifies the location of a value relative to the root of a conversion,
 * for the purpose of attributing diagnostics.
 * <p>
 * Paths are immutable. The {@code at*} methods return a new path
 * sharing structure with this one, so extending a path at every level
 * of a deep conversion is cheap.
 */
public final class Path {
	private static final Path EMPTY = new Path(TreePVector.empty());

	@NotNull
	private final PVector<PathStep> steps;

	private Path(@NotNull PVector<PathStep> steps) {
		this.steps = steps;
	}

	public static Path empty() {
		return EMPTY;
	}

	public static Path root(String attributeName) {
		return EMPTY.atName(attributeName);
	}

	public Path at(PathStep step) {
		return new Path(steps.plus(step));
	}

	public Path atName(String name) {
		return at(new AttributeName(name));
	}

	public Path atListIndex(long index) {
		return at(new ElementKeyInt(index));
	}

	public Path atMapKey(String key) {
		return at(new ElementKeyString(key));
	}

	public Path atSetValue(WireValue value) {
		return at(new ElementKeyValue(value));
	}

	public List<PathStep> steps() {
		return steps;
	}

	public int length() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * @throws IllegalStateException if this path is empty
	 */
	public Path parent() {
		if (steps.isEmpty()) {
			throw new IllegalStateException("Empty path has no parent");
		}
		return new Path(steps.subList(0, steps.size() - 1));
	}

	/**
	 * @throws IllegalStateException if this path is empty
	 */
	public PathStep lastStep() {
		if (steps.isEmpty()) {
			throw new IllegalStateException("Empty path has no steps");
		}
		return steps.get(steps.size() - 1);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (PathStep step : steps) {
			sb.append(step.render(first));
			first = false;
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Path other && steps.equals(other.steps);
	}

	@Override
	public int hashCode() {
		return steps.hashCode();
	}
}
