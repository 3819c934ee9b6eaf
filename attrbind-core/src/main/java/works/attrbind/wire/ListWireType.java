package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record ListWireType(WireType element) implements WireType {
	public ListWireType {
		requireNonNull(element);
	}

	@Override
	public boolean isCollection() {
		return true;
	}

	@Override
	public String toString() {
		return "list<" + element + ">";
	}
}
