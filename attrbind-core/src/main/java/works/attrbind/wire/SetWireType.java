package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record SetWireType(WireType element) implements WireType {
	public SetWireType {
		requireNonNull(element);
	}

	@Override
	public boolean isCollection() {
		return true;
	}

	@Override
	public String toString() {
		return "set<" + element + ">";
	}
}
