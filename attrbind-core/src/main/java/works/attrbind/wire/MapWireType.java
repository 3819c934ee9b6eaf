package works.attrbind.wire;

import static java.util.Objects.requireNonNull;

public record MapWireType(WireType element) implements WireType {
	public MapWireType {
		requireNonNull(element);
	}

	@Override
	public boolean isCollection() {
		return true;
	}

	@Override
	public String toString() {
		return "map<" + element + ">";
	}
}
