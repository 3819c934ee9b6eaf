package works.attrbind.types;

import java.util.Map;
import works.attrbind.attr.AttrType;

public final class AttrTypes {
	public static final StringType STRING = new StringType();
	public static final NumberType NUMBER = new NumberType();
	public static final BoolType BOOL = new BoolType();

	private AttrTypes() { }

	public static ListType listOf(AttrType elementType) {
		return new ListType(elementType);
	}

	public static SetType setOf(AttrType elementType) {
		return new SetType(elementType);
	}

	public static MapType mapOf(AttrType elementType) {
		return new MapType(elementType);
	}

	public static ObjectType objectOf(Map<String, ? extends AttrType> attributeTypes) {
		return new ObjectType(Map.copyOf(attributeTypes));
	}
}
