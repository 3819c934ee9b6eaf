package works.attrbind.attr;

/**
 * A collection-shaped {@link AttrType} whose elements all have the same type.
 */
public interface TypeWithElementType extends AttrType {
	AttrType elementType();

	TypeWithElementType withElementType(AttrType elementType);
}
