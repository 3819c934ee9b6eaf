package works.attrbind.wire;

/**
 * Describes the shape of a {@link WireValue}.
 * <p>
 * Implementations are value objects: two types are the same type
 * if and only if they are {@link Object#equals equal}.
 */
public sealed interface WireType permits
	PrimitiveWireType,
	ListWireType,
	SetWireType,
	MapWireType,
	ObjectWireType
{
	PrimitiveWireType STRING = PrimitiveWireType.STRING;
	PrimitiveWireType NUMBER = PrimitiveWireType.NUMBER;
	PrimitiveWireType BOOL = PrimitiveWireType.BOOL;

	/**
	 * @return true if this is a collection type whose values contain elements of a single type
	 */
	default boolean isCollection() {
		return false;
	}
}
