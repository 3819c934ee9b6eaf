package works.attrbind.attr;

import java.util.Map;

/**
 * An object-shaped {@link AttrType} that can describe its attributes.
 * This is what lets records be converted to and from values of this type.
 */
public interface TypeWithAttributeTypes extends AttrType {
	/**
	 * @return the declared type of each attribute, by name
	 */
	Map<String, AttrType> attributeTypes();

	/**
	 * @return a type like this one, but with the given attribute types
	 */
	TypeWithAttributeTypes withAttributeTypes(Map<String, AttrType> attributeTypes);
}
