/**
 * The schema-facing type system: {@link works.attrbind.attr.AttrType} and {@link works.attrbind.attr.AttrValue}.
 * <p>
 * Unlike the sealed {@link works.attrbind.wire wire} model, this type system is open:
 * schemas may supply their own types, which opt into extra behaviour by implementing the
 * capability interfaces {@link works.attrbind.attr.TypeWithAttributeTypes},
 * {@link works.attrbind.attr.TypeWithElementType} and {@link works.attrbind.attr.TypeWithValidate}.
 * Built-in types live in {@link works.attrbind.types}.
 */
package works.attrbind.attr;
