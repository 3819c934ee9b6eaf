/**
 * Built-in {@link works.attrbind.attr.AttrType} implementations, one per {@link works.attrbind.wire.WireType} shape.
 * <p>
 * {@link works.attrbind.types.AttrTypes} has constants and factory methods for all of them.
 */
package works.attrbind.types;
