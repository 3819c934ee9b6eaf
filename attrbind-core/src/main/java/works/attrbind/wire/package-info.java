/**
 * The canonical, self-describing value model exchanged over the wire,
 * rooted at {@link works.attrbind.wire.WireType} and {@link works.attrbind.wire.WireValue}.
 * <p>
 * Both hierarchies are sealed: code that dispatches on them can rely on
 * seeing only the variants declared here.
 */
package works.attrbind.wire;
