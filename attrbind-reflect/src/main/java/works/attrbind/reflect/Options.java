package works.attrbind.reflect;

/**
 * Settings that affect how the {@link DefaultValueConverter} handles
 * values it has no natural Java representation for.
 *
 * @param unhandledNullAsEmpty when a null value is converted into a primitive type,
 *                             use the primitive's zero value instead of reporting an error
 * @param unhandledUnknownAsEmpty when an unknown value is converted into a Java type,
 *                                use that type's zero value instead of reporting an error
 * @param maxDepth the deepest {@link works.attrbind.path.Path} at which a value may be converted.
 *                 Guards against pathologically nested data.
 */
public record Options(
	boolean unhandledNullAsEmpty,
	boolean unhandledUnknownAsEmpty,
	int maxDepth
) {
	public static final Options DEFAULT = new Options(false, false, 64);

	public Options {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public Options withUnhandledNullAsEmpty(boolean unhandledNullAsEmpty) {
		return new Options(unhandledNullAsEmpty, unhandledUnknownAsEmpty, maxDepth);
	}

	public Options withUnhandledUnknownAsEmpty(boolean unhandledUnknownAsEmpty) {
		return new Options(unhandledNullAsEmpty, unhandledUnknownAsEmpty, maxDepth);
	}

	public Options withMaxDepth(int maxDepth) {
		return new Options(unhandledNullAsEmpty, unhandledUnknownAsEmpty, maxDepth);
	}
}
