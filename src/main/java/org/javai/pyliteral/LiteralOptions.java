package org.javai.pyliteral;

/**
 * Limits applied while parsing and formatting literals.
 *
 * @param maxDepth the deepest collection nesting accepted by the parser and walked by the formatter
 */
public record LiteralOptions(int maxDepth) {

	public static final int DEFAULT_MAX_DEPTH = 256;

	private static final LiteralOptions DEFAULTS = new LiteralOptions(DEFAULT_MAX_DEPTH);

	public LiteralOptions {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
		}
	}

	public static LiteralOptions defaults() {
		return DEFAULTS;
	}

	public LiteralOptions withMaxDepth(int maxDepth) {
		return new LiteralOptions(maxDepth);
	}
}
