package org.javai.pyliteral;

/**
 * Exception thrown when literal text cannot be turned into a {@link org.javai.pyliteral.value.Value}.
 */
public class LiteralParseException extends RuntimeException {

	public enum Kind {
		SYNTAX,            // grammar rejected the input
		ILLEGAL_ESCAPE,    // bad octal/hex/unicode escape, or a \N{...} escape
		FLOAT_PARSE,       // assembled float text rejected by the float parser
		NUMERIC_CAST,      // integer too large for the promoted numeric type
		NESTING_TOO_DEEP   // collections nested beyond the configured depth
	}

	private final Kind kind;
	private final int position;

	public LiteralParseException(Kind kind, String message, int position) {
		super(message);
		this.kind = kind;
		this.position = position;
	}

	public LiteralParseException(Kind kind, String message, int position, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.position = position;
	}

	public static LiteralParseException syntax(String message, int position) {
		return new LiteralParseException(Kind.SYNTAX, message, position);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * The 0-based character offset in the input where the problem was detected,
	 * or -1 when no position applies.
	 */
	public int getPosition() {
		return position;
	}
}
