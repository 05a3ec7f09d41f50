package org.javai.pyliteral;

/**
 * Exception thrown when a {@link org.javai.pyliteral.value.Value} cannot be written as literal text.
 */
public class LiteralFormatException extends RuntimeException {

	public enum Kind {
		EMPTY_SET,          // no literal syntax exists for an empty set
		NON_FINITE_FLOAT,   // NaN has no literal syntax
		NESTING_TOO_DEEP,
		IO                  // the destination failed to accept output
	}

	private final Kind kind;

	public LiteralFormatException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public LiteralFormatException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}
}
