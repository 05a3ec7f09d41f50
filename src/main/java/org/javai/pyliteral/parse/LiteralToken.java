package org.javai.pyliteral.parse;

import java.util.List;

/**
 * Represents a token of literal text.
 *
 * @param type the token type
 * @param value the raw lexeme, exactly as it appears in the input
 * @param position the character position in the input string
 * @param segments for {@code STRING} and {@code BYTES} tokens, the body split into literal runs
 *        and escape sequences; empty for all other tokens
 */
public record LiteralToken(TokenType type, String value, int position, List<StringSegment> segments) {

	public enum TokenType {
		STRING,        // 'text', "text", '''text''', """text"""
		BYTES,         // b'text' and the other quotings
		INTEGER,       // 42, 0x2a, 0o52, 0b101010, 1_000
		FLOAT,         // 1.5, 1., .5, 1e3, 1.5E-3
		IMAGINARY,     // 5j, 1.5J
		KEYWORD,       // True, False, None
		PLUS,          // +
		MINUS,         // -
		LPAREN,        // (
		RPAREN,        // )
		LBRACKET,      // [
		RBRACKET,      // ]
		LBRACE,        // {
		RBRACE,        // }
		COMMA,         // ,
		COLON,         // :
		EOF            // end of input
	}

	public LiteralToken {
		segments = segments != null ? List.copyOf(segments) : List.of();
	}

	public LiteralToken(TokenType type, String value, int position) {
		this(type, value, position, List.of());
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING, BYTES, INTEGER, FLOAT, IMAGINARY, KEYWORD -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isNumber() {
		return type == TokenType.INTEGER || type == TokenType.FLOAT || type == TokenType.IMAGINARY;
	}

	public boolean isSign() {
		return type == TokenType.PLUS || type == TokenType.MINUS;
	}

	/**
	 * Short human-readable description used in syntax error messages.
	 */
	public String describe() {
		return switch (type) {
			case EOF -> "end of input";
			case LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, COLON, PLUS, MINUS -> "'" + value + "'";
			default -> toString();
		};
	}
}
