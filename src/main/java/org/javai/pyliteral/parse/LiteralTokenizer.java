package org.javai.pyliteral.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.pyliteral.LiteralParseException;
import org.javai.pyliteral.parse.LiteralToken.TokenType;
import org.javai.pyliteral.parse.StringSegment.SegmentType;

/**
 * Tokenizer for Python literal text.
 * Converts input string into a stream of tokens. String and bytes bodies are split into
 * {@link StringSegment}s; numbers are checked against the Python numeric literal grammar but
 * kept as raw lexemes.
 */
public class LiteralTokenizer {

	private static final Set<String> KEYWORDS = Set.of("True", "False", "None");

	private final String input;
	private int pos = 0;

	public LiteralTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws LiteralParseException if invalid syntax or a malformed escape is encountered
	 */
	public List<LiteralToken> tokenize() {
		List<LiteralToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new LiteralToken(TokenType.EOF, "", pos));
		return tokens;
	}

	private LiteralToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> punctuation(TokenType.LPAREN);
			case ')' -> punctuation(TokenType.RPAREN);
			case '[' -> punctuation(TokenType.LBRACKET);
			case ']' -> punctuation(TokenType.RBRACKET);
			case '{' -> punctuation(TokenType.LBRACE);
			case '}' -> punctuation(TokenType.RBRACE);
			case ',' -> punctuation(TokenType.COMMA);
			case ':' -> punctuation(TokenType.COLON);
			case '+' -> punctuation(TokenType.PLUS);
			case '-' -> punctuation(TokenType.MINUS);
			case '\'', '"' -> scanString(start, false);
			default -> {
				if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanWord();
				} else {
					throw LiteralParseException.syntax("Unexpected character: '" + c + "' at position " + pos, pos);
				}
			}
		};
	}

	private LiteralToken punctuation(TokenType type) {
		int start = pos;
		char c = advance();
		return new LiteralToken(type, String.valueOf(c), start);
	}

	// ---------------------------------------------------------------------------------------
	// Words: keywords and string prefixes

	private LiteralToken scanWord() {
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		String word = input.substring(start, pos);

		if (!isAtEnd() && (peek() == '\'' || peek() == '"')) {
			if (word.equals("b") || word.equals("B")) {
				return scanString(start, true);
			}
			throw LiteralParseException.syntax(
					"Unsupported string prefix '" + word + "' at position " + start + ": only b/B is allowed", start);
		}
		if (KEYWORDS.contains(word)) {
			return new LiteralToken(TokenType.KEYWORD, word, start);
		}
		throw LiteralParseException.syntax(
				"Unexpected identifier '" + word + "' at position " + start + ": only True, False and None are allowed",
				start);
	}

	// ---------------------------------------------------------------------------------------
	// Strings and bytes

	private LiteralToken scanString(int start, boolean bytes) {
		char quote = peek();
		boolean triple = peekAt(1) == quote && peekAt(2) == quote;
		pos += triple ? 3 : 1;

		List<StringSegment> segments = new ArrayList<>();
		StringBuilder run = new StringBuilder();
		int runStart = pos;

		while (true) {
			if (isAtEnd()) {
				throw LiteralParseException.syntax("Unterminated string starting at position " + start, start);
			}
			char c = peek();
			if (c == quote && (!triple || (peekAt(1) == quote && peekAt(2) == quote))) {
				pos += triple ? 3 : 1;
				break;
			}
			if (c == '\\') {
				if (run.length() > 0) {
					segments.add(StringSegment.literal(run.toString(), runStart));
					run.setLength(0);
				}
				segments.add(scanEscape(start, bytes));
				runStart = pos;
				continue;
			}
			if (!triple && (c == '\n' || c == '\r')) {
				throw LiteralParseException.syntax("Unterminated string starting at position " + start
						+ ": line break at position " + pos, start);
			}
			if (bytes && c > 0x7F) {
				throw nonAsciiInBytes(c, pos);
			}
			if (Character.isSurrogate(c)) {
				if (!Character.isHighSurrogate(c) || !Character.isLowSurrogate(peekAt(1))) {
					throw unpairedSurrogate(c, pos);
				}
				run.append(advance());
			}
			run.append(advance());
		}
		if (run.length() > 0) {
			segments.add(StringSegment.literal(run.toString(), runStart));
		}

		TokenType type = bytes ? TokenType.BYTES : TokenType.STRING;
		return new LiteralToken(type, input.substring(start, pos), start, segments);
	}

	private StringSegment scanEscape(int stringStart, boolean bytes) {
		int start = pos;
		advance(); // consume '\'
		if (isAtEnd()) {
			throw LiteralParseException.syntax("Unterminated string starting at position " + stringStart, stringStart);
		}
		char c = advance();
		if (bytes && c > 0x7F) {
			throw nonAsciiInBytes(c, pos - 1);
		}
		switch (c) {
			case '\\', '\'', '"', 'a', 'b', 'f', 'n', 'r', 't', 'v' -> {
				return new StringSegment(SegmentType.CHAR_ESCAPE, String.valueOf(c), start);
			}
			case '\n' -> {
				return new StringSegment(SegmentType.LINE_CONTINUATION, "", start);
			}
			case '\r' -> {
				if (peek() == '\n') {
					advance();
				}
				return new StringSegment(SegmentType.LINE_CONTINUATION, "", start);
			}
			case 'x' -> {
				return new StringSegment(SegmentType.HEX_ESCAPE, scanHexDigits(start, 2, "\\x"), start);
			}
			default -> {
				// handled below
			}
		}
		if (isOctalDigit(c)) {
			int digitsStart = pos - 1;
			while (pos - digitsStart < 3 && isOctalDigit(peek())) {
				advance();
			}
			return new StringSegment(SegmentType.OCTAL_ESCAPE, input.substring(digitsStart, pos), start);
		}
		if (!bytes) {
			if (c == 'u') {
				return new StringSegment(SegmentType.UNICODE_ESCAPE, scanHexDigits(start, 4, "\\u"), start);
			}
			if (c == 'U') {
				return new StringSegment(SegmentType.UNICODE_ESCAPE, scanHexDigits(start, 8, "\\U"), start);
			}
			if (c == 'N') {
				if (peek() == '{') {
					int end = pos + 1;
					while (end < input.length() && isCharacterNameChar(input.charAt(end))) {
						end++;
					}
					if (end < input.length() && input.charAt(end) == '}') {
						pos = end + 1;
					}
				}
				return new StringSegment(SegmentType.NAME_ESCAPE, input.substring(start + 1, pos), start);
			}
		}
		if (Character.isSurrogate(c)) {
			if (!Character.isHighSurrogate(c) || !Character.isLowSurrogate(peek())) {
				throw unpairedSurrogate(c, pos - 1);
			}
			advance();
		}
		return new StringSegment(SegmentType.UNKNOWN_ESCAPE, input.substring(start, pos), start);
	}

	private LiteralParseException nonAsciiInBytes(char c, int position) {
		return LiteralParseException.syntax("Bytes can only contain ASCII literal characters, found '"
				+ c + "' at position " + position, position);
	}

	private LiteralParseException unpairedSurrogate(char c, int position) {
		return LiteralParseException.syntax("Unpaired surrogate U+" + Integer.toHexString(c) + " at position "
				+ position + ": strings can only hold Unicode scalar values", position);
	}

	private String scanHexDigits(int escapeStart, int count, String escapeName) {
		int digitsStart = pos;
		for (int i = 0; i < count; i++) {
			if (!isHexDigit(peek())) {
				throw new LiteralParseException(LiteralParseException.Kind.ILLEGAL_ESCAPE,
						"Truncated " + escapeName + " escape at position " + escapeStart + ": expected " + count
								+ " hex digits", escapeStart);
			}
			advance();
		}
		return input.substring(digitsStart, pos);
	}

	// ---------------------------------------------------------------------------------------
	// Numbers

	private LiteralToken scanNumber() {
		int start = pos;

		if (peek() == '0' && isRadixMarker(peekAt(1))) {
			return scanRadixInteger(start);
		}

		boolean leadingDigits = isDigit(peek());
		if (leadingDigits) {
			scanDigitPart();
		}
		boolean fraction = false;
		if (peek() == '.') {
			fraction = true;
			advance();
			if (isDigit(peek())) {
				scanDigitPart();
			} else if (!leadingDigits) {
				throw invalidNumber(start, "decimal");
			}
		}
		boolean exponent = false;
		if (peek() == 'e' || peek() == 'E') {
			int afterMarker = (peekAt(1) == '+' || peekAt(1) == '-') ? 2 : 1;
			if (!isDigit(peekAt(afterMarker))) {
				throw invalidNumber(start, "decimal");
			}
			exponent = true;
			pos += afterMarker;
			scanDigitPart();
		}
		boolean imaginary = false;
		if (peek() == 'j' || peek() == 'J') {
			imaginary = true;
			advance();
		}
		if (isIdentifierChar(peek())) {
			throw invalidNumber(start, "decimal");
		}

		String lexeme = input.substring(start, pos);
		if (imaginary) {
			return new LiteralToken(TokenType.IMAGINARY, lexeme, start);
		}
		if (fraction || exponent) {
			return new LiteralToken(TokenType.FLOAT, lexeme, start);
		}
		String digits = lexeme.replace("_", "");
		if (digits.length() > 1 && digits.charAt(0) == '0' && !digits.chars().allMatch(ch -> ch == '0')) {
			throw LiteralParseException.syntax("Leading zeros in decimal integer literals are not permitted: '"
					+ lexeme + "' at position " + start + " (use an 0o prefix for octal integers)", start);
		}
		return new LiteralToken(TokenType.INTEGER, lexeme, start);
	}

	private LiteralToken scanRadixInteger(int start) {
		char marker = Character.toLowerCase(peekAt(1));
		int radix = marker == 'b' ? 2 : marker == 'o' ? 8 : 16;
		String name = radix == 2 ? "binary" : radix == 8 ? "octal" : "hexadecimal";
		pos += 2;

		int digits = 0;
		while (true) {
			if (peek() == '_' && radixDigit(peekAt(1), radix) >= 0) {
				advance();
			}
			if (radixDigit(peek(), radix) < 0) {
				break;
			}
			advance();
			digits++;
		}
		if (digits == 0 || isIdentifierChar(peek())) {
			throw invalidNumber(start, name);
		}
		return new LiteralToken(TokenType.INTEGER, input.substring(start, pos), start);
	}

	/**
	 * Consumes {@code digit (["_"] digit)*}. The caller guarantees the first char is a digit.
	 */
	private void scanDigitPart() {
		advance();
		while (true) {
			if (peek() == '_' && isDigit(peekAt(1))) {
				pos += 2;
			} else if (isDigit(peek())) {
				advance();
			} else {
				return;
			}
		}
	}

	private LiteralParseException invalidNumber(int start, String kind) {
		int end = pos;
		while (end < input.length() && (isIdentifierChar(input.charAt(end)) || input.charAt(end) == '.')) {
			end++;
		}
		return LiteralParseException.syntax(
				"Invalid " + kind + " literal '" + input.substring(start, Math.max(end, pos)) + "' at position " + start,
				start);
	}

	// ---------------------------------------------------------------------------------------
	// Character helpers

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekAt(int offset) {
		int index = pos + offset;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isOctalDigit(char c) {
		return c >= '0' && c <= '7';
	}

	private boolean isHexDigit(char c) {
		return radixDigit(c, 16) >= 0;
	}

	private int radixDigit(char c, int radix) {
		return c < 0x80 ? Character.digit(c, radix) : -1;
	}

	private boolean isCharacterNameChar(char c) {
		return isIdentifierChar(c) || c == ' ' || c == '-';
	}

	private boolean isRadixMarker(char c) {
		return c == 'b' || c == 'B' || c == 'o' || c == 'O' || c == 'x' || c == 'X';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
