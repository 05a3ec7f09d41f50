package org.javai.pyliteral.parse;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.javai.pyliteral.LiteralParseException;
import org.javai.pyliteral.parse.LiteralNode.BytesNode;
import org.javai.pyliteral.parse.LiteralNode.DictEntryNode;
import org.javai.pyliteral.parse.LiteralNode.DictNode;
import org.javai.pyliteral.parse.LiteralNode.KeywordNode;
import org.javai.pyliteral.parse.LiteralNode.ListNode;
import org.javai.pyliteral.parse.LiteralNode.NumberExprNode;
import org.javai.pyliteral.parse.LiteralNode.NumberLiteral;
import org.javai.pyliteral.parse.LiteralNode.SetNode;
import org.javai.pyliteral.parse.LiteralNode.Sign;
import org.javai.pyliteral.parse.LiteralNode.StringNode;
import org.javai.pyliteral.parse.LiteralNode.Term;
import org.javai.pyliteral.parse.LiteralNode.TupleNode;
import org.javai.pyliteral.value.Value;

/**
 * Visitor that materializes a {@link Value} from a literal parse tree: decodes escape sequences,
 * converts numeric lexemes and folds {@code +}/{@code -} expressions left to right.
 */
public class ValueBuilder implements LiteralNodeVisitor<Value> {

	public static Value build(LiteralNode root) {
		return root.accept(new ValueBuilder());
	}

	// ---------------------------------------------------------------------------------------
	// Strings and bytes

	@Override
	public Value visitString(StringNode node) {
		StringBuilder out = new StringBuilder();
		for (StringSegment segment : node.segments()) {
			switch (segment.type()) {
				case LITERAL, UNKNOWN_ESCAPE -> out.append(segment.text());
				case LINE_CONTINUATION -> {
					// contributes nothing
				}
				case CHAR_ESCAPE -> out.append(decodeCharEscape(segment));
				case OCTAL_ESCAPE -> out.appendCodePoint(Integer.parseInt(segment.text(), 8));
				case HEX_ESCAPE -> out.appendCodePoint(Integer.parseInt(segment.text(), 16));
				case UNICODE_ESCAPE -> out.appendCodePoint(decodeUnicodeEscape(segment));
				case NAME_ESCAPE -> throw new LiteralParseException(LiteralParseException.Kind.ILLEGAL_ESCAPE,
						"Unicode name escapes are not supported: \\" + segment.text() + " at position "
								+ segment.position(), segment.position());
			}
		}
		return Value.string(out.toString());
	}

	@Override
	public Value visitBytes(BytesNode node) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (StringSegment segment : node.segments()) {
			switch (segment.type()) {
				case LITERAL, UNKNOWN_ESCAPE -> {
					String text = segment.text();
					for (int i = 0; i < text.length(); i++) {
						out.write(text.charAt(i));
					}
				}
				case LINE_CONTINUATION -> {
					// contributes nothing
				}
				case CHAR_ESCAPE -> out.write(decodeCharEscape(segment));
				case OCTAL_ESCAPE -> {
					int value = Integer.parseInt(segment.text(), 8);
					if (value > 0xFF) {
						throw new LiteralParseException(LiteralParseException.Kind.ILLEGAL_ESCAPE,
								"Octal escape is invalid in bytes: \\" + segment.text() + " exceeds 0xff at position "
										+ segment.position(), segment.position());
					}
					out.write(value);
				}
				case HEX_ESCAPE -> out.write(Integer.parseInt(segment.text(), 16));
				case UNICODE_ESCAPE, NAME_ESCAPE -> throw new IllegalStateException(
						"Tokenizer produced a " + segment.type() + " segment inside a bytes literal");
			}
		}
		return Value.bytes(out.toByteArray());
	}

	private char decodeCharEscape(StringSegment segment) {
		return switch (segment.text().charAt(0)) {
			case '\\' -> '\\';
			case '\'' -> '\'';
			case '"' -> '"';
			case 'a' -> '\u0007';
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			case 'v' -> '\u000B';
			default -> throw new IllegalStateException("Not a character escape: \\" + segment.text());
		};
	}

	private int decodeUnicodeEscape(StringSegment segment) {
		long codePoint = Long.parseLong(segment.text(), 16);
		if (codePoint > Character.MAX_CODE_POINT
				|| (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
			String marker = segment.text().length() == 4 ? "u" : "U";
			throw new LiteralParseException(LiteralParseException.Kind.ILLEGAL_ESCAPE,
					"Unicode escape is invalid: \\" + marker + segment.text() + " is not a Unicode scalar value at position "
							+ segment.position(), segment.position());
		}
		return (int) codePoint;
	}

	// ---------------------------------------------------------------------------------------
	// Numbers

	/**
	 * Folds the terms left to right starting from integer zero. The binary operator before a term
	 * and every unary minus written directly before its number each flip between adding and
	 * subtracting that number.
	 */
	@Override
	public Value visitNumberExpr(NumberExprNode node) {
		Value result = Value.integer(0);
		for (Term term : node.terms()) {
			boolean negate = term.operator() == Sign.MINUS;
			for (Sign sign : term.unarySigns()) {
				if (sign == Sign.MINUS) {
					negate = !negate;
				}
			}
			NumberLiteral literal = term.number();
			Value number = convertNumber(literal);
			result = negate
					? NumericCoercion.subtract(result, number, literal.position())
					: NumericCoercion.add(result, number, literal.position());
		}
		return result;
	}

	private Value convertNumber(NumberLiteral literal) {
		return switch (literal.kind()) {
			case INTEGER -> Value.integer(parseInteger(literal.text()));
			case FLOAT -> Value.floating(parseFloat(literal.text(), literal.position()));
			case IMAGINARY -> {
				String magnitude = literal.text().substring(0, literal.text().length() - 1);
				yield Value.complex(0.0, parseFloat(magnitude, literal.position()));
			}
			default -> throw new IllegalStateException("Not a numeric literal: " + literal.kind());
		};
	}

	static BigInteger parseInteger(String text) {
		String digits = text.replace("_", "");
		if (digits.length() > 2 && digits.charAt(0) == '0') {
			switch (Character.toLowerCase(digits.charAt(1))) {
				case 'b' -> {
					return new BigInteger(digits.substring(2), 2);
				}
				case 'o' -> {
					return new BigInteger(digits.substring(2), 8);
				}
				case 'x' -> {
					return new BigInteger(digits.substring(2), 16);
				}
				default -> {
					// decimal with leading zeros, e.g. 000
				}
			}
		}
		return new BigInteger(digits);
	}

	/**
	 * Assembles a canonical decimal float from the digit run, fraction marker and signed exponent
	 * of a float or digit-only lexeme and parses it as a double.
	 */
	static double parseFloat(String text, int position) {
		StringBuilder parsable = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c >= '0' && c <= '9') {
				parsable.append(c);
			} else if (c == '.') {
				parsable.append('.');
			} else if (c == 'e' || c == 'E') {
				parsable.append('e');
			} else if (c == '-') {
				parsable.append('-');
			}
		}
		try {
			return Double.parseDouble(parsable.toString());
		} catch (NumberFormatException e) {
			throw new LiteralParseException(LiteralParseException.Kind.FLOAT_PARSE,
					"Float parsing error: '" + text + "' at position " + position + ": " + e.getMessage(), position, e);
		}
	}

	// ---------------------------------------------------------------------------------------
	// Collections and keywords

	@Override
	public Value visitTuple(TupleNode node) {
		return Value.tuple(buildAll(node.elements()));
	}

	@Override
	public Value visitList(ListNode node) {
		return Value.list(buildAll(node.elements()));
	}

	@Override
	public Value visitSet(SetNode node) {
		return Value.set(buildAll(node.elements()));
	}

	@Override
	public Value visitDict(DictNode node) {
		List<Value.DictEntry> entries = new ArrayList<>(node.entries().size());
		for (DictEntryNode entry : node.entries()) {
			Value key = entry.key().accept(this);
			entries.add(Value.entry(key, entry.value().accept(this)));
		}
		return Value.dict(entries);
	}

	@Override
	public Value visitKeyword(KeywordNode node) {
		return switch (node.keyword()) {
			case "True" -> Value.bool(true);
			case "False" -> Value.bool(false);
			case "None" -> Value.none();
			default -> throw new IllegalStateException("Not a keyword: " + node.keyword());
		};
	}

	private List<Value> buildAll(List<LiteralNode> nodes) {
		List<Value> values = new ArrayList<>(nodes.size());
		for (LiteralNode node : nodes) {
			values.add(node.accept(this));
		}
		return values;
	}
}
