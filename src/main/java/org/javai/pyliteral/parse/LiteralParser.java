package org.javai.pyliteral.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyliteral.LiteralOptions;
import org.javai.pyliteral.LiteralParseException;
import org.javai.pyliteral.parse.LiteralNode.DictEntryNode;
import org.javai.pyliteral.parse.LiteralNode.Sign;
import org.javai.pyliteral.parse.LiteralNode.Term;
import org.javai.pyliteral.parse.LiteralToken.TokenType;

/**
 * Recursive-descent parser for literal text.
 * <p>
 * Converts a list of tokens from {@link LiteralTokenizer} into a {@link LiteralNode} tree. The
 * input must hold exactly one top-level value:
 *
 * <pre>
 * value       := STRING | BYTES | KEYWORD | number_expr | tuple | list | dict | set
 * number_expr := sign* NUMBER (('+' | '-') sign* NUMBER)*
 * tuple       := '(' ')' | '(' value ',' ')' | '(' value (',' value)+ ','? ')'
 * list        := '[' (value (',' value)* ','?)? ']'
 * dict        := '{' '}' | '{' value ':' value (',' value ':' value)* ','? '}'
 * set         := '{' value (',' value)* ','? '}'
 * </pre>
 *
 * Collection nesting deeper than {@link LiteralOptions#maxDepth()} is rejected.
 */
public class LiteralParser {

	private final List<LiteralToken> tokens;
	private final int maxDepth;
	private int current = 0;

	public LiteralParser(List<LiteralToken> tokens) {
		this(tokens, LiteralOptions.defaults());
	}

	public LiteralParser(List<LiteralToken> tokens, LiteralOptions options) {
		this.tokens = tokens != null && !tokens.isEmpty() ? tokens : List.of(new LiteralToken(TokenType.EOF, "", 0));
		this.maxDepth = options.maxDepth();
	}

	/**
	 * Parses the tokens into a single literal tree.
	 *
	 * @return the root node
	 * @throws LiteralParseException if the tokens do not form exactly one literal
	 */
	public LiteralNode parse() {
		LiteralNode root = parseValue(0);
		if (!isAtEnd()) {
			throw unexpected("end of input");
		}
		return root;
	}

	private LiteralNode parseValue(int depth) {
		LiteralToken token = peek();

		return switch (token.type()) {
			case STRING -> {
				advance();
				yield new LiteralNode.StringNode(token.segments(), token.position());
			}
			case BYTES -> {
				advance();
				yield new LiteralNode.BytesNode(token.segments(), token.position());
			}
			case KEYWORD -> {
				advance();
				yield new LiteralNode.KeywordNode(token.value(), token.position());
			}
			case INTEGER, FLOAT, IMAGINARY, PLUS, MINUS -> parseNumberExpr();
			case LPAREN -> parseTuple(enter(depth, token));
			case LBRACKET -> parseList(enter(depth, token));
			case LBRACE -> parseBraced(enter(depth, token));
			case RPAREN, RBRACKET, RBRACE, COMMA, COLON, EOF -> throw unexpected("a value");
		};
	}

	private int enter(int depth, LiteralToken opening) {
		int nested = depth + 1;
		if (nested > maxDepth) {
			throw new LiteralParseException(LiteralParseException.Kind.NESTING_TOO_DEEP,
					"Collections nested deeper than " + maxDepth + " levels at position " + opening.position(),
					opening.position());
		}
		return nested;
	}

	private LiteralNode parseNumberExpr() {
		int startPos = peek().position();
		List<Term> terms = new ArrayList<>();
		Sign operator = Sign.PLUS;

		while (true) {
			List<Sign> unarySigns = new ArrayList<>();
			while (peek().isSign()) {
				unarySigns.add(toSign(advance()));
			}
			LiteralToken number = peek();
			if (!number.isNumber()) {
				throw unexpected("a number");
			}
			advance();
			terms.add(new Term(operator, unarySigns,
					new LiteralNode.NumberLiteral(number.type(), number.value(), number.position())));

			if (!peek().isSign()) {
				break;
			}
			operator = toSign(advance());
		}
		return new LiteralNode.NumberExprNode(terms, startPos);
	}

	private LiteralNode parseTuple(int depth) {
		int startPos = advance().position(); // consume '('
		List<LiteralNode> elements = new ArrayList<>();
		if (match(TokenType.RPAREN)) {
			return new LiteralNode.TupleNode(elements, startPos);
		}

		elements.add(parseValue(depth));
		boolean sawComma = false;
		while (!match(TokenType.RPAREN)) {
			expect(TokenType.COMMA, "',' or ')'");
			sawComma = true;
			if (match(TokenType.RPAREN)) {
				break;
			}
			elements.add(parseValue(depth));
		}
		if (!sawComma) {
			throw LiteralParseException.syntax("Expected ',' after the single element of the tuple at position "
					+ startPos + ": parenthesized expressions are not supported", startPos);
		}
		return new LiteralNode.TupleNode(elements, startPos);
	}

	private LiteralNode parseList(int depth) {
		int startPos = advance().position(); // consume '['
		List<LiteralNode> elements = parseElements(depth, TokenType.RBRACKET, "',' or ']'");
		return new LiteralNode.ListNode(elements, startPos);
	}

	/**
	 * Parses {@code {}} as an empty dict, otherwise decides between dict and set on the token
	 * after the first element.
	 */
	private LiteralNode parseBraced(int depth) {
		int startPos = advance().position(); // consume '{'
		if (match(TokenType.RBRACE)) {
			return new LiteralNode.DictNode(List.of(), startPos);
		}

		LiteralNode first = parseValue(depth);
		if (!match(TokenType.COLON)) {
			List<LiteralNode> elements = new ArrayList<>();
			elements.add(first);
			if (!match(TokenType.RBRACE)) {
				expect(TokenType.COMMA, "',' or '}'");
				elements.addAll(parseElements(depth, TokenType.RBRACE, "',' or '}'"));
			}
			return new LiteralNode.SetNode(elements, startPos);
		}

		List<DictEntryNode> entries = new ArrayList<>();
		entries.add(new DictEntryNode(first, parseValue(depth)));
		while (!match(TokenType.RBRACE)) {
			expect(TokenType.COMMA, "',' or '}'");
			if (match(TokenType.RBRACE)) {
				break;
			}
			LiteralNode key = parseValue(depth);
			expect(TokenType.COLON, "':'");
			entries.add(new DictEntryNode(key, parseValue(depth)));
		}
		return new LiteralNode.DictNode(entries, startPos);
	}

	/**
	 * Parses {@code (value (',' value)* ','?)? close}, consuming the closing token.
	 */
	private List<LiteralNode> parseElements(int depth, TokenType close, String expected) {
		List<LiteralNode> elements = new ArrayList<>();
		while (!match(close)) {
			elements.add(parseValue(depth));
			if (match(close)) {
				break;
			}
			expect(TokenType.COMMA, expected);
		}
		return elements;
	}

	private Sign toSign(LiteralToken token) {
		return token.type() == TokenType.MINUS ? Sign.MINUS : Sign.PLUS;
	}

	private LiteralToken peek() {
		return tokens.get(Math.min(current, tokens.size() - 1));
	}

	private LiteralToken advance() {
		LiteralToken token = peek();
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean match(TokenType type) {
		if (peek().type() == type) {
			advance();
			return true;
		}
		return false;
	}

	private void expect(TokenType type, String expected) {
		if (!match(type)) {
			throw unexpected(expected);
		}
	}

	private boolean isAtEnd() {
		return current >= tokens.size() || peek().type() == TokenType.EOF;
	}

	private LiteralParseException unexpected(String expected) {
		LiteralToken found = peek();
		return LiteralParseException.syntax(
				"Expected " + expected + " but found " + found.describe() + " at position " + found.position(),
				found.position());
	}
}
