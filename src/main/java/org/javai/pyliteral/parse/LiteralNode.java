package org.javai.pyliteral.parse;

import java.util.List;
import org.javai.pyliteral.parse.LiteralToken.TokenType;

/**
 * Concrete parse tree of a literal. Sealed to ensure all node types are known.
 * <p>
 * Nodes carry no interpreted values: string bodies are still segmented escapes and numbers are
 * still raw lexemes. {@link ValueBuilder} turns a tree into a {@link org.javai.pyliteral.value.Value}.
 */
public sealed interface LiteralNode {

	/**
	 * @return the character position in the input where this node starts
	 */
	int position();

	<R> R accept(LiteralNodeVisitor<R> visitor);

	record StringNode(List<StringSegment> segments, int position) implements LiteralNode {
		public StringNode {
			segments = List.copyOf(segments);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitString(this);
		}
	}

	record BytesNode(List<StringSegment> segments, int position) implements LiteralNode {
		public BytesNode {
			segments = List.copyOf(segments);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitBytes(this);
		}
	}

	/**
	 * A run of numeric terms joined by binary {@code +}/{@code -}.
	 */
	record NumberExprNode(List<Term> terms, int position) implements LiteralNode {
		public NumberExprNode {
			terms = List.copyOf(terms);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitNumberExpr(this);
		}
	}

	/**
	 * One term of a {@link NumberExprNode}.
	 *
	 * @param operator the binary operator before the term; {@code PLUS} for the first term
	 * @param unarySigns the unary signs written directly before the number, in source order
	 * @param number the numeric literal
	 */
	record Term(Sign operator, List<Sign> unarySigns, NumberLiteral number) {
		public Term {
			unarySigns = List.copyOf(unarySigns);
		}
	}

	enum Sign {
		PLUS,
		MINUS
	}

	/**
	 * @param kind {@code INTEGER}, {@code FLOAT} or {@code IMAGINARY}
	 * @param text the raw lexeme
	 */
	record NumberLiteral(TokenType kind, String text, int position) {
	}

	record TupleNode(List<LiteralNode> elements, int position) implements LiteralNode {
		public TupleNode {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitTuple(this);
		}
	}

	record ListNode(List<LiteralNode> elements, int position) implements LiteralNode {
		public ListNode {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitList(this);
		}
	}

	record SetNode(List<LiteralNode> elements, int position) implements LiteralNode {
		public SetNode {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitSet(this);
		}
	}

	record DictNode(List<DictEntryNode> entries, int position) implements LiteralNode {
		public DictNode {
			entries = List.copyOf(entries);
		}

		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitDict(this);
		}
	}

	record DictEntryNode(LiteralNode key, LiteralNode value) {
	}

	/**
	 * {@code True}, {@code False} or {@code None}.
	 */
	record KeywordNode(String keyword, int position) implements LiteralNode {
		@Override
		public <R> R accept(LiteralNodeVisitor<R> visitor) {
			return visitor.visitKeyword(this);
		}
	}
}
