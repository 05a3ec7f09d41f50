package org.javai.pyliteral.parse;

import org.javai.pyliteral.parse.LiteralNode.BytesNode;
import org.javai.pyliteral.parse.LiteralNode.DictNode;
import org.javai.pyliteral.parse.LiteralNode.KeywordNode;
import org.javai.pyliteral.parse.LiteralNode.ListNode;
import org.javai.pyliteral.parse.LiteralNode.NumberExprNode;
import org.javai.pyliteral.parse.LiteralNode.SetNode;
import org.javai.pyliteral.parse.LiteralNode.StringNode;
import org.javai.pyliteral.parse.LiteralNode.TupleNode;

/**
 * Visitor interface for traversing literal parse trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface LiteralNodeVisitor<R> {

	R visitString(StringNode node);

	R visitBytes(BytesNode node);

	R visitNumberExpr(NumberExprNode node);

	R visitTuple(TupleNode node);

	R visitList(ListNode node);

	R visitSet(SetNode node);

	R visitDict(DictNode node);

	R visitKeyword(KeywordNode node);
}
