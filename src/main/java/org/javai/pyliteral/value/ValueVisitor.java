package org.javai.pyliteral.value;

import java.math.BigInteger;
import java.util.List;

/**
 * Visitor interface for walking {@link Value} trees.
 * <p>
 * Each method receives the payload of one variant. Collection methods receive the elements
 * in source order; visiting the children is left to the implementation.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ValueVisitor<R> {

	R visitString(String value);

	/**
	 * @param value a copy of the byte payload
	 */
	R visitBytes(byte[] value);

	R visitInteger(BigInteger value);

	R visitFloat(double value);

	R visitComplex(double real, double imaginary);

	R visitTuple(List<Value> elements);

	R visitList(List<Value> elements);

	R visitDict(List<Value.DictEntry> entries);

	R visitSet(List<Value> elements);

	R visitBoolean(boolean value);

	R visitNone();
}
