package org.javai.pyliteral.parse;

import java.math.BigInteger;
import org.javai.pyliteral.LiteralParseException;
import org.javai.pyliteral.value.Value;
import org.javai.pyliteral.value.Value.ComplexValue;
import org.javai.pyliteral.value.Value.FloatValue;
import org.javai.pyliteral.value.Value.IntegerValue;

/**
 * Addition and subtraction across integer, float and complex values with Python's promotion
 * rules: integer and float give float, anything with complex gives complex.
 * <p>
 * Only numeric values ever reach these methods; any other operand is an internal error.
 */
public final class NumericCoercion {

	private NumericCoercion() {
	}

	/**
	 * @param position input position reported if an integer cannot be promoted to double
	 */
	public static Value add(Value lhs, Value rhs, int position) {
		if (lhs instanceof IntegerValue a && rhs instanceof IntegerValue b) {
			return Value.integer(a.value().add(b.value()));
		}
		if (lhs instanceof ComplexValue a && rhs instanceof ComplexValue b) {
			return Value.complex(a.real() + b.real(), a.imaginary() + b.imaginary());
		}
		if (lhs instanceof ComplexValue a) {
			return Value.complex(a.real() + toDouble(rhs, position), a.imaginary());
		}
		if (rhs instanceof ComplexValue b) {
			return Value.complex(toDouble(lhs, position) + b.real(), b.imaginary());
		}
		return Value.floating(toDouble(lhs, position) + toDouble(rhs, position));
	}

	/**
	 * Computes {@code lhs - rhs}.
	 *
	 * @param position input position reported if an integer cannot be promoted to double
	 */
	public static Value subtract(Value lhs, Value rhs, int position) {
		if (lhs instanceof IntegerValue a && rhs instanceof IntegerValue b) {
			return Value.integer(a.value().subtract(b.value()));
		}
		if (lhs instanceof ComplexValue a && rhs instanceof ComplexValue b) {
			return Value.complex(a.real() - b.real(), a.imaginary() - b.imaginary());
		}
		if (lhs instanceof ComplexValue a) {
			return Value.complex(a.real() - toDouble(rhs, position), a.imaginary());
		}
		if (rhs instanceof ComplexValue b) {
			return Value.complex(toDouble(lhs, position) - b.real(), 0.0 - b.imaginary());
		}
		return Value.floating(toDouble(lhs, position) - toDouble(rhs, position));
	}

	/**
	 * Converts an integer to double. Precision loss is silent; a magnitude beyond the double range
	 * is a {@code NUMERIC_CAST} error.
	 */
	static double toDouble(BigInteger value, int position) {
		double result = value.doubleValue();
		if (Double.isInfinite(result)) {
			throw new LiteralParseException(LiteralParseException.Kind.NUMERIC_CAST,
					"Error casting number: " + value + " to double at position " + position, position);
		}
		return result;
	}

	private static double toDouble(Value value, int position) {
		if (value instanceof IntegerValue i) {
			return toDouble(i.value(), position);
		}
		if (value instanceof FloatValue f) {
			return f.value();
		}
		throw new IllegalStateException("Not a real number: " + value.kind());
	}
}
