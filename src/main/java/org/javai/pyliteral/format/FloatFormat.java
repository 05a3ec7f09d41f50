package org.javai.pyliteral.format;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import org.javai.pyliteral.LiteralFormatException;

/**
 * Renders doubles in exponent notation ({@code 7e3}, {@code -3.263e2}, {@code 1.5e-7}) so that a
 * formatted float can never be read back as an integer. The mantissa carries the fewest significant
 * digits that still parse back to the same double, with ties in digit count resolved to the nearest.
 */
public final class FloatFormat {

	/**
	 * Parses back to {@link Double#POSITIVE_INFINITY}, as Python's literal evaluation does.
	 */
	static final String INFINITY = "1e999";

	private FloatFormat() {
	}

	public static String format(double value) {
		StringBuilder out = new StringBuilder(24);
		appendTo(out, value);
		return out.toString();
	}

	static void appendTo(StringBuilder out, double value) {
		if (Double.isNaN(value)) {
			throw new LiteralFormatException(LiteralFormatException.Kind.NON_FINITE_FLOAT,
					"Unable to format NaN: there is no literal representation of NaN");
		}
		if (isNegative(value)) {
			out.append('-');
		}
		double magnitude = Math.abs(value);
		if (Double.isInfinite(magnitude)) {
			out.append(INFINITY);
			return;
		}
		if (magnitude == 0.0) {
			out.append("0e0");
			return;
		}

		BigDecimal decimal = shortestDigits(magnitude);
		String digits = decimal.unscaledValue().toString();
		int exponent = digits.length() - 1 - decimal.scale();

		out.append(digits.charAt(0));
		if (digits.length() > 1) {
			out.append('.').append(digits, 1, digits.length());
		}
		out.append('e').append(exponent);
	}

	/**
	 * Seventeen significant digits always round-trip a double, so the search ends there.
	 */
	static BigDecimal shortestDigits(double magnitude) {
		BigDecimal exact = new BigDecimal(magnitude);
		for (int precision = 1; precision < 17; precision++) {
			BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (Double.parseDouble(rounded.toString()) == magnitude) {
				return rounded.stripTrailingZeros();
			}
		}
		return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}

	/**
	 * True for negative values including {@code -0.0}.
	 */
	static boolean isNegative(double value) {
		return Double.doubleToRawLongBits(value) < 0;
	}
}
