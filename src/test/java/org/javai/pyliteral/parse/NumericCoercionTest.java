package org.javai.pyliteral.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.javai.pyliteral.LiteralParseException;
import org.javai.pyliteral.value.Value;
import org.junit.jupiter.api.Test;

class NumericCoercionTest {

	@Test
	void integerWithIntegerStaysInteger() {
		BigInteger big = BigInteger.TWO.pow(100);

		assertThat(NumericCoercion.add(Value.integer(big), Value.integer(1), 0))
				.isEqualTo(Value.integer(big.add(BigInteger.ONE)));
		assertThat(NumericCoercion.subtract(Value.integer(3), Value.integer(5), 0)).isEqualTo(Value.integer(-2));
	}

	@Test
	void floatWithFloatStaysFloat() {
		assertThat(NumericCoercion.add(Value.floating(1.5), Value.floating(2.0), 0)).isEqualTo(Value.floating(3.5));
		assertThat(NumericCoercion.subtract(Value.floating(1.5), Value.floating(2.0), 0)).isEqualTo(Value.floating(-0.5));
	}

	@Test
	void complexWithComplexStaysComplex() {
		assertThat(NumericCoercion.add(Value.complex(1, 2), Value.complex(3, 4), 0)).isEqualTo(Value.complex(4, 6));
		assertThat(NumericCoercion.subtract(Value.complex(1, 2), Value.complex(3, 5), 0)).isEqualTo(Value.complex(-2, -3));
	}

	@Test
	void integerAndFloatPromoteToFloatInEitherOrder() {
		assertThat(NumericCoercion.add(Value.integer(1), Value.floating(0.5), 0)).isEqualTo(Value.floating(1.5));
		assertThat(NumericCoercion.add(Value.floating(0.5), Value.integer(1), 0)).isEqualTo(Value.floating(1.5));
	}

	@Test
	void subtractionKeepsOperandOrder() {
		assertThat(NumericCoercion.subtract(Value.integer(1), Value.floating(0.25), 0)).isEqualTo(Value.floating(0.75));
		assertThat(NumericCoercion.subtract(Value.floating(0.25), Value.integer(1), 0)).isEqualTo(Value.floating(-0.75));
		assertThat(NumericCoercion.subtract(Value.integer(1), Value.complex(2, 3), 0)).isEqualTo(Value.complex(-1, -3));
		assertThat(NumericCoercion.subtract(Value.complex(2, 3), Value.integer(1), 0)).isEqualTo(Value.complex(1, 3));
		assertThat(NumericCoercion.subtract(Value.floating(0.5), Value.complex(2, 3), 0)).isEqualTo(Value.complex(-1.5, -3));
		assertThat(NumericCoercion.subtract(Value.complex(2, 3), Value.floating(0.5), 0)).isEqualTo(Value.complex(1.5, 3));
	}

	@Test
	void integerAndComplexPromoteToComplex() {
		assertThat(NumericCoercion.add(Value.integer(2), Value.complex(0, 7), 0)).isEqualTo(Value.complex(2, 7));
		assertThat(NumericCoercion.add(Value.complex(0, 7), Value.integer(2), 0)).isEqualTo(Value.complex(2, 7));
	}

	@Test
	void floatAndComplexPromoteToComplex() {
		assertThat(NumericCoercion.add(Value.floating(2.5), Value.complex(1, 7), 0)).isEqualTo(Value.complex(3.5, 7));
		assertThat(NumericCoercion.add(Value.complex(1, 7), Value.floating(2.5), 0)).isEqualTo(Value.complex(3.5, 7));
	}

	@Test
	void integerBeyondDoubleRangeCannotBePromoted() {
		BigInteger huge = BigInteger.TEN.pow(400);

		assertThatThrownBy(() -> NumericCoercion.add(Value.integer(huge), Value.floating(1.0), 17))
				.isInstanceOf(LiteralParseException.class)
				.hasMessage("Error casting number: " + huge + " to double at position 17")
				.extracting("position").isEqualTo(17);
		assertThatThrownBy(() -> NumericCoercion.subtract(Value.complex(0, 1), Value.integer(huge.negate()), 0))
				.isInstanceOf(LiteralParseException.class)
				.extracting("kind").isEqualTo(LiteralParseException.Kind.NUMERIC_CAST);
	}

	@Test
	void nonNumericOperandIsAnInternalError() {
		assertThatThrownBy(() -> NumericCoercion.add(Value.integer(1), Value.string("x"), 0))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> NumericCoercion.subtract(Value.none(), Value.complex(0, 1), 0))
				.isInstanceOf(IllegalStateException.class);
	}
}
