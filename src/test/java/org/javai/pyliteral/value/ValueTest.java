package org.javai.pyliteral.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.javai.pyliteral.LiteralFormatException;
import org.junit.jupiter.api.Test;

class ValueTest {

	@Test
	void kindMatchesVariant() {
		assertThat(Value.string("a").kind()).isEqualTo(ValueKind.STRING);
		assertThat(Value.bytes(new byte[0]).kind()).isEqualTo(ValueKind.BYTES);
		assertThat(Value.integer(1).kind()).isEqualTo(ValueKind.INTEGER);
		assertThat(Value.floating(1).kind()).isEqualTo(ValueKind.FLOAT);
		assertThat(Value.complex(1, 2).kind()).isEqualTo(ValueKind.COMPLEX);
		assertThat(Value.tuple().kind()).isEqualTo(ValueKind.TUPLE);
		assertThat(Value.list().kind()).isEqualTo(ValueKind.LIST);
		assertThat(Value.dict().kind()).isEqualTo(ValueKind.DICT);
		assertThat(Value.set().kind()).isEqualTo(ValueKind.SET);
		assertThat(Value.bool(true).kind()).isEqualTo(ValueKind.BOOLEAN);
		assertThat(Value.none().kind()).isEqualTo(ValueKind.NONE);
	}

	@Test
	void kindGroups() {
		assertThat(ValueKind.COMPLEX.isNumeric()).isTrue();
		assertThat(ValueKind.BOOLEAN.isNumeric()).isFalse();
		assertThat(ValueKind.SET.isCollection()).isTrue();
		assertThat(ValueKind.BYTES.isCollection()).isFalse();
	}

	@Test
	void classificationIsExclusive() {
		Value value = Value.integer(5);

		assertThat(value.isInteger()).isTrue();
		assertThat(value.isFloat()).isFalse();
		assertThat(value.isString()).isFalse();
		assertThat(value.isNone()).isFalse();
		assertThat(Value.none().isNone()).isTrue();
		assertThat(Value.set(Value.none()).isSet()).isTrue();
		assertThat(Value.dict().isDict()).isTrue();
	}

	@Test
	void accessorsReturnPayloadOnlyForTheirVariant() {
		assertThat(Value.string("abc").asString()).contains("abc");
		assertThat(Value.string("abc").asInteger()).isEmpty();
		assertThat(Value.integer(7).asInteger()).contains(BigInteger.valueOf(7));
		assertThat(Value.floating(2.5).asFloat()).contains(2.5);
		assertThat(Value.floating(2.5).asComplex()).isEmpty();
		assertThat(Value.complex(1, 2).asComplex()).hasValueSatisfying(c -> {
			assertThat(c.real()).isEqualTo(1.0);
			assertThat(c.imaginary()).isEqualTo(2.0);
		});
		assertThat(Value.bool(false).asBoolean()).contains(false);
		assertThat(Value.none().asBoolean()).isEmpty();
		assertThat(Value.tuple(Value.integer(1)).asTuple()).contains(List.of(Value.integer(1)));
		assertThat(Value.tuple(Value.integer(1)).asList()).isEmpty();
		assertThat(Value.list(Value.integer(1)).asList()).contains(List.of(Value.integer(1)));
		assertThat(Value.set(Value.integer(1)).asSet()).contains(List.of(Value.integer(1)));
		assertThat(Value.dict(Value.entry(Value.none(), Value.none())).asDict())
				.contains(List.of(Value.entry(Value.none(), Value.none())));
		assertThat(Value.bytes(new byte[] {1, 2}).asBytes()).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2));
	}

	@Test
	void bytesAreCopiedInAndOut() {
		byte[] source = {1, 2, 3};
		Value.BytesValue value = Value.bytes(source);

		source[0] = 9;
		value.value()[1] = 9;

		assertThat(value.value()).containsExactly(1, 2, 3);
		assertThat(value.length()).isEqualTo(3);
	}

	@Test
	void bytesCompareByContent() {
		assertThat(Value.bytes(new byte[] {1, 2})).isEqualTo(Value.bytes(new byte[] {1, 2}));
		assertThat(Value.bytes(new byte[] {1, 2})).hasSameHashCodeAs(Value.bytes(new byte[] {1, 2}));
		assertThat(Value.bytes(new byte[] {1, 2})).isNotEqualTo(Value.bytes(new byte[] {2, 1}));
		assertThat(Value.bytes(new byte[] {1, 2})).hasToString("b'\\x01\\x02'");
	}

	@Test
	void stringsRejectUnpairedSurrogates() {
		assertThatThrownBy(() -> Value.string("a" + (char) 0xD800 + "b"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unpaired surrogate U+d800 at index 1");
		assertThatThrownBy(() -> Value.string(String.valueOf((char) 0xDC00)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Value.string("x" + (char) 0xD83D))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(Value.string(new String(Character.toChars(0x1F600))).formatAscii()).isEqualTo("'\\U0001f600'");
	}

	@Test
	void toStringIsTheLiteralText() {
		assertThat(Value.list(Value.integer(1), Value.string("a")).toString()).isEqualTo("[1, 'a']");
		assertThat(Value.floating(0.5)).hasToString("5e-1");
		assertThat(Value.none()).hasToString("None");
		assertThat(Value.dict(Value.entry(Value.bool(true), Value.tuple()))).hasToString("{True: ()}");
	}

	@Test
	void toStringFallsBackWhenThereIsNoLiteral() {
		assertThat(Value.set()).hasToString("SetValue[elements=[]]");
		assertThat(Value.floating(Double.NaN)).hasToString("FloatValue[value=NaN]");
		assertThat(Value.list(Value.set())).hasToString("ListValue[elements=[SetValue[elements=[]]]]");
	}

	@Test
	void collectionsAreImmutableSnapshots() {
		List<Value> source = new ArrayList<>(List.of(Value.integer(1)));
		Value.ListValue value = Value.list(source);

		source.add(Value.integer(2));

		assertThat(value.elements()).containsExactly(Value.integer(1));
		assertThatThrownBy(() -> value.elements().add(Value.none())).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void collectionsCompareInOrder() {
		assertThat(Value.set(Value.integer(1), Value.integer(2))).isNotEqualTo(Value.set(Value.integer(2), Value.integer(1)));
		assertThat(Value.list(Value.integer(1))).isNotEqualTo(Value.tuple(Value.integer(1)));
		assertThat(Value.dict(Value.entry(Value.integer(1), Value.none())))
				.isEqualTo(Value.dict(List.of(Value.entry(Value.integer(1), Value.none()))));
	}

	@Test
	void nullPayloadsAreRejected() {
		assertThatThrownBy(() -> Value.string(null)).isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> Value.integer(null)).isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> Value.entry(null, Value.none())).isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> Value.list(Value.none(), null)).isInstanceOf(NullPointerException.class);
	}

	@Test
	void visitorDispatchesOnVariant() {
		ValueVisitor<String> names = new ValueVisitor<>() {
			@Override
			public String visitString(String value) {
				return "string " + value;
			}

			@Override
			public String visitBytes(byte[] value) {
				return "bytes " + value.length;
			}

			@Override
			public String visitInteger(BigInteger value) {
				return "integer " + value;
			}

			@Override
			public String visitFloat(double value) {
				return "float " + value;
			}

			@Override
			public String visitComplex(double real, double imaginary) {
				return "complex " + real + " " + imaginary;
			}

			@Override
			public String visitTuple(List<Value> elements) {
				return "tuple " + elements.size();
			}

			@Override
			public String visitList(List<Value> elements) {
				return "list " + elements.size();
			}

			@Override
			public String visitDict(List<Value.DictEntry> entries) {
				return "dict " + entries.size();
			}

			@Override
			public String visitSet(List<Value> elements) {
				return "set " + elements.size();
			}

			@Override
			public String visitBoolean(boolean value) {
				return "boolean " + value;
			}

			@Override
			public String visitNone() {
				return "none";
			}
		};

		assertThat(Value.string("x").accept(names)).isEqualTo("string x");
		assertThat(Value.bytes(new byte[2]).accept(names)).isEqualTo("bytes 2");
		assertThat(Value.complex(1, 2).accept(names)).isEqualTo("complex 1.0 2.0");
		assertThat(Value.dict().accept(names)).isEqualTo("dict 0");
		assertThat(Value.none().accept(names)).isEqualTo("none");
	}

	// ---------------------------------------------------------------------------------------
	// Formatting shortcuts

	@Test
	void formatAsciiUsesCanonicalText() {
		assertThat(Value.list(Value.integer(1), Value.string("é")).formatAscii()).isEqualTo("[1, '\\xe9']");
	}

	@Test
	void writeAsciiToAppendable() {
		StringBuilder out = new StringBuilder();

		Value.tuple(Value.none()).writeAscii(out);

		assertThat(out).hasToString("(None,)");
	}

	@Test
	void writeAsciiToStreamLeavesItOpen() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();

		Value.string("snow ☃").writeAscii(out);
		out.write('!');

		assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("'snow \\u2603'!");
	}

	@Test
	void writeAsciiReportsStreamFailure() {
		OutputStream failing = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("closed");
			}
		};

		assertThatThrownBy(() -> Value.string("x").writeAscii(failing))
				.isInstanceOf(LiteralFormatException.class)
				.extracting("kind").isEqualTo(LiteralFormatException.Kind.IO);
	}

	@Test
	void toAsciiBytesEncodesCanonicalText() {
		assertThat(Value.bytes(new byte[] {(byte) 0xFF}).toAsciiBytes())
				.isEqualTo("b'\\xff'".getBytes(StandardCharsets.US_ASCII));
	}
}
