package org.javai.pyliteral.value;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.javai.pyliteral.LiteralFormatException;
import org.javai.pyliteral.format.AsciiFormatter;

/**
 * A Python literal value. Sealed to ensure all variants are known.
 * <p>
 * Values are immutable and compare structurally. Collections keep their elements exactly in
 * the order they were given: a {@link SetValue} is not deduplicated and a {@link DictValue}
 * may hold the same key more than once.
 * <ul>
 *   <li>{@link StringValue} - a sequence of Unicode code points</li>
 *   <li>{@link BytesValue} - a sequence of raw bytes</li>
 *   <li>{@link IntegerValue} - an arbitrary-precision integer</li>
 *   <li>{@link FloatValue} - a 64-bit IEEE-754 float</li>
 *   <li>{@link ComplexValue} - a pair of 64-bit floats</li>
 *   <li>{@link TupleValue}, {@link ListValue}, {@link SetValue} - ordered element sequences</li>
 *   <li>{@link DictValue} - ordered key/value pairs</li>
 *   <li>{@link BooleanValue}, {@link NoneValue}</li>
 * </ul>
 */
public sealed interface Value {

	ValueKind kind();

	<R> R accept(ValueVisitor<R> visitor);

	// ---------------------------------------------------------------------------------------
	// Formatting

	/**
	 * Formats this value as canonical ASCII literal text.
	 *
	 * @throws LiteralFormatException if the tree holds an empty set or a NaN
	 */
	default String formatAscii() {
		return AsciiFormatter.format(this);
	}

	/**
	 * Streams the canonical ASCII text into {@code out}. Wrap expensive destinations in a
	 * buffering writer.
	 *
	 * @throws LiteralFormatException with kind {@code IO} if the destination fails
	 */
	default void writeAscii(Appendable out) {
		AsciiFormatter.write(this, out);
	}

	/**
	 * Streams the canonical ASCII text into {@code out} as US-ASCII bytes. The stream is flushed
	 * but not closed.
	 */
	default void writeAscii(OutputStream out) {
		Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.US_ASCII));
		AsciiFormatter.write(this, writer);
		try {
			writer.flush();
		} catch (IOException e) {
			throw new LiteralFormatException(LiteralFormatException.Kind.IO, "Failed to flush literal output", e);
		}
	}

	/**
	 * Returns the canonical ASCII text encoded as bytes, for embedding in binary headers.
	 */
	default byte[] toAsciiBytes() {
		String text = formatAscii();
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) > 0x7F) {
				throw new IllegalStateException(
						"Formatter produced non-ASCII char U+" + Integer.toHexString(text.charAt(i)) + " at index " + i);
			}
		}
		return text.getBytes(StandardCharsets.US_ASCII);
	}

	// ---------------------------------------------------------------------------------------
	// Classification

	default boolean isString() {
		return kind() == ValueKind.STRING;
	}

	default boolean isBytes() {
		return kind() == ValueKind.BYTES;
	}

	default boolean isInteger() {
		return kind() == ValueKind.INTEGER;
	}

	default boolean isFloat() {
		return kind() == ValueKind.FLOAT;
	}

	default boolean isComplex() {
		return kind() == ValueKind.COMPLEX;
	}

	default boolean isTuple() {
		return kind() == ValueKind.TUPLE;
	}

	default boolean isList() {
		return kind() == ValueKind.LIST;
	}

	default boolean isDict() {
		return kind() == ValueKind.DICT;
	}

	default boolean isSet() {
		return kind() == ValueKind.SET;
	}

	default boolean isBoolean() {
		return kind() == ValueKind.BOOLEAN;
	}

	default boolean isNone() {
		return kind() == ValueKind.NONE;
	}

	// ---------------------------------------------------------------------------------------
	// Payload access

	default Optional<String> asString() {
		return this instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
	}

	default Optional<byte[]> asBytes() {
		return this instanceof BytesValue b ? Optional.of(b.value()) : Optional.empty();
	}

	default Optional<BigInteger> asInteger() {
		return this instanceof IntegerValue i ? Optional.of(i.value()) : Optional.empty();
	}

	default Optional<Double> asFloat() {
		return this instanceof FloatValue f ? Optional.of(f.value()) : Optional.empty();
	}

	default Optional<ComplexValue> asComplex() {
		return this instanceof ComplexValue c ? Optional.of(c) : Optional.empty();
	}

	default Optional<List<Value>> asTuple() {
		return this instanceof TupleValue t ? Optional.of(t.elements()) : Optional.empty();
	}

	default Optional<List<Value>> asList() {
		return this instanceof ListValue l ? Optional.of(l.elements()) : Optional.empty();
	}

	default Optional<List<DictEntry>> asDict() {
		return this instanceof DictValue d ? Optional.of(d.entries()) : Optional.empty();
	}

	default Optional<List<Value>> asSet() {
		return this instanceof SetValue s ? Optional.of(s.elements()) : Optional.empty();
	}

	default Optional<Boolean> asBoolean() {
		return this instanceof BooleanValue b ? Optional.of(b.value()) : Optional.empty();
	}

	// ---------------------------------------------------------------------------------------
	// Factories

	static StringValue string(String value) {
		return new StringValue(value);
	}

	static BytesValue bytes(byte[] value) {
		return new BytesValue(value);
	}

	static IntegerValue integer(long value) {
		return new IntegerValue(BigInteger.valueOf(value));
	}

	static IntegerValue integer(BigInteger value) {
		return new IntegerValue(value);
	}

	static FloatValue floating(double value) {
		return new FloatValue(value);
	}

	static ComplexValue complex(double real, double imaginary) {
		return new ComplexValue(real, imaginary);
	}

	static TupleValue tuple(Value... elements) {
		return new TupleValue(List.of(elements));
	}

	static TupleValue tuple(List<Value> elements) {
		return new TupleValue(elements);
	}

	static ListValue list(Value... elements) {
		return new ListValue(List.of(elements));
	}

	static ListValue list(List<Value> elements) {
		return new ListValue(elements);
	}

	static SetValue set(Value... elements) {
		return new SetValue(List.of(elements));
	}

	static SetValue set(List<Value> elements) {
		return new SetValue(elements);
	}

	static DictValue dict(DictEntry... entries) {
		return new DictValue(List.of(entries));
	}

	static DictValue dict(List<DictEntry> entries) {
		return new DictValue(entries);
	}

	static DictEntry entry(Value key, Value value) {
		return new DictEntry(key, value);
	}

	static BooleanValue bool(boolean value) {
		return value ? BooleanValue.TRUE : BooleanValue.FALSE;
	}

	static NoneValue none() {
		return NoneValue.INSTANCE;
	}

	/**
	 * Literal text of {@code value} for {@code toString()}. Values without a literal form (an empty
	 * set, a NaN, nesting beyond the default depth) fall back to the record description.
	 */
	private static String literalOr(Value value, Supplier<String> fallback) {
		try {
			return AsciiFormatter.format(value);
		} catch (LiteralFormatException e) {
			return fallback.get();
		}
	}

	// ---------------------------------------------------------------------------------------
	// Variants

	/**
	 * Unicode text. Surrogate chars must come in high/low pairs.
	 */
	record StringValue(String value) implements Value {
		public StringValue {
			Objects.requireNonNull(value, "value must not be null");
			for (int i = 0; i < value.length(); i++) {
				char c = value.charAt(i);
				if (Character.isHighSurrogate(c) && i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
					i++;
				} else if (Character.isSurrogate(c)) {
					throw new IllegalArgumentException("Unpaired surrogate U+" + Integer.toHexString(c) + " at index " + i
							+ ": string values can only hold Unicode scalar values");
				}
			}
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "StringValue[value=" + value + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.STRING;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitString(value);
		}
	}

	/**
	 * Raw bytes. The array is copied on construction and on access.
	 */
	record BytesValue(byte[] value) implements Value {
		public BytesValue {
			value = Objects.requireNonNull(value, "value must not be null").clone();
		}

		@Override
		public byte[] value() {
			return value.clone();
		}

		public int length() {
			return value.length;
		}

		@Override
		public ValueKind kind() {
			return ValueKind.BYTES;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitBytes(value.clone());
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof BytesValue other && Arrays.equals(value, other.value);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(value);
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "BytesValue[value=" + Arrays.toString(value) + "]");
		}
	}

	record IntegerValue(BigInteger value) implements Value {
		public IntegerValue {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "IntegerValue[value=" + value + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.INTEGER;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitInteger(value);
		}
	}

	record FloatValue(double value) implements Value {
		@Override
		public String toString() {
			return literalOr(this, () -> "FloatValue[value=" + value + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.FLOAT;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitFloat(value);
		}
	}

	record ComplexValue(double real, double imaginary) implements Value {
		@Override
		public String toString() {
			return literalOr(this, () -> "ComplexValue[real=" + real + ", imaginary=" + imaginary + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.COMPLEX;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitComplex(real, imaginary);
		}
	}

	record TupleValue(List<Value> elements) implements Value {
		public TupleValue {
			elements = List.copyOf(elements);
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "TupleValue[elements=" + elements + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.TUPLE;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitTuple(elements);
		}
	}

	record ListValue(List<Value> elements) implements Value {
		public ListValue {
			elements = List.copyOf(elements);
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "ListValue[elements=" + elements + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.LIST;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitList(elements);
		}
	}

	/**
	 * Key/value pairs in source order. Keys are neither hashed nor deduplicated.
	 */
	record DictValue(List<DictEntry> entries) implements Value {
		public DictValue {
			entries = List.copyOf(entries);
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "DictValue[entries=" + entries + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.DICT;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitDict(entries);
		}
	}

	/**
	 * Elements in source order. An empty set is a valid value but has no literal text.
	 */
	record SetValue(List<Value> elements) implements Value {
		public SetValue {
			elements = List.copyOf(elements);
		}

		@Override
		public String toString() {
			return literalOr(this, () -> "SetValue[elements=" + elements + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.SET;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitSet(elements);
		}
	}

	record BooleanValue(boolean value) implements Value {
		static final BooleanValue TRUE = new BooleanValue(true);
		static final BooleanValue FALSE = new BooleanValue(false);

		@Override
		public String toString() {
			return literalOr(this, () -> "BooleanValue[value=" + value + "]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.BOOLEAN;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitBoolean(value);
		}
	}

	record NoneValue() implements Value {
		static final NoneValue INSTANCE = new NoneValue();

		@Override
		public String toString() {
			return literalOr(this, () -> "NoneValue[]");
		}

		@Override
		public ValueKind kind() {
			return ValueKind.NONE;
		}

		@Override
		public <R> R accept(ValueVisitor<R> visitor) {
			return visitor.visitNone();
		}
	}

	/**
	 * One key/value pair of a {@link DictValue}.
	 */
	record DictEntry(Value key, Value value) {
		public DictEntry {
			Objects.requireNonNull(key, "key must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}
	}
}
