package org.javai.pyliteral.format;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import org.javai.pyliteral.LiteralFormatException;
import org.javai.pyliteral.LiteralOptions;
import org.javai.pyliteral.value.Value;
import org.javai.pyliteral.value.ValueVisitor;

/**
 * Visitor that writes a {@link Value} as canonical Python literal text containing only ASCII.
 * <p>
 * Output is written in a single pass straight to the destination. A failure of the destination
 * aborts the rest of the tree with a {@link LiteralFormatException} of kind {@code IO}.
 */
public class AsciiFormatter implements ValueVisitor<Void> {

	private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

	private final Appendable out;
	private final int maxDepth;
	private int depth = 0;

	public AsciiFormatter(Appendable out) {
		this(out, LiteralOptions.defaults());
	}

	public AsciiFormatter(Appendable out, LiteralOptions options) {
		this.out = Objects.requireNonNull(out, "out must not be null");
		this.maxDepth = options.maxDepth();
	}

	/**
	 * Static convenience method to format a value into a string.
	 */
	public static String format(Value value) {
		return format(value, LiteralOptions.defaults());
	}

	public static String format(Value value, LiteralOptions options) {
		StringBuilder builder = new StringBuilder();
		write(value, builder, options);
		return builder.toString();
	}

	/**
	 * Static convenience method to stream a value into a destination.
	 */
	public static void write(Value value, Appendable out) {
		write(value, out, LiteralOptions.defaults());
	}

	public static void write(Value value, Appendable out, LiteralOptions options) {
		value.accept(new AsciiFormatter(out, options));
	}

	// ---------------------------------------------------------------------------------------
	// Scalars

	@Override
	public Void visitString(String value) {
		emit('\'');
		value.codePoints().forEach(codePoint -> {
			switch (codePoint) {
				case '\\' -> emit("\\\\");
				case '\r' -> emit("\\r");
				case '\t' -> emit("\\t");
				case '\n' -> emit("\\n");
				case '\'' -> emit("\\'");
				default -> {
					if (isPrintableAscii(codePoint)) {
						emit((char) codePoint);
					} else if (codePoint <= 0xFF) {
						emitHexEscape('x', codePoint, 2);
					} else if (codePoint <= 0xFFFF) {
						emitHexEscape('u', codePoint, 4);
					} else {
						emitHexEscape('U', codePoint, 8);
					}
				}
			}
		});
		emit('\'');
		return null;
	}

	@Override
	public Void visitBytes(byte[] value) {
		emit("b'");
		for (byte b : value) {
			int unsigned = b & 0xFF;
			switch (unsigned) {
				case '\\' -> emit("\\\\");
				case '\r' -> emit("\\r");
				case '\t' -> emit("\\t");
				case '\n' -> emit("\\n");
				case '\'' -> emit("\\'");
				default -> {
					if (isPrintableAscii(unsigned)) {
						emit((char) unsigned);
					} else {
						emitHexEscape('x', unsigned, 2);
					}
				}
			}
		}
		emit('\'');
		return null;
	}

	@Override
	public Void visitInteger(BigInteger value) {
		emit(value.toString());
		return null;
	}

	@Override
	public Void visitFloat(double value) {
		emit(FloatFormat.format(value));
		return null;
	}

	@Override
	public Void visitComplex(double real, double imaginary) {
		StringBuilder text = new StringBuilder(48);
		FloatFormat.appendTo(text, real);
		if (!FloatFormat.isNegative(imaginary)) {
			text.append('+');
		}
		FloatFormat.appendTo(text, imaginary);
		text.append('j');
		emit(text);
		return null;
	}

	@Override
	public Void visitBoolean(boolean value) {
		emit(value ? "True" : "False");
		return null;
	}

	@Override
	public Void visitNone() {
		emit("None");
		return null;
	}

	// ---------------------------------------------------------------------------------------
	// Collections

	@Override
	public Void visitTuple(List<Value> elements) {
		enter();
		emit('(');
		emitElements(elements);
		if (elements.size() == 1) {
			emit(',');
		}
		emit(')');
		leave();
		return null;
	}

	@Override
	public Void visitList(List<Value> elements) {
		enter();
		emit('[');
		emitElements(elements);
		emit(']');
		leave();
		return null;
	}

	@Override
	public Void visitDict(List<Value.DictEntry> entries) {
		enter();
		emit('{');
		boolean first = true;
		for (Value.DictEntry entry : entries) {
			if (!first) {
				emit(", ");
			}
			first = false;
			entry.key().accept(this);
			emit(": ");
			entry.value().accept(this);
		}
		emit('}');
		leave();
		return null;
	}

	@Override
	public Void visitSet(List<Value> elements) {
		if (elements.isEmpty()) {
			throw new LiteralFormatException(LiteralFormatException.Kind.EMPTY_SET,
					"Unable to format empty set literal: {} is an empty dict");
		}
		enter();
		emit('{');
		emitElements(elements);
		emit('}');
		leave();
		return null;
	}

	private void emitElements(List<Value> elements) {
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0) {
				emit(", ");
			}
			elements.get(i).accept(this);
		}
	}

	private void enter() {
		if (++depth > maxDepth) {
			throw new LiteralFormatException(LiteralFormatException.Kind.NESTING_TOO_DEEP,
					"Collections nested deeper than " + maxDepth + " levels");
		}
	}

	private void leave() {
		depth--;
	}

	// ---------------------------------------------------------------------------------------
	// Output

	private static boolean isPrintableAscii(int c) {
		return c >= 0x20 && c < 0x7F;
	}

	private void emitHexEscape(char marker, int value, int width) {
		char[] escape = new char[width + 2];
		escape[0] = '\\';
		escape[1] = marker;
		for (int i = width + 1; i >= 2; i--) {
			escape[i] = HEX_DIGITS[value & 0xF];
			value >>>= 4;
		}
		emit(new String(escape));
	}

	private void emit(char c) {
		try {
			out.append(c);
		} catch (IOException e) {
			throw writeFailed(e);
		}
	}

	private void emit(CharSequence text) {
		try {
			out.append(text);
		} catch (IOException e) {
			throw writeFailed(e);
		}
	}

	private LiteralFormatException writeFailed(IOException e) {
		return new LiteralFormatException(LiteralFormatException.Kind.IO, "Error in format writer: " + e.getMessage(), e);
	}
}
