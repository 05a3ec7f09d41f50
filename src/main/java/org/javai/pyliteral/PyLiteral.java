package org.javai.pyliteral;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.javai.pyliteral.format.AsciiFormatter;
import org.javai.pyliteral.parse.LiteralNode;
import org.javai.pyliteral.parse.LiteralParser;
import org.javai.pyliteral.parse.LiteralTokenizer;
import org.javai.pyliteral.parse.ValueBuilder;
import org.javai.pyliteral.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading and writing Python literals.
 * <p>
 * Example usage:
 *
 * <pre>
 * Value header = PyLiteral.parse("{'descr': '&lt;f8', 'fortran_order': False, 'shape': (3, 4), }");
 * String text = PyLiteral.format(header);
 * // {'descr': '&lt;f8', 'fortran_order': False, 'shape': (3, 4)}
 * </pre>
 *
 * The static methods share an instance configured from {@value LiteralOptionsLoader#DEFAULT_RESOURCE}
 * when it is on the classpath. Instances hold no mutable state and may be shared between threads.
 */
public final class PyLiteral {

	private static final Logger logger = LoggerFactory.getLogger(PyLiteral.class);

	private static volatile PyLiteral shared;

	private final LiteralOptions options;

	private PyLiteral(LiteralOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Creates an instance configured from the classpath, falling back to the defaults.
	 */
	public static PyLiteral create() {
		return new PyLiteral(new LiteralOptionsLoader().loadFromClasspath(Thread.currentThread().getContextClassLoader()));
	}

	public static PyLiteral withOptions(LiteralOptions options) {
		return new PyLiteral(options);
	}

	public static Value parse(String text) {
		return shared().read(text);
	}

	public static Value parse(Reader reader) {
		return shared().read(reader);
	}

	public static String format(Value value) {
		return shared().toText(value);
	}

	public static void write(Value value, Appendable out) {
		shared().writeTo(value, out);
	}

	private static PyLiteral shared() {
		PyLiteral instance = shared;
		if (instance == null) {
			synchronized (PyLiteral.class) {
				instance = shared;
				if (instance == null) {
					instance = create();
					shared = instance;
				}
			}
		}
		return instance;
	}

	public LiteralOptions options() {
		return options;
	}

	/**
	 * Parses literal text into a value.
	 *
	 * @throws LiteralParseException if the text is not exactly one supported literal
	 */
	public Value read(String text) {
		Objects.requireNonNull(text, "text must not be null");
		try {
			LiteralNode root = new LiteralParser(new LiteralTokenizer(text).tokenize(), options).parse();
			return ValueBuilder.build(root);
		} catch (LiteralParseException e) {
			logger.debug("Rejected literal text of {} chars ({}): {}", text.length(), e.getKind(), e.getMessage());
			throw e;
		}
	}

	/**
	 * Reads the whole reader and parses its content. The reader is not closed.
	 */
	public Value read(Reader reader) {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try {
			int n;
			while ((n = reader.read(buffer)) != -1) {
				text.append(buffer, 0, n);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read literal text", e);
		}
		return read(text.toString());
	}

	/**
	 * Formats a value as canonical ASCII literal text.
	 *
	 * @throws LiteralFormatException if the value holds an empty set, a NaN, or nests too deeply
	 */
	public String toText(Value value) {
		StringBuilder out = new StringBuilder();
		writeTo(value, out);
		return out.toString();
	}

	/**
	 * Streams the canonical ASCII text into {@code out}.
	 *
	 * @throws LiteralFormatException as {@link #toText(Value)}, or with kind {@code IO} if the destination fails
	 */
	public void writeTo(Value value, Appendable out) {
		Objects.requireNonNull(value, "value must not be null");
		try {
			AsciiFormatter.write(value, out, options);
		} catch (LiteralFormatException e) {
			logger.debug("Failed to format {} value ({}): {}", value.kind(), e.getKind(), e.getMessage());
			throw e;
		}
	}
}
