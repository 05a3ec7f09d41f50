package org.javai.pyliteral.parse;

/**
 * One piece of a string or bytes literal body, as recognized by the tokenizer. Escapes are
 * recognized here but decoded later by {@link ValueBuilder}.
 *
 * @param type the kind of segment
 * @param text for {@code LITERAL} the raw run; for escapes, the text after the backslash
 *        ({@code n}, {@code 101}, {@code 7f}, {@code 00e9}, {@code N{DASH}}); for
 *        {@code UNKNOWN_ESCAPE} the backslash and the following char; empty for line continuations
 * @param position the character position of the segment in the input string
 */
public record StringSegment(SegmentType type, String text, int position) {

	public enum SegmentType {
		LITERAL,
		CHAR_ESCAPE,         // \\ \' \" \a \b \f \n \r \t \v
		OCTAL_ESCAPE,        // \o, \oo, \ooo
		HEX_ESCAPE,          // \xhh
		UNICODE_ESCAPE,      // \\uxxxx and \\Uxxxxxxxx, strings only
		NAME_ESCAPE,         // \N{...}, strings only
		UNKNOWN_ESCAPE,      // any other backslash pair, kept verbatim
		LINE_CONTINUATION    // backslash before a line break
	}

	public static StringSegment literal(String text, int position) {
		return new StringSegment(SegmentType.LITERAL, text, position);
	}
}
