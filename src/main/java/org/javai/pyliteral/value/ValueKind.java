package org.javai.pyliteral.value;

/**
 * The closed set of literal variants a {@link Value} can take.
 */
public enum ValueKind {
	STRING,
	BYTES,
	INTEGER,
	FLOAT,
	COMPLEX,
	TUPLE,
	LIST,
	DICT,
	SET,
	BOOLEAN,
	NONE;

	public boolean isNumeric() {
		return this == INTEGER || this == FLOAT || this == COMPLEX;
	}

	public boolean isCollection() {
		return this == TUPLE || this == LIST || this == DICT || this == SET;
	}
}
