package org.lokray.ferra.ast;

/**
 * How a block was delimited in the source. A block uses exactly one of the two styles.
 */
public enum BlockStyle
{
	/** {@code { statements }} */
	BRACE,
	/** {@code : NEWLINE INDENT statements DEDENT} */
	INDENTED
}
