package org.lokray.toybeam.lexer;

/**
 * Position of a token or construct in the source text.
 *
 * @param line   1-based line number.
 * @param column 1-based column number.
 * @param offset 0-based character offset from the start of the source.
 */
public record SourceSpan(int line, int column, int offset)
{
	public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0);

	@Override
	public String toString()
	{
		return line + ":" + column;
	}
}
