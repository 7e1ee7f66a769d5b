package org.lokray.toybeam.codegen;

import org.lokray.toybeam.ast.expressions.BitstringSegment;
import org.lokray.toybeam.exception.CodegenException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.lexer.SourceSpan;
import org.lokray.toybeam.lexer.Token;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The resolved type, signedness and endianness of one bitstring segment, with the
 * defaults for whatever the segment leaves out. At most one word per category may be given.
 * <p>
 * Defaults: integer segments are 8 bits, floats 64 bits, binaries take the rest of the
 * input in whole bytes, and utf8 segments carry no size.
 */
public class BitstringSpecifiers
{
	private static final String UNDEFINED = "'undefined'";

	private final String type;
	private final String signedness;
	private final String endianness;

	private BitstringSpecifiers(String type, String signedness, String endianness)
	{
		this.type = type;
		this.signedness = signedness;
		this.endianness = endianness;
	}

	/**
	 * Resolves the specifier words written after {@code /}.
	 *
	 * @param specifiers The words, in source order.
	 * @param hasSize    Whether the segment gives an explicit size.
	 * @param segment    Where the segment starts, for diagnostics.
	 * @throws CodegenException CONFLICTING_BITSTRING_SPECIFIER when a category is given twice
	 *                          or a utf8 segment has a size.
	 */
	public static BitstringSpecifiers resolve(List<Token> specifiers, boolean hasSize, SourceSpan segment) throws CodegenException
	{
		String type = null;
		String signedness = null;
		String endianness = null;
		for (Token token : specifiers)
		{
			String word = token.getLexeme();
			switch (word)
			{
				case "integer":
				case "float":
				case "binary":
				case "bytes":
				case "utf8":
					type = pick("type", type, word.equals("bytes") ? "binary" : word, token);
					break;
				case "signed":
				case "unsigned":
					signedness = pick("signedness", signedness, word, token);
					break;
				case "big":
				case "little":
					endianness = pick("endianness", endianness, word, token);
					break;
				default:
					throw new CodegenException(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, token.getSpan(),
							"Unknown segment specifier '" + word + "'.");
			}
		}
		if (type == null)
		{
			type = "integer";
		}
		if (type.equals("utf8") && hasSize)
		{
			throw new CodegenException(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, segment,
					"A utf8 segment cannot have a size.");
		}
		return new BitstringSpecifiers(type,
				signedness != null ? signedness : "unsigned",
				endianness != null ? endianness : "big");
	}

	private static String pick(String category, String previous, String word, Token token) throws CodegenException
	{
		if (previous != null)
		{
			throw new CodegenException(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, token.getSpan(),
					"Segment " + category + " given twice: '" + previous + "' and '" + token.getLexeme() + "'.");
		}
		return word;
	}

	public String getType()
	{
		return type;
	}

	public String getSignedness()
	{
		return signedness;
	}

	public String getEndianness()
	{
		return endianness;
	}

	/**
	 * The size term used when the segment gives none.
	 */
	public String defaultSize()
	{
		switch (type)
		{
			case "float":
				return "64";
			case "binary":
				return "'all'";
			case "utf8":
				return UNDEFINED;
			default:
				return "8";
		}
	}

	public String unit()
	{
		switch (type)
		{
			case "binary":
				return "8";
			case "utf8":
				return UNDEFINED;
			default:
				return "1";
		}
	}

	/**
	 * Renders the segment {@code #<value>(size, unit, 'type', [flags])}.
	 *
	 * @param size The explicit size term, or null for the default.
	 */
	public String render(String value, String size)
	{
		return CoreErlang.segment(value, size != null ? size : defaultSize(), unit(), type,
				List.of(CoreErlang.atom(signedness), CoreErlang.atom(endianness)));
	}

	/**
	 * A string inside a bitstring stands for its UTF-8 bytes, one 8-bit segment each.
	 */
	public List<String> stringSegments(BitstringSegment<?> segment, String text) throws CodegenException
	{
		if (segment.getSize() != null || type.equals("float"))
		{
			throw new CodegenException(ErrorKind.UNSUPPORTED_CONSTRUCT, segment.getFirstToken().getSpan(),
					"A string segment cannot have a size or a float type.");
		}
		List<String> bytes = new ArrayList<>();
		for (byte b : text.getBytes(StandardCharsets.UTF_8))
		{
			bytes.add(CoreErlang.segment(CoreErlang.integer(BigInteger.valueOf(b & 0xFF)), "8", "1", "integer",
					List.of("'unsigned'", "'big'")));
		}
		return bytes;
	}

	@Override
	public String toString()
	{
		return type + "-" + signedness + "-" + endianness;
	}
}
