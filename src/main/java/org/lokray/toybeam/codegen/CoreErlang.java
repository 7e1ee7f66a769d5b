package org.lokray.toybeam.codegen;

import org.lokray.toybeam.ast.Literal;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Text builders for Core Erlang terms and forms. Everything here is pure string assembly;
 * callers are responsible for passing well-formed sub-terms.
 */
public final class CoreErlang
{
	public static final String UNIT = "{}";
	public static final String TRUE = "'true'";
	public static final String FALSE = "'false'";

	private CoreErlang()
	{
	}

	/**
	 * Quotes an atom, escaping quote and backslash.
	 */
	public static String atom(String name)
	{
		return "'" + name.replace("\\", "\\\\").replace("'", "\\'") + "'";
	}

	/**
	 * The constant term for a source literal; usable both as a value and as a pattern.
	 */
	public static String literal(Literal literal)
	{
		switch (literal.getKind())
		{
			case INTEGER:
				return integer((BigInteger) literal.getValue());
			case STRING:
				return string((String) literal.getValue());
			case ATOM:
				return atom((String) literal.getValue());
			case BOOLEAN:
				return (Boolean) literal.getValue() ? TRUE : FALSE;
			default:
				return UNIT;
		}
	}

	public static String integer(BigInteger value)
	{
		return value.toString();
	}

	/**
	 * A string literal, which the runtime reads as a list of UTF-8 bytes. Printable ASCII is kept,
	 * everything else is written as an octal escape per byte.
	 */
	public static String string(String text)
	{
		StringBuilder sb = new StringBuilder("\"");
		for (byte b : text.getBytes(StandardCharsets.UTF_8))
		{
			int c = b & 0xFF;
			if (c == '"' || c == '\\')
			{
				sb.append('\\').append((char) c);
			}
			else if (c >= 0x20 && c <= 0x7E)
			{
				sb.append((char) c);
			}
			else
			{
				sb.append('\\').append(String.format("%03o", c));
			}
		}
		return sb.append('"').toString();
	}

	public static String tuple(List<String> elements)
	{
		return "{" + String.join(", ", elements) + "}";
	}

	public static String list(List<String> elements)
	{
		return "[" + String.join(", ", elements) + "]";
	}

	public static String cons(List<String> heads, String tail)
	{
		return "[" + String.join(", ", heads) + "|" + tail + "]";
	}

	/**
	 * Several patterns or values in one position, as used by multi-argument dispatch.
	 */
	public static String values(List<String> elements)
	{
		return "<" + String.join(", ", elements) + ">";
	}

	public static String functionName(String name, int arity)
	{
		return atom(name) + "/" + arity;
	}

	public static String call(String module, String function, List<String> arguments)
	{
		return "call " + atom(module) + ":" + atom(function) + "(" + String.join(", ", arguments) + ")";
	}

	public static String apply(String function, List<String> arguments)
	{
		return "apply " + function + "(" + String.join(", ", arguments) + ")";
	}

	/**
	 * Raises a match failure carrying the given reason term.
	 */
	public static String matchFail(String reason)
	{
		return "primop 'match_fail'(" + reason + ")";
	}

	public static String fun(List<String> parameters, String body)
	{
		return "fun (" + String.join(", ", parameters) + ") ->\n" + indent(body, 4);
	}

	/**
	 * {@code let <Var> = Value in Body}; the body continues at the current indentation.
	 */
	public static String let(String variable, String value, String body)
	{
		if (isSingleLine(value))
		{
			return "let <" + variable + "> = " + value + "\nin " + body;
		}
		return "let <" + variable + "> =\n" + indent(value, 4) + "\nin " + body;
	}

	public static String caseOf(String scrutinee, List<String> clauses)
	{
		StringBuilder sb = new StringBuilder();
		if (isSingleLine(scrutinee))
		{
			sb.append("case ").append(scrutinee).append(" of\n");
		}
		else
		{
			sb.append("case\n").append(indent(scrutinee, 4)).append("\nof\n");
		}
		for (String clause : clauses)
		{
			sb.append(indent(clause, 2)).append("\n");
		}
		return sb.append("end").toString();
	}

	/**
	 * A receive over the mailbox. Core Erlang has no closing keyword for receive: the after
	 * clause ends it.
	 */
	public static String receive(List<String> clauses, String timeout, String timeoutBody)
	{
		StringBuilder sb = new StringBuilder("receive\n");
		for (String clause : clauses)
		{
			sb.append(indent(clause, 2)).append("\n");
		}
		sb.append("after ").append(timeout).append(" ->\n").append(indent(timeoutBody, 4));
		return sb.toString();
	}

	public static String clause(String pattern, String guard, String body)
	{
		return pattern + " when " + guard + " ->\n" + indent(body, 4);
	}

	/**
	 * One segment of a binary: {@code #<Value>(Size, Unit, 'type', [flags])}.
	 */
	public static String segment(String value, String size, String unit, String type, List<String> flags)
	{
		return "#<" + value + ">(" + size + "," + unit + "," + atom(type) + "," + list(flags).replace(", ", ",") + ")";
	}

	public static String binary(List<String> segments)
	{
		return "#{" + String.join(",", segments) + "}#";
	}

	/**
	 * Converts a type name such as {@code HttpClient} to the module atom text {@code http_client}.
	 */
	public static String snakeCase(String typeName)
	{
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < typeName.length(); i++)
		{
			char c = typeName.charAt(i);
			if (Character.isUpperCase(c))
			{
				if (i > 0 && typeName.charAt(i - 1) != '_')
				{
					sb.append('_');
				}
				sb.append(Character.toLowerCase(c));
			}
			else
			{
				sb.append(c);
			}
		}
		return sb.toString();
	}

	public static boolean isSingleLine(String text)
	{
		return text.indexOf('\n') < 0;
	}

	public static String indent(String text, int spaces)
	{
		String pad = " ".repeat(spaces);
		StringBuilder sb = new StringBuilder();
		String[] lines = text.split("\n", -1);
		for (int i = 0; i < lines.length; i++)
		{
			if (i > 0)
			{
				sb.append('\n');
			}
			if (!lines[i].isEmpty())
			{
				sb.append(pad).append(lines[i]);
			}
		}
		return sb.toString();
	}
}
