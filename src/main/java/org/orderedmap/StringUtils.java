package org.orderedmap;

import java.lang.reflect.Array;

/** Utilities for printing values */
public class StringUtils {
	private StringUtils() {}

	/**
	 * Prints a value as it would appear as a literal in java source, as nearly as possible. Strings and characters are quoted and escaped,
	 * numbers carry their type suffix or cast, enums are qualified by their type, and arrays are printed as array initializers. Other values
	 * are printed with {@link Object#toString()}.
	 *
	 * @param value The value to print
	 * @param into The StringBuilder to print into--may be null, in which case a new one will be created
	 * @return The printed StringBuilder
	 */
	public static StringBuilder printLiteral(Object value, StringBuilder into) {
		if (into == null)
			into = new StringBuilder();
		if (value == null)
			into.append("null");
		else if (value instanceof CharSequence) {
			into.append('"');
			CharSequence seq = (CharSequence) value;
			for (int i = 0; i < seq.length(); i++)
				escape(seq.charAt(i), '"', into);
			into.append('"');
		} else if (value instanceof Character) {
			into.append('\'');
			escape((Character) value, '\'', into);
			into.append('\'');
		} else if (value instanceof Long)
			into.append(value).append('L');
		else if (value instanceof Float)
			printFloating(((Float) value).doubleValue(), "Float", "f", into);
		else if (value instanceof Double)
			printFloating((Double) value, "Double", "", into);
		else if (value instanceof Short)
			into.append("(short) ").append(value);
		else if (value instanceof Byte)
			into.append("(byte) ").append(value);
		else if (value instanceof Enum)
			into.append(((Enum<?>) value).getDeclaringClass().getSimpleName()).append('.').append(((Enum<?>) value).name());
		else if (value instanceof Class)
			into.append(((Class<?>) value).getSimpleName()).append(".class");
		else if (value.getClass().isArray()) {
			into.append("new ").append(value.getClass().getComponentType().getSimpleName()).append("[] {");
			int length = Array.getLength(value);
			for (int i = 0; i < length; i++) {
				into.append(i == 0 ? " " : ", ");
				printLiteral(Array.get(value, i), into);
			}
			into.append(length == 0 ? "}" : " }");
		} else
			into.append(value);
		return into;
	}

	private static void printFloating(double value, String boxType, String suffix, StringBuilder into) {
		if (Double.isNaN(value))
			into.append(boxType).append(".NaN");
		else if (value == Double.POSITIVE_INFINITY)
			into.append(boxType).append(".POSITIVE_INFINITY");
		else if (value == Double.NEGATIVE_INFINITY)
			into.append(boxType).append(".NEGATIVE_INFINITY");
		else if (suffix.isEmpty())
			into.append(value);
		else
			into.append((float) value).append(suffix);
	}

	private static void escape(char ch, char quote, StringBuilder into) {
		switch (ch) {
		case '\\':
			into.append("\\\\");
			break;
		case '\n':
			into.append("\\n");
			break;
		case '\r':
			into.append("\\r");
			break;
		case '\t':
			into.append("\\t");
			break;
		case '\b':
			into.append("\\b");
			break;
		case '\f':
			into.append("\\f");
			break;
		default:
			if (ch == quote)
				into.append('\\').append(ch);
			else if (ch < ' ' || ch == 0x7f)
				into.append(String.format("\\u%04x", (int) ch));
			else
				into.append(ch);
		}
	}
}
