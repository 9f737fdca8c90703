package chomsky.util;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * String helpers for rendering grammars and for log and error messages.
 */
public class Utils {

	/**
	 * Joins the string representations of the passed objects.
	 *
	 * @param objs joined objects
	 * @param separator string put between two objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		return objs.stream().map(Object::toString).collect(Collectors.joining(separator));
	}

	/**
	 * Escapes the non printable characters of the passed string, used for log and error messages.
	 */
	public static String toPrintableRepresentation(String source) {
		StringBuilder builder = new StringBuilder();
		for (char c : source.toCharArray()) {
			switch (c) {
				case '\t':
					builder.append("\\t");
					break;
				case '\r':
					builder.append("\\r");
					break;
				case '\n':
					builder.append("\\n");
					break;
				default:
					if (Character.isISOControl(c)) {
						builder.append(String.format("\\u%04x", (int)c));
					} else {
						builder.append(c);
					}
			}
		}
		return builder.toString();
	}
}
