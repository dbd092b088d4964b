package pgen.util;

import java.util.Collection;
import java.util.Iterator;

/**
 * String formatting of symbol and production collections for log messages and toString methods
 */
public class Utils {

	private Utils(){}

	/**
	 * Joins the string representations of several objects.
	 *
	 * @param objects passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objects, String separator){
		StringBuilder builder = new StringBuilder();
		Iterator<T> iterator = objects.iterator();
		while (iterator.hasNext()){
			builder.append(iterator.next());
			if (iterator.hasNext()){
				builder.append(separator);
			}
		}
		return builder.toString();
	}

	/**
	 * Formats a set like collection as <pre>{a, b, c}</pre>
	 */
	public static <T> String formatSet(Collection<T> objects){
		return "{" + join(objects, ", ") + "}";
	}
}
