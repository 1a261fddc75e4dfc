package hscoq.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T param) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, List<T> items, String separator, Formatter<T> writer)
			throws IOException {
		boolean isFirst = true;
		for (T item : items) {
			if (!isFirst) {
				out.write(separator);
			}
			isFirst = false;
			writer.format(item);
		}
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		writeSeparated(out, items, ", ", writer);
	}

	public static <T> void writeSpaceSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		writeSeparated(out, items, " ", writer);
	}

	/**
	 * Writes each item preceded by a single space, so that an empty list writes nothing.
	 */
	public static <T> void writeSpacePrefixed(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		for (T item : items) {
			out.write(" ");
			writer.format(item);
		}
	}

	/**
	 * Writes a Gallina string literal, doubling embedded quotes.
	 */
	public static void writeStringLiteral(Writer out, String value) throws IOException {
		out.write("\"");
		out.write(value.replace("\"", "\"\""));
		out.write("\"");
	}

}
