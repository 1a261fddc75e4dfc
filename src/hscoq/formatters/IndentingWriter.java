package hscoq.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that starts every line with the current indentation, and tracks the column the next character
 * lands on so that constructs can align their continuation lines with an earlier column.
 * <p>
 * Indentation is written lazily, when the first character of a line arrives, so blank lines carry no
 * trailing whitespace.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int step;
	private int level = 0;
	private int column = 0;
	private boolean atLineStart = false;

	/**
	 * Undoes one indentation change when closed; meant for try-with-resources.
	 */
	public static class Indent implements AutoCloseable {

		private final IndentingWriter owner;
		private final int delta;

		private Indent(IndentingWriter owner, int delta) {
			this.owner = owner;
			this.delta = delta;
		}

		@Override
		public void close() {
			owner.level -= delta;
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 2);
	}

	public IndentingWriter(Writer out, int step) {
		this.out = out;
		this.step = step;
	}

	public Indent indent() {
		return shift(step);
	}

	/**
	 * Indents following lines so that they start at the given column.
	 */
	public Indent indentToPosition(int position) {
		return shift(position - level);
	}

	private Indent shift(int delta) {
		if (level + delta < 0) {
			throw new IllegalArgumentException("can't indent below 0");
		}
		level += delta;
		return new Indent(this, delta);
	}

	/**
	 * @return the 0-based column the next character will be written at
	 */
	public int getHorizontalPosition() {
		return atLineStart ? level : column;
	}

	public void newLine() throws IOException {
		write(System.lineSeparator());
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; i++) {
			char c = chars[i];
			if (c == '\n') {
				out.write(c);
				atLineStart = true;
				column = 0;
				continue;
			}
			if (atLineStart && c != '\r') {
				for (int s = 0; s < level; s++) {
					out.write(' ');
				}
				atLineStart = false;
				column = level;
			}
			out.write(c);
			if (c != '\r') {
				column++;
			}
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
