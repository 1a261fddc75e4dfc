package hscoq.errors;

import hscoq.Unreachable;
import hscoq.formatters.IndentingWriter;
import hscoq.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Something that went wrong during a translation run and was recorded instead of aborting it.
 */
public abstract class Issue {

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public String format() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(new IndentingWriter(sw)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	@Override
	public String toString() {
		return format();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
