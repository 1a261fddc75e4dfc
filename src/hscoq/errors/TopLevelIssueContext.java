package hscoq.errors;

import hscoq.Unreachable;
import hscoq.formatters.IndentingWriter;
import hscoq.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of a whole translation run in the order they were reported.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	// Detected N issue(s): then one issue per line
	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + issues.size() + " issue(s):");
		IssueFormattingVisitor visitor = new IssueFormattingVisitor(out);
		for (Issue issue : issues) {
			out.newLine();
			issue.accept(visitor);
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
