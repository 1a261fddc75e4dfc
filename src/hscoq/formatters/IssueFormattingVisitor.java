package hscoq.formatters;

import hscoq.errors.IssueVisitor;
import hscoq.errors.IssueWithContext;
import hscoq.trans.ConversionFailureIssue;
import hscoq.trans.IOErrorIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(ConversionFailureIssue conversionFailureIssue) throws IOException {
		out.write(conversionFailureIssue.getError().getPrefix());
		out.write(": ");
		out.write(conversionFailureIssue.getError().getMsg());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

}
