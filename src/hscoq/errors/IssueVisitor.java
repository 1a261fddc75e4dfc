package hscoq.errors;

import hscoq.trans.ConversionFailureIssue;
import hscoq.trans.IOErrorIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(ConversionFailureIssue conversionFailureIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
}
