package hscoq.errors;

/**
 * Sink for the issues of a translation run. Nested contexts wrap each issue with the context they were
 * created for before handing it on.
 */
public abstract class IssueContext {

	public abstract void error(Issue issue);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}

}
