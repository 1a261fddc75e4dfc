package hscoq.errors;

public class IssueWithContext extends Issue {

	private final Issue issue;
	private final Context context;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	/**
	 * @return the issue with every layer of context removed
	 */
	public Issue getRootIssue() {
		Issue root = issue;
		while (root instanceof IssueWithContext) {
			root = ((IssueWithContext) root).issue;
		}
		return root;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
