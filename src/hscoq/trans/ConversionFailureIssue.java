package hscoq.trans;

import hscoq.errors.Issue;
import hscoq.errors.IssueVisitor;

/**
 * A declaration whose conversion aborted with a {@link ProgramError}; the declaration is left out of the output.
 */
public class ConversionFailureIssue extends Issue {

	private final ProgramError error;

	public ConversionFailureIssue(ProgramError error) {
		super();
		this.error = error;
	}

	public ProgramError getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
