package hscoq.trans;

import hscoq.HsCoqException;

/**
 * Aborts the conversion of the current declaration. Never caught by the conversion code itself.
 */
public class ProgramError extends HsCoqException {

	private static final long serialVersionUID = 2675120731945127301L;
	private static final String prefix = "Program error";

	public ProgramError(String msg) {
		super(prefix, msg);
	}

	public static ProgramError unsupported(String what) {
		return new ProgramError(what + " unsupported");
	}

	public static ProgramError editFailure(String what) {
		return new ProgramError("Could not apply edit: " + what);
	}

}
