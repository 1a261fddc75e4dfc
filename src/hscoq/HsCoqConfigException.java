package hscoq;

/**
 * Raised when a translation configuration document cannot be read or is malformed.
 */
public class HsCoqConfigException extends HsCoqException {

	private static final long serialVersionUID = 4120338190657717731L;
	private static final String prefix = "Configuration error";

	public HsCoqConfigException(String msg) {
		super(prefix, msg);
	}

	public HsCoqConfigException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}

}
