package hscoq;

/**
 * A translation failure consisting of a prefix (the kind of error) and a message.
 *
 */
public abstract class HsCoqException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public HsCoqException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public HsCoqException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
