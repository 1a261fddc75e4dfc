package hscoq.formatters;

/**
 * A JSON document that does not describe a Gallina node.
 */
public class GallinaJSONParseException extends Exception {

	private static final long serialVersionUID = 2284173390536151902L;

	public GallinaJSONParseException(String msg) {
		super(msg);
	}

	public GallinaJSONParseException(String msg, Throwable cause) {
		super(msg, cause);
	}

}
