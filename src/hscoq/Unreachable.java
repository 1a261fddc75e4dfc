package hscoq;

/**
 * Thrown where control cannot arrive unless an invariant of this code base is broken, such as a
 * {@link java.io.StringWriter} reporting an I/O failure.
 */
public class Unreachable extends RuntimeException {

	public Unreachable(String detail) {
		super("unreachable: " + detail);
	}

	public Unreachable(Throwable cause) {
		super("unreachable", cause);
	}

}
