package hscoq.errors;

/**
 * Describes what the translation was doing when an issue was recorded.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;

}
