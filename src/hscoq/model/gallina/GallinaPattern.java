package hscoq.model.gallina;

/**
 * A pattern of the pattern-matching sub-language.
 */
public abstract class GallinaPattern extends GallinaNode {

	public abstract <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
