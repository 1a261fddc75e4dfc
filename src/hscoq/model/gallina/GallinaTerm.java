package hscoq.model.gallina;

/**
 * A Gallina term.
 */
public abstract class GallinaTerm extends GallinaNode {

	public abstract <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
