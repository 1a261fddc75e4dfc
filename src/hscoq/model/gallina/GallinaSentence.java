package hscoq.model.gallina;

/**
 * A top-level declaration, terminated by a period when rendered.
 */
public abstract class GallinaSentence extends GallinaNode {

	public abstract <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
