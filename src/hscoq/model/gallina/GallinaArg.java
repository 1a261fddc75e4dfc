package hscoq.model.gallina;

public abstract class GallinaArg extends GallinaNode {

	public abstract <T, E extends Throwable> T accept(GallinaArgVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
