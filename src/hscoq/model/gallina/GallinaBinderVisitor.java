package hscoq.model.gallina;

public abstract class GallinaBinderVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaInferredBinder inferredBinder) throws E;
	public abstract T visit(GallinaTypedBinder typedBinder) throws E;
	public abstract T visit(GallinaLetBinder letBinder) throws E;
	public abstract T visit(GallinaGeneralizedBinder generalizedBinder) throws E;
}
