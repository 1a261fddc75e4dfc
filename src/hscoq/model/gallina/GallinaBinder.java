package hscoq.model.gallina;

public abstract class GallinaBinder extends GallinaNode {

	/**
	 * Whether free variables of the binder's type are automatically quantified ({@code `}).
	 */
	public enum Generalizability {
		UNGENERALIZABLE,
		GENERALIZABLE,
	}

	/**
	 * Explicit binders are wrapped in parentheses, implicit ones in braces.
	 */
	public enum Explicitness {
		EXPLICIT,
		IMPLICIT,
	}

	public abstract <T, E extends Throwable> T accept(GallinaBinderVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
