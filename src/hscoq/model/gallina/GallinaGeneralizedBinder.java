package hscoq.model.gallina;

import java.util.Objects;

/**
 * A generalized implicit term, such as a superclass constraint: {@code `{term}} or {@code `(term)}.
 */
public class GallinaGeneralizedBinder extends GallinaBinder {

	private final Explicitness explicitness;
	private final GallinaTerm term;

	public GallinaGeneralizedBinder(Explicitness explicitness, GallinaTerm term) {
		this.explicitness = explicitness;
		this.term = term;
	}

	public Explicitness getExplicitness() {
		return explicitness;
	}

	public GallinaTerm getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaBinderVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaGeneralizedBinder generalizedBinder = (GallinaGeneralizedBinder) o;
		return explicitness == generalizedBinder.explicitness &&
				Objects.equals(term, generalizedBinder.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(explicitness, term);
	}
}
