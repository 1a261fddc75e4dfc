package hscoq.model.gallina;

/**
 * Stands in for a value that could not be translated.
 */
public class GallinaMissingValue extends GallinaTerm {

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return GallinaMissingValue.class.hashCode();
	}
}
