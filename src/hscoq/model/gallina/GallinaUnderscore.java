package hscoq.model.gallina;

public class GallinaUnderscore extends GallinaTerm {

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
		return GallinaUnderscore.class.hashCode();
	}
}
