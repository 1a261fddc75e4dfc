package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code term <: term}
 */
public class GallinaCheckType extends GallinaTerm {

	private final GallinaTerm term;
	private final GallinaTerm type;

	public GallinaCheckType(GallinaTerm term, GallinaTerm type) {
		this.term = term;
		this.type = type;
	}

	public GallinaTerm getTerm() {
		return term;
	}

	public GallinaTerm getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaCheckType checkType = (GallinaCheckType) o;
		return Objects.equals(term, checkType.term) &&
				Objects.equals(type, checkType.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term, type);
	}
}
