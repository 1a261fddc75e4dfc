package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code term : term}
 */
public class GallinaHasType extends GallinaTerm {

	private final GallinaTerm term;
	private final GallinaTerm type;

	public GallinaHasType(GallinaTerm term, GallinaTerm type) {
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
		GallinaHasType hasType = (GallinaHasType) o;
		return Objects.equals(term, hasType.term) &&
				Objects.equals(type, hasType.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term, type);
	}
}
