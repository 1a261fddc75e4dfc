package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code term :>}
 */
public class GallinaToSupportType extends GallinaTerm {

	private final GallinaTerm term;

	public GallinaToSupportType(GallinaTerm term) {
		this.term = term;
	}

	public GallinaTerm getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaToSupportType toSupportType = (GallinaToSupportType) o;
		return Objects.equals(term, toSupportType.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term);
	}
}
