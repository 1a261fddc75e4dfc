package hscoq.model.gallina;

import java.util.Objects;

/**
 * Suppresses implicit arguments of the wrapped term, as used in instance declarations.
 */
public class GallinaBang extends GallinaTerm {

	private final GallinaTerm term;

	public GallinaBang(GallinaTerm term) {
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
		GallinaBang bang = (GallinaBang) o;
		return Objects.equals(term, bang.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term);
	}
}
