package hscoq.model.gallina;

import java.util.Objects;

public class GallinaParens extends GallinaTerm {

	private final GallinaTerm term;

	public GallinaParens(GallinaTerm term) {
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
		GallinaParens parens = (GallinaParens) o;
		return Objects.equals(term, parens.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term);
	}
}
