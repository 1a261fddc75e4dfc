package hscoq.model.gallina;

import java.util.Objects;

public class GallinaPositionalArg extends GallinaArg {

	private final GallinaTerm term;

	public GallinaPositionalArg(GallinaTerm term) {
		this.term = term;
	}

	public GallinaTerm getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaArgVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaPositionalArg positionalArg = (GallinaPositionalArg) o;
		return Objects.equals(term, positionalArg.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term);
	}
}
