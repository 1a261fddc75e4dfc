package hscoq.model.gallina;

import java.util.Objects;

public class GallinaArrow extends GallinaTerm {

	private final GallinaTerm domain;
	private final GallinaTerm codomain;

	public GallinaArrow(GallinaTerm domain, GallinaTerm codomain) {
		this.domain = domain;
		this.codomain = codomain;
	}

	public GallinaTerm getDomain() {
		return domain;
	}

	public GallinaTerm getCodomain() {
		return codomain;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaArrow arrow = (GallinaArrow) o;
		return Objects.equals(domain, arrow.domain) &&
				Objects.equals(codomain, arrow.codomain);
	}

	@Override
	public int hashCode() {
		return Objects.hash(domain, codomain);
	}
}
