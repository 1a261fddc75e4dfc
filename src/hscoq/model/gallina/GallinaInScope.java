package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code term % scope}
 */
public class GallinaInScope extends GallinaTerm {

	private final GallinaTerm term;
	private final String scope;

	public GallinaInScope(GallinaTerm term, String scope) {
		this.term = term;
		this.scope = scope;
	}

	public GallinaTerm getTerm() {
		return term;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInScope inScope = (GallinaInScope) o;
		return Objects.equals(term, inScope.term) &&
				Objects.equals(scope, inScope.scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(term, scope);
	}
}
