package hscoq.model.gallina;

import java.util.Objects;

public class GallinaArgumentSpec extends GallinaNode {

	public enum Explicitness {
		// name
		EXPLICIT,
		// [ name ]
		IMPLICIT,
		// { name }
		MAXIMAL,
	}

	private final Explicitness explicitness;
	private final GallinaName name;
	private final String scope;

	public GallinaArgumentSpec(Explicitness explicitness, GallinaName name, String scope) {
		this.explicitness = explicitness;
		this.name = name;
		this.scope = scope;
	}

	public Explicitness getExplicitness() {
		return explicitness;
	}

	public GallinaName getName() {
		return name;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaArgumentSpec that = (GallinaArgumentSpec) o;
		return explicitness == that.explicitness &&
				Objects.equals(name, that.name) &&
				Objects.equals(scope, that.scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(explicitness, name, scope);
	}
}
