package hscoq.model.gallina;

import java.util.Objects;

public class GallinaInScopePattern extends GallinaPattern {

	private final GallinaPattern pattern;
	private final String scope;

	public GallinaInScopePattern(GallinaPattern pattern, String scope) {
		this.pattern = pattern;
		this.scope = scope;
	}

	public GallinaPattern getPattern() {
		return pattern;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInScopePattern inScopePattern = (GallinaInScopePattern) o;
		return Objects.equals(pattern, inScopePattern.pattern) &&
				Objects.equals(scope, inScopePattern.scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, scope);
	}
}
