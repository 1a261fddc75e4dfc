package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code let fix fix_body in term}
 */
public class GallinaLetFix extends GallinaTerm {

	private final GallinaFixBody definition;
	private final GallinaTerm body;

	public GallinaLetFix(GallinaFixBody definition, GallinaTerm body) {
		this.definition = definition;
		this.body = body;
	}

	public GallinaFixBody getDefinition() {
		return definition;
	}

	public GallinaTerm getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaLetFix letFix = (GallinaLetFix) o;
		return Objects.equals(definition, letFix.definition) &&
				Objects.equals(body, letFix.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, body);
	}
}
