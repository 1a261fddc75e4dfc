package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code let cofix cofix_body in term}
 */
public class GallinaLetCofix extends GallinaTerm {

	private final GallinaCofixBody definition;
	private final GallinaTerm body;

	public GallinaLetCofix(GallinaCofixBody definition, GallinaTerm body) {
		this.definition = definition;
		this.body = body;
	}

	public GallinaCofixBody getDefinition() {
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
		GallinaLetCofix letCofix = (GallinaLetCofix) o;
		return Objects.equals(definition, letCofix.definition) &&
				Objects.equals(body, letCofix.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, body);
	}
}
