package hscoq.model.gallina;

import java.util.Objects;

public class GallinaCofix extends GallinaTerm {

	private final GallinaCofixBodies bodies;

	public GallinaCofix(GallinaCofixBodies bodies) {
		this.bodies = bodies;
	}

	public GallinaCofixBodies getBodies() {
		return bodies;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaCofix cofix = (GallinaCofix) o;
		return Objects.equals(bodies, cofix.bodies);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bodies);
	}
}
