package hscoq.model.gallina;

import java.util.Objects;

public class GallinaFix extends GallinaTerm {

	private final GallinaFixBodies bodies;

	public GallinaFix(GallinaFixBodies bodies) {
		this.bodies = bodies;
	}

	public GallinaFixBodies getBodies() {
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
		GallinaFix fix = (GallinaFix) o;
		return Objects.equals(bodies, fix.bodies);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bodies);
	}
}
