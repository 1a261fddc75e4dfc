package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaFixpoint extends GallinaSentence {

	private final List<GallinaFixBody> bodies;
	private final List<GallinaNotationBinding> notations;

	public GallinaFixpoint(List<GallinaFixBody> bodies, List<GallinaNotationBinding> notations) {
		if (bodies.isEmpty()) {
			throw new IllegalArgumentException("fixpoint requires at least one body");
		}
		this.bodies = Collections.unmodifiableList(new ArrayList<>(bodies));
		this.notations = Collections.unmodifiableList(new ArrayList<>(notations));
	}

	public List<GallinaFixBody> getBodies() {
		return bodies;
	}

	public List<GallinaNotationBinding> getNotations() {
		return notations;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaFixpoint fixpoint = (GallinaFixpoint) o;
		return Objects.equals(bodies, fixpoint.bodies) &&
				Objects.equals(notations, fixpoint.notations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bodies, notations);
	}
}
