package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaCoFixpoint extends GallinaSentence {

	private final List<GallinaCofixBody> bodies;
	private final List<GallinaNotationBinding> notations;

	public GallinaCoFixpoint(List<GallinaCofixBody> bodies, List<GallinaNotationBinding> notations) {
		if (bodies.isEmpty()) {
			throw new IllegalArgumentException("cofixpoint requires at least one body");
		}
		this.bodies = Collections.unmodifiableList(new ArrayList<>(bodies));
		this.notations = Collections.unmodifiableList(new ArrayList<>(notations));
	}

	public List<GallinaCofixBody> getBodies() {
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
		GallinaCoFixpoint coFixpoint = (GallinaCoFixpoint) o;
		return Objects.equals(bodies, coFixpoint.bodies) &&
				Objects.equals(notations, coFixpoint.notations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bodies, notations);
	}
}
