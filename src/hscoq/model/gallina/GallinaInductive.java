package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaInductive extends GallinaSentence {

	public enum Kind {
		INDUCTIVE,
		COINDUCTIVE,
	}

	private final Kind kind;
	private final List<GallinaInductiveBody> bodies;
	private final List<GallinaNotationBinding> notations;

	public GallinaInductive(Kind kind, List<GallinaInductiveBody> bodies, List<GallinaNotationBinding> notations) {
		if (bodies.isEmpty()) {
			throw new IllegalArgumentException("inductive definition requires at least one body");
		}
		this.kind = kind;
		this.bodies = Collections.unmodifiableList(new ArrayList<>(bodies));
		this.notations = Collections.unmodifiableList(new ArrayList<>(notations));
	}

	public Kind getKind() {
		return kind;
	}

	public List<GallinaInductiveBody> getBodies() {
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
		GallinaInductive inductive = (GallinaInductive) o;
		return kind == inductive.kind &&
				Objects.equals(bodies, inductive.bodies) &&
				Objects.equals(notations, inductive.notations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, bodies, notations);
	}
}
