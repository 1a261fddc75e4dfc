package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code cofix_body} or {@code cofix_body with ... with cofix_body for ident}.
 */
public class GallinaCofixBodies extends GallinaNode {

	private final List<GallinaCofixBody> bodies;
	// only present when there is more than one body
	private final String forIdent;

	public GallinaCofixBodies(List<GallinaCofixBody> bodies, String forIdent) {
		if (bodies.isEmpty()) {
			throw new IllegalArgumentException("cofix requires at least one body");
		}
		if (bodies.size() > 1 && forIdent == null) {
			throw new IllegalArgumentException("mutual cofix requires the identifier it is for");
		}
		if (bodies.size() == 1 && forIdent != null) {
			throw new IllegalArgumentException("single cofix body cannot name the identifier it is for");
		}
		this.bodies = Collections.unmodifiableList(new ArrayList<>(bodies));
		this.forIdent = forIdent;
	}

	public GallinaCofixBodies(GallinaCofixBody body) {
		this(Collections.singletonList(body), null);
	}

	public List<GallinaCofixBody> getBodies() {
		return bodies;
	}

	public String getForIdent() {
		return forIdent;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaCofixBodies that = (GallinaCofixBodies) o;
		return Objects.equals(bodies, that.bodies) &&
				Objects.equals(forIdent, that.forIdent);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bodies, forIdent);
	}
}
