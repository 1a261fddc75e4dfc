package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code forall binders, term}
 */
public class GallinaForall extends GallinaTerm {

	private final List<GallinaBinder> binders;
	private final GallinaTerm body;

	public GallinaForall(List<GallinaBinder> binders, GallinaTerm body) {
		if (binders.isEmpty()) {
			throw new IllegalArgumentException("forall requires at least one binder");
		}
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.body = body;
	}

	public List<GallinaBinder> getBinders() {
		return binders;
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
		GallinaForall forall = (GallinaForall) o;
		return Objects.equals(binders, forall.binders) &&
				Objects.equals(body, forall.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(binders, body);
	}
}
