package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code fun binders => term}
 */
public class GallinaFun extends GallinaTerm {

	private final List<GallinaBinder> binders;
	private final GallinaTerm body;

	public GallinaFun(List<GallinaBinder> binders, GallinaTerm body) {
		if (binders.isEmpty()) {
			throw new IllegalArgumentException("fun requires at least one binder");
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
		GallinaFun thatFun = (GallinaFun) o;
		return Objects.equals(binders, thatFun.binders) &&
				Objects.equals(body, thatFun.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(binders, body);
	}
}
