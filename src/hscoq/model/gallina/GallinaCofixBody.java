package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaCofixBody extends GallinaNode {

	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;
	private final GallinaTerm body;

	public GallinaCofixBody(String name, List<GallinaBinder> binders, GallinaTerm type, GallinaTerm body) {
		if (binders.isEmpty()) {
			throw new IllegalArgumentException("cofixpoint body requires at least one binder");
		}
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getBinders() {
		return binders;
	}

	public GallinaTerm getType() {
		return type;
	}

	public GallinaTerm getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaCofixBody cofixBody = (GallinaCofixBody) o;
		return Objects.equals(name, cofixBody.name) &&
				Objects.equals(binders, cofixBody.binders) &&
				Objects.equals(type, cofixBody.type) &&
				Objects.equals(body, cofixBody.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binders, type, body);
	}
}
