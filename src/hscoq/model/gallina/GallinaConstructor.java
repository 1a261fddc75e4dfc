package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code ident [binders] [: term]}
 */
public class GallinaConstructor extends GallinaNode {

	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;

	public GallinaConstructor(String name, List<GallinaBinder> binders, GallinaTerm type) {
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
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

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaConstructor constructor = (GallinaConstructor) o;
		return Objects.equals(name, constructor.name) &&
				Objects.equals(binders, constructor.binders) &&
				Objects.equals(type, constructor.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binders, type);
	}
}
