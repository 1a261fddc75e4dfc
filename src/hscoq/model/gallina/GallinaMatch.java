package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaMatch extends GallinaTerm {

	private final List<GallinaMatchItem> items;
	private final GallinaReturnType returnType;
	private final List<GallinaEquation> equations;

	public GallinaMatch(List<GallinaMatchItem> items, GallinaReturnType returnType, List<GallinaEquation> equations) {
		if (items.isEmpty()) {
			throw new IllegalArgumentException("match requires at least one scrutinee");
		}
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
		this.returnType = returnType;
		this.equations = Collections.unmodifiableList(new ArrayList<>(equations));
	}

	public List<GallinaMatchItem> getItems() {
		return items;
	}

	public GallinaReturnType getReturnType() {
		return returnType;
	}

	public List<GallinaEquation> getEquations() {
		return equations;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaMatch match = (GallinaMatch) o;
		return Objects.equals(items, match.items) &&
				Objects.equals(returnType, match.returnType) &&
				Objects.equals(equations, match.equations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(items, returnType, equations);
	}
}
