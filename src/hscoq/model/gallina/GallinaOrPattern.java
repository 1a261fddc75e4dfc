package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code pattern | ... | pattern}
 */
public class GallinaOrPattern extends GallinaNode {

	private final List<GallinaPattern> alternatives;

	public GallinaOrPattern(List<GallinaPattern> alternatives) {
		if (alternatives.isEmpty()) {
			throw new IllegalArgumentException("or pattern requires at least one alternative");
		}
		this.alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
	}

	public List<GallinaPattern> getAlternatives() {
		return alternatives;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaOrPattern orPattern = (GallinaOrPattern) o;
		return Objects.equals(alternatives, orPattern.alternatives);
	}

	@Override
	public int hashCode() {
		return Objects.hash(alternatives);
	}
}
