package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaMultPattern extends GallinaNode {

	private final List<GallinaPattern> patterns;

	public GallinaMultPattern(List<GallinaPattern> patterns) {
		if (patterns.isEmpty()) {
			throw new IllegalArgumentException("multiple pattern requires at least one pattern");
		}
		this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
	}

	public List<GallinaPattern> getPatterns() {
		return patterns;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaMultPattern multPattern = (GallinaMultPattern) o;
		return Objects.equals(patterns, multPattern.patterns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(patterns);
	}
}
