package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code ( or_pattern , ... , or_pattern )}
 */
public class GallinaOrPatterns extends GallinaPattern {

	private final List<GallinaOrPattern> orPatterns;

	public GallinaOrPatterns(List<GallinaOrPattern> orPatterns) {
		if (orPatterns.isEmpty()) {
			throw new IllegalArgumentException("or patterns require at least one alternative group");
		}
		this.orPatterns = Collections.unmodifiableList(new ArrayList<>(orPatterns));
	}

	public List<GallinaOrPattern> getOrPatterns() {
		return orPatterns;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaOrPatterns orPatterns = (GallinaOrPatterns) o;
		return Objects.equals(orPatterns, orPatterns.orPatterns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(orPatterns);
	}
}
