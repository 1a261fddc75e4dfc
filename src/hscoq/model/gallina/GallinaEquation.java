package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code mult_pattern | ... | mult_pattern => term}
 */
public class GallinaEquation extends GallinaNode {

	private final List<GallinaMultPattern> patterns;
	private final GallinaTerm body;

	public GallinaEquation(List<GallinaMultPattern> patterns, GallinaTerm body) {
		if (patterns.isEmpty()) {
			throw new IllegalArgumentException("equation requires at least one pattern");
		}
		this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
		this.body = body;
	}

	public List<GallinaMultPattern> getPatterns() {
		return patterns;
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
		GallinaEquation equation = (GallinaEquation) o;
		return Objects.equals(patterns, equation.patterns) &&
				Objects.equals(body, equation.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(patterns, body);
	}
}
