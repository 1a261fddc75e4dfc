package hscoq.model.gallina;

import java.util.Objects;

public class GallinaAsPattern extends GallinaPattern {

	private final GallinaPattern pattern;
	private final String name;

	public GallinaAsPattern(GallinaPattern pattern, String name) {
		this.pattern = pattern;
		this.name = name;
	}

	public GallinaPattern getPattern() {
		return pattern;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaAsPattern asPattern = (GallinaAsPattern) o;
		return Objects.equals(pattern, asPattern.pattern) &&
				Objects.equals(name, asPattern.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, name);
	}
}
