package hscoq.model.gallina;

import java.util.Objects;

public class GallinaStringPattern extends GallinaPattern {

	private final String value;

	public GallinaStringPattern(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaStringPattern stringPattern = (GallinaStringPattern) o;
		return Objects.equals(value, stringPattern.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
