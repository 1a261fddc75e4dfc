package hscoq.model.gallina;

import java.util.Objects;

/**
 * A string literal that originates in the source program.
 */
public class GallinaHsString extends GallinaTerm {

	private final String value;

	public GallinaHsString(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaHsString hsString = (GallinaHsString) o;
		return Objects.equals(value, hsString.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
