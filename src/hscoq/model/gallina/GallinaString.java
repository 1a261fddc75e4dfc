package hscoq.model.gallina;

import java.util.Objects;

public class GallinaString extends GallinaTerm {

	private final String value;

	public GallinaString(String value) {
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
		GallinaString thatString = (GallinaString) o;
		return Objects.equals(value, thatString.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
