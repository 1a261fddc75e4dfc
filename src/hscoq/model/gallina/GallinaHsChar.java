package hscoq.model.gallina;

import java.util.Objects;

/**
 * A character literal that originates in the source program.
 */
public class GallinaHsChar extends GallinaTerm {

	private final char value;

	public GallinaHsChar(char value) {
		this.value = value;
	}

	public char getValue() {
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
		GallinaHsChar hsChar = (GallinaHsChar) o;
		return value == hsChar.value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
