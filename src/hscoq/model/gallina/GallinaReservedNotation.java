package hscoq.model.gallina;

import java.util.Objects;

public class GallinaReservedNotation extends GallinaSentence {

	private final String name;

	public GallinaReservedNotation(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaReservedNotation reservedNotation = (GallinaReservedNotation) o;
		return Objects.equals(name, reservedNotation.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
