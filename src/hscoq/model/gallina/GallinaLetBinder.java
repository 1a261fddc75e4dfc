package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code ( name [: term] := term )}
 */
public class GallinaLetBinder extends GallinaBinder {

	private final GallinaName name;
	private final GallinaTerm type;
	private final GallinaTerm value;

	public GallinaLetBinder(GallinaName name, GallinaTerm type, GallinaTerm value) {
		this.name = name;
		this.type = type;
		this.value = value;
	}

	public GallinaName getName() {
		return name;
	}

	public GallinaTerm getType() {
		return type;
	}

	public GallinaTerm getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaBinderVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaLetBinder letBinder = (GallinaLetBinder) o;
		return Objects.equals(name, letBinder.name) &&
				Objects.equals(type, letBinder.type) &&
				Objects.equals(value, letBinder.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, value);
	}
}
