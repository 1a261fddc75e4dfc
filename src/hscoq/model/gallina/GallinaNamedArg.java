package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code ( ident := term )}
 */
public class GallinaNamedArg extends GallinaArg {

	private final String name;
	private final GallinaTerm value;

	public GallinaNamedArg(String name, GallinaTerm value) {
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public GallinaTerm getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaArgVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaNamedArg namedArg = (GallinaNamedArg) o;
		return Objects.equals(name, namedArg.name) &&
				Objects.equals(value, namedArg.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}
}
