package hscoq.model.gallina;

import java.util.Objects;

/**
 * A binding occurrence: either an identifier or the anonymous name {@code _}.
 */
public class GallinaName extends GallinaNode {

	private static final GallinaName UNDERSCORE = new GallinaName(null);

	// null for the anonymous name
	private final String ident;

	private GallinaName(String ident) {
		this.ident = ident;
	}

	public static GallinaName ident(String ident) {
		if (ident == null) {
			throw new IllegalArgumentException("identifier names must not be null, use underscore()");
		}
		return new GallinaName(ident);
	}

	public static GallinaName underscore() {
		return UNDERSCORE;
	}

	public boolean isUnderscore() {
		return ident == null;
	}

	/**
	 * @return the identifier, or null for {@code _}
	 */
	public String getIdent() {
		return ident;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaName name = (GallinaName) o;
		return Objects.equals(ident, name.ident);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ident);
	}
}
