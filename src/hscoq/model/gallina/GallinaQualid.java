package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A possibly qualified identifier, {@code ident} or {@code qualid.ident}.
 */
public class GallinaQualid extends GallinaNode {

	// null for a bare identifier
	private final GallinaQualid qualifier;
	private final String ident;

	private GallinaQualid(GallinaQualid qualifier, String ident) {
		this.qualifier = qualifier;
		this.ident = ident;
	}

	public static GallinaQualid bare(String ident) {
		return new GallinaQualid(null, ident);
	}

	public static GallinaQualid qualified(GallinaQualid qualifier, String accessIdent) {
		return new GallinaQualid(qualifier, accessIdent);
	}

	/**
	 * Splits a dotted name such as {@code GHC.Base.map} into its qualifier chain.
	 */
	public static GallinaQualid parse(String dotted) {
		String[] parts = dotted.split("\\.", -1);
		GallinaQualid result = bare(parts[0]);
		for (int i = 1; i < parts.length; ++i) {
			result = qualified(result, parts[i]);
		}
		return result;
	}

	public boolean isBare() {
		return qualifier == null;
	}

	public GallinaQualid getQualifier() {
		return qualifier;
	}

	public String getIdent() {
		return ident;
	}

	public List<String> getParts() {
		List<String> parts = new ArrayList<>();
		for (GallinaQualid q = this; q != null; q = q.qualifier) {
			parts.add(q.ident);
		}
		Collections.reverse(parts);
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaQualid qualid = (GallinaQualid) o;
		return Objects.equals(qualifier, qualid.qualifier) &&
				Objects.equals(ident, qualid.ident);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualifier, ident);
	}
}
