package hscoq.model.gallina;

import java.util.Objects;

/**
 * A reference to a (possibly qualified) identifier.
 */
public class GallinaVariable extends GallinaTerm {

	private final GallinaQualid qualid;

	public GallinaVariable(GallinaQualid qualid) {
		this.qualid = qualid;
	}

	public GallinaQualid getQualid() {
		return qualid;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaVariable variable = (GallinaVariable) o;
		return Objects.equals(qualid, variable.qualid);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualid);
	}
}
