package hscoq.model.gallina;

import java.util.Objects;

public class GallinaQualidPattern extends GallinaPattern {

	private final GallinaQualid qualid;

	public GallinaQualidPattern(GallinaQualid qualid) {
		this.qualid = qualid;
	}

	public GallinaQualid getQualid() {
		return qualid;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaQualidPattern qualidPattern = (GallinaQualidPattern) o;
		return Objects.equals(qualid, qualidPattern.qualid);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualid);
	}
}
