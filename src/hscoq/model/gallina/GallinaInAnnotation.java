package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaInAnnotation extends GallinaNode {

	private final GallinaQualid qualid;
	private final List<GallinaPattern> patterns;

	public GallinaInAnnotation(GallinaQualid qualid, List<GallinaPattern> patterns) {
		this.qualid = qualid;
		this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
	}

	public GallinaQualid getQualid() {
		return qualid;
	}

	public List<GallinaPattern> getPatterns() {
		return patterns;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInAnnotation inAnnotation = (GallinaInAnnotation) o;
		return Objects.equals(qualid, inAnnotation.qualid) &&
				Objects.equals(patterns, inAnnotation.patterns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualid, patterns);
	}
}
