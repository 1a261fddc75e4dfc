package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code term [as name] [in qualid [pattern ... pattern]]}
 */
public class GallinaMatchItem extends GallinaNode {

	private final GallinaTerm scrutinee;
	private final GallinaName as;
	private final GallinaInAnnotation inAnnotation;

	public GallinaMatchItem(GallinaTerm scrutinee, GallinaName as, GallinaInAnnotation inAnnotation) {
		this.scrutinee = scrutinee;
		this.as = as;
		this.inAnnotation = inAnnotation;
	}

	public GallinaTerm getScrutinee() {
		return scrutinee;
	}

	public GallinaName getAs() {
		return as;
	}

	public GallinaInAnnotation getInAnnotation() {
		return inAnnotation;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaMatchItem matchItem = (GallinaMatchItem) o;
		return Objects.equals(scrutinee, matchItem.scrutinee) &&
				Objects.equals(as, matchItem.as) &&
				Objects.equals(inAnnotation, matchItem.inAnnotation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scrutinee, as, inAnnotation);
	}
}
