package hscoq.model.gallina;

import java.util.Objects;

/**
 * The converted type of a declared name, together with its operator fixity when it has one.
 */
public class GallinaSignature {

	private final GallinaTerm type;
	private final GallinaAssociativity associativity;
	private final Integer level;

	public GallinaSignature(GallinaTerm type) {
		this.type = type;
		this.associativity = null;
		this.level = null;
	}

	public GallinaSignature(GallinaTerm type, GallinaAssociativity associativity, int level) {
		this.type = type;
		this.associativity = associativity;
		this.level = level;
	}

	public GallinaTerm getType() {
		return type;
	}

	public boolean hasFixity() {
		return level != null;
	}

	public GallinaAssociativity getAssociativity() {
		return associativity;
	}

	public Integer getLevel() {
		return level;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaSignature signature = (GallinaSignature) o;
		return Objects.equals(type, signature.type) &&
				associativity == signature.associativity &&
				Objects.equals(level, signature.level);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, associativity, level);
	}

	@Override
	public String toString() {
		if (!hasFixity()) {
			return type.toString();
		}
		return type + " (" + associativity + ", " + level + ")";
	}
}
