package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code Infix "op" := ( term ) ( [assoc associativity ,] at level num ) .}
 */
public class GallinaInfixDefinition extends GallinaSentence {

	private final String operator;
	private final GallinaTerm definition;
	private final GallinaAssociativity associativity;
	private final int level;

	public GallinaInfixDefinition(String operator, GallinaTerm definition, GallinaAssociativity associativity,
								  int level) {
		this.operator = operator;
		this.definition = definition;
		this.associativity = associativity;
		this.level = level;
	}

	public String getOperator() {
		return operator;
	}

	public GallinaTerm getDefinition() {
		return definition;
	}

	/**
	 * @return the declared associativity, or null when the notation leaves it unspecified
	 */
	public GallinaAssociativity getAssociativity() {
		return associativity;
	}

	public int getLevel() {
		return level;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInfixDefinition that = (GallinaInfixDefinition) o;
		return level == that.level &&
				Objects.equals(operator, that.operator) &&
				Objects.equals(definition, that.definition) &&
				associativity == that.associativity;
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, definition, associativity, level);
	}
}
