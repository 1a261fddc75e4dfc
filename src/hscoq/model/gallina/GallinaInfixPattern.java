package hscoq.model.gallina;

import java.util.Objects;

public class GallinaInfixPattern extends GallinaPattern {

	private final GallinaPattern lhs;
	private final String operator;
	private final GallinaPattern rhs;

	public GallinaInfixPattern(GallinaPattern lhs, String operator, GallinaPattern rhs) {
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public GallinaPattern getLhs() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public GallinaPattern getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInfixPattern infixPattern = (GallinaInfixPattern) o;
		return Objects.equals(lhs, infixPattern.lhs) &&
				Objects.equals(operator, infixPattern.operator) &&
				Objects.equals(rhs, infixPattern.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}
}
