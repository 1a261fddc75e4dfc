package hscoq.model.gallina;

import java.util.Objects;

public class GallinaInfix extends GallinaTerm {

	private final GallinaTerm lhs;
	private final String operator;
	private final GallinaTerm rhs;

	public GallinaInfix(GallinaTerm lhs, String operator, GallinaTerm rhs) {
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public GallinaTerm getLhs() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public GallinaTerm getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInfix infix = (GallinaInfix) o;
		return Objects.equals(lhs, infix.lhs) &&
				Objects.equals(operator, infix.operator) &&
				Objects.equals(rhs, infix.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}
}
