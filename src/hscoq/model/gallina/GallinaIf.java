package hscoq.model.gallina;

import java.util.Objects;

public class GallinaIf extends GallinaTerm {

	private final GallinaTerm condition;
	private final GallinaDepRetType returnType;
	private final GallinaTerm thenBranch;
	private final GallinaTerm elseBranch;

	public GallinaIf(GallinaTerm condition, GallinaDepRetType returnType, GallinaTerm thenBranch, GallinaTerm elseBranch) {
		this.condition = condition;
		this.returnType = returnType;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public GallinaTerm getCondition() {
		return condition;
	}

	public GallinaDepRetType getReturnType() {
		return returnType;
	}

	public GallinaTerm getThenBranch() {
		return thenBranch;
	}

	public GallinaTerm getElseBranch() {
		return elseBranch;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaIf thatIf = (GallinaIf) o;
		return Objects.equals(condition, thatIf.condition) &&
				Objects.equals(returnType, thatIf.returnType) &&
				Objects.equals(thenBranch, thatIf.thenBranch) &&
				Objects.equals(elseBranch, thatIf.elseBranch);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, returnType, thenBranch, elseBranch);
	}
}
