package hscoq.model.gallina;

import java.util.Objects;

public class GallinaDepRetType extends GallinaNode {

	private final GallinaName as;
	private final GallinaReturnType returnType;

	public GallinaDepRetType(GallinaName as, GallinaReturnType returnType) {
		this.as = as;
		this.returnType = returnType;
	}

	public GallinaName getAs() {
		return as;
	}

	public GallinaReturnType getReturnType() {
		return returnType;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaDepRetType depRetType = (GallinaDepRetType) o;
		return Objects.equals(as, depRetType.as) &&
				Objects.equals(returnType, depRetType.returnType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(as, returnType);
	}
}
