package hscoq.model.gallina;

import java.util.Objects;

public class GallinaReturnType extends GallinaNode {

	private final GallinaTerm type;

	public GallinaReturnType(GallinaTerm type) {
		this.type = type;
	}

	public GallinaTerm getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaReturnType returnType = (GallinaReturnType) o;
		return Objects.equals(type, returnType.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type);
	}
}
