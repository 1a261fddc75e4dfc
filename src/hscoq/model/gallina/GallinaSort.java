package hscoq.model.gallina;

import java.util.Objects;

public class GallinaSort extends GallinaTerm {

	public enum Kind {
		PROP,
		SET,
		TYPE,
	}

	private final Kind kind;

	public GallinaSort(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaSort sort = (GallinaSort) o;
		return kind == sort.kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind);
	}
}
