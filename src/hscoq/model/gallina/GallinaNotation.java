package hscoq.model.gallina;

import java.util.Objects;

public class GallinaNotation extends GallinaSentence {

	private final GallinaNotationBinding binding;

	public GallinaNotation(GallinaNotationBinding binding) {
		this.binding = binding;
	}

	public GallinaNotationBinding getBinding() {
		return binding;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaNotation notation = (GallinaNotation) o;
		return Objects.equals(binding, notation.binding);
	}

	@Override
	public int hashCode() {
		return Objects.hash(binding);
	}
}
