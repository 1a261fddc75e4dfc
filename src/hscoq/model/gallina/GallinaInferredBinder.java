package hscoq.model.gallina;

import java.util.Objects;

/**
 * A binder without a type annotation, {@code name} or {@code {name}}.
 */
public class GallinaInferredBinder extends GallinaBinder {

	private final Explicitness explicitness;
	private final GallinaName name;

	public GallinaInferredBinder(Explicitness explicitness, GallinaName name) {
		this.explicitness = explicitness;
		this.name = name;
	}

	public Explicitness getExplicitness() {
		return explicitness;
	}

	public GallinaName getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaBinderVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInferredBinder inferredBinder = (GallinaInferredBinder) o;
		return explicitness == inferredBinder.explicitness &&
				Objects.equals(name, inferredBinder.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(explicitness, name);
	}
}
