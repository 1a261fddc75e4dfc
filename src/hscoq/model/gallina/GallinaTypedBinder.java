package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaTypedBinder extends GallinaBinder {

	private final Generalizability generalizability;
	private final Explicitness explicitness;
	private final List<GallinaName> names;
	private final GallinaTerm type;

	public GallinaTypedBinder(Generalizability generalizability, Explicitness explicitness, List<GallinaName> names, GallinaTerm type) {
		if (names.isEmpty()) {
			throw new IllegalArgumentException("typed binder requires at least one name");
		}
		this.generalizability = generalizability;
		this.explicitness = explicitness;
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.type = type;
	}

	public Generalizability getGeneralizability() {
		return generalizability;
	}

	public Explicitness getExplicitness() {
		return explicitness;
	}

	public List<GallinaName> getNames() {
		return names;
	}

	public GallinaTerm getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaBinderVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaTypedBinder typedBinder = (GallinaTypedBinder) o;
		return generalizability == typedBinder.generalizability &&
				explicitness == typedBinder.explicitness &&
				Objects.equals(names, typedBinder.names) &&
				Objects.equals(type, typedBinder.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(generalizability, explicitness, names, type);
	}
}
