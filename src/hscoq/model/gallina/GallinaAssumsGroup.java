package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaAssumsGroup extends GallinaNode {

	private final List<String> names;
	private final GallinaTerm type;

	public GallinaAssumsGroup(List<String> names, GallinaTerm type) {
		if (names.isEmpty()) {
			throw new IllegalArgumentException("assumption group requires at least one name");
		}
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.type = type;
	}

	public List<String> getNames() {
		return names;
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
		GallinaAssumsGroup assumsGroup = (GallinaAssumsGroup) o;
		return Objects.equals(names, assumsGroup.names) &&
				Objects.equals(type, assumsGroup.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type);
	}
}
