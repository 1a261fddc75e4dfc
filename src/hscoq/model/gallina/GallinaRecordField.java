package hscoq.model.gallina;

import java.util.Objects;

/**
 * A named field of a class ({@code ident : term}) or instance ({@code ident := term}).
 */
public class GallinaRecordField extends GallinaNode {

	private final String name;
	private final GallinaTerm value;

	public GallinaRecordField(String name, GallinaTerm value) {
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public GallinaTerm getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaRecordField recordField = (GallinaRecordField) o;
		return Objects.equals(name, recordField.name) &&
				Objects.equals(value, recordField.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}
}
