package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code let ident [binders] [: term] := term in term}
 */
public class GallinaLet extends GallinaTerm {

	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;
	private final GallinaTerm value;
	private final GallinaTerm body;

	public GallinaLet(String name, List<GallinaBinder> binders, GallinaTerm type, GallinaTerm value, GallinaTerm body) {
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
		this.value = value;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getBinders() {
		return binders;
	}

	public GallinaTerm getType() {
		return type;
	}

	public GallinaTerm getValue() {
		return value;
	}

	public GallinaTerm getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaLet thatLet = (GallinaLet) o;
		return Objects.equals(name, thatLet.name) &&
				Objects.equals(binders, thatLet.binders) &&
				Objects.equals(type, thatLet.type) &&
				Objects.equals(value, thatLet.value) &&
				Objects.equals(body, thatLet.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binders, type, value, body);
	}
}
