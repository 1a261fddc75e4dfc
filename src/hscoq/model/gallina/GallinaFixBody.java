package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code ident binders [{struct ident}] [: term] := term}
 */
public class GallinaFixBody extends GallinaNode {

	private final String name;
	private final List<GallinaBinder> binders;
	private final String structArgument;
	private final GallinaTerm type;
	private final GallinaTerm body;

	public GallinaFixBody(String name, List<GallinaBinder> binders, String structArgument, GallinaTerm type, GallinaTerm body) {
		if (binders.isEmpty()) {
			throw new IllegalArgumentException("fixpoint body requires at least one binder");
		}
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.structArgument = structArgument;
		this.type = type;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getBinders() {
		return binders;
	}

	public String getStructArgument() {
		return structArgument;
	}

	public GallinaTerm getType() {
		return type;
	}

	public GallinaTerm getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaFixBody fixBody = (GallinaFixBody) o;
		return Objects.equals(name, fixBody.name) &&
				Objects.equals(binders, fixBody.binders) &&
				Objects.equals(structArgument, fixBody.structArgument) &&
				Objects.equals(type, fixBody.type) &&
				Objects.equals(body, fixBody.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binders, structArgument, type, body);
	}
}
