package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code [Local] Definition ident [binders] [: term] := term .}
 */
public class GallinaDefinition extends GallinaSentence {

	private final GallinaLocality locality;
	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;
	private final GallinaTerm body;

	public GallinaDefinition(GallinaLocality locality, String name, List<GallinaBinder> binders, GallinaTerm type, GallinaTerm body) {
		this.locality = locality;
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
		this.body = body;
	}

	public GallinaLocality getLocality() {
		return locality;
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

	public GallinaTerm getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaDefinition definition = (GallinaDefinition) o;
		return locality == definition.locality &&
				Objects.equals(name, definition.name) &&
				Objects.equals(binders, definition.binders) &&
				Objects.equals(type, definition.type) &&
				Objects.equals(body, definition.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(locality, name, binders, type, body);
	}
}
