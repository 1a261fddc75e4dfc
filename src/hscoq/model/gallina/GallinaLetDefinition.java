package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code Let ident [binders] [: term] := term .}
 */
public class GallinaLetDefinition extends GallinaSentence {

	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;
	private final GallinaTerm body;

	public GallinaLetDefinition(String name, List<GallinaBinder> binders, GallinaTerm type, GallinaTerm body) {
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
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
		GallinaLetDefinition letDefinition = (GallinaLetDefinition) o;
		return Objects.equals(name, letDefinition.name) &&
				Objects.equals(binders, letDefinition.binders) &&
				Objects.equals(type, letDefinition.type) &&
				Objects.equals(body, letDefinition.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binders, type, body);
	}
}
