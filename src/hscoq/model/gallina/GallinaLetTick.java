package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code let ' pattern := term in term}
 */
public class GallinaLetTick extends GallinaTerm {

	private final GallinaPattern pattern;
	private final GallinaTerm value;
	private final GallinaTerm body;

	public GallinaLetTick(GallinaPattern pattern, GallinaTerm value, GallinaTerm body) {
		this.pattern = pattern;
		this.value = value;
		this.body = body;
	}

	public GallinaPattern getPattern() {
		return pattern;
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
		GallinaLetTick letTick = (GallinaLetTick) o;
		return Objects.equals(pattern, letTick.pattern) &&
				Objects.equals(value, letTick.value) &&
				Objects.equals(body, letTick.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, value, body);
	}
}
