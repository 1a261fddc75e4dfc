package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code let ' pattern [in qualid [pattern ... pattern]] := term return_type in term}
 *
 * The {@code in} annotation only parses when the return type is present, so it only exists in this form.
 */
public class GallinaLetTickDep extends GallinaTerm {

	private final GallinaPattern pattern;
	private final GallinaInAnnotation inAnnotation;
	private final GallinaTerm value;
	private final GallinaReturnType returnType;
	private final GallinaTerm body;

	public GallinaLetTickDep(GallinaPattern pattern, GallinaInAnnotation inAnnotation, GallinaTerm value, GallinaReturnType returnType, GallinaTerm body) {
		this.pattern = pattern;
		this.inAnnotation = inAnnotation;
		this.value = value;
		this.returnType = returnType;
		this.body = body;
	}

	public GallinaPattern getPattern() {
		return pattern;
	}

	public GallinaInAnnotation getInAnnotation() {
		return inAnnotation;
	}

	public GallinaTerm getValue() {
		return value;
	}

	public GallinaReturnType getReturnType() {
		return returnType;
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
		GallinaLetTickDep letTickDep = (GallinaLetTickDep) o;
		return Objects.equals(pattern, letTickDep.pattern) &&
				Objects.equals(inAnnotation, letTickDep.inAnnotation) &&
				Objects.equals(value, letTickDep.value) &&
				Objects.equals(returnType, letTickDep.returnType) &&
				Objects.equals(body, letTickDep.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, inAnnotation, value, returnType, body);
	}
}
