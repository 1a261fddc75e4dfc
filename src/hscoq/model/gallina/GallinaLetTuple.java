package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code let ( name, ..., name ) [dep_ret_type] := term in term}
 */
public class GallinaLetTuple extends GallinaTerm {

	private final List<GallinaName> names;
	private final GallinaDepRetType returnType;
	private final GallinaTerm value;
	private final GallinaTerm body;

	public GallinaLetTuple(List<GallinaName> names, GallinaDepRetType returnType, GallinaTerm value, GallinaTerm body) {
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.returnType = returnType;
		this.value = value;
		this.body = body;
	}

	public List<GallinaName> getNames() {
		return names;
	}

	public GallinaDepRetType getReturnType() {
		return returnType;
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
		GallinaLetTuple letTuple = (GallinaLetTuple) o;
		return Objects.equals(names, letTuple.names) &&
				Objects.equals(returnType, letTuple.returnType) &&
				Objects.equals(value, letTuple.value) &&
				Objects.equals(body, letTuple.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, returnType, value, body);
	}
}
