package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code @qualid term ... term}
 */
public class GallinaExplicitApp extends GallinaTerm {

	private final GallinaQualid function;
	private final List<GallinaTerm> arguments;

	public GallinaExplicitApp(GallinaQualid function, List<GallinaTerm> arguments) {
		this.function = function;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public GallinaQualid getFunction() {
		return function;
	}

	public List<GallinaTerm> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaExplicitApp explicitApp = (GallinaExplicitApp) o;
		return Objects.equals(function, explicitApp.function) &&
				Objects.equals(arguments, explicitApp.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}
}
