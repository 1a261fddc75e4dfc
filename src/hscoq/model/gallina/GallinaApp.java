package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Curried application of a head to one or more arguments. A head on its own is never wrapped in an
 * application.
 */
public class GallinaApp extends GallinaTerm {

	private final GallinaTerm function;
	private final List<GallinaArg> arguments;

	public GallinaApp(GallinaTerm function, List<GallinaArg> arguments) {
		if (arguments.isEmpty()) {
			throw new IllegalArgumentException("application requires at least one argument");
		}
		this.function = function;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public GallinaTerm getFunction() {
		return function;
	}

	public List<GallinaArg> getArguments() {
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
		GallinaApp app = (GallinaApp) o;
		return Objects.equals(function, app.function) &&
				Objects.equals(arguments, app.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}
}
