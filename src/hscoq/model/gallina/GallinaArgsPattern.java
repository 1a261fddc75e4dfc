package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaArgsPattern extends GallinaPattern {

	private final GallinaQualid constructor;
	private final List<GallinaPattern> arguments;

	public GallinaArgsPattern(GallinaQualid constructor, List<GallinaPattern> arguments) {
		if (arguments.isEmpty()) {
			throw new IllegalArgumentException("constructor pattern requires at least one argument");
		}
		this.constructor = constructor;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public GallinaQualid getConstructor() {
		return constructor;
	}

	public List<GallinaPattern> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaArgsPattern argsPattern = (GallinaArgsPattern) o;
		return Objects.equals(constructor, argsPattern.constructor) &&
				Objects.equals(arguments, argsPattern.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constructor, arguments);
	}
}
