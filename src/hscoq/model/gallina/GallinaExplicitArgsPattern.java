package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code @qualid pattern ... pattern}
 */
public class GallinaExplicitArgsPattern extends GallinaPattern {

	private final GallinaQualid constructor;
	private final List<GallinaPattern> arguments;

	public GallinaExplicitArgsPattern(GallinaQualid constructor, List<GallinaPattern> arguments) {
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
		GallinaExplicitArgsPattern explicitArgsPattern = (GallinaExplicitArgsPattern) o;
		return Objects.equals(constructor, explicitArgsPattern.constructor) &&
				Objects.equals(arguments, explicitArgsPattern.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constructor, arguments);
	}
}
