package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code [Local|Global] Arguments qualid [argument_spec ...] .}
 */
public class GallinaArguments extends GallinaSentence {

	private final GallinaLocality locality;
	private final GallinaQualid function;
	private final List<GallinaArgumentSpec> specs;

	public GallinaArguments(GallinaLocality locality, GallinaQualid function, List<GallinaArgumentSpec> specs) {
		this.locality = locality;
		this.function = function;
		this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
	}

	public GallinaLocality getLocality() {
		return locality;
	}

	public GallinaQualid getFunction() {
		return function;
	}

	public List<GallinaArgumentSpec> getSpecs() {
		return specs;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaArguments arguments = (GallinaArguments) o;
		return Objects.equals(locality, arguments.locality) &&
				Objects.equals(function, arguments.function) &&
				Objects.equals(specs, arguments.specs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(locality, function, specs);
	}
}
