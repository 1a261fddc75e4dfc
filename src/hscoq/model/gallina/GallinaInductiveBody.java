package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GallinaInductiveBody extends GallinaNode {

	private final String name;
	private final List<GallinaBinder> parameters;
	private final GallinaTerm type;
	private final List<GallinaConstructor> constructors;

	public GallinaInductiveBody(String name, List<GallinaBinder> parameters, GallinaTerm type, List<GallinaConstructor> constructors) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.type = type;
		this.constructors = Collections.unmodifiableList(new ArrayList<>(constructors));
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getParameters() {
		return parameters;
	}

	public GallinaTerm getType() {
		return type;
	}

	public List<GallinaConstructor> getConstructors() {
		return constructors;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInductiveBody inductiveBody = (GallinaInductiveBody) o;
		return Objects.equals(name, inductiveBody.name) &&
				Objects.equals(parameters, inductiveBody.parameters) &&
				Objects.equals(type, inductiveBody.type) &&
				Objects.equals(constructors, inductiveBody.constructors);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, type, constructors);
	}
}
