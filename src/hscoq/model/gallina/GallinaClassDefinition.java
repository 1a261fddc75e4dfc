package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code Class ident [binders] [: sort] := { ident : term ; ... } .}
 */
public class GallinaClassDefinition extends GallinaSentence {

	private final String name;
	private final List<GallinaBinder> parameters;
	private final GallinaSort sort;
	private final List<GallinaRecordField> fields;

	public GallinaClassDefinition(String name, List<GallinaBinder> parameters, GallinaSort sort, List<GallinaRecordField> fields) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.sort = sort;
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getParameters() {
		return parameters;
	}

	public GallinaSort getSort() {
		return sort;
	}

	public List<GallinaRecordField> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaClassDefinition classDefinition = (GallinaClassDefinition) o;
		return Objects.equals(name, classDefinition.name) &&
				Objects.equals(parameters, classDefinition.parameters) &&
				Objects.equals(sort, classDefinition.sort) &&
				Objects.equals(fields, classDefinition.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, sort, fields);
	}
}
