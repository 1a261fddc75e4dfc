package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code Instance ident [binders] : term := { ident := term ; ... } [proof] .}
 */
public class GallinaInstanceDefinition extends GallinaSentence {

	private final String name;
	private final List<GallinaBinder> parameters;
	private final GallinaTerm classType;
	private final List<GallinaRecordField> fields;
	private final GallinaProof proof;

	public GallinaInstanceDefinition(String name, List<GallinaBinder> parameters, GallinaTerm classType, List<GallinaRecordField> fields, GallinaProof proof) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.classType = classType;
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		this.proof = proof;
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getParameters() {
		return parameters;
	}

	public GallinaTerm getClassType() {
		return classType;
	}

	public List<GallinaRecordField> getFields() {
		return fields;
	}

	public GallinaProof getProof() {
		return proof;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaInstanceDefinition instanceDefinition = (GallinaInstanceDefinition) o;
		return Objects.equals(name, instanceDefinition.name) &&
				Objects.equals(parameters, instanceDefinition.parameters) &&
				Objects.equals(classType, instanceDefinition.classType) &&
				Objects.equals(fields, instanceDefinition.fields) &&
				Objects.equals(proof, instanceDefinition.proof);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, classType, fields, proof);
	}
}
