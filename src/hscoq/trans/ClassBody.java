package hscoq.trans;

import hscoq.model.gallina.GallinaClassDefinition;
import hscoq.model.gallina.GallinaSentence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A converted class: its definition followed by the notations for its operator-named methods.
 */
public class ClassBody {

	private final GallinaClassDefinition definition;
	private final List<GallinaSentence> notations;

	public ClassBody(GallinaClassDefinition definition, List<GallinaSentence> notations) {
		this.definition = definition;
		this.notations = Collections.unmodifiableList(new ArrayList<>(notations));
	}

	public GallinaClassDefinition getDefinition() {
		return definition;
	}

	public List<GallinaSentence> getNotations() {
		return notations;
	}

	public List<GallinaSentence> toSentences() {
		List<GallinaSentence> result = new ArrayList<>();
		result.add(definition);
		result.addAll(notations);
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClassBody classBody = (ClassBody) o;
		return Objects.equals(definition, classBody.definition) &&
				Objects.equals(notations, classBody.notations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, notations);
	}
}
