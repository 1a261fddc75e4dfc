package hscoq.model.gallina;

import java.util.Objects;

public class GallinaAssumption extends GallinaSentence {

	public enum Keyword {
		AXIOM,
		AXIOMS,
		CONJECTURE,
		PARAMETER,
		PARAMETERS,
		VARIABLE,
		VARIABLES,
		HYPOTHESIS,
		HYPOTHESES,
	}

	private final Keyword keyword;
	private final GallinaAssums assums;

	public GallinaAssumption(Keyword keyword, GallinaAssums assums) {
		this.keyword = keyword;
		this.assums = assums;
	}

	public Keyword getKeyword() {
		return keyword;
	}

	public GallinaAssums getAssums() {
		return assums;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaAssumption assumption = (GallinaAssumption) o;
		return keyword == assumption.keyword &&
				Objects.equals(assums, assumption.assums);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, assums);
	}
}
