package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A theorem-like statement together with its proof.
 */
public class GallinaAssertion extends GallinaSentence {

	public enum Keyword {
		THEOREM,
		LEMMA,
		REMARK,
		FACT,
		COROLLARY,
		PROPOSITION,
		DEFINITION,
		EXAMPLE,
	}

	private final Keyword keyword;
	private final String name;
	private final List<GallinaBinder> binders;
	private final GallinaTerm type;
	private final GallinaProof proof;

	public GallinaAssertion(Keyword keyword, String name, List<GallinaBinder> binders, GallinaTerm type, GallinaProof proof) {
		this.keyword = keyword;
		this.name = name;
		this.binders = Collections.unmodifiableList(new ArrayList<>(binders));
		this.type = type;
		this.proof = proof;
	}

	public Keyword getKeyword() {
		return keyword;
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getBinders() {
		return binders;
	}

	public GallinaTerm getType() {
		return type;
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
		GallinaAssertion assertion = (GallinaAssertion) o;
		return keyword == assertion.keyword &&
				Objects.equals(name, assertion.name) &&
				Objects.equals(binders, assertion.binders) &&
				Objects.equals(type, assertion.type) &&
				Objects.equals(proof, assertion.proof);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, name, binders, type, proof);
	}
}
