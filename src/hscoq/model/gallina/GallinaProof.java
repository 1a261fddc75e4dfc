package hscoq.model.gallina;

import java.util.Objects;

/**
 * {@code Proof. tactics Qed.} and its {@code Defined} / {@code Admitted} variants. Tactics are kept as text.
 */
public class GallinaProof extends GallinaNode {

	public enum Ending {
		QED,
		DEFINED,
		ADMITTED,
	}

	private final Ending ending;
	private final String tactics;

	public GallinaProof(Ending ending, String tactics) {
		this.ending = ending;
		this.tactics = tactics;
	}

	public Ending getEnding() {
		return ending;
	}

	public String getTactics() {
		return tactics;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaProof proof = (GallinaProof) o;
		return ending == proof.ending &&
				Objects.equals(tactics, proof.tactics);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ending, tactics);
	}
}
