package hscoq.model.gallina;

import java.math.BigInteger;
import java.util.Objects;

public class GallinaNumPattern extends GallinaPattern {

	private final BigInteger value;

	public GallinaNumPattern(BigInteger value) {
		this.value = value;
	}

	public BigInteger getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaNumPattern numPattern = (GallinaNumPattern) o;
		return Objects.equals(value, numPattern.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
