package hscoq.model.gallina;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A polymorphic number literal, written {@code #num}.
 */
public class GallinaPolyNum extends GallinaTerm {

	private final BigInteger value;

	public GallinaPolyNum(BigInteger value) {
		this.value = value;
	}

	public BigInteger getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaPolyNum polyNum = (GallinaPolyNum) o;
		return Objects.equals(value, polyNum.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
