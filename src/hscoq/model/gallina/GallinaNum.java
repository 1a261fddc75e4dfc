package hscoq.model.gallina;

import java.math.BigInteger;
import java.util.Objects;

public class GallinaNum extends GallinaTerm {

	private final BigInteger value;

	public GallinaNum(BigInteger value) {
		if (value.signum() < 0) {
			throw new IllegalArgumentException("number literals are natural numbers, got " + value);
		}
		this.value = value;
	}

	public GallinaNum(long value) {
		this(BigInteger.valueOf(value));
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
		GallinaNum num = (GallinaNum) o;
		return Objects.equals(value, num.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
