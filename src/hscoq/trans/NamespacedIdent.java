package hscoq.trans;

import java.util.Objects;

public class NamespacedIdent {

	private final HsNamespace namespace;
	private final String ident;

	public NamespacedIdent(HsNamespace namespace, String ident) {
		this.namespace = namespace;
		this.ident = ident;
	}

	public HsNamespace getNamespace() {
		return namespace;
	}

	public String getIdent() {
		return ident;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NamespacedIdent that = (NamespacedIdent) o;
		return namespace == that.namespace &&
				Objects.equals(ident, that.ident);
	}

	@Override
	public int hashCode() {
		return Objects.hash(namespace, ident);
	}

	@Override
	public String toString() {
		return namespace.getConfigName() + " " + ident;
	}
}
