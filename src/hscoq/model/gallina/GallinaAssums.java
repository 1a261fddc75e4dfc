package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The names and types introduced by an assumption, either {@code ident ... ident : term} or
 * {@code ( ident ... ident : term ) ... ( ident ... ident : term )}.
 */
public class GallinaAssums extends GallinaNode {

	private final List<GallinaAssumsGroup> groups;
	private final boolean parenthesized;

	public GallinaAssums(List<GallinaAssumsGroup> groups, boolean parenthesized) {
		if (groups.isEmpty()) {
			throw new IllegalArgumentException("assumption requires at least one group");
		}
		if (!parenthesized && groups.size() != 1) {
			throw new IllegalArgumentException("unparenthesized assumption must have exactly one group");
		}
		this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
		this.parenthesized = parenthesized;
	}

	public List<GallinaAssumsGroup> getGroups() {
		return groups;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaAssums assums = (GallinaAssums) o;
		return parenthesized == assums.parenthesized &&
				Objects.equals(groups, assums.groups);
	}

	@Override
	public int hashCode() {
		return Objects.hash(groups, parenthesized);
	}
}
