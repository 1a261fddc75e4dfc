package hscoq.trans;

import java.util.*;

/**
 * User-supplied edit directives: declarations to leave out entirely, and class methods to drop.
 */
public class Edits {

	private final Set<String> skipped;
	private final Map<String, Set<String>> skippedMethods;

	public Edits(Set<String> skipped, Map<String, Set<String>> skippedMethods) {
		this.skipped = Collections.unmodifiableSet(new TreeSet<>(skipped));
		Map<String, Set<String>> methods = new TreeMap<>();
		for (Map.Entry<String, Set<String>> entry : skippedMethods.entrySet()) {
			methods.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
		}
		this.skippedMethods = Collections.unmodifiableMap(methods);
	}

	public static Edits empty() {
		return new Edits(Collections.emptySet(), Collections.emptyMap());
	}

	public Set<String> getSkipped() {
		return skipped;
	}

	public boolean isSkipped(String ident) {
		return skipped.contains(ident);
	}

	public Map<String, Set<String>> getSkippedMethods() {
		return skippedMethods;
	}

	public Set<String> getSkippedMethods(String className) {
		return skippedMethods.getOrDefault(className, Collections.emptySet());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Edits edits = (Edits) o;
		return Objects.equals(skipped, edits.skipped) &&
				Objects.equals(skippedMethods, edits.skippedMethods);
	}

	@Override
	public int hashCode() {
		return Objects.hash(skipped, skippedMethods);
	}

	@Override
	public String toString() {
		return "Edits(skip=" + skipped + ", skip_method=" + skippedMethods + ")";
	}
}
