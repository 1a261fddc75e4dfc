package hscoq.trans;

import hscoq.model.gallina.GallinaBinder;
import hscoq.model.gallina.GallinaSignature;
import hscoq.model.gallina.GallinaTerm;

import java.util.*;

/**
 * A source class declaration whose types and method bodies have already been converted to Gallina by the
 * front end, ready for {@link ClassConversion}.
 */
public class HsClassDeclaration {

	public enum Feature {
		FUNCTIONAL_DEPENDENCIES,
		ASSOCIATED_TYPES,
		ASSOCIATED_TYPE_DEFAULTS,
	}

	/**
	 * A default method definition. A pattern binding has no name-and-arguments form and cannot be converted.
	 */
	public static class DefaultMethod {
		private final String name;
		private final List<GallinaBinder> arguments;
		private final GallinaTerm body;
		private final boolean patternBinding;

		public DefaultMethod(String name, List<GallinaBinder> arguments, GallinaTerm body) {
			this(name, arguments, body, false);
		}

		private DefaultMethod(String name, List<GallinaBinder> arguments, GallinaTerm body, boolean patternBinding) {
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.body = body;
			this.patternBinding = patternBinding;
		}

		public static DefaultMethod patternBinding(String name, GallinaTerm body) {
			return new DefaultMethod(name, Collections.emptyList(), body, true);
		}

		public String getName() {
			return name;
		}

		public List<GallinaBinder> getArguments() {
			return arguments;
		}

		public GallinaTerm getBody() {
			return body;
		}

		public boolean isPatternBinding() {
			return patternBinding;
		}
	}

	private final String name;
	private final List<GallinaBinder> typeVariables;
	private final List<GallinaTerm> superclasses;
	private final LinkedHashMap<String, GallinaSignature> signatures;
	private final List<DefaultMethod> defaults;
	private final Set<Feature> features;

	public HsClassDeclaration(String name, List<GallinaBinder> typeVariables, List<GallinaTerm> superclasses,
							  Map<String, GallinaSignature> signatures, List<DefaultMethod> defaults,
							  Set<Feature> features) {
		this.name = name;
		this.typeVariables = Collections.unmodifiableList(new ArrayList<>(typeVariables));
		this.superclasses = Collections.unmodifiableList(new ArrayList<>(superclasses));
		this.signatures = new LinkedHashMap<>(signatures);
		this.defaults = Collections.unmodifiableList(new ArrayList<>(defaults));
		this.features = features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
	}

	public String getName() {
		return name;
	}

	public List<GallinaBinder> getTypeVariables() {
		return typeVariables;
	}

	public List<GallinaTerm> getSuperclasses() {
		return superclasses;
	}

	/**
	 * @return method signatures keyed by source method name, in declaration order
	 */
	public Map<String, GallinaSignature> getSignatures() {
		return Collections.unmodifiableMap(signatures);
	}

	public List<DefaultMethod> getDefaults() {
		return defaults;
	}

	public boolean hasFeature(Feature feature) {
		return features.contains(feature);
	}
}
