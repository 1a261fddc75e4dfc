package hscoq.trans;

import hscoq.model.gallina.*;

import java.util.*;

public class ClassConversion {

	private ClassConversion() {}

	public static final int DEFAULT_NOTATION_LEVEL = 99;

	public static ClassBody convertClassDeclaration(ConversionState state, HsClassDeclaration declaration) {
		if (declaration.hasFeature(HsClassDeclaration.Feature.FUNCTIONAL_DEPENDENCIES)) {
			throw ProgramError.unsupported("functional dependencies");
		}
		if (declaration.hasFeature(HsClassDeclaration.Feature.ASSOCIATED_TYPES)) {
			throw ProgramError.unsupported("associated types");
		}
		if (declaration.hasFeature(HsClassDeclaration.Feature.ASSOCIATED_TYPE_DEFAULTS)) {
			throw ProgramError.unsupported("default associated type definitions");
		}

		Set<String> skippedMethods = state.getEdits().getSkippedMethods(declaration.getName());
		for (String method : skippedMethods) {
			if (!declaration.getSignatures().containsKey(method)) {
				throw ProgramError.editFailure(
						"skip method " + declaration.getName() + "." + method + " not found");
			}
		}

		String name = state.renamedOrSelf(HsNamespace.TYPE, declaration.getName());

		List<GallinaBinder> parameters = new ArrayList<>(declaration.getTypeVariables());
		for (GallinaTerm superclass : declaration.getSuperclasses()) {
			parameters.add(new GallinaGeneralizedBinder(GallinaBinder.Explicitness.IMPLICIT, superclass));
		}

		Map<String, GallinaSignature> signatures = new LinkedHashMap<>();
		for (Map.Entry<String, GallinaSignature> entry : declaration.getSignatures().entrySet()) {
			if (!skippedMethods.contains(entry.getKey())) {
				signatures.put(entry.getKey(), entry.getValue());
			}
		}

		Map<String, GallinaTerm> defaults = new HashMap<>();
		for (HsClassDeclaration.DefaultMethod method : declaration.getDefaults()) {
			if (method.isPatternBinding()) {
				throw ProgramError.unsupported("pattern bindings in class declarations");
			}
			if (skippedMethods.contains(method.getName())) {
				continue;
			}
			GallinaTerm body = method.getArguments().isEmpty()
					? method.getBody()
					: new GallinaFun(method.getArguments(), method.getBody());
			defaults.put(InfixNames.toCoqName(method.getName()), body);
		}
		if (!defaults.isEmpty()) {
			state.setDefaultMethods(name, defaults);
		}

		List<GallinaRecordField> fields = new ArrayList<>();
		for (Map.Entry<String, GallinaSignature> entry : signatures.entrySet()) {
			fields.add(new GallinaRecordField(InfixNames.toCoqName(entry.getKey()), entry.getValue().getType()));
		}
		GallinaClassDefinition definition = new GallinaClassDefinition(name, parameters, null, fields);
		state.setClassDefinition(name, definition);

		List<GallinaSentence> notations = new ArrayList<>();
		for (Map.Entry<String, GallinaSignature> entry : signatures.entrySet()) {
			if (InfixNames.isOperator(entry.getKey())) {
				notations.addAll(buildInfixNotations(entry.getKey(), entry.getValue()));
			}
		}
		return new ClassBody(definition, notations);
	}

	/**
	 * Builds the infix notation for an operator and the prefix notation {@code _op_} naming it as a function.
	 */
	public static List<GallinaSentence> buildInfixNotations(String operator, GallinaSignature signature) {
		GallinaTerm definition = new GallinaVariable(GallinaQualid.bare(InfixNames.toCoqName(operator)));
		GallinaAssociativity associativity = null;
		int level = DEFAULT_NOTATION_LEVEL;
		if (signature != null && signature.hasFixity()) {
			associativity = signature.getAssociativity();
			level = signature.getLevel();
		}
		return Arrays.asList(
				new GallinaInfixDefinition(operator, definition, associativity, level),
				new GallinaNotation(new GallinaNotationBinding(InfixNames.toPrefixNotation(operator), definition)));
	}

	/**
	 * @return the leading implicit binders of a class member's recorded signature, empty when the class or
	 * member is unknown
	 */
	public static List<GallinaBinder> getImplicitBindersForClassMember(ConversionState state, String className,
																	   String memberName) {
		GallinaClassDefinition definition = state.getClassDefinition(className);
		if (definition == null) {
			return Collections.emptyList();
		}
		String coqName = InfixNames.toCoqName(memberName);
		for (GallinaRecordField field : definition.getFields()) {
			if (field.getName().equals(coqName)) {
				return getImplicits(field.getValue());
			}
		}
		return Collections.emptyList();
	}

	/**
	 * Strips the implicit binders off the front of a type. Nested quantifiers are only entered when every
	 * binder of the enclosing one is implicit.
	 */
	public static List<GallinaBinder> getImplicits(GallinaTerm type) {
		List<GallinaBinder> result = new ArrayList<>();
		while (type instanceof GallinaForall) {
			GallinaForall forall = (GallinaForall) type;
			for (GallinaBinder binder : forall.getBinders()) {
				if (!isImplicit(binder)) {
					return result;
				}
				result.add(binder);
			}
			type = forall.getBody();
		}
		return result;
	}

	private static boolean isImplicit(GallinaBinder binder) {
		if (binder instanceof GallinaInferredBinder) {
			return ((GallinaInferredBinder) binder).getExplicitness() == GallinaBinder.Explicitness.IMPLICIT;
		}
		if (binder instanceof GallinaGeneralizedBinder) {
			return ((GallinaGeneralizedBinder) binder).getExplicitness() == GallinaBinder.Explicitness.IMPLICIT;
		}
		return false;
	}

}
