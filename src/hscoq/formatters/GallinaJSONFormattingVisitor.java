package hscoq.formatters;

import hscoq.model.gallina.*;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Serializes a node into a JSON object that records its variant in {@code "node"} and every field by name.
 * Absent optional fields are written as {@code null}. {@link GallinaJSONParser} reads the result back.
 */
public class GallinaJSONFormattingVisitor extends GallinaNodeVisitor<JSONObject, RuntimeException> {

	public static JSONObject toJSON(GallinaNode node) {
		return node.accept(new GallinaJSONFormattingVisitor());
	}

	private static Object json(GallinaNode node) {
		return node == null ? JSONObject.NULL : toJSON(node);
	}

	private static JSONArray json(List<? extends GallinaNode> nodes) {
		JSONArray result = new JSONArray();
		for (GallinaNode node : nodes) {
			result.put(toJSON(node));
		}
		return result;
	}

	private static Object nullable(Object value) {
		return value == null ? JSONObject.NULL : value;
	}

	private static JSONObject node(String kind) {
		return new JSONObject().put("node", kind);
	}

	@Override
	public JSONObject visit(GallinaTerm term) {
		return term.accept(new TermVisitor());
	}

	@Override
	public JSONObject visit(GallinaArg arg) {
		return arg.accept(new GallinaArgVisitor<JSONObject, RuntimeException>() {
			@Override
			public JSONObject visit(GallinaPositionalArg positionalArg) {
				return node("PositionalArg").put("term", json(positionalArg.getTerm()));
			}

			@Override
			public JSONObject visit(GallinaNamedArg namedArg) {
				return node("NamedArg").put("name", namedArg.getName()).put("value", json(namedArg.getValue()));
			}
		});
	}

	@Override
	public JSONObject visit(GallinaBinder binder) {
		return binder.accept(new GallinaBinderVisitor<JSONObject, RuntimeException>() {
			@Override
			public JSONObject visit(GallinaInferredBinder inferredBinder) {
				return node("InferredBinder")
						.put("explicitness", inferredBinder.getExplicitness().name())
						.put("name", json(inferredBinder.getName()));
			}

			@Override
			public JSONObject visit(GallinaTypedBinder typedBinder) {
				return node("TypedBinder")
						.put("generalizability", typedBinder.getGeneralizability().name())
						.put("explicitness", typedBinder.getExplicitness().name())
						.put("names", json(typedBinder.getNames()))
						.put("type", json(typedBinder.getType()));
			}

			@Override
			public JSONObject visit(GallinaLetBinder letBinder) {
				return node("LetBinder")
						.put("name", json(letBinder.getName()))
						.put("type", json(letBinder.getType()))
						.put("value", json(letBinder.getValue()));
			}

			@Override
			public JSONObject visit(GallinaGeneralizedBinder generalizedBinder) {
				return node("GeneralizedBinder")
						.put("explicitness", generalizedBinder.getExplicitness().name())
						.put("term", json(generalizedBinder.getTerm()));
			}
		});
	}

	@Override
	public JSONObject visit(GallinaPattern pattern) {
		return pattern.accept(new PatternVisitor());
	}

	@Override
	public JSONObject visit(GallinaSentence sentence) {
		return sentence.accept(new SentenceVisitor());
	}

	@Override
	public JSONObject visit(GallinaName name) {
		return node("Name").put("ident", nullable(name.getIdent()));
	}

	@Override
	public JSONObject visit(GallinaQualid qualid) {
		return node("Qualid").put("parts", new JSONArray(qualid.getParts()));
	}

	@Override
	public JSONObject visit(GallinaFixBodies fixBodies) {
		return node("FixBodies")
				.put("bodies", json(fixBodies.getBodies()))
				.put("for", nullable(fixBodies.getForIdent()));
	}

	@Override
	public JSONObject visit(GallinaCofixBodies cofixBodies) {
		return node("CofixBodies")
				.put("bodies", json(cofixBodies.getBodies()))
				.put("for", nullable(cofixBodies.getForIdent()));
	}

	@Override
	public JSONObject visit(GallinaFixBody fixBody) {
		return node("FixBody")
				.put("name", fixBody.getName())
				.put("binders", json(fixBody.getBinders()))
				.put("struct", nullable(fixBody.getStructArgument()))
				.put("type", json(fixBody.getType()))
				.put("body", json(fixBody.getBody()));
	}

	@Override
	public JSONObject visit(GallinaCofixBody cofixBody) {
		return node("CofixBody")
				.put("name", cofixBody.getName())
				.put("binders", json(cofixBody.getBinders()))
				.put("type", json(cofixBody.getType()))
				.put("body", json(cofixBody.getBody()));
	}

	@Override
	public JSONObject visit(GallinaMatchItem matchItem) {
		return node("MatchItem")
				.put("scrutinee", json(matchItem.getScrutinee()))
				.put("as", json(matchItem.getAs()))
				.put("in", json(matchItem.getInAnnotation()));
	}

	@Override
	public JSONObject visit(GallinaInAnnotation inAnnotation) {
		return node("InAnnotation")
				.put("qualid", json(inAnnotation.getQualid()))
				.put("patterns", json(inAnnotation.getPatterns()));
	}

	@Override
	public JSONObject visit(GallinaDepRetType depRetType) {
		return node("DepRetType")
				.put("as", json(depRetType.getAs()))
				.put("returnType", json(depRetType.getReturnType()));
	}

	@Override
	public JSONObject visit(GallinaReturnType returnType) {
		return node("ReturnType").put("type", json(returnType.getType()));
	}

	@Override
	public JSONObject visit(GallinaEquation equation) {
		return node("Equation")
				.put("patterns", json(equation.getPatterns()))
				.put("body", json(equation.getBody()));
	}

	@Override
	public JSONObject visit(GallinaMultPattern multPattern) {
		return node("MultPattern").put("patterns", json(multPattern.getPatterns()));
	}

	@Override
	public JSONObject visit(GallinaOrPattern orPattern) {
		return node("OrPattern").put("alternatives", json(orPattern.getAlternatives()));
	}

	@Override
	public JSONObject visit(GallinaAssums assums) {
		return node("Assums")
				.put("groups", json(assums.getGroups()))
				.put("parenthesized", assums.isParenthesized());
	}

	@Override
	public JSONObject visit(GallinaAssumsGroup assumsGroup) {
		return node("AssumsGroup")
				.put("names", new JSONArray(assumsGroup.getNames()))
				.put("type", json(assumsGroup.getType()));
	}

	@Override
	public JSONObject visit(GallinaInductiveBody inductiveBody) {
		return node("InductiveBody")
				.put("name", inductiveBody.getName())
				.put("parameters", json(inductiveBody.getParameters()))
				.put("type", json(inductiveBody.getType()))
				.put("constructors", json(inductiveBody.getConstructors()));
	}

	@Override
	public JSONObject visit(GallinaConstructor constructor) {
		return node("Constructor")
				.put("name", constructor.getName())
				.put("binders", json(constructor.getBinders()))
				.put("type", json(constructor.getType()));
	}

	@Override
	public JSONObject visit(GallinaProof proof) {
		return node("Proof")
				.put("ending", proof.getEnding().name())
				.put("tactics", proof.getTactics());
	}

	@Override
	public JSONObject visit(GallinaRecordField recordField) {
		return node("RecordField")
				.put("name", recordField.getName())
				.put("value", json(recordField.getValue()));
	}

	@Override
	public JSONObject visit(GallinaNotationBinding notationBinding) {
		return node("NotationBinding")
				.put("name", notationBinding.getName())
				.put("value", json(notationBinding.getValue()));
	}

	@Override
	public JSONObject visit(GallinaArgumentSpec argumentSpec) {
		return node("ArgumentSpec")
				.put("explicitness", argumentSpec.getExplicitness().name())
				.put("name", json(argumentSpec.getName()))
				.put("scope", nullable(argumentSpec.getScope()));
	}

	private static class TermVisitor extends GallinaTermVisitor<JSONObject, RuntimeException> {

		@Override
		public JSONObject visit(GallinaForall forall) {
			return node("Forall").put("binders", json(forall.getBinders())).put("body", json(forall.getBody()));
		}

		@Override
		public JSONObject visit(GallinaFun funNode) {
			return node("Fun").put("binders", json(funNode.getBinders())).put("body", json(funNode.getBody()));
		}

		@Override
		public JSONObject visit(GallinaFix fix) {
			return node("Fix").put("bodies", json(fix.getBodies()));
		}

		@Override
		public JSONObject visit(GallinaCofix cofix) {
			return node("Cofix").put("bodies", json(cofix.getBodies()));
		}

		@Override
		public JSONObject visit(GallinaLet letNode) {
			return node("Let")
					.put("name", letNode.getName())
					.put("binders", json(letNode.getBinders()))
					.put("type", json(letNode.getType()))
					.put("value", json(letNode.getValue()))
					.put("body", json(letNode.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetFix letFix) {
			return node("LetFix")
					.put("definition", json(letFix.getDefinition()))
					.put("body", json(letFix.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetCofix letCofix) {
			return node("LetCofix")
					.put("definition", json(letCofix.getDefinition()))
					.put("body", json(letCofix.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetTuple letTuple) {
			return node("LetTuple")
					.put("names", json(letTuple.getNames()))
					.put("returnType", json(letTuple.getReturnType()))
					.put("value", json(letTuple.getValue()))
					.put("body", json(letTuple.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetTick letTick) {
			return node("LetTick")
					.put("pattern", json(letTick.getPattern()))
					.put("value", json(letTick.getValue()))
					.put("body", json(letTick.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetTickDep letTickDep) {
			return node("LetTickDep")
					.put("pattern", json(letTickDep.getPattern()))
					.put("in", json(letTickDep.getInAnnotation()))
					.put("value", json(letTickDep.getValue()))
					.put("returnType", json(letTickDep.getReturnType()))
					.put("body", json(letTickDep.getBody()));
		}

		@Override
		public JSONObject visit(GallinaIf ifNode) {
			return node("If")
					.put("condition", json(ifNode.getCondition()))
					.put("returnType", json(ifNode.getReturnType()))
					.put("then", json(ifNode.getThenBranch()))
					.put("else", json(ifNode.getElseBranch()));
		}

		@Override
		public JSONObject visit(GallinaHasType hasType) {
			return node("HasType").put("term", json(hasType.getTerm())).put("type", json(hasType.getType()));
		}

		@Override
		public JSONObject visit(GallinaCheckType checkType) {
			return node("CheckType").put("term", json(checkType.getTerm())).put("type", json(checkType.getType()));
		}

		@Override
		public JSONObject visit(GallinaToSupportType toSupportType) {
			return node("ToSupportType").put("term", json(toSupportType.getTerm()));
		}

		@Override
		public JSONObject visit(GallinaArrow arrow) {
			return node("Arrow").put("domain", json(arrow.getDomain())).put("codomain", json(arrow.getCodomain()));
		}

		@Override
		public JSONObject visit(GallinaApp app) {
			return node("App").put("function", json(app.getFunction())).put("arguments", json(app.getArguments()));
		}

		@Override
		public JSONObject visit(GallinaExplicitApp explicitApp) {
			return node("ExplicitApp")
					.put("function", json(explicitApp.getFunction()))
					.put("arguments", json(explicitApp.getArguments()));
		}

		@Override
		public JSONObject visit(GallinaInfix infix) {
			return node("Infix")
					.put("lhs", json(infix.getLhs()))
					.put("operator", infix.getOperator())
					.put("rhs", json(infix.getRhs()));
		}

		@Override
		public JSONObject visit(GallinaInScope inScope) {
			return node("InScope").put("term", json(inScope.getTerm())).put("scope", inScope.getScope());
		}

		@Override
		public JSONObject visit(GallinaMatch match) {
			return node("Match")
					.put("items", json(match.getItems()))
					.put("returnType", json(match.getReturnType()))
					.put("equations", json(match.getEquations()));
		}

		@Override
		public JSONObject visit(GallinaVariable variable) {
			return node("Variable").put("qualid", json(variable.getQualid()));
		}

		@Override
		public JSONObject visit(GallinaSort sort) {
			return node("Sort").put("kind", sort.getKind().name());
		}

		@Override
		public JSONObject visit(GallinaNum num) {
			return node("Num").put("value", num.getValue());
		}

		@Override
		public JSONObject visit(GallinaPolyNum polyNum) {
			return node("PolyNum").put("value", polyNum.getValue());
		}

		@Override
		public JSONObject visit(GallinaString stringNode) {
			return node("String").put("value", stringNode.getValue());
		}

		@Override
		public JSONObject visit(GallinaHsString hsString) {
			return node("HsString").put("value", hsString.getValue());
		}

		@Override
		public JSONObject visit(GallinaHsChar hsChar) {
			return node("HsChar").put("value", String.valueOf(hsChar.getValue()));
		}

		@Override
		public JSONObject visit(GallinaUnderscore underscore) {
			return node("Underscore");
		}

		@Override
		public JSONObject visit(GallinaParens parens) {
			return node("Parens").put("term", json(parens.getTerm()));
		}

		@Override
		public JSONObject visit(GallinaBang bang) {
			return node("Bang").put("term", json(bang.getTerm()));
		}

		@Override
		public JSONObject visit(GallinaMissingValue missingValue) {
			return node("MissingValue");
		}

	}

	private static class PatternVisitor extends GallinaPatternVisitor<JSONObject, RuntimeException> {

		@Override
		public JSONObject visit(GallinaArgsPattern argsPattern) {
			return node("ArgsPattern")
					.put("constructor", json(argsPattern.getConstructor()))
					.put("arguments", json(argsPattern.getArguments()));
		}

		@Override
		public JSONObject visit(GallinaExplicitArgsPattern explicitArgsPattern) {
			return node("ExplicitArgsPattern")
					.put("constructor", json(explicitArgsPattern.getConstructor()))
					.put("arguments", json(explicitArgsPattern.getArguments()));
		}

		@Override
		public JSONObject visit(GallinaInfixPattern infixPattern) {
			return node("InfixPattern")
					.put("lhs", json(infixPattern.getLhs()))
					.put("operator", infixPattern.getOperator())
					.put("rhs", json(infixPattern.getRhs()));
		}

		@Override
		public JSONObject visit(GallinaAsPattern asPattern) {
			return node("AsPattern").put("pattern", json(asPattern.getPattern())).put("name", asPattern.getName());
		}

		@Override
		public JSONObject visit(GallinaInScopePattern inScopePattern) {
			return node("InScopePattern")
					.put("pattern", json(inScopePattern.getPattern()))
					.put("scope", inScopePattern.getScope());
		}

		@Override
		public JSONObject visit(GallinaQualidPattern qualidPattern) {
			return node("QualidPattern").put("qualid", json(qualidPattern.getQualid()));
		}

		@Override
		public JSONObject visit(GallinaUnderscorePattern underscorePattern) {
			return node("UnderscorePattern");
		}

		@Override
		public JSONObject visit(GallinaNumPattern numPattern) {
			return node("NumPattern").put("value", numPattern.getValue());
		}

		@Override
		public JSONObject visit(GallinaStringPattern stringPattern) {
			return node("StringPattern").put("value", stringPattern.getValue());
		}

		@Override
		public JSONObject visit(GallinaOrPatterns orPatterns) {
			return node("OrPatterns").put("orPatterns", json(orPatterns.getOrPatterns()));
		}

	}

	private static class SentenceVisitor extends GallinaSentenceVisitor<JSONObject, RuntimeException> {

		@Override
		public JSONObject visit(GallinaAssumption assumption) {
			return node("Assumption")
					.put("keyword", assumption.getKeyword().name())
					.put("assums", json(assumption.getAssums()));
		}

		@Override
		public JSONObject visit(GallinaDefinition definition) {
			return node("Definition")
					.put("locality", definition.getLocality().name())
					.put("name", definition.getName())
					.put("binders", json(definition.getBinders()))
					.put("type", json(definition.getType()))
					.put("body", json(definition.getBody()));
		}

		@Override
		public JSONObject visit(GallinaLetDefinition letDefinition) {
			return node("LetDefinition")
					.put("name", letDefinition.getName())
					.put("binders", json(letDefinition.getBinders()))
					.put("type", json(letDefinition.getType()))
					.put("body", json(letDefinition.getBody()));
		}

		@Override
		public JSONObject visit(GallinaInductive inductive) {
			return node("Inductive")
					.put("kind", inductive.getKind().name())
					.put("bodies", json(inductive.getBodies()))
					.put("notations", json(inductive.getNotations()));
		}

		@Override
		public JSONObject visit(GallinaFixpoint fixpoint) {
			return node("Fixpoint")
					.put("bodies", json(fixpoint.getBodies()))
					.put("notations", json(fixpoint.getNotations()));
		}

		@Override
		public JSONObject visit(GallinaCoFixpoint coFixpoint) {
			return node("CoFixpoint")
					.put("bodies", json(coFixpoint.getBodies()))
					.put("notations", json(coFixpoint.getNotations()));
		}

		@Override
		public JSONObject visit(GallinaAssertion assertion) {
			return node("Assertion")
					.put("keyword", assertion.getKeyword().name())
					.put("name", assertion.getName())
					.put("binders", json(assertion.getBinders()))
					.put("type", json(assertion.getType()))
					.put("proof", json(assertion.getProof()));
		}

		@Override
		public JSONObject visit(GallinaClassDefinition classDefinition) {
			return node("ClassDefinition")
					.put("name", classDefinition.getName())
					.put("parameters", json(classDefinition.getParameters()))
					.put("sort", json(classDefinition.getSort()))
					.put("fields", json(classDefinition.getFields()));
		}

		@Override
		public JSONObject visit(GallinaInstanceDefinition instanceDefinition) {
			return node("InstanceDefinition")
					.put("name", instanceDefinition.getName())
					.put("parameters", json(instanceDefinition.getParameters()))
					.put("classType", json(instanceDefinition.getClassType()))
					.put("fields", json(instanceDefinition.getFields()))
					.put("proof", json(instanceDefinition.getProof()));
		}

		@Override
		public JSONObject visit(GallinaReservedNotation reservedNotation) {
			return node("ReservedNotation").put("name", reservedNotation.getName());
		}

		@Override
		public JSONObject visit(GallinaNotation notation) {
			return node("Notation").put("binding", json(notation.getBinding()));
		}

		@Override
		public JSONObject visit(GallinaInfixDefinition infixDefinition) {
			return node("InfixDefinition")
					.put("operator", infixDefinition.getOperator())
					.put("definition", json(infixDefinition.getDefinition()))
					.put("associativity", nullable(infixDefinition.getAssociativity() == null
							? null : infixDefinition.getAssociativity().name()))
					.put("level", infixDefinition.getLevel());
		}

		@Override
		public JSONObject visit(GallinaArguments arguments) {
			return node("Arguments")
					.put("locality", nullable(arguments.getLocality() == null
							? null : arguments.getLocality().name()))
					.put("function", json(arguments.getFunction()))
					.put("specs", json(arguments.getSpecs()));
		}

		@Override
		public JSONObject visit(GallinaComment comment) {
			return node("Comment").put("text", comment.getText());
		}

	}

}
