package hscoq.formatters;

import hscoq.model.gallina.*;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON written by {@link GallinaJSONFormattingVisitor} back into nodes. Documents naming an unknown
 * variant, missing a field, or describing a node that breaks a constructor invariant are rejected.
 */
public class GallinaJSONParser {

	private GallinaJSONParser() {}

	public static GallinaNode fromJSON(JSONObject json) throws GallinaJSONParseException {
		String tag;
		try {
			tag = json.getString("node");
		} catch (JSONException e) {
			throw new GallinaJSONParseException("missing node tag: " + e.getMessage(), e);
		}
		try {
			return read(tag, json);
		} catch (JSONException | IllegalArgumentException e) {
			throw new GallinaJSONParseException("malformed " + tag + ": " + e.getMessage(), e);
		}
	}

	public static GallinaNode fromJSON(String json) throws GallinaJSONParseException {
		try {
			return fromJSON(new JSONObject(json));
		} catch (JSONException e) {
			throw new GallinaJSONParseException("parsing error: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads a node and checks it belongs to the expected category, e.g. {@code GallinaTerm.class}.
	 */
	public static <T extends GallinaNode> T fromJSON(JSONObject json, Class<T> category)
			throws GallinaJSONParseException {
		GallinaNode node = fromJSON(json);
		if (!category.isInstance(node)) {
			throw new GallinaJSONParseException(
					"expected " + category.getSimpleName() + ", found " + json.optString("node"));
		}
		return category.cast(node);
	}

	private static <T extends GallinaNode> T field(JSONObject json, String key, Class<T> category)
			throws GallinaJSONParseException {
		return fromJSON(json.getJSONObject(key), category);
	}

	private static <T extends GallinaNode> T optionalField(JSONObject json, String key, Class<T> category)
			throws GallinaJSONParseException {
		if (json.isNull(key)) {
			return null;
		}
		return field(json, key, category);
	}

	private static <T extends GallinaNode> List<T> list(JSONObject json, String key, Class<T> category)
			throws GallinaJSONParseException {
		JSONArray array = json.getJSONArray(key);
		List<T> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(fromJSON(array.getJSONObject(i), category));
		}
		return result;
	}

	private static List<String> strings(JSONObject json, String key) {
		JSONArray array = json.getJSONArray(key);
		List<String> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(array.getString(i));
		}
		return result;
	}

	private static String optionalString(JSONObject json, String key) {
		return json.isNull(key) ? null : json.getString(key);
	}

	private static GallinaTerm term(JSONObject json, String key) throws GallinaJSONParseException {
		return field(json, key, GallinaTerm.class);
	}

	private static GallinaTerm optionalTerm(JSONObject json, String key) throws GallinaJSONParseException {
		return optionalField(json, key, GallinaTerm.class);
	}

	private static GallinaPattern pattern(JSONObject json, String key) throws GallinaJSONParseException {
		return field(json, key, GallinaPattern.class);
	}

	private static List<GallinaBinder> binders(JSONObject json, String key) throws GallinaJSONParseException {
		return list(json, key, GallinaBinder.class);
	}

	private static BigInteger natural(JSONObject json) {
		return json.getBigInteger("value");
	}

	private static GallinaNode read(String tag, JSONObject json) throws GallinaJSONParseException {
		switch (tag) {
			// arguments
			case "PositionalArg":
				return new GallinaPositionalArg(term(json, "term"));
			case "NamedArg":
				return new GallinaNamedArg(json.getString("name"), term(json, "value"));

			// binders
			case "InferredBinder":
				return new GallinaInferredBinder(
						GallinaBinder.Explicitness.valueOf(json.getString("explicitness")),
						field(json, "name", GallinaName.class));
			case "TypedBinder":
				return new GallinaTypedBinder(
						GallinaBinder.Generalizability.valueOf(json.getString("generalizability")),
						GallinaBinder.Explicitness.valueOf(json.getString("explicitness")),
						list(json, "names", GallinaName.class),
						term(json, "type"));
			case "LetBinder":
				return new GallinaLetBinder(field(json, "name", GallinaName.class), optionalTerm(json, "type"),
						term(json, "value"));
			case "GeneralizedBinder":
				return new GallinaGeneralizedBinder(
						GallinaBinder.Explicitness.valueOf(json.getString("explicitness")), term(json, "term"));

			// names and helper nodes
			case "Name":
				return json.isNull("ident") ? GallinaName.underscore() : GallinaName.ident(json.getString("ident"));
			case "Qualid":
				return qualid(strings(json, "parts"));
			case "FixBodies":
				return new GallinaFixBodies(list(json, "bodies", GallinaFixBody.class), optionalString(json, "for"));
			case "CofixBodies":
				return new GallinaCofixBodies(list(json, "bodies", GallinaCofixBody.class),
						optionalString(json, "for"));
			case "FixBody":
				return new GallinaFixBody(json.getString("name"), binders(json, "binders"),
						optionalString(json, "struct"), optionalTerm(json, "type"), term(json, "body"));
			case "CofixBody":
				return new GallinaCofixBody(json.getString("name"), binders(json, "binders"),
						optionalTerm(json, "type"), term(json, "body"));
			case "MatchItem":
				return new GallinaMatchItem(term(json, "scrutinee"), optionalField(json, "as", GallinaName.class),
						optionalField(json, "in", GallinaInAnnotation.class));
			case "InAnnotation":
				return new GallinaInAnnotation(field(json, "qualid", GallinaQualid.class),
						list(json, "patterns", GallinaPattern.class));
			case "DepRetType":
				return new GallinaDepRetType(optionalField(json, "as", GallinaName.class),
						field(json, "returnType", GallinaReturnType.class));
			case "ReturnType":
				return new GallinaReturnType(term(json, "type"));
			case "Equation":
				return new GallinaEquation(list(json, "patterns", GallinaMultPattern.class), term(json, "body"));
			case "MultPattern":
				return new GallinaMultPattern(list(json, "patterns", GallinaPattern.class));
			case "OrPattern":
				return new GallinaOrPattern(list(json, "alternatives", GallinaPattern.class));
			case "Assums":
				return new GallinaAssums(list(json, "groups", GallinaAssumsGroup.class),
						json.getBoolean("parenthesized"));
			case "AssumsGroup":
				return new GallinaAssumsGroup(strings(json, "names"), term(json, "type"));
			case "InductiveBody":
				return new GallinaInductiveBody(json.getString("name"), binders(json, "parameters"),
						optionalTerm(json, "type"), list(json, "constructors", GallinaConstructor.class));
			case "Constructor":
				return new GallinaConstructor(json.getString("name"), binders(json, "binders"),
						optionalTerm(json, "type"));
			case "Proof":
				return new GallinaProof(GallinaProof.Ending.valueOf(json.getString("ending")),
						json.getString("tactics"));
			case "RecordField":
				return new GallinaRecordField(json.getString("name"), term(json, "value"));
			case "NotationBinding":
				return new GallinaNotationBinding(json.getString("name"), term(json, "value"));
			case "ArgumentSpec":
				return new GallinaArgumentSpec(
						GallinaArgumentSpec.Explicitness.valueOf(json.getString("explicitness")),
						field(json, "name", GallinaName.class), optionalString(json, "scope"));

			// terms
			case "Forall":
				return new GallinaForall(binders(json, "binders"), term(json, "body"));
			case "Fun":
				return new GallinaFun(binders(json, "binders"), term(json, "body"));
			case "Fix":
				return new GallinaFix(field(json, "bodies", GallinaFixBodies.class));
			case "Cofix":
				return new GallinaCofix(field(json, "bodies", GallinaCofixBodies.class));
			case "Let":
				return new GallinaLet(json.getString("name"), binders(json, "binders"), optionalTerm(json, "type"),
						term(json, "value"), term(json, "body"));
			case "LetFix":
				return new GallinaLetFix(field(json, "definition", GallinaFixBody.class), term(json, "body"));
			case "LetCofix":
				return new GallinaLetCofix(field(json, "definition", GallinaCofixBody.class), term(json, "body"));
			case "LetTuple":
				return new GallinaLetTuple(list(json, "names", GallinaName.class),
						optionalField(json, "returnType", GallinaDepRetType.class), term(json, "value"),
						term(json, "body"));
			case "LetTick":
				return new GallinaLetTick(pattern(json, "pattern"), term(json, "value"), term(json, "body"));
			case "LetTickDep":
				return new GallinaLetTickDep(pattern(json, "pattern"),
						optionalField(json, "in", GallinaInAnnotation.class), term(json, "value"),
						field(json, "returnType", GallinaReturnType.class), term(json, "body"));
			case "If":
				return new GallinaIf(term(json, "condition"),
						optionalField(json, "returnType", GallinaDepRetType.class),
						term(json, "then"), term(json, "else"));
			case "HasType":
				return new GallinaHasType(term(json, "term"), term(json, "type"));
			case "CheckType":
				return new GallinaCheckType(term(json, "term"), term(json, "type"));
			case "ToSupportType":
				return new GallinaToSupportType(term(json, "term"));
			case "Arrow":
				return new GallinaArrow(term(json, "domain"), term(json, "codomain"));
			case "App":
				return new GallinaApp(term(json, "function"), list(json, "arguments", GallinaArg.class));
			case "ExplicitApp":
				return new GallinaExplicitApp(field(json, "function", GallinaQualid.class),
						list(json, "arguments", GallinaTerm.class));
			case "Infix":
				return new GallinaInfix(term(json, "lhs"), json.getString("operator"), term(json, "rhs"));
			case "InScope":
				return new GallinaInScope(term(json, "term"), json.getString("scope"));
			case "Match":
				return new GallinaMatch(list(json, "items", GallinaMatchItem.class),
						optionalField(json, "returnType", GallinaReturnType.class),
						list(json, "equations", GallinaEquation.class));
			case "Variable":
				return new GallinaVariable(field(json, "qualid", GallinaQualid.class));
			case "Sort":
				return new GallinaSort(GallinaSort.Kind.valueOf(json.getString("kind")));
			case "Num":
				return new GallinaNum(natural(json));
			case "PolyNum":
				return new GallinaPolyNum(natural(json));
			case "String":
				return new GallinaString(json.getString("value"));
			case "HsString":
				return new GallinaHsString(json.getString("value"));
			case "HsChar":
				return new GallinaHsChar(character(json.getString("value")));
			case "Underscore":
				return new GallinaUnderscore();
			case "Parens":
				return new GallinaParens(term(json, "term"));
			case "Bang":
				return new GallinaBang(term(json, "term"));
			case "MissingValue":
				return new GallinaMissingValue();

			// patterns
			case "ArgsPattern":
				return new GallinaArgsPattern(field(json, "constructor", GallinaQualid.class),
						list(json, "arguments", GallinaPattern.class));
			case "ExplicitArgsPattern":
				return new GallinaExplicitArgsPattern(field(json, "constructor", GallinaQualid.class),
						list(json, "arguments", GallinaPattern.class));
			case "InfixPattern":
				return new GallinaInfixPattern(pattern(json, "lhs"), json.getString("operator"),
						pattern(json, "rhs"));
			case "AsPattern":
				return new GallinaAsPattern(pattern(json, "pattern"), json.getString("name"));
			case "InScopePattern":
				return new GallinaInScopePattern(pattern(json, "pattern"), json.getString("scope"));
			case "QualidPattern":
				return new GallinaQualidPattern(field(json, "qualid", GallinaQualid.class));
			case "UnderscorePattern":
				return new GallinaUnderscorePattern();
			case "NumPattern":
				return new GallinaNumPattern(natural(json));
			case "StringPattern":
				return new GallinaStringPattern(json.getString("value"));
			case "OrPatterns":
				return new GallinaOrPatterns(list(json, "orPatterns", GallinaOrPattern.class));

			// sentences
			case "Assumption":
				return new GallinaAssumption(GallinaAssumption.Keyword.valueOf(json.getString("keyword")),
						field(json, "assums", GallinaAssums.class));
			case "Definition":
				return new GallinaDefinition(GallinaLocality.valueOf(json.getString("locality")),
						json.getString("name"), binders(json, "binders"), optionalTerm(json, "type"),
						term(json, "body"));
			case "LetDefinition":
				return new GallinaLetDefinition(json.getString("name"), binders(json, "binders"),
						optionalTerm(json, "type"), term(json, "body"));
			case "Inductive":
				return new GallinaInductive(GallinaInductive.Kind.valueOf(json.getString("kind")),
						list(json, "bodies", GallinaInductiveBody.class),
						list(json, "notations", GallinaNotationBinding.class));
			case "Fixpoint":
				return new GallinaFixpoint(list(json, "bodies", GallinaFixBody.class),
						list(json, "notations", GallinaNotationBinding.class));
			case "CoFixpoint":
				return new GallinaCoFixpoint(list(json, "bodies", GallinaCofixBody.class),
						list(json, "notations", GallinaNotationBinding.class));
			case "Assertion":
				return new GallinaAssertion(GallinaAssertion.Keyword.valueOf(json.getString("keyword")),
						json.getString("name"), binders(json, "binders"), term(json, "type"),
						field(json, "proof", GallinaProof.class));
			case "ClassDefinition":
				return new GallinaClassDefinition(json.getString("name"), binders(json, "parameters"),
						optionalField(json, "sort", GallinaSort.class),
						list(json, "fields", GallinaRecordField.class));
			case "InstanceDefinition":
				return new GallinaInstanceDefinition(json.getString("name"), binders(json, "parameters"),
						term(json, "classType"), list(json, "fields", GallinaRecordField.class),
						optionalField(json, "proof", GallinaProof.class));
			case "ReservedNotation":
				return new GallinaReservedNotation(json.getString("name"));
			case "Notation":
				return new GallinaNotation(field(json, "binding", GallinaNotationBinding.class));
			case "InfixDefinition": {
				String associativity = optionalString(json, "associativity");
				return new GallinaInfixDefinition(json.getString("operator"), term(json, "definition"),
						associativity == null ? null : GallinaAssociativity.valueOf(associativity),
						json.getInt("level"));
			}
			case "Arguments": {
				String locality = optionalString(json, "locality");
				return new GallinaArguments(locality == null ? null : GallinaLocality.valueOf(locality),
						field(json, "function", GallinaQualid.class),
						list(json, "specs", GallinaArgumentSpec.class));
			}
			case "Comment":
				return new GallinaComment(json.getString("text"));

			default:
				throw new GallinaJSONParseException("unknown node tag " + tag);
		}
	}

	private static GallinaQualid qualid(List<String> parts) {
		if (parts.isEmpty()) {
			throw new IllegalArgumentException("a qualid needs at least one part");
		}
		GallinaQualid result = GallinaQualid.bare(parts.get(0));
		for (String part : parts.subList(1, parts.size())) {
			result = GallinaQualid.qualified(result, part);
		}
		return result;
	}

	private static char character(String value) {
		if (value.length() != 1) {
			throw new IllegalArgumentException("expected a single character, found \"" + value + "\"");
		}
		return value.charAt(0);
	}

}
