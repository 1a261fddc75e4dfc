package hscoq.model.gallina;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class GallinaBuilder {
	private GallinaBuilder() {}

	public static final GallinaSort TYPE = new GallinaSort(GallinaSort.Kind.TYPE);
	public static final GallinaSort PROP = new GallinaSort(GallinaSort.Kind.PROP);
	public static final GallinaUnderscore UNDERSCORE = new GallinaUnderscore();

	// names

	public static GallinaName name(String ident) {
		return GallinaName.ident(ident);
	}

	public static List<GallinaName> names(String... idents) {
		List<GallinaName> result = new ArrayList<>();
		for (String ident : idents) {
			result.add(name(ident));
		}
		return result;
	}

	public static GallinaQualid qualid(String ident) {
		return GallinaQualid.bare(ident);
	}

	// terms

	public static GallinaVariable var(String ident) {
		return new GallinaVariable(qualid(ident));
	}

	public static GallinaVariable qualifiedVar(String dotted) {
		return new GallinaVariable(GallinaQualid.parse(dotted));
	}

	public static GallinaApp app(GallinaTerm function, GallinaTerm... arguments) {
		List<GallinaArg> args = new ArrayList<>();
		for (GallinaTerm argument : arguments) {
			args.add(new GallinaPositionalArg(argument));
		}
		return new GallinaApp(function, args);
	}

	public static GallinaApp app(String function, GallinaTerm... arguments) {
		return app(var(function), arguments);
	}

	public static GallinaInfix infix(GallinaTerm lhs, String operator, GallinaTerm rhs) {
		return new GallinaInfix(lhs, operator, rhs);
	}

	public static GallinaArrow arrow(GallinaTerm domain, GallinaTerm codomain) {
		return new GallinaArrow(domain, codomain);
	}

	/**
	 * Builds the right-nested arrow {@code t1 -> t2 -> ... -> tn}.
	 */
	public static GallinaTerm arrows(GallinaTerm... types) {
		GallinaTerm result = types[types.length - 1];
		for (int i = types.length - 2; i >= 0; --i) {
			result = arrow(types[i], result);
		}
		return result;
	}

	public static GallinaForall forall(List<GallinaBinder> binders, GallinaTerm body) {
		return new GallinaForall(binders, body);
	}

	public static GallinaFun fun(List<GallinaBinder> binders, GallinaTerm body) {
		return new GallinaFun(binders, body);
	}

	public static GallinaNum num(long value) {
		return new GallinaNum(value);
	}

	public static GallinaString str(String value) {
		return new GallinaString(value);
	}

	public static GallinaInScope scope(GallinaTerm term, String scope) {
		return new GallinaInScope(term, scope);
	}

	public static GallinaIf ifThenElse(GallinaTerm condition, GallinaTerm thenBranch, GallinaTerm elseBranch) {
		return new GallinaIf(condition, null, thenBranch, elseBranch);
	}

	public static GallinaLet let(String name, GallinaTerm value, GallinaTerm body) {
		return new GallinaLet(name, Collections.emptyList(), null, value, body);
	}

	public static GallinaMatch match(GallinaTerm scrutinee, GallinaEquation... equations) {
		return new GallinaMatch(
				Collections.singletonList(new GallinaMatchItem(scrutinee, null, null)),
				null,
				Arrays.asList(equations));
	}

	public static GallinaEquation equation(GallinaPattern pattern, GallinaTerm body) {
		return new GallinaEquation(
				Collections.singletonList(new GallinaMultPattern(Collections.singletonList(pattern))), body);
	}

	// binders

	public static List<GallinaBinder> binders(GallinaBinder... binders) {
		return Arrays.asList(binders);
	}

	public static GallinaInferredBinder inferred(String name) {
		return new GallinaInferredBinder(GallinaBinder.Explicitness.EXPLICIT, name(name));
	}

	public static GallinaInferredBinder implicitInferred(String name) {
		return new GallinaInferredBinder(GallinaBinder.Explicitness.IMPLICIT, name(name));
	}

	public static GallinaTypedBinder typed(GallinaTerm type, String... names) {
		return new GallinaTypedBinder(GallinaBinder.Generalizability.UNGENERALIZABLE,
				GallinaBinder.Explicitness.EXPLICIT, names(names), type);
	}

	public static GallinaTypedBinder implicitTyped(GallinaTerm type, String... names) {
		return new GallinaTypedBinder(GallinaBinder.Generalizability.UNGENERALIZABLE,
				GallinaBinder.Explicitness.IMPLICIT, names(names), type);
	}

	public static GallinaGeneralizedBinder generalized(GallinaBinder.Explicitness explicitness, GallinaTerm term) {
		return new GallinaGeneralizedBinder(explicitness, term);
	}

	// patterns

	public static GallinaQualidPattern pvar(String ident) {
		return new GallinaQualidPattern(qualid(ident));
	}

	public static GallinaArgsPattern pargs(String constructor, GallinaPattern... arguments) {
		return new GallinaArgsPattern(qualid(constructor), Arrays.asList(arguments));
	}

	public static GallinaInfixPattern pinfix(GallinaPattern lhs, String operator, GallinaPattern rhs) {
		return new GallinaInfixPattern(lhs, operator, rhs);
	}

	public static GallinaUnderscorePattern pwild() {
		return new GallinaUnderscorePattern();
	}

	// sentences

	public static GallinaDefinition definition(String name, List<GallinaBinder> binders, GallinaTerm type,
											   GallinaTerm body) {
		return new GallinaDefinition(GallinaLocality.GLOBAL, name, binders, type, body);
	}

	public static GallinaRecordField field(String name, GallinaTerm value) {
		return new GallinaRecordField(name, value);
	}

}
