package hscoq.formatters;

import hscoq.model.gallina.*;
import org.json.JSONObject;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class GallinaJSONParserTest {

	private static final GallinaTerm x = var("x");
	private static final GallinaTerm nat = var("nat");

	private static final GallinaFixBody fixBody = new GallinaFixBody("f", binders(inferred("n")), "n", nat,
			app("f", x));
	private static final GallinaCofixBody cofixBody = new GallinaCofixBody("g", binders(inferred("n")), null,
			app("g", x));
	private static final GallinaInAnnotation inAnnotation = new GallinaInAnnotation(qualid("list"),
			Collections.singletonList(pwild()));
	private static final GallinaOrPattern orPattern = new GallinaOrPattern(Arrays.asList(pvar("O"), pwild()));

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// terms
				{forall(binders(typed(TYPE, "a")), arrow(var("a"), var("a")))},
				{fun(binders(inferred("y")), x)},
				{new GallinaFix(new GallinaFixBodies(fixBody))},
				{new GallinaCofix(new GallinaCofixBodies(Arrays.asList(cofixBody,
						new GallinaCofixBody("h", Collections.emptyList(), nat, var("g"))), "g"))},
				{new GallinaLet("y", binders(inferred("z")), nat, x, var("y"))},
				{new GallinaLetFix(fixBody, var("f"))},
				{new GallinaLetCofix(cofixBody, var("g"))},
				{new GallinaLetTuple(Arrays.asList(name("a"), GallinaName.underscore()),
						new GallinaDepRetType(name("p"), new GallinaReturnType(nat)), x, var("a"))},
				{new GallinaLetTick(pargs("pair", pvar("a"), pvar("b")), x, var("a"))},
				{new GallinaLetTickDep(pvar("a"), inAnnotation, x, new GallinaReturnType(nat), var("a"))},
				{new GallinaIf(var("b"), null, num(1), num(0))},
				{new GallinaHasType(x, nat)},
				{new GallinaCheckType(x, nat)},
				{new GallinaToSupportType(x)},
				{new GallinaExplicitApp(qualid("f"), Arrays.asList(x, UNDERSCORE))},
				{new GallinaApp(var("f"), Arrays.asList(new GallinaPositionalArg(x), new GallinaNamedArg("n", num(2))))},
				{infix(x, "+", infix(var("y"), "*", var("z")))},
				{scope(num(1), "Z")},
				{new GallinaMatch(Collections.singletonList(new GallinaMatchItem(x, name("y"), inAnnotation)),
						new GallinaReturnType(nat),
						Collections.singletonList(new GallinaEquation(
								Collections.singletonList(new GallinaMultPattern(Collections.singletonList(
										new GallinaOrPatterns(Collections.singletonList(orPattern))))),
								num(0))))},
				{qualifiedVar("GHC.Base.map")},
				{PROP},
				{num(10)},
				{new GallinaPolyNum(BigInteger.valueOf(42))},
				{str("say \"hi\"")},
				{new GallinaHsString("abc")},
				{new GallinaHsChar('c')},
				{new GallinaParens(x)},
				{new GallinaBang(app("Eq", nat))},
				{new GallinaMissingValue()},
				{UNDERSCORE},
				{name("x")},
				{GallinaName.underscore()},
				{GallinaQualid.parse("Data.Maybe.Maybe")},

				// binders and patterns
				{new GallinaFun(Arrays.asList(
						implicitInferred("a"),
						new GallinaTypedBinder(GallinaBinder.Generalizability.GENERALIZABLE,
								GallinaBinder.Explicitness.IMPLICIT, names("b", "c"), TYPE),
						new GallinaLetBinder(name("d"), null, num(1)),
						new GallinaLetBinder(name("e"), nat, num(2)),
						generalized(GallinaBinder.Explicitness.IMPLICIT, app("Eq", var("a")))), x)},
				{new GallinaLetTick(new GallinaAsPattern(
						new GallinaExplicitArgsPattern(qualid("S"), Collections.singletonList(pwild())), "m"), x, x)},
				{new GallinaLetTick(new GallinaInScopePattern(pinfix(pvar("a"), "::", pvar("b")), "list"), x, x)},
				{new GallinaLetTick(new GallinaNumPattern(BigInteger.ONE), x, x)},
				{new GallinaLetTick(new GallinaStringPattern("s"), x, x)},

				// sentences
				{new GallinaAssumption(GallinaAssumption.Keyword.AXIOM, new GallinaAssums(
						Collections.singletonList(new GallinaAssumsGroup(Arrays.asList("a", "b"), nat)), false))},
				{new GallinaDefinition(GallinaLocality.LOCAL, "x", Collections.emptyList(), null, num(1))},
				{new GallinaLetDefinition("y", binders(inferred("z")), nat, var("z"))},
				{new GallinaInductive(GallinaInductive.Kind.INDUCTIVE,
						Collections.singletonList(new GallinaInductiveBody("list", binders(typed(TYPE, "a")), TYPE,
								Arrays.asList(
										new GallinaConstructor("nil", Collections.emptyList(), null),
										new GallinaConstructor("cons", binders(typed(var("a"), "h")),
												app("list", var("a")))))),
						Collections.singletonList(new GallinaNotationBinding("x :: y", app("cons", x, var("y")))))},
				{new GallinaFixpoint(Collections.singletonList(fixBody), Collections.emptyList())},
				{new GallinaCoFixpoint(Collections.singletonList(cofixBody), Collections.emptyList())},
				{new GallinaAssertion(GallinaAssertion.Keyword.LEMMA, "l", Collections.emptyList(), PROP,
						new GallinaProof(GallinaProof.Ending.QED, "trivial."))},
				{new GallinaClassDefinition("Eq", binders(typed(TYPE, "a")), PROP,
						Collections.singletonList(field("eqb", arrow(var("a"), var("a")))))},
				{new GallinaInstanceDefinition("Eq_nat", Collections.emptyList(), app("Eq", nat),
						Collections.singletonList(field("eqb", qualifiedVar("Nat.eqb"))),
						new GallinaProof(GallinaProof.Ending.ADMITTED, ""))},
				{new GallinaReservedNotation("x == y")},
				{new GallinaNotation(new GallinaNotationBinding("_==_", var("op_zeze__")))},
				{new GallinaInfixDefinition("==", var("op_zeze__"), null, 99)},
				{new GallinaInfixDefinition("++", var("app"), GallinaAssociativity.RIGHT, 60)},
				{new GallinaArguments(GallinaLocality.GLOBAL, qualid("pair"), Arrays.asList(
						new GallinaArgumentSpec(GallinaArgumentSpec.Explicitness.MAXIMAL, name("a"), null),
						new GallinaArgumentSpec(GallinaArgumentSpec.Explicitness.EXPLICIT,
								GallinaName.underscore(), "type")))},
				{new GallinaArguments(null, qualid("id"), Collections.emptyList())},
				{new GallinaComment("converted from GHC.Base")},
		});
	}

	private final GallinaNode node;

	public GallinaJSONParserTest(GallinaNode node) {
		this.node = node;
	}

	@Test
	public void test() throws GallinaJSONParseException {
		JSONObject json = GallinaJSONFormattingVisitor.toJSON(node);
		GallinaNode rebuilt = GallinaJSONParser.fromJSON(json);
		assertThat(rebuilt, is(node));
		assertThat(rebuilt.toString(), is(node.toString()));
		assertThat(new GallinaNodeOrdering().compare(rebuilt, node), is(0));

		// the text form goes through the same path
		assertThat(GallinaJSONParser.fromJSON(json.toString()), is(node));
	}

}
