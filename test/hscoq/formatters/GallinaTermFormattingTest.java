package hscoq.formatters;

import hscoq.model.gallina.*;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class GallinaTermFormattingTest {

	private static final GallinaTerm x = var("x");
	private static final GallinaTerm y = var("y");
	private static final GallinaTerm z = var("z");
	private static final GallinaTerm f = var("f");

	private static String lines(String... lines) {
		return String.join(System.lineSeparator(), lines);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				// tighter operators on either side need no parentheses
				{infix(x, "+", infix(y, "*", z)), "x + y * z"},
				{infix(infix(x, "*", y), "+", z), "x * y + z"},
				{infix(infix(x, "+", y), "*", z), "(x + y) * z"},
				{infix(x, "*", infix(y, "+", z)), "x * (y + z)"},

				// associativity
				{infix(infix(x, "-", y), "-", z), "x - y - z"},
				{infix(x, "-", infix(y, "-", z)), "x - (y - z)"},
				{infix(x, "::", infix(y, "::", z)), "x :: y :: z"},
				{infix(infix(x, "::", y), "::", z), "(x :: y) :: z"},
				{infix(x, "^", infix(y, "^", z)), "x ^ y ^ z"},
				{infix(infix(x, "=", y), "=", z), "(x = y) = z"},
				{infix(x, "=", infix(y, "=", z)), "x = (y = z)"},
				{infix(infix(x, "/\\", y), "\\/", z), "x /\\ y \\/ z"},
				{infix(x, "/\\", infix(y, "\\/", z)), "x /\\ (y \\/ z)"},
				{infix(infix(x, "<", y), "&&", z), "(x < y) && z"},

				// operators outside the table are always parenthesized
				{infix(x, "<$>", y), "(x <$> y)"},
				{infix(app(f, x), "<$>", y), "((f x) <$> y)"},
				{infix(infix(x, "<$>", y), "+", z), "(x <$> y) + z"},

				// application
				{app(f, x, y), "f x y"},
				{app(app(f, x), y), "f x y"},
				{app(f, app(var("g"), x), y), "f (g x) y"},
				{app(f, infix(x, "+", y)), "f (x + y)"},
				{infix(app(f, x), "+", app(f, y)), "f x + f y"},
				{new GallinaApp(f, Collections.singletonList(new GallinaNamedArg("A", var("nat")))),
						"f (A := nat)"},
				{new GallinaExplicitApp(qualid("f"), Arrays.asList(x, app(var("g"), y))), "@f x (g y)"},
				{new GallinaExplicitApp(qualid("f"), Collections.emptyList()), "@f"},
				{app(var("map"), new GallinaExplicitApp(qualid("f"), Collections.singletonList(x))),
						"map (@f x)"},
				{qualifiedVar("GHC.Base.map"), "GHC.Base.map"},

				// arrows
				{arrows(x, y, z), "x -> y -> z"},
				{arrow(arrow(x, y), z), "(x -> y) -> z"},
				{app(f, arrow(x, y)), "f (x -> y)"},
				{arrow(app(var("list"), x), var("nat")), "list x -> nat"},
				{arrow(x, forall(binders(inferred("a")), var("a"))), "x -> forall a, a"},
				{arrow(forall(binders(inferred("a")), var("a")), x), "(forall a, a) -> x"},

				// binding forms
				{forall(binders(typed(TYPE, "a")), arrow(var("a"), var("a"))), "forall (a : Type), a -> a"},
				{forall(binders(implicitTyped(TYPE, "a", "b"), inferred("x")), PROP),
						"forall {a b : Type} x, Prop"},
				{fun(binders(inferred("x")), infix(x, "+", num(1))), "fun x => x + 1"},
				{app(f, fun(binders(inferred("x")), x)), "f (fun x => x)"},
				{infix(fun(binders(inferred("x")), x), "+", y), "(fun x => x) + y"},
				{fun(binders(new GallinaInferredBinder(GallinaBinder.Explicitness.EXPLICIT,
						GallinaName.underscore())), x), "fun _ => x"},
				{ifThenElse(var("b"), x, y), "if b then x else y"},
				{infix(x, "+", ifThenElse(var("b"), x, y)), "x + (if b then x else y)"},
				{new GallinaFix(new GallinaFixBodies(new GallinaFixBody("go", binders(inferred("n")), "n", null,
						app(var("go"), var("n"))))), "fix go n {struct n} := go n"},

				// casts
				{new GallinaHasType(x, var("nat")), "(x : nat)"},
				{new GallinaHasType(infix(x, "+", y), var("nat")), "(x + y : nat)"},
				{new GallinaCheckType(x, var("nat")), "(x <: nat)"},
				{new GallinaToSupportType(x), "(x :>)"},

				// scopes
				{scope(infix(x, "+", y), "Z"), "(x + y)%Z"},
				{app(f, scope(x, "Z")), "f x%Z"},
				{infix(scope(x, "Z"), "+", y), "x%Z + y"},

				// literals and markers
				{num(42), "42"},
				{new GallinaPolyNum(BigInteger.valueOf(3)), "#3"},
				{str("say \"hi\""), "\"say \"\"hi\"\"\""},
				{new GallinaHsString("abc"), "&\"abc\""},
				{new GallinaHsChar('c'), "&#\"c\""},
				{new GallinaHsChar('"'), "&#\"\"\"\""},
				{UNDERSCORE, "_"},
				{new GallinaMissingValue(), "patternFailure"},
				{new GallinaParens(x), "(x)"},
				{new GallinaBang(app(var("Eq"), var("a"))), "!Eq a"},
				{app(f, new GallinaBang(x)), "f (!x)"},

				// layout
				{let("x", num(1), infix(x, "+", x)), lines("let x := 1 in", "x + x")},
				{app(f, let("x", num(1), x)), lines("f (let x := 1 in", "   x)")},
				{match(x, equation(pargs("S", pvar("n")), var("n")), equation(pvar("O"), num(0))),
						lines("match x with", "| S n => n", "| O => 0", "end")},
				{new GallinaMatch(
						Collections.singletonList(new GallinaMatchItem(x, null, null)),
						null, Collections.emptyList()), "match x with end"},
				{new GallinaMatch(
						Arrays.asList(new GallinaMatchItem(x, null, null), new GallinaMatchItem(y, null, null)),
						new GallinaReturnType(var("nat")),
						Collections.singletonList(new GallinaEquation(
								Collections.singletonList(new GallinaMultPattern(Arrays.asList(pwild(), pwild()))),
								num(0)))),
						lines("match x, y return nat with", "| _, _ => 0", "end")},
		});
	}

	private final GallinaTerm term;
	private final String expected;

	public GallinaTermFormattingTest(GallinaTerm term, String expected) {
		this.term = term;
		this.expected = expected;
	}

	@Test
	public void test() throws GallinaJSONParseException {
		assertThat(GallinaFormatting.render(term, GallinaPrecedence.TOP), is(expected));
		assertThat(term.toString(), is(expected));

		GallinaTerm rebuilt = GallinaJSONParser.fromJSON(GallinaJSONFormattingVisitor.toJSON(term), GallinaTerm.class);
		assertThat(rebuilt, is(term));
		assertThat(GallinaFormatting.render(rebuilt, GallinaPrecedence.TOP), is(expected));
	}

}
