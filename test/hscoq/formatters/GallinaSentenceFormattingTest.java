package hscoq.formatters;

import hscoq.model.gallina.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class GallinaSentenceFormattingTest {

	private static String lines(String... lines) {
		return String.join(System.lineSeparator(), lines);
	}

	private static final GallinaTerm a = var("a");

	private static GallinaInductiveBody listBody() {
		return new GallinaInductiveBody("list", binders(typed(TYPE, "a")), TYPE, Arrays.asList(
				new GallinaConstructor("nil", Collections.emptyList(), app("list", a)),
				new GallinaConstructor("cons", Collections.emptyList(),
						arrows(a, app("list", a), app("list", a)))));
	}

	@Test
	public void definition() {
		GallinaSentence def = GallinaBuilder.definition("id", binders(implicitTyped(TYPE, "a"), typed(a, "x")), a, var("x"));
		assertThat(def.toString(), is(lines(
				"Definition id {a : Type} (x : a) : a :=",
				"  x.")));
	}

	@Test
	public void localDefinitionWithoutType() {
		GallinaSentence def = new GallinaDefinition(GallinaLocality.LOCAL, "one", Collections.emptyList(), null,
				num(1));
		assertThat(def.toString(), is(lines(
				"Local Definition one :=",
				"  1.")));
	}

	@Test
	public void letDefinition() {
		GallinaSentence def = new GallinaLetDefinition("two", Collections.emptyList(), var("nat"), num(2));
		assertThat(def.toString(), is(lines(
				"Let two : nat :=",
				"  2.")));
	}

	@Test
	public void definitionBodyKeepsAlignment() {
		GallinaSentence def = GallinaBuilder.definition("f", binders(inferred("x")), null,
				let("y", var("x"), infix(var("y"), "+", num(1))));
		assertThat(def.toString(), is(lines(
				"Definition f x :=",
				"  let y := x in",
				"  y + 1.")));
	}

	@Test
	public void inductive() {
		GallinaSentence ind = new GallinaInductive(GallinaInductive.Kind.INDUCTIVE,
				Collections.singletonList(listBody()), Collections.emptyList());
		assertThat(ind.toString(), is(lines(
				"Inductive list (a : Type) : Type :=",
				"  | nil : list a",
				"  | cons : a -> list a -> list a.")));
	}

	@Test
	public void mutualInductiveWithNotations() {
		GallinaInductiveBody tree = new GallinaInductiveBody("tree", Collections.emptyList(), TYPE,
				Collections.singletonList(new GallinaConstructor("node", binders(typed(var("forest"), "f")), null)));
		GallinaInductiveBody forest = new GallinaInductiveBody("forest", Collections.emptyList(), TYPE,
				Collections.emptyList());
		GallinaSentence ind = new GallinaInductive(GallinaInductive.Kind.COINDUCTIVE, Arrays.asList(tree, forest),
				Arrays.asList(
						new GallinaNotationBinding("t", var("tree")),
						new GallinaNotationBinding("f", var("forest"))));
		assertThat(ind.toString(), is(lines(
				"CoInductive tree : Type :=",
				"  | node (f : forest)",
				"with forest : Type :=",
				"where \"'t'\" := (tree)",
				"and \"'f'\" := (forest).")));
	}

	@Test
	public void fixpoint() {
		GallinaFixBody length = new GallinaFixBody("length",
				binders(implicitTyped(TYPE, "a"), typed(app("list", a), "xs")), "xs", var("nat"),
				match(var("xs"),
						equation(pvar("nil"), num(0)),
						equation(pargs("cons", pwild(), pvar("ys")), infix(num(1), "+", app("length", var("ys"))))));
		GallinaSentence fix = new GallinaFixpoint(Collections.singletonList(length), Collections.emptyList());
		assertThat(fix.toString(), is(lines(
				"Fixpoint length {a : Type} (xs : list a) {struct xs} : nat :=",
				"  match xs with",
				"  | nil => 0",
				"  | cons _ ys => 1 + length ys",
				"  end.")));
	}

	@Test
	public void mutualFixpoint() {
		GallinaFixBody even = new GallinaFixBody("even", binders(inferred("n")), null, null,
				app("odd", var("n")));
		GallinaFixBody odd = new GallinaFixBody("odd", binders(inferred("n")), null, null,
				app("even", var("n")));
		GallinaSentence fix = new GallinaFixpoint(Arrays.asList(even, odd), Collections.emptyList());
		assertThat(fix.toString(), is(lines(
				"Fixpoint even n :=",
				"  odd n",
				"with odd n :=",
				"  even n.")));
	}

	@Test
	public void assertion() {
		GallinaSentence thm = new GallinaAssertion(GallinaAssertion.Keyword.THEOREM, "trivial",
				Collections.emptyList(), var("True"),
				new GallinaProof(GallinaProof.Ending.QED, "exact I."));
		assertThat(thm.toString(), is(lines(
				"Theorem trivial : True.",
				"Proof.",
				"  exact I.",
				"Qed.")));
	}

	@Test
	public void assumptions() {
		GallinaSentence single = new GallinaAssumption(GallinaAssumption.Keyword.AXIOM, new GallinaAssums(
				Collections.singletonList(new GallinaAssumsGroup(Arrays.asList("x", "y"), var("nat"))), false));
		GallinaSentence grouped = new GallinaAssumption(GallinaAssumption.Keyword.AXIOMS, new GallinaAssums(
				Arrays.asList(
						new GallinaAssumsGroup(Collections.singletonList("x"), var("nat")),
						new GallinaAssumsGroup(Collections.singletonList("y"), var("bool"))), true));
		assertThat(single.toString(), is("Axiom x y : nat."));
		assertThat(grouped.toString(), is("Axioms (x : nat) (y : bool)."));
	}

	@Test
	public void classDefinition() {
		GallinaTerm sig = arrows(a, a, var("bool"));
		GallinaSentence cls = new GallinaClassDefinition("Eq_", binders(typed(TYPE, "a")), null,
				Arrays.asList(field("op_zeze__", sig), field("op_zsze__", sig)));
		assertThat(cls.toString(), is(lines(
				"Class Eq_ (a : Type) := {",
				"  op_zeze__ : a -> a -> bool ;",
				"  op_zsze__ : a -> a -> bool }.")));
	}

	@Test
	public void emptyClassWithSort() {
		GallinaSentence cls = new GallinaClassDefinition("Trivial", Collections.emptyList(), PROP,
				Collections.emptyList());
		assertThat(cls.toString(), is("Class Trivial : Prop := {}."));
	}

	@Test
	public void instanceDefinition() {
		GallinaSentence inst = new GallinaInstanceDefinition("Eq_nat", Collections.emptyList(),
				app("Eq_", var("nat")), Collections.singletonList(field("op_zeze__", qualifiedVar("Nat.eqb"))),
				null);
		assertThat(inst.toString(), is(lines(
				"Instance Eq_nat : !Eq_ nat := {",
				"  op_zeze__ := Nat.eqb }.")));
	}

	@Test
	public void instanceWithProof() {
		GallinaSentence inst = new GallinaInstanceDefinition("Default_unit", Collections.emptyList(),
				new GallinaBang(app("Default", var("unit"))), Collections.emptyList(),
				new GallinaProof(GallinaProof.Ending.DEFINED, "constructor."));
		assertThat(inst.toString(), is(lines(
				"Instance Default_unit : !Default unit := {}.",
				"Proof.",
				"  constructor.",
				"Defined.")));
	}

	@Test
	public void notations() {
		assertThat(new GallinaReservedNotation("x").toString(), is("Reserved Notation \"'x'\"."));
		assertThat(new GallinaNotation(new GallinaNotationBinding("_==_", var("op_zeze__"))).toString(),
				is("Notation \"'_==_'\" := (op_zeze__)."));
		assertThat(new GallinaInfixDefinition("==", var("op_zeze__"), null, 99).toString(),
				is("Infix \"==\" := (op_zeze__) (at level 99)."));
		assertThat(new GallinaInfixDefinition("+", var("plus"), GallinaAssociativity.LEFT, 50).toString(),
				is("Infix \"+\" := (plus) (left associativity, at level 50)."));
		assertThat(new GallinaInfixDefinition("==>", var("impl"), GallinaAssociativity.NONE, 90).toString(),
				is("Infix \"==>\" := (impl) (no associativity, at level 90)."));
	}

	@Test
	public void arguments() {
		GallinaSentence args = new GallinaArguments(null, qualid("pair"), Arrays.asList(
				new GallinaArgumentSpec(GallinaArgumentSpec.Explicitness.MAXIMAL, name("A"), null),
				new GallinaArgumentSpec(GallinaArgumentSpec.Explicitness.IMPLICIT, name("B"), null),
				new GallinaArgumentSpec(GallinaArgumentSpec.Explicitness.EXPLICIT, name("x"), "type")));
		assertThat(args.toString(), is("Arguments pair {A} [B] x%type."));
		GallinaSentence global = new GallinaArguments(GallinaLocality.GLOBAL, qualid("id"), Collections.emptyList());
		assertThat(global.toString(), is("Global Arguments id."));
	}

	@Test
	public void comment() {
		assertThat(new GallinaComment("a *) b").toString(), is("(* a * ) b *)"));
	}

	@Test
	public void renderSentences() {
		String text = GallinaFormatting.renderSentences(Arrays.asList(
				GallinaBuilder.definition("a", Collections.emptyList(), null, num(1)),
				GallinaBuilder.definition("b", Collections.emptyList(), null, num(2))));
		assertThat(text, is(lines(
				"Definition a :=",
				"  1.",
				"",
				"Definition b :=",
				"  2.",
				"")));
	}

}
