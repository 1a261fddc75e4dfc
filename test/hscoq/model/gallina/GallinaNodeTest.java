package hscoq.model.gallina;

import hscoq.formatters.GallinaJSONFormattingVisitor;
import hscoq.formatters.GallinaJSONParseException;
import hscoq.formatters.GallinaJSONParser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class GallinaNodeTest {

	@Test(expected = IllegalArgumentException.class)
	public void forallRequiresBinders() {
		new GallinaForall(Collections.emptyList(), var("x"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void funRequiresBinders() {
		new GallinaFun(Collections.emptyList(), var("x"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void appRequiresArguments() {
		new GallinaApp(var("f"), Collections.emptyList());
	}

	@Test(expected = IllegalArgumentException.class)
	public void typedBinderRequiresNames() {
		new GallinaTypedBinder(GallinaBinder.Generalizability.UNGENERALIZABLE, GallinaBinder.Explicitness.EXPLICIT,
				Collections.emptyList(), TYPE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void matchRequiresScrutinee() {
		new GallinaMatch(Collections.emptyList(), null, Collections.emptyList());
	}

	@Test(expected = IllegalArgumentException.class)
	public void fixpointRequiresBodies() {
		new GallinaFixpoint(Collections.emptyList(), Collections.emptyList());
	}

	@Test(expected = IllegalArgumentException.class)
	public void mutualFixRequiresForIdentifier() {
		GallinaFixBody f = new GallinaFixBody("f", binders(inferred("n")), null, null, var("n"));
		GallinaFixBody g = new GallinaFixBody("g", binders(inferred("n")), null, null, var("n"));
		new GallinaFixBodies(Arrays.asList(f, g), null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void numbersAreNatural() {
		new GallinaNum(-1);
	}

	@Test
	public void mutualFixWithForIdentifier() {
		GallinaFixBody f = new GallinaFixBody("f", binders(inferred("n")), null, null, app("g", var("n")));
		GallinaFixBody g = new GallinaFixBody("g", binders(inferred("n")), null, null, app("f", var("n")));
		GallinaTerm fix = new GallinaFix(new GallinaFixBodies(Arrays.asList(f, g), "f"));
		assertThat(fix.toString(), is("fix f n := g n with g n := f n for f"));
	}

	@Test
	public void listsAreCopied() {
		List<GallinaBinder> binders = new ArrayList<>();
		binders.add(inferred("x"));
		GallinaFun fun = fun(binders, var("x"));
		binders.add(inferred("y"));
		assertThat(fun.getBinders().size(), is(1));
	}

	@Test
	public void structuralEquality() {
		GallinaTerm a = infix(app("f", var("x")), "+", num(1));
		GallinaTerm b = infix(app("f", var("x")), "+", num(1));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, infix(app("f", var("x")), "-", num(1)));
		assertEquals(new GallinaUnderscore(), UNDERSCORE);
		assertEquals(GallinaName.underscore(), GallinaName.underscore());
		assertNotEquals(GallinaName.underscore(), name("_"));
		assertEquals(GallinaQualid.parse("A.b"), GallinaQualid.qualified(GallinaQualid.bare("A"), "b"));
	}

	@Test
	public void qualidParts() {
		GallinaQualid q = GallinaQualid.parse("GHC.Base.map");
		assertThat(q.getParts(), is(Arrays.asList("GHC", "Base", "map")));
		assertThat(q.getIdent(), is("map"));
		assertFalse(q.isBare());
		assertTrue(q.getQualifier().getQualifier().isBare());
	}

	@Test
	public void jsonSerialization() {
		JSONObject json = GallinaJSONFormattingVisitor.toJSON(app("f", num(1)));
		assertThat(json.getString("node"), is("App"));
		assertThat(json.getJSONObject("function").getString("node"), is("Variable"));
		JSONObject arg = json.getJSONArray("arguments").getJSONObject(0);
		assertThat(arg.getString("node"), is("PositionalArg"));
		assertThat(arg.getJSONObject("term").getBigInteger("value"), is(BigInteger.ONE));
		JSONObject definition = GallinaJSONFormattingVisitor.toJSON(
				definition("x", Collections.emptyList(), null, num(1)));
		assertTrue(definition.isNull("type"));
		assertThat(definition.getString("locality"), is("GLOBAL"));
	}

	@Test
	public void orderingIsConsistentWithEquals() {
		GallinaNodeOrdering ordering = new GallinaNodeOrdering();
		GallinaTerm a = app("f", var("x"));
		GallinaTerm b = app("f", var("y"));
		assertThat(ordering.compare(a, app("f", var("x"))), is(0));
		assertThat(Integer.signum(ordering.compare(a, b)), is(-Integer.signum(ordering.compare(b, a))));
		assertNotEquals(0, ordering.compare(a, b));

		List<GallinaNode> nodes = new ArrayList<>(Arrays.asList(b, num(1), a, var("z")));
		List<GallinaNode> reversed = new ArrayList<>(nodes);
		Collections.reverse(reversed);
		nodes.sort(ordering);
		reversed.sort(ordering);
		assertThat(nodes, is(reversed));
	}

	@Test
	public void orderingIsStructural() {
		GallinaNodeOrdering ordering = new GallinaNodeOrdering();
		assertTrue(ordering.compare(num(9), num(10)) < 0);
		assertTrue(ordering.compare(num(10), num(9)) > 0);
		assertTrue(ordering.compare(app("f", var("x")), app("f", var("y"))) < 0);
		assertTrue(ordering.compare(app("f", var("x")), app("f", var("x"), var("y"))) < 0);
		// variants order by name
		assertTrue(ordering.compare(app("f", num(1)), num(0)) < 0);
		// an absent optional field comes first
		assertTrue(ordering.compare(definition("x", Collections.emptyList(), null, num(1)),
				definition("x", Collections.emptyList(), var("nat"), num(1))) < 0);
	}

	@Test
	public void readsSerializedNodes() throws GallinaJSONParseException {
		GallinaTerm term = app("f", num(1), str("a"));
		assertThat(GallinaJSONParser.fromJSON(GallinaJSONFormattingVisitor.toJSON(term)), is(term));
		assertThat(GallinaJSONParser.fromJSON(GallinaJSONFormattingVisitor.toJSON(term).toString()), is(term));
		assertThat(GallinaJSONParser.fromJSON(GallinaJSONFormattingVisitor.toJSON(term), GallinaTerm.class),
				is(term));
	}

	@Test(expected = GallinaJSONParseException.class)
	public void rejectsUnknownTag() throws GallinaJSONParseException {
		GallinaJSONParser.fromJSON(new JSONObject().put("node", "Lambda"));
	}

	@Test(expected = GallinaJSONParseException.class)
	public void rejectsMissingTag() throws GallinaJSONParseException {
		GallinaJSONParser.fromJSON(new JSONObject().put("value", 1));
	}

	@Test
	public void rejectsWrongCategory() {
		try {
			GallinaJSONParser.fromJSON(GallinaJSONFormattingVisitor.toJSON(pwild()), GallinaTerm.class);
			fail("expected GallinaJSONParseException");
		} catch (GallinaJSONParseException e) {
			assertThat(e.getMessage(), is("expected GallinaTerm, found UnderscorePattern"));
		}
	}

	@Test
	public void rejectsBrokenInvariants() {
		JSONObject json = GallinaJSONFormattingVisitor.toJSON(app("f", var("x")));
		json.put("arguments", new JSONArray());
		try {
			GallinaJSONParser.fromJSON(json);
			fail("expected GallinaJSONParseException");
		} catch (GallinaJSONParseException e) {
			assertThat(e.getMessage(), startsWith("malformed App: "));
		}
	}

	@Test(expected = GallinaJSONParseException.class)
	public void rejectsMissingField() throws GallinaJSONParseException {
		JSONObject json = GallinaJSONFormattingVisitor.toJSON(infix(var("x"), "+", var("y")));
		json.remove("rhs");
		GallinaJSONParser.fromJSON(json);
	}

	@Test(expected = GallinaJSONParseException.class)
	public void rejectsMalformedDocument() throws GallinaJSONParseException {
		GallinaJSONParser.fromJSON("{\"node\": ");
	}

	@Test
	public void signatureFixity() {
		GallinaSignature plain = new GallinaSignature(arrow(var("a"), var("a")));
		GallinaSignature op = new GallinaSignature(var("a"), GallinaAssociativity.LEFT, 50);
		assertFalse(plain.hasFixity());
		assertTrue(op.hasFixity());
		assertThat(op.getLevel(), is(50));
		assertThat(plain.toString(), is("a -> a"));
	}

}
