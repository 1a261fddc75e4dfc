package hscoq.trans;

import hscoq.model.gallina.*;
import org.junit.Before;
import org.junit.Test;

import java.util.*;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ClassConversionTest {

	private static final GallinaTerm a = var("a");

	private ConversionState state;

	@Before
	public void setup() {
		state = new ConversionState();
	}

	private static HsClassDeclaration eqClass(List<HsClassDeclaration.DefaultMethod> defaults,
											  Set<HsClassDeclaration.Feature> features) {
		Map<String, GallinaSignature> signatures = new LinkedHashMap<>();
		signatures.put("==", new GallinaSignature(arrows(a, a, var("bool")), GallinaAssociativity.NONE, 70));
		signatures.put("/=", new GallinaSignature(arrows(a, a, var("bool"))));
		return new HsClassDeclaration("Eq", binders(typed(TYPE, "a")), Collections.emptyList(), signatures,
				defaults, features);
	}

	@Test
	public void convertsClass() {
		ClassBody body = ClassConversion.convertClassDeclaration(state,
				eqClass(Collections.emptyList(), Collections.emptySet()));
		assertThat(body.getDefinition().toString(), is(String.join(System.lineSeparator(),
				"Class Eq (a : Type) := {",
				"  op_zeze__ : a -> a -> bool ;",
				"  op_zsze__ : a -> a -> bool }.")));
		assertThat(state.getClassDefinition("Eq"), is(body.getDefinition()));
		assertThat(body.getNotations(), is(Arrays.<GallinaSentence>asList(
				new GallinaInfixDefinition("==", var("op_zeze__"), GallinaAssociativity.NONE, 70),
				new GallinaNotation(new GallinaNotationBinding("_==_", var("op_zeze__"))),
				new GallinaInfixDefinition("/=", var("op_zsze__"), null, 99),
				new GallinaNotation(new GallinaNotationBinding("_/=_", var("op_zsze__"))))));
		assertThat(body.toSentences().size(), is(5));
	}

	@Test
	public void superclassesBecomeImplicitBinders() {
		Map<String, GallinaSignature> signatures = new LinkedHashMap<>();
		signatures.put("compare", new GallinaSignature(arrows(a, a, var("comparison"))));
		HsClassDeclaration ord = new HsClassDeclaration("Ord", binders(typed(TYPE, "a")),
				Collections.singletonList(app("Eq", a)), signatures, Collections.emptyList(),
				Collections.emptySet());
		state.rename(HsNamespace.TYPE, "Ord", "Ord_");
		ClassBody body = ClassConversion.convertClassDeclaration(state, ord);
		assertThat(body.getDefinition().getName(), is("Ord_"));
		assertThat(body.getDefinition().getParameters(), is(Arrays.<GallinaBinder>asList(
				typed(TYPE, "a"),
				generalized(GallinaBinder.Explicitness.IMPLICIT, app("Eq", a)))));
		assertThat(body.getDefinition().toString(), is(String.join(System.lineSeparator(),
				"Class Ord_ (a : Type) `{Eq a} := {",
				"  compare : a -> a -> comparison }.")));
		assertTrue(body.getNotations().isEmpty());
		assertNotNull(state.getClassDefinition("Ord_"));
	}

	@Test
	public void recordsDefaultMethods() {
		HsClassDeclaration eq = eqClass(Collections.singletonList(new HsClassDeclaration.DefaultMethod("/=",
				binders(inferred("x"), inferred("y")), app("negb", infix(var("x"), "==", var("y"))))),
				Collections.emptySet());
		state.localize(() -> {
			ClassConversion.convertClassDeclaration(state, eq);
			assertThat(state.getDefaultMethods("Eq").keySet(), is(Collections.singleton("op_zsze__")));
			assertThat(state.getDefaultMethods("Eq").get("op_zsze__").toString(),
					is("fun x y => negb (x == y)"));
			return null;
		});
		assertThat(state.getDefaultMethods("Eq").size(), is(2));
		assertNull(state.getClassDefinition("Eq"));
	}

	@Test
	public void rejectsFunctionalDependencies() {
		try {
			ClassConversion.convertClassDeclaration(state, eqClass(Collections.emptyList(),
					EnumSet.of(HsClassDeclaration.Feature.FUNCTIONAL_DEPENDENCIES)));
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("functional dependencies unsupported"));
		}
		assertNull(state.getClassDefinition("Eq"));
	}

	@Test
	public void rejectsAssociatedTypes() {
		try {
			ClassConversion.convertClassDeclaration(state, eqClass(Collections.emptyList(),
					EnumSet.of(HsClassDeclaration.Feature.ASSOCIATED_TYPES)));
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("associated types unsupported"));
		}
	}

	@Test
	public void rejectsPatternBindingDefaults() {
		try {
			ClassConversion.convertClassDeclaration(state, eqClass(Collections.singletonList(
					HsClassDeclaration.DefaultMethod.patternBinding("==", var("undefined"))),
					Collections.emptySet()));
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("pattern bindings in class declarations unsupported"));
		}
	}

	@Test
	public void skipsMethods() {
		Edits edits = new Edits(Collections.emptySet(),
				Collections.singletonMap("Eq", Collections.singleton("/=")));
		ConversionState edited = new ConversionState(Collections.emptyMap(), edits);
		ClassBody body = ClassConversion.convertClassDeclaration(edited, eqClass(Collections.emptyList(),
				Collections.emptySet()));
		assertThat(body.getDefinition().getFields().size(), is(1));
		assertThat(body.getDefinition().getFields().get(0).getName(), is("op_zeze__"));
		assertThat(body.getNotations().size(), is(2));
	}

	@Test
	public void skipOfUnknownMethodFails() {
		Edits edits = new Edits(Collections.emptySet(),
				Collections.singletonMap("Eq", Collections.singleton("compare")));
		ConversionState edited = new ConversionState(Collections.emptyMap(), edits);
		try {
			ClassConversion.convertClassDeclaration(edited, eqClass(Collections.emptyList(),
					Collections.emptySet()));
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("Could not apply edit: skip method Eq.compare not found"));
		}
	}

	@Test
	public void implicitBindersForClassMember() {
		Map<String, GallinaSignature> signatures = new LinkedHashMap<>();
		signatures.put("fmap", new GallinaSignature(forall(
				binders(implicitInferred("a"), implicitInferred("b")),
				forall(binders(generalized(GallinaBinder.Explicitness.IMPLICIT, app("Show", var("a"))),
						typed(var("a"), "x")),
						arrow(var("a"), var("b"))))));
		signatures.put("pure", new GallinaSignature(arrow(a, app("f", a))));
		ClassConversion.convertClassDeclaration(state, new HsClassDeclaration("Functor",
				binders(inferred("f")), Collections.emptyList(), signatures, Collections.emptyList(),
				Collections.emptySet()));

		assertThat(ClassConversion.getImplicitBindersForClassMember(state, "Functor", "fmap"),
				is(Arrays.<GallinaBinder>asList(
						implicitInferred("a"),
						implicitInferred("b"),
						generalized(GallinaBinder.Explicitness.IMPLICIT, app("Show", var("a"))))));
		assertTrue(ClassConversion.getImplicitBindersForClassMember(state, "Functor", "pure").isEmpty());
		assertTrue(ClassConversion.getImplicitBindersForClassMember(state, "Functor", "missing").isEmpty());
		assertTrue(ClassConversion.getImplicitBindersForClassMember(state, "Monad", "fmap").isEmpty());
	}

	@Test
	public void implicitsStopAtFirstExplicitQuantifier() {
		GallinaTerm type = forall(binders(implicitInferred("a"), inferred("x")),
				forall(binders(implicitInferred("b")), var("b")));
		assertThat(ClassConversion.getImplicits(type), is(Collections.<GallinaBinder>singletonList(
				implicitInferred("a"))));
	}

}
