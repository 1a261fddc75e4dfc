package hscoq.trans;

import hscoq.model.gallina.GallinaTerm;
import org.junit.Before;
import org.junit.Test;

import java.util.*;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ConversionStateTest {

	private ConversionState state;

	@Before
	public void setup() {
		state = new ConversionState();
	}

	@Test
	public void freshIsMonotonic() {
		long first = state.fresh();
		long second = state.fresh();
		assertThat(first, is(0L));
		assertThat(second, is(1L));
	}

	@Test
	public void freshNamesContinuePastIntRange() {
		ConversionState late = new ConversionState(Collections.emptyMap(), Edits.empty(), Integer.MAX_VALUE);
		assertThat(late.gensym("x"), is("__x_2147483647__"));
		assertThat(late.gensym("x"), is("__x_2147483648__"));
		assertThat(late.fresh(), is(2147483649L));
	}

	@Test(expected = ArithmeticException.class)
	public void freshRefusesToWrap() {
		ConversionState last = new ConversionState(Collections.emptyMap(), Edits.empty(), Long.MAX_VALUE);
		last.fresh();
	}

	@Test
	public void gensymFormat() {
		assertThat(state.gensym("x"), is("__x_0__"));
		assertThat(state.gensym("x"), is("__x_1__"));
	}

	@Test
	public void gensymNamesAreDistinct() {
		Set<String> names = new HashSet<>();
		for (int i = 0; i < 100; ++i) {
			assertTrue(names.add(state.gensym("x")));
		}
	}

	@Test
	public void gensymNamesAreDistinctAcrossLocalize() {
		String before = state.gensym("x");
		String inside = state.localize(() -> state.gensym("x"));
		String after = state.gensym("x");
		assertThat(new HashSet<>(Arrays.asList(before, inside, after)).size(), is(3));
	}

	@Test
	public void renameLastWriteWins() {
		assertNull(state.getRenamed(HsNamespace.VALUE, "map"));
		assertThat(state.renamedOrSelf(HsNamespace.VALUE, "map"), is("map"));
		state.rename(HsNamespace.VALUE, "map", "fmap");
		state.rename(HsNamespace.VALUE, "map", "List.map");
		assertThat(state.getRenamed(HsNamespace.VALUE, "map"), is("List.map"));
		assertNull(state.getRenamed(HsNamespace.TYPE, "map"));
	}

	@Test
	public void initialRenamingsAreCopied() {
		Map<NamespacedIdent, String> renamings = new HashMap<>();
		renamings.put(new NamespacedIdent(HsNamespace.TYPE, "Bool"), "bool");
		ConversionState configured = new ConversionState(renamings, Edits.empty());
		renamings.clear();
		assertThat(configured.getRenamed(HsNamespace.TYPE, "Bool"), is("bool"));
	}

	@Test
	public void localizeDiscardsInnerRenamings() {
		state.rename(HsNamespace.VALUE, "Eq.==", "eqb");
		state.localize(() -> {
			state.rename(HsNamespace.VALUE, "Eq./=", "neqb");
			assertThat(state.getRenamed(HsNamespace.VALUE, "Eq./="), is("neqb"));
			return null;
		});
		assertThat(state.getRenamed(HsNamespace.VALUE, "Eq.=="), is("eqb"));
		assertNull(state.getRenamed(HsNamespace.VALUE, "Eq./="));
	}

	@Test
	public void localizeDiscardsTableWrites() {
		state.addConstructors("Maybe", Arrays.asList("Nothing", "Just"));
		state.localize(() -> {
			state.addConstructors("Either", Arrays.asList("Left", "Right"));
			state.setConstructorFields("Just", new ConstructorFields.NonRecordFields(1));
			state.setDefaultMethods("Ord", Collections.singletonMap("max", var("max")));
			return null;
		});
		assertThat(state.getConstructors("Maybe"), is(Arrays.asList("Nothing", "Just")));
		assertNull(state.getConstructors("Either"));
		assertNull(state.getConstructorType("Left"));
		assertNull(state.getConstructorFields("Just"));
		assertTrue(state.getDefaultMethods("Ord").isEmpty());
	}

	@Test
	public void localizeRestoresOnException() {
		state.fresh();
		try {
			state.localize(() -> {
				state.rename(HsNamespace.TYPE, "Int", "Z");
				state.fresh();
				throw ProgramError.unsupported("rank-n types");
			});
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("rank-n types unsupported"));
		}
		assertNull(state.getRenamed(HsNamespace.TYPE, "Int"));
		assertThat(state.fresh(), is(2L));
	}

	@Test
	public void localizeReturnsResult() {
		assertThat(state.localize(() -> 42), is(42));
	}

	@Test
	public void constructorMetadata() {
		state.addConstructors("Point", Collections.singletonList("MkPoint"));
		state.setConstructorFields("MkPoint", new ConstructorFields.RecordFields(Arrays.asList("px", "py")));
		assertThat(state.getConstructorType("MkPoint"), is("Point"));
		assertThat(state.getRecordFieldType("px"), is("Point"));
		assertThat(state.getConstructorFields("MkPoint").getArity(), is(2));
	}

	@Test
	public void eqHasDefaultMethods() {
		Map<String, GallinaTerm> defaults = state.getDefaultMethods("Eq");
		assertThat(defaults.keySet(), is(new HashSet<>(Arrays.asList("op_zeze__", "op_zsze__"))));
		assertThat(defaults.get("op_zeze__").toString(), is("fun x y => negb (x /= y)"));
		assertThat(defaults.get("op_zsze__").toString(), is("fun x y => negb (x == y)"));
	}

	@Test
	public void programErrorMessages() {
		assertThat(ProgramError.unsupported("functional dependencies").getMessage(),
				is("Program error: functional dependencies unsupported"));
		assertThat(ProgramError.editFailure("skip foo").getMsg(), is("Could not apply edit: skip foo"));
	}

}
