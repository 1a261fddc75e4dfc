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
public class GallinaPatternFormattingTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{pvar("x"), "x"},
				{pwild(), "_"},
				{new GallinaNumPattern(BigInteger.TEN), "10"},
				{new GallinaStringPattern("a"), "\"a\""},
				{pargs("cons", pvar("x"), pargs("cons", pvar("y"), pvar("ys"))), "cons x (cons y ys)"},
				{pargs("Some", pargs("S", pvar("n"))), "Some (S n)"},
				{pinfix(pvar("x"), "::", pinfix(pvar("y"), "::", pvar("ys"))), "x :: y :: ys"},
				{pinfix(pinfix(pvar("x"), "::", pvar("y")), "::", pvar("ys")), "(x :: y) :: ys"},
				{pinfix(pargs("S", pvar("n")), "::", pvar("xs")), "S n :: xs"},
				{pargs("Some", pinfix(pvar("x"), "::", pvar("xs"))), "Some (x :: xs)"},
				{pinfix(pvar("a"), "<&>", pvar("b")), "(a <&> b)"},
				{new GallinaAsPattern(pargs("S", pvar("n")), "m"), "(S n as m)"},
				{new GallinaInScopePattern(new GallinaNumPattern(BigInteger.ONE), "N"), "1%N"},
				{pargs("S", new GallinaInScopePattern(new GallinaNumPattern(BigInteger.ONE), "N")), "S 1%N"},
				{new GallinaExplicitArgsPattern(qualid("pair"), Arrays.asList(pwild(), pwild())), "@pair _ _"},
				{pargs("Some", new GallinaExplicitArgsPattern(qualid("pair"), Collections.singletonList(pwild()))),
						"Some (@pair _)"},
				{new GallinaOrPatterns(Collections.singletonList(
						new GallinaOrPattern(Arrays.asList(pvar("A"), pvar("B"))))), "(A | B)"},
				{new GallinaOrPatterns(Arrays.asList(
						new GallinaOrPattern(Arrays.asList(pargs("S", pvar("n")), pvar("O"))),
						new GallinaOrPattern(Collections.singletonList(pwild())))), "(S n | O, _)"},
				{new GallinaQualidPattern(GallinaQualid.parse("GHC.Types.True")), "GHC.Types.True"},
		});
	}

	private final GallinaPattern pattern;
	private final String expected;

	public GallinaPatternFormattingTest(GallinaPattern pattern, String expected) {
		this.pattern = pattern;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(pattern.toString(), is(expected));
	}

}
