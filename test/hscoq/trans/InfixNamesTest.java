package hscoq.trans;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class InfixNamesTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"==", "op_zeze__"},
				{"/=", "op_zsze__"},
				{"<$>", "op_zlzdzg__"},
				{">>=", "op_zgzgze__"},
				{"++", "op_zpzp__"},
				{":|", "op_ZCzb__"},
				{".", "op_zi__"},
				{"map", "map"},
				{"_unused", "_unused"},
				{"op_zeze__", "op_zeze__"},
		});
	}

	private final String ident;
	private final String expected;

	public InfixNamesTest(String ident, String expected) {
		this.ident = ident;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(InfixNames.toCoqName(ident), is(expected));
	}

}
