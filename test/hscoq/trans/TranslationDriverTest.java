package hscoq.trans;

import hscoq.errors.IssueWithContext;
import hscoq.errors.TopLevelIssueContext;
import hscoq.model.gallina.GallinaSentence;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static hscoq.model.gallina.GallinaBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TranslationDriverTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	// declarations are "name=value" strings; a value of "?" cannot be converted
	private static class ConstantConverter implements DeclarationConverter<String> {
		@Override
		public List<GallinaSentence> convert(ConversionState state, String declaration) {
			String value = declaration.substring(declaration.indexOf('=') + 1);
			if (value.equals("?")) {
				throw ProgramError.unsupported("unknown values");
			}
			String name = state.renamedOrSelf(HsNamespace.VALUE, name(declaration));
			return Collections.singletonList(
					definition(name, Collections.emptyList(), var("nat"), num(Long.parseLong(value))));
		}

		@Override
		public String name(String declaration) {
			return declaration.substring(0, declaration.indexOf('='));
		}
	}

	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		ctx = new TopLevelIssueContext();
	}

	private static TranslationDriver<String> driver(Set<String> skipped) {
		ConversionState state = new ConversionState(
				Collections.singletonMap(new NamespacedIdent(HsNamespace.VALUE, "one"), "uno"),
				new Edits(skipped, Collections.emptyMap()));
		return new TranslationDriver<>(state, new ConstantConverter());
	}

	@Test
	public void convertsInOrder() {
		List<GallinaSentence> sentences = driver(Collections.emptySet())
				.convertModule(ctx, Arrays.asList("one=1", "two=2"));
		assertFalse(ctx.hasErrors());
		assertThat(TranslationDriver.render(sentences), is(String.join(System.lineSeparator(),
				"Definition uno : nat :=",
				"  1.",
				"",
				"Definition two : nat :=",
				"  2.",
				"")));
	}

	@Test
	public void failedDeclarationIsReportedAndSkipped() {
		List<GallinaSentence> sentences = driver(Collections.emptySet())
				.convertModule(ctx, Arrays.asList("one=1", "bad=?", "two=2"));
		assertThat(sentences.size(), is(2));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(0);
		assertThat(((WhileConvertingDeclaration) issue.getContext()).getDeclarationName(), is("bad"));
		ConversionFailureIssue failure = (ConversionFailureIssue) issue.getRootIssue();
		assertThat(failure.getError().getMsg(), is("unknown values unsupported"));
		assertThat(ctx.format(), is(String.join(System.lineSeparator(),
				"Detected 1 issue(s):",
				"while converting declaration bad",
				"  Program error: unknown values unsupported")));
	}

	@Test
	public void skipEditsDropDeclarations() {
		List<GallinaSentence> sentences = driver(Collections.singleton("bad"))
				.convertModule(ctx, Arrays.asList("one=1", "bad=?"));
		assertThat(sentences.size(), is(1));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void unmatchedSkipEditFails() {
		try {
			driver(new HashSet<>(Arrays.asList("missing", "one")))
					.convertModule(ctx, Collections.singletonList("one=1"));
			fail("expected ProgramError");
		} catch (ProgramError e) {
			assertThat(e.getMsg(), is("Could not apply edit: skip missing"));
		}
	}

	@Test
	public void writesOutputFile() throws IOException {
		File out = new File(folder.getRoot(), "Out.v");
		TranslationDriver.write(ctx, out, Collections.singletonList(
				definition("x", Collections.emptyList(), null, num(0))));
		assertFalse(ctx.hasErrors());
		assertThat(FileUtils.readFileToString(out, StandardCharsets.UTF_8),
				is("Definition x :=" + System.lineSeparator() + "  0." + System.lineSeparator()));
	}

	@Test
	public void writeFailureBecomesIssue() throws IOException {
		File directory = folder.newFolder("taken");
		TranslationDriver.write(ctx, directory, Collections.singletonList(
				definition("x", Collections.emptyList(), null, num(0))));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(IOErrorIssue.class));
	}

}
