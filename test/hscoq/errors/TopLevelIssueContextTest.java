package hscoq.errors;

import hscoq.trans.ConversionFailureIssue;
import hscoq.trans.IOErrorIssue;
import hscoq.trans.ProgramError;
import hscoq.trans.WhileConvertingDeclaration;
import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TopLevelIssueContextTest {

	@Test
	public void testNoIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 0 issue(s):"));
	}

	@Test
	public void testNestedContextForwardsToParent() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext nested = ctx.withContext(new WhileConvertingDeclaration("foo"));
		assertFalse(nested.hasErrors());
		nested.error(new ConversionFailureIssue(ProgramError.unsupported("x")));
		assertTrue(nested.hasErrors());
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(IssueWithContext.class));
		assertThat(ctx.format(), is(String.join(System.lineSeparator(),
				"Detected 1 issue(s):",
				"while converting declaration foo",
				"  Program error: x unsupported")));
	}

	@Test
	public void testIssueMessages() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new IOErrorIssue(new IOException("disk full")));
		ctx.withContext(new WhileConvertingDeclaration("bar"))
				.error(new ConversionFailureIssue(ProgramError.editFailure("skip baz")));
		assertThat(ctx.getIssues().get(0).format(), is("IO Error: java.io.IOException: disk full"));
		assertThat(ctx.format(), is(String.join(System.lineSeparator(),
				"Detected 2 issue(s):",
				"IO Error: java.io.IOException: disk full",
				"while converting declaration bar",
				"  Program error: Could not apply edit: skip baz")));
	}

}
