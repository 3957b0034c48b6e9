package colongo.trans.passes.rewrite;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import colongo.errors.Issue;
import colongo.errors.TopLevelIssueContext;
import colongo.lexer.LexerIssue;
import colongo.util.OffsetMap;
import colongo.util.SourceFile;

public class MarkerRewritingPassIssueTest {

	@Test
	public void testReservedOperator() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		RewrittenSource result = MarkerRewritingPass.perform(
				ctx, new SourceFile(Paths.get("TEST"), "x := 1\nif y := 2; y > 0 {\n}\n"), "T_");
		assertThat(result, is(nullValue()));
		List<Issue> issues = ctx.getSortedIssues();
		assertThat(issues.size(), is(2));
		assertThat(issues.get(0), instanceOf(ReservedOperatorIssue.class));
		assertThat(issues.get(0).getMessage(), is("TEST:1:3: reserved operator \":=\" used directly"));
		assertThat(issues.get(1).getMessage(), is("TEST:2:6: reserved operator \":=\" used directly"));
	}

	@Test
	public void testLexerIssuesSuppressOutput() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		RewrittenSource result = MarkerRewritingPass.perform(
				ctx, new SourceFile(Paths.get("TEST"), ":x = 'ab"), "T_");
		assertThat(result, is(nullValue()));
		assertThat(ctx.getIssues().get(0), instanceOf(LexerIssue.class));
	}

	@Test
	public void testOffsetsMapBack() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		RewrittenSource result = MarkerRewritingPass.perform(
				ctx, new SourceFile(Paths.get("TEST"), "y = 0\n:x = y"), "T_");
		assertThat(result.getText(), is("y = 0\n T_x := y"));
		OffsetMap map = result.getOffsetMap();
		// the encoded name starts at the colon
		assertThat(map.toOriginal(7), is(6));
		assertThat(map.toOriginal(9), is(7));
		// the inserted colon belongs to the "="
		assertThat(map.toOriginal(11), is(9));
		assertThat(map.toOriginal(12), is(9));
		assertThat(map.toOriginal(15), is(12));
	}

}
