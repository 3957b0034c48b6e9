package colongo.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import colongo.errors.Issue;
import colongo.errors.TopLevelIssueContext;
import colongo.util.SourceFile;

public class GoLexerIssueTest {

	private static List<Issue> lex(String source) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		new GoLexer(new SourceFile(Paths.get("TEST"), source), false).readTokens(ctx);
		return ctx.getSortedIssues();
	}

	@Test
	public void testUnterminatedString() {
		List<Issue> issues = lex("x = \"abc\ny = 1");
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0).getMessage(), is("TEST:1:5: string literal not terminated"));
	}

	@Test
	public void testIllegalCharacter() {
		List<Issue> issues = lex("a @ b");
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0).getMessage(), is("TEST:1:3: illegal character U+0040"));
	}

	@Test
	public void testLeadingByteOrderMark() {
		assertThat(lex("\uFEFFpackage main\n").size(), is(0));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<GoToken> tokens = new GoLexer(new SourceFile(Paths.get("TEST"), "\uFEFFpackage main\n"), false)
				.readTokens(ctx);
		assertThat(tokens.get(0).getType(), is(GoTokenType.PACKAGE));
		// anywhere else it is an ordinary illegal character
		assertThat(lex("a \uFEFF").size(), is(1));
	}

	@Test
	public void testUnterminatedComment() {
		List<Issue> issues = lex("a /* b");
		assertThat(issues.size(), is(1));
		assertThat(((LexerIssue) issues.get(0)).getDescription(), is("comment not terminated"));
	}

	@Test
	public void testLiteralValues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<GoToken> tokens = new GoLexer(new SourceFile(Paths.get("TEST"), "x = `a\nb` // c"), true)
				.readTokens(ctx);
		assertThat(tokens.get(2).getValue(), is("`a\nb`"));
		assertThat(tokens.get(2).getLocation().getEndLine(), is(2));
		assertTrue(tokens.get(3).isAutomaticSemicolon());
		assertThat(tokens.get(4).getType(), is(GoTokenType.COMMENT));
		assertThat(tokens.get(4).getValue(), is("// c"));
	}

}
