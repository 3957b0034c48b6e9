package colongo.trans.passes.desugar;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import colongo.errors.Issue;
import colongo.errors.TopLevelIssueContext;
import colongo.formatters.FormattingTools;
import colongo.model.golang.GoModule;
import colongo.parser.GoParseException;
import colongo.parser.GoParser;
import colongo.trans.passes.revert.MarkerRevertingPass;
import colongo.trans.passes.rewrite.MarkerRewritingPass;
import colongo.trans.passes.rewrite.RewrittenSource;
import colongo.util.SourceFile;

public class DesugaringPassTest {

	private static final String PREFIX = "package main\n\nfunc main() {\n";
	private static final String SUFFIX = "}\n";

	private TopLevelIssueContext ctx = new TopLevelIssueContext();

	private GoModule desugar(String body) throws GoParseException {
		SourceFile file = new SourceFile(Paths.get("TEST"), PREFIX + body + SUFFIX);
		RewrittenSource rewritten = MarkerRewritingPass.perform(ctx, file, "D_");
		assertThat(rewritten, is(notNullValue()));
		GoModule module = GoParser.readModule(file.remapped(rewritten.getOffsetMap()), rewritten.getText());
		MarkerRevertingPass.perform(module, "D_");
		DesugaringPass.perform(ctx, module, "t");
		return module;
	}

	private String translate(String body) throws GoParseException {
		GoModule module = desugar(body);
		assertFalse(ctx.hasErrors());
		String formatted = FormattingTools.format(module);
		assertTrue(formatted.startsWith(PREFIX));
		return formatted.substring(PREFIX.length(), formatted.length() - SUFFIX.length());
	}

	@Test
	public void testTemporariesAreNumberedAcrossTheFile() throws GoParseException {
		assertThat(translate("\t:a, b = f()\n\tif c {\n\t\tx, :y = g()\n\t}\n"), is(
				"\tt0, t1 := f()\n\tvar a = t0\n\tb = t1\n" +
						"\tif c {\n\t\tt2, t3 := g()\n\t\tx = t2\n\t\tvar y = t3\n\t}\n"));
	}

	@Test
	public void testIgnoredTargetsGetNoTemporary() throws GoParseException {
		assertThat(translate("\t_, :a, b = f()\n"), is("\t_, t0, t1 := f()\n\tvar a = t0\n\tb = t1\n"));
	}

	@Test
	public void testComplexTargetsAreReassigned() throws GoParseException {
		assertThat(translate("\t:a, p.x = f()\n"), is("\tt0, t1 := f()\n\tvar a = t0\n\tp.x = t1\n"));
	}

	@Test
	public void testPlainAssignmentsAreKept() throws GoParseException {
		assertThat(translate("\ta, b = b, a\n\t_ = a\n"), is("\ta, b = b, a\n\t_ = a\n"));
	}

	@Test
	public void testCaseBodies() throws GoParseException {
		assertThat(translate("\tswitch {\n\tcase c:\n\t\t:a = 1\n\t}\n"),
				is("\tswitch {\n\tcase c:\n\t\tvar a = 1\n\t}\n"));
	}

	@Test
	public void testFunctionLiteralBodies() throws GoParseException {
		assertThat(translate("\tgo func() {\n\t\t:a, b = f()\n\t}()\n"),
				is("\tgo func() {\n\t\tt0, t1 := f()\n\t\tvar a = t0\n\t\tb = t1\n\t}()\n"));
	}

	@Test
	public void testNestedLabels() throws GoParseException {
		assertThat(translate("outer:\ninner:\n\t:a, b = f()\n"),
				is("outer:\ninner:\n\tt0, t1 := f()\n\tvar a = t0\n\tb = t1\n"));
	}

	@Test
	public void testMixedRange() throws GoParseException {
		desugar("\tfor :k, v = range xs {\n\t}\n");
		List<Issue> issues = ctx.getSortedIssues();
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0).getMessage(), is("TEST:4:2: mixed assignment in range"));
	}

	@Test
	public void testMixedSelectCommunication() throws GoParseException {
		desugar("\tselect {\n\tcase :v, ok = <-ch:\n\t}\n");
		List<Issue> issues = ctx.getSortedIssues();
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0).getMessage(), is("TEST:5:7: mixed assignment in init statement"));
	}

	@Test
	public void testNothingChangesWhenAnIssueIsFound() throws GoParseException {
		GoModule module = desugar("\t:a, b = f()\n\tif :c, d = g(); d {\n\t}\n");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(FormattingTools.format(module), is(PREFIX + "\ta, b = f()\n\tif c, d = g(); d {\n\t}\n" + SUFFIX));
	}

}
