package colongo.trans.passes.rewrite;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import colongo.errors.TopLevelIssueContext;
import colongo.util.SourceFile;

@RunWith(Parameterized.class)
public class MarkerRewritingPassTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			// a declared name followed by a comma keeps its "="
			{ ":n, err = f()", " T_n, err = f()" },
			{ "x = 1\n:y = 2", "x = 1\n T_y := 2" },
			{ "a, :b = 1, 2", "a,  T_b = 1, 2" },
			{ ":a, :b = 1, 2", " T_a,  T_b = 1, 2" },
			{ "switch :v = x.(type) {", "switch  T_v := x.(type) {" },
			{ "for :k, :v = range m {", "for  T_k,  T_v = range m {" },
			{ "f(:a, b)", "f( T_a, b)" },

			// colons that are not markers
			{ "x[a:b]", "x[a:b]" },
			{ "x[:n]", "x[:n]" },
			{ "x[i:j], y = 1, 2", "x[i:j], y = 1, 2" },
			{ "T{a: b, c: d}", "T{a: b, c: d}" },
			{ "L: x = 1", "L: x = 1" },
			{ "case x: y = 1", "case x: y = 1" },
			{ ":_ = f()", ":_ = f()" },
			{ ": x = 1", ": x = 1" },
			{ "// :x = 1\ny = 2", "// :x = 1\ny = 2" },
			{ "s := \":x = 1\"", null },
		});
	}

	private String source;
	private String expected;

	public MarkerRewritingPassTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		RewrittenSource actual = MarkerRewritingPass.perform(ctx, new SourceFile(Paths.get("TEST"), source), "T_");
		if (expected == null) {
			assertThat(actual, is(nullValue()));
			assertTrue(ctx.hasErrors());
		} else {
			assertFalse(ctx.format(), ctx.hasErrors());
			assertThat(actual.getText(), is(expected));
		}
	}

}
