package colongo.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import colongo.model.golang.GoModule;
import colongo.parser.GoParseException;
import colongo.parser.GoParser;
import colongo.util.SourceFile;

@RunWith(Parameterized.class)
public class GoFormattingTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{
						"package main\nfunc main() {\nx=1\n}\n",
						"package main\n\nfunc main() {\n\tx = 1\n}\n",
				},
				{
						"package main\n\n\n\nvar x = 1\n",
						"package main\n\nvar x = 1\n",
				},
				{
						"package main\n\nvar a = 1\nvar b = 2\nfunc f() {}\n",
						"package main\n\nvar a = 1\nvar b = 2\n\nfunc f() {}\n",
				},
				{
						"package main\n\nconst (\n\ta = 1 // one\n\tbcd = 2 // two\n)\n",
						"package main\n\nconst (\n\ta   = 1 // one\n\tbcd = 2 // two\n)\n",
				},
				{
						"package main\n\n// f does nothing.\nfunc f() {}\n",
						"package main\n\n// f does nothing.\nfunc f() {}\n",
				},
				{
						"package main\n\nfunc f(x bool) {\n\tif (x) {\n\t\treturn\n\t}\n}\n",
						"package main\n\nfunc f(x bool) {\n\tif x {\n\t\treturn\n\t}\n}\n",
				},
				{
						"package main\n\nfunc f() {\n\tx = 1\n\n\n\ty = 2\n}\n",
						"package main\n\nfunc f() {\n\tx = 1\n\n\ty = 2\n}\n",
				},
		});
	}

	private String input;
	private String expected;

	public GoFormattingTest(String input, String expected) {
		this.input = input;
		this.expected = expected;
	}

	private static String format(String source) throws GoParseException {
		GoModule module = GoParser.readModule(new SourceFile(Paths.get("TEST"), source));
		return FormattingTools.format(module);
	}

	@Test
	public void test() throws GoParseException {
		assertThat(format(input), is(expected));
		// formatted output is a fixed point
		assertThat(format(expected), is(expected));
	}

}
