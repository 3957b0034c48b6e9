package colongo.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import colongo.util.SourceFile;

@RunWith(Parameterized.class)
public class GoParserIssueTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"main\n", "TEST:1:1: expected 'package', found main"},
				{"package main\n\nfunc main() {\n\tif {\n\t}\n}\n", "TEST:4:5: missing condition in if statement"},
				{"package main\n\nvar x\n", "TEST:3:5: missing variable type or initialization"},
				{"package main\n\nconst c\n", "TEST:3:7: missing init expr for const declaration"},
				{"package main\n\nfunc f() {}\n\nimport \"os\"\n",
						"TEST:5:1: imports must appear before other declarations"},
				{"package main\n\nfunc main() {\n\t\"oops\n}\n", "TEST:4:2: string literal not terminated"},
		});
	}

	private String source;
	private String expected;

	public GoParserIssueTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		try {
			GoParser.readModule(new SourceFile(Paths.get("TEST"), source));
			fail("parsing should have failed");
		} catch (GoParseException e) {
			assertThat(e.getLocation().prettyString() + ": " + e.getReason(), is(expected));
		}
	}

}
