package colongo.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

import colongo.model.golang.*;
import colongo.util.SourceFile;

public class GoParserTest {

	private static GoModule parse(String source) throws GoParseException {
		return GoParser.readModule(new SourceFile(Paths.get("TEST"), source));
	}

	private static GoBlock body(GoModule module, int index) {
		return ((GoFunctionDeclaration) module.getDeclarations().get(index)).getBody();
	}

	@Test
	public void testImportPathKeepsQuotes() throws GoParseException {
		GoModule module = parse("package main\n\nimport (\n\t\"fmt\"\n\tos2 \"os\"\n)\n");
		assertThat(module.getName(), is("main"));
		GoImportDeclaration imports = (GoImportDeclaration) module.getDeclarations().get(0);
		assertTrue(imports.isGrouped());
		assertThat(imports.getSpecs().get(0).getPath(), is("\"fmt\""));
		assertThat(imports.getSpecs().get(0).getName(), is(nullValue()));
		assertThat(imports.getSpecs().get(1).getName(), is("os2"));
	}

	@Test
	public void testCommentsAreCollected() throws GoParseException {
		GoModule module = parse("package main\n\n// main does nothing\nfunc main() {\n\tx = 1 /* inline */\n}\n");
		assertThat(module.getComments().size(), is(2));
		assertTrue(module.getComments().get(0).isLineComment());
		assertFalse(module.getComments().get(1).isLineComment());
	}

	@Test
	public void testAssignmentOperators() throws GoParseException {
		GoModule module = parse("package main\n\nfunc main() {\n\tx = 1\n\ty := 2\n\tx += y\n}\n");
		GoBlock body = body(module, 0);
		assertThat(body.getStatements().size(), is(3));
		assertThat(((GoAssignmentStatement) body.getStatements().get(0)).getOperator(),
				is(GoAssignmentStatement.Operator.ASSIGN));
		assertThat(((GoAssignmentStatement) body.getStatements().get(1)).getOperator(),
				is(GoAssignmentStatement.Operator.DEFINE));
		assertThat(((GoAssignmentStatement) body.getStatements().get(1)).getLhs().get(0),
				is(new GoVariableName(null, "y")));
	}

	@Test
	public void testRangeClause() throws GoParseException {
		GoModule module = parse("package main\n\nfunc main() {\n\tfor k, v = range xs {\n\t}\n\tfor range xs {\n\t}\n}\n");
		GoBlock body = body(module, 0);
		GoForRange withKeys = (GoForRange) body.getStatements().get(0);
		assertThat(withKeys.getKey(), is(new GoVariableName(null, "k")));
		assertThat(withKeys.getValue(), is(new GoVariableName(null, "v")));
		assertThat(withKeys.getOperator(), is(GoAssignmentStatement.Operator.ASSIGN));
		GoForRange bare = (GoForRange) body.getStatements().get(1);
		assertThat(bare.getKey(), is(nullValue()));
		assertThat(bare.getValue(), is(nullValue()));
	}

	@Test
	public void testLabeledStatement() throws GoParseException {
		GoModule module = parse("package main\n\nfunc main() {\nouter:\n\tx = 1\n}\n");
		GoLabeledStatement labeled = (GoLabeledStatement) body(module, 0).getStatements().get(0);
		assertThat(labeled.getLabel(), is("outer"));
		assertThat(labeled.getStatement(), instanceOf(GoAssignmentStatement.class));
	}

	@Test
	public void testLocationsPointIntoTheFile() throws GoParseException {
		GoModule module = parse("package main\n\nfunc main() {\n\tx = 1\n}\n");
		GoStatement statement = body(module, 0).getStatements().get(0);
		assertThat(statement.getLocation().getStartLine(), is(4));
		assertThat(statement.getLocation().getStartColumn(), is(2));
		assertThat(statement.getLocation().prettyString(), is("TEST:4:2"));
	}

}
