package colongo.trans.passes.revert;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import colongo.formatters.FormattingTools;
import colongo.model.golang.*;
import colongo.parser.GoParseException;
import colongo.parser.GoParser;
import colongo.util.SourceFile;

public class MarkerRevertingPassTest {

	private static GoModule parseAndRevert(String source) throws GoParseException {
		GoModule module = GoParser.readModule(new SourceFile(Paths.get("TEST"), source));
		MarkerRevertingPass.perform(module, "T_");
		return module;
	}

	private static List<GoStatement> statements(GoModule module) {
		return ((GoFunctionDeclaration) module.getDeclarations().get(0)).getBody().getStatements();
	}

	@Test
	public void testTaggedNamesGetTheirColonBack() throws GoParseException {
		GoModule module = parseAndRevert("package main\n\nfunc main() {\n\tT_x := 1\n\ty, T_z = f()\n}\n");
		List<GoStatement> statements = statements(module);
		GoAssignmentStatement first = (GoAssignmentStatement) statements.get(0);
		assertThat(first.getOperator(), is(GoAssignmentStatement.Operator.ASSIGN));
		assertThat(first.getLhs().get(0), is(new GoVariableName(null, ":x")));
		GoAssignmentStatement second = (GoAssignmentStatement) statements.get(1);
		assertThat(second.getLhs().get(0), is(new GoVariableName(null, "y")));
		assertThat(second.getLhs().get(1), is(new GoVariableName(null, ":z")));
	}

	@Test
	public void testRangeOperator() throws GoParseException {
		GoModule module = parseAndRevert("package main\n\nfunc main() {\n\tfor T_k := range xs {\n\t}\n}\n");
		GoForRange forRange = (GoForRange) statements(module).get(0);
		assertThat(forRange.getOperator(), is(GoAssignmentStatement.Operator.ASSIGN));
		assertThat(forRange.getKey(), is(new GoVariableName(null, ":k")));
	}

	@Test
	public void testSelectorNames() throws GoParseException {
		GoModule module = parseAndRevert("package main\n\nfunc main() {\n\tp.T_x = 1\n}\n");
		assertThat(FormattingTools.format(module), is("package main\n\nfunc main() {\n\tp.:x = 1\n}\n"));
	}

	@Test
	public void testUntaggedNamesAreKept() throws GoParseException {
		String source = "package main\n\nfunc main() {\n\tx = T\n\ty = _T\n}\n";
		assertThat(FormattingTools.format(parseAndRevert(source)), is(source));
	}

}
