package colongo.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static colongo.lexer.GoTokenType.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import colongo.errors.TopLevelIssueContext;
import colongo.util.SourceFile;

@RunWith(Parameterized.class)
public class GoLexerTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ "a := b", Arrays.asList(IDENT, DEFINE, IDENT, SEMICOLON, EOF) },
			{ ":x, y = f()", Arrays.asList(COLON, IDENT, COMMA, IDENT, ASSIGN, IDENT, LPAREN, RPAREN, SEMICOLON, EOF) },
			{ "a[1:n]", Arrays.asList(IDENT, LBRACK, INT, COLON, IDENT, RBRACK, SEMICOLON, EOF) },
			{ "return\n}", Arrays.asList(RETURN, SEMICOLON, RBRACE, SEMICOLON, EOF) },
			{ "x // trailing\ny", Arrays.asList(IDENT, SEMICOLON, IDENT, SEMICOLON, EOF) },
			{ "x /* inline */ + y", Arrays.asList(IDENT, ADD, IDENT, SEMICOLON, EOF) },
			{ "if x {\n}\n", Arrays.asList(IF, IDENT, LBRACE, RBRACE, SEMICOLON, EOF) },
			{ "1.5 2i 0x1F 'a' \"s\" `r`", Arrays.asList(FLOAT, IMAG, INT, CHAR, STRING, STRING, SEMICOLON, EOF) },
			{ "a &^= b", Arrays.asList(IDENT, AND_NOT_ASSIGN, IDENT, SEMICOLON, EOF) },
			{ "ch <- <-in", Arrays.asList(IDENT, ARROW, ARROW, IDENT, SEMICOLON, EOF) },
			{ "f(a...)", Arrays.asList(IDENT, LPAREN, IDENT, ELLIPSIS, RPAREN, SEMICOLON, EOF) },
			{ "L:\n\tfor {", Arrays.asList(IDENT, COLON, FOR, LBRACE, EOF) },
			{ "x++\n", Arrays.asList(IDENT, INC, SEMICOLON, EOF) },
			{ "héllo", Arrays.asList(IDENT, SEMICOLON, EOF) },
		});
	}

	private String source;
	private List<GoTokenType> expected;

	public GoLexerTest(String source, List<GoTokenType> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<GoToken> tokens = new GoLexer(new SourceFile(Paths.get("TEST"), source), false).readTokens(ctx);
		List<GoTokenType> actual = new ArrayList<>();
		for (GoToken token : tokens) {
			actual.add(token.getType());
		}
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(actual, is(expected));
	}

}
