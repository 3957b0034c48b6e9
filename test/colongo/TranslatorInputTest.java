package colongo;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import colongo.lexer.LexerIssue;
import colongo.parser.GoParseException;

public class TranslatorInputTest {

	private static byte[] bytes(String text) {
		return text.getBytes(StandardCharsets.UTF_8);
	}

	@Test
	public void testMalformedUTF8IsReported() throws GoParseException {
		ByteArrayOutputStream source = new ByteArrayOutputStream();
		source.write(bytes("package main\n\nvar s = \"a"), 0, 24);
		source.write(0xFF);
		source.write(bytes("b\"\n"), 0, 3);

		TranslationResult result = new Translator().translate("p.cgo", source.toByteArray());
		assertFalse(result.isSuccessful());
		assertThat(result.getTranslated(), is(nullValue()));
		assertThat(result.getFormatted(), is(nullValue()));
		assertThat(result.getIssues().size(), is(1));
		assertThat(result.getIssues().get(0), instanceOf(LexerIssue.class));
		assertThat(result.getIssues().get(0).getMessage(), is("p.cgo:3:11: illegal UTF-8 encoding"));
	}

	@Test
	public void testTruncatedSequenceAtEndIsReported() throws GoParseException {
		byte[] valid = bytes("package main\n// é");
		byte[] truncated = new byte[valid.length - 1];
		System.arraycopy(valid, 0, truncated, 0, truncated.length);

		TranslationResult result = new Translator().translate("p.cgo", truncated);
		assertFalse(result.isSuccessful());
		assertThat(result.getIssues().get(0).getMessage(), is("p.cgo:2:4: illegal UTF-8 encoding"));
	}

	@Test
	public void testMultiByteCharactersArePreserved() throws GoParseException {
		String source = "package main\n\nvar s = \"héllo, 世界\"\n";
		TranslationResult result = new Translator().translate("p.cgo", bytes(source));
		assertTrue(result.isSuccessful());
		assertThat(new String(result.getTranslated(), StandardCharsets.UTF_8), is(source));
	}

	@Test
	public void testLeadingByteOrderMarkIsSkipped() throws GoParseException {
		TranslationResult result = new Translator().translate("p.cgo", bytes("\uFEFFpackage main\n"));
		assertTrue(result.isSuccessful());
		assertThat(new String(result.getTranslated(), StandardCharsets.UTF_8), is("package main\n"));
	}

}
