package colongo;

import static org.junit.Assert.*;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import colongo.parser.GoParseException;

public class TranslatorOptionsTest {

	// configuration with both prefixes set
	private JSONObject config;

	@Before
	public void setup() {
		config = new JSONObject("{\"prefixes\": {\"declaration\": \"decl_\", \"temporary\": \"tmp_\"}}");
	}

	private JSONObject getPrefixes() {
		return config.getJSONObject(TranslatorOptions.PREFIXES_FIELD);
	}

	@Test
	public void testConfiguredPrefixes() {
		TranslatorOptions options = new TranslatorOptions(config);
		assertEquals("decl_", options.getDeclarationTag());
		assertEquals("tmp_", options.getTemporaryTag());
	}

	// the defaults are used when the configuration says nothing
	@Test
	public void testNoPrefixes() {
		config.remove(TranslatorOptions.PREFIXES_FIELD);
		TranslatorOptions options = new TranslatorOptions(config);
		assertEquals(TranslatorOptions.DEFAULT_DECLARATION_TAG, options.getDeclarationTag());
		assertEquals(TranslatorOptions.DEFAULT_TEMPORARY_TAG, options.getTemporaryTag());
	}

	// each prefix falls back to its default on its own
	@Test
	public void testMissingTemporaryPrefix() {
		getPrefixes().remove(TranslatorOptions.TEMPORARY_FIELD);
		TranslatorOptions options = new TranslatorOptions(config);
		assertEquals("decl_", options.getDeclarationTag());
		assertEquals(TranslatorOptions.DEFAULT_TEMPORARY_TAG, options.getTemporaryTag());
	}

	@Test(expected = ColonGoOptionException.class)
	public void testPrefixesNotAnObject() {
		config.put(TranslatorOptions.PREFIXES_FIELD, "decl_");
		new TranslatorOptions(config);
	}

	@Test(expected = ColonGoOptionException.class)
	public void testEmptyPrefix() {
		getPrefixes().put(TranslatorOptions.DECLARATION_FIELD, "");
		new TranslatorOptions(config);
	}

	@Test(expected = ColonGoOptionException.class)
	public void testPrefixStartingWithDigit() {
		getPrefixes().put(TranslatorOptions.TEMPORARY_FIELD, "1tmp");
		new TranslatorOptions(config);
	}

	@Test(expected = ColonGoOptionException.class)
	public void testPrefixWithPunctuation() {
		getPrefixes().put(TranslatorOptions.DECLARATION_FIELD, "decl-");
		new TranslatorOptions(config);
	}

	// a temporary name could otherwise be read back as a declaration marker
	@Test(expected = ColonGoOptionException.class)
	public void testOverlappingPrefixes() {
		getPrefixes().put(TranslatorOptions.TEMPORARY_FIELD, "decl_tmp_");
		new TranslatorOptions(config);
	}

	@Test
	public void testUnicodeLettersAreAllowed() {
		getPrefixes().put(TranslatorOptions.DECLARATION_FIELD, "déclaration_");
		assertEquals("déclaration_", new TranslatorOptions(config).getDeclarationTag());
	}

	@Test
	public void testCustomPrefixesReachTheOutput() throws GoParseException {
		Translator translator = new Translator(new TranslatorOptions(config));
		byte[] source = "package main\n\nfunc main() {\n\t:x, y = f()\n}\n".getBytes(StandardCharsets.UTF_8);
		String translated = new String(translator.translate("TEST", source).getTranslated(), StandardCharsets.UTF_8);
		assertEquals("package main\n\nfunc main() {\n\ttmp_0, tmp_1 := f()\n\tvar x = tmp_0\n\ty = tmp_1\n}\n",
				translated);
	}

}
