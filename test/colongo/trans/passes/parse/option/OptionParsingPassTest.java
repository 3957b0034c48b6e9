package colongo.trans.passes.parse.option;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import colongo.ColonGoOptions;
import colongo.TranslatorOptions;
import colongo.errors.TopLevelIssueContext;

public class OptionParsingPassTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final TopLevelIssueContext ctx = new TopLevelIssueContext();
	private final Logger logger = Logger.getLogger("colongo.test");

	private String writeConfig(String json) throws IOException {
		File config = folder.newFile("config.json");
		FileUtils.writeStringToFile(config, json, StandardCharsets.UTF_8);
		return config.getPath();
	}

	@Test
	public void testDefaults() {
		ColonGoOptions opts = OptionParsingPass.perform(ctx, logger, new String[]{"main.cgo"});
		assertFalse(ctx.hasErrors());
		assertFalse(opts.formatOnly);
		assertThat(opts.inputFilePaths, is(Collections.singletonList("main.cgo")));
		assertThat(opts.translatorOptions.getDeclarationTag(), is(TranslatorOptions.DEFAULT_DECLARATION_TAG));
		assertThat(logger.getLevel(), is(Level.INFO));
	}

	@Test
	public void testFlags() {
		ColonGoOptions opts = OptionParsingPass.perform(ctx, logger, new String[]{"-v", "-f", "a.cgo", "b.cgo"});
		assertFalse(ctx.hasErrors());
		assertTrue(opts.formatOnly);
		assertThat(opts.inputFilePaths.size(), is(2));
		assertThat(logger.getLevel(), is(Level.FINE));
	}

	@Test
	public void testQuiet() {
		OptionParsingPass.perform(ctx, logger, new String[]{"-q", "a.cgo"});
		assertThat(logger.getLevel(), is(Level.WARNING));
	}

	@Test
	public void testConfigFile() throws IOException {
		String config = writeConfig("{\"prefixes\": {\"temporary\": \"tmp_\"}}");
		ColonGoOptions opts = OptionParsingPass.perform(ctx, logger, new String[]{"-c", config, "a.cgo"});
		assertFalse(ctx.hasErrors());
		assertThat(opts.translatorOptions.getTemporaryTag(), is("tmp_"));
		assertThat(opts.translatorOptions.getDeclarationTag(), is(TranslatorOptions.DEFAULT_DECLARATION_TAG));
	}

	@Test
	public void testMalformedConfigFile() throws IOException {
		String config = writeConfig("{\"prefixes\": ");
		OptionParsingPass.perform(ctx, logger, new String[]{"-c", config, "a.cgo"});
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(OptionParserIssue.class));
		assertThat(ctx.getIssues().get(0).getMessage(), startsWith("unable to parse options: " + config));
	}

	@Test
	public void testMissingConfigFile() {
		String config = new File(folder.getRoot(), "missing.json").getPath();
		OptionParsingPass.perform(ctx, logger, new String[]{"-c", config, "a.cgo"});
		assertThat(ctx.getIssues().get(0).getMessage(),
				startsWith("unable to parse options: Error reading configuration file"));
	}

	@Test
	public void testInvalidPrefix() throws IOException {
		String config = writeConfig("{\"prefixes\": {\"declaration\": \"x-\"}}");
		OptionParsingPass.perform(ctx, logger, new String[]{"-c", config, "a.cgo"});
		assertThat(ctx.getIssues().get(0).getMessage(), is(
				"unable to parse options: the declaration prefix may only contain letters, digits and '_': x-"));
	}

}
