package colongo;

import colongo.errors.IssueContext;
import colongo.errors.TopLevelIssueContext;
import colongo.formatters.FormattingTools;
import colongo.lexer.LexerIssue;
import colongo.model.golang.GoModule;
import colongo.parser.GoParseException;
import colongo.parser.GoParser;
import colongo.trans.passes.desugar.DesugaringPass;
import colongo.trans.passes.revert.MarkerRevertingPass;
import colongo.trans.passes.rewrite.MarkerRewritingPass;
import colongo.trans.passes.rewrite.RewrittenSource;
import colongo.util.SourceFile;
import colongo.util.SourceLocation;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Translates Go with colon-prefixed declarations into plain Go.
 *
 * A translator keeps no state between calls, so one instance may translate several inputs at
 * the same time.
 */
public class Translator {

	private static final Logger logger = Logger.getLogger(Translator.class.getName());

	private final TranslatorOptions options;

	public Translator(TranslatorOptions options) {
		this.options = options;
	}

	public Translator() {
		this(TranslatorOptions.defaults());
	}

	public TranslatorOptions getOptions() {
		return options;
	}

	/**
	 * @param name the name locations are reported against, usually the input's path
	 * @param source UTF-8 encoded Go source
	 * @throws GoParseException if the input, once its markers are encoded, is not valid Go
	 */
	public TranslationResult translate(String name, byte[] source) throws GoParseException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String text = decode(ctx, Paths.get(name), source);
		if (text == null) {
			return TranslationResult.failure(ctx.getSortedIssues());
		}
		SourceFile file = new SourceFile(Paths.get(name), text);

		logger.fine("Encoding markers in " + name);
		RewrittenSource rewritten = MarkerRewritingPass.perform(ctx, file, options.getDeclarationTag());
		if (rewritten == null) {
			return TranslationResult.failure(ctx.getSortedIssues());
		}

		logger.fine("Parsing " + name);
		GoModule module = GoParser.readModule(file.remapped(rewritten.getOffsetMap()), rewritten.getText());
		MarkerRevertingPass.perform(module, options.getDeclarationTag());
		String formatted = FormattingTools.format(module);

		logger.fine("Desugaring declarations in " + name);
		DesugaringPass.perform(ctx, module, options.getTemporaryTag());
		if (ctx.hasErrors()) {
			return TranslationResult.failure(ctx.getSortedIssues());
		}
		String translated = FormattingTools.format(module);

		return TranslationResult.success(
				formatted.getBytes(StandardCharsets.UTF_8),
				translated.getBytes(StandardCharsets.UTF_8));
	}

	// malformed input is reported where it starts rather than replaced
	private static String decode(IssueContext ctx, Path path, byte[] source) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		CharBuffer out = CharBuffer.allocate(source.length);
		CoderResult result = decoder.decode(ByteBuffer.wrap(source), out, true);
		if (!result.isError()) {
			result = decoder.flush(out);
		}
		out.flip();
		if (result.isError()) {
			String valid = out.toString();
			SourceLocation location = new SourceFile(path, valid).locate(valid.length(), valid.length());
			ctx.error(new LexerIssue(location, "illegal UTF-8 encoding"));
			return null;
		}
		return out.toString();
	}

}
