package colongo;

import colongo.errors.Issue;
import colongo.errors.TopLevelIssueContext;
import colongo.parser.GoParseException;
import colongo.trans.IOErrorIssue;
import colongo.trans.passes.parse.ParsingIssue;
import colongo.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class ColonGoMain {
	private String[] cmdArgs;
	private static Logger logger;

	public ColonGoMain(String[] args) {
		cmdArgs = args;
		// the parent of every logger in the project
		logger = Logger.getLogger("colongo");
	}

	// Creates a ColonGoMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new ColonGoMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		ColonGoOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}

		Translator translator = new Translator(opts.translatorOptions);
		boolean success = true;
		for (String inputFilePath : opts.inputFilePaths) {
			success &= translateFile(translator, opts.formatOnly, inputFilePath);
		}
		return success;
	}

	private boolean translateFile(Translator translator, boolean formatOnly, String inputFilePath) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			logger.info("Reading \"" + inputFilePath + "\"");
			byte[] source = FileUtils.readFileToByteArray(new File(inputFilePath));

			logger.info("Translating \"" + inputFilePath + "\"");
			TranslationResult result = translator.translate(inputFilePath, source);
			if (result.isSuccessful()) {
				System.out.write(formatOnly ? result.getFormatted() : result.getTranslated());
				System.out.flush();
			} else {
				for (Issue issue : result.getIssues()) {
					ctx.error(issue);
				}
			}
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(Paths.get(inputFilePath), e));
		} catch (GoParseException e) {
			ctx.error(new ParsingIssue(e));
		}
		if (ctx.hasErrors()) {
			logger.severe("found issues in \"" + inputFilePath + "\"");
			System.err.println(ctx.format());
			return false;
		}
		return true;
	}

}
