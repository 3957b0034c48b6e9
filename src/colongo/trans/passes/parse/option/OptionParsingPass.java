package colongo.trans.passes.parse.option;

import colongo.ColonGoOptionException;
import colongo.ColonGoOptions;
import colongo.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static ColonGoOptions perform(IssueContext ctx, Logger logger, String[] args) {
		ColonGoOptions opts = new ColonGoOptions(args);
		try {
			opts.parse();
		} catch (ColonGoOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		// the console handler drops detailed records unless told otherwise
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
