package jspy.trans.passes.parse.option;

import jspy.JSPyOptionException;
import jspy.JSPyOptions;
import jspy.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	/**
	 * Parses the command line and the config file it names, then sets the verbosity of logger.
	 *
	 * @return the merged options, or null after reporting an {@link OptionParserIssue} to ctx
	 */
	public static JSPyOptions perform(IssueContext ctx, Logger logger, String[] args) {
		JSPyOptions opts;
		try {
			opts = new JSPyOptions(args);
			opts.parse();
		} catch (JSPyOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
			return null;
		}
		Level level = logLevel(opts);
		logger.setLevel(level);
		// records reach the console through the root handlers, which filter on their own level
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}

	static Level logLevel(JSPyOptions opts) {
		if (opts.logLvlQuiet) {
			return Level.WARNING;
		}
		return opts.logLvlVerbose ? Level.FINEST : Level.INFO;
	}
}
