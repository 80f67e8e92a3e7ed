package jspy;

import jspy.errors.TopLevelIssueContext;
import jspy.model.py.PyModule;
import jspy.trans.IOErrorIssue;
import jspy.trans.JSPyTranslator;
import jspy.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Command line entry point: reads one JavaScript file and writes the translated Python module.
 */
public class JSPyMain {
	private static final Logger logger = Logger.getLogger("JSPy");

	private final String[] cmdArgs;
	private final TopLevelIssueContext ctx = new TopLevelIssueContext();

	public JSPyMain(String[] args) {
		cmdArgs = args;
	}

	public static void main(String[] args) {
		if (new JSPyMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * @return true if the output file was written; otherwise the issues have been printed to stderr
	 */
	public boolean run() {
		JSPyOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (opts == null) {
			report();
			System.err.println("Run with -h for usage.");
			return false;
		}

		Path inputFilePath = Paths.get(opts.inputFilePath);
		String source;
		try {
			logger.info("Reading " + inputFilePath);
			source = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			report();
			return false;
		}

		PyModule module = JSPyTranslator.translate(ctx, inputFilePath, source, opts.toTranslationOptions());
		if (module == null) {
			report();
			return false;
		}

		File destFile = new File(opts.destFile);
		try {
			logger.info("Writing Python module to \"" + destFile + "\"");
			FileUtils.writeStringToFile(destFile, JSPyTranslator.format(module), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			report();
			return false;
		}
		return true;
	}

	TopLevelIssueContext getIssueContext() {
		return ctx;
	}

	private void report() {
		logger.severe("found issues");
		System.err.println(ctx.format());
	}
}
