package jspy.trans;

import jspy.Unreachable;
import jspy.errors.Issue;
import jspy.errors.IssueContext;
import jspy.formatters.IndentingWriter;
import jspy.formatters.PyNodeFormattingVisitor;
import jspy.model.js.JSProgram;
import jspy.model.py.PyModule;
import jspy.trans.passes.codegen.PythonCodeGenPass;
import jspy.trans.passes.codegen.TranslationResult;
import jspy.trans.passes.imports.ImportEmissionPass;
import jspy.trans.passes.parse.JSParsingPass;
import jspy.trans.passes.structure.StructuralAnalysisPass;
import jspy.trans.passes.structure.StructuralAnnotations;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Runs the translation pipeline for one source unit: parsing, structural analysis, code generation and import
 * emission. The first error aborts the unit.
 */
public final class JSPyTranslator {

	private static final Logger logger = Logger.getLogger("JSPy");

	private JSPyTranslator() {}

	/**
	 * @return the translated module, or null if an issue was reported to {@code ctx}
	 */
	public static PyModule translate(IssueContext ctx, Path inputFilePath, CharSequence source,
	                                 TranslationOptions options) {
		logger.info("Parsing JavaScript");
		JSProgram program = JSParsingPass.perform(ctx, inputFilePath, source);
		if (ctx.hasErrors()) {
			return null;
		}
		try {
			logger.info("Analysing control flow structure");
			StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);

			logger.info("Generating Python code");
			TranslationResult result = PythonCodeGenPass.perform(annotations, program, options);
			logger.fine(() -> "Runtime symbols: " + result.getRequiredSymbols().getRuntimeSymbols()
					+ ", stdlib modules: " + result.getRequiredSymbols().getStdlibModules());

			logger.info("Emitting imports");
			return ImportEmissionPass.perform(moduleName(inputFilePath), result, options.getRuntimeModule());
		} catch (Issue issue) {
			ctx.error(issue);
			return null;
		}
	}

	/**
	 * Translates source text, throwing the first issue found.
	 */
	public static String translateToString(CharSequence source, TranslationOptions options) {
		FailFastIssueContext ctx = new FailFastIssueContext();
		PyModule module = translate(ctx, Paths.get("input.js"), source, options);
		return format(module);
	}

	public static String format(PyModule module) {
		StringWriter writer = new StringWriter();
		IndentingWriter out = new IndentingWriter(writer);
		try {
			module.accept(new PyNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return writer.toString();
	}

	private static String moduleName(Path inputFilePath) {
		String fileName = inputFilePath.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	private static final class FailFastIssueContext extends IssueContext {
		@Override
		public void error(Issue err) {
			throw err;
		}

		@Override
		public boolean hasErrors() {
			return false;
		}
	}
}
