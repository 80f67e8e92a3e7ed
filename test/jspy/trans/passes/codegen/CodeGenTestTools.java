package jspy.trans.passes.codegen;

import jspy.trans.JSPyTranslator;
import jspy.trans.TranslationOptions;

public class CodeGenTestTools {
	private CodeGenTestTools() {}

	public static String translate(String source) {
		return JSPyTranslator.translateToString(source, TranslationOptions.defaults());
	}

	public static String lines(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	public static String lastLine(String output) {
		String[] lines = output.split("\n");
		return lines[lines.length - 1];
	}
}
