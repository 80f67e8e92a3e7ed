package jspy.trans.passes.codegen;

import jspy.model.py.PyStatement;

import java.util.Collections;
import java.util.List;

/**
 * Translated module body, before import emission, and the symbols it requires.
 */
public class TranslationResult {

	private final List<PyStatement> body;
	private final RequiredSymbols requiredSymbols;

	public TranslationResult(List<PyStatement> body, RequiredSymbols requiredSymbols) {
		this.body = Collections.unmodifiableList(body);
		this.requiredSymbols = requiredSymbols;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	public RequiredSymbols getRequiredSymbols() {
		return requiredSymbols;
	}
}
