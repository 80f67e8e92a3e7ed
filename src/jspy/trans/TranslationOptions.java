package jspy.trans;

import jspy.model.py.PyRuntime;

/**
 * Settings that change the generated code.
 */
public class TranslationOptions {

	private final String runtimeModule;
	private final boolean strictBindings;

	public TranslationOptions(String runtimeModule, boolean strictBindings) {
		this.runtimeModule = runtimeModule;
		this.strictBindings = strictBindings;
	}

	public static TranslationOptions defaults() {
		return new TranslationOptions(PyRuntime.DEFAULT_MODULE, true);
	}

	/**
	 * @return the module generated code imports runtime helpers from
	 */
	public String getRuntimeModule() {
		return runtimeModule;
	}

	/**
	 * @return true if references to undeclared identifiers are rejected
	 */
	public boolean isStrictBindings() {
		return strictBindings;
	}
}
