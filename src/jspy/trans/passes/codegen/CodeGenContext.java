package jspy.trans.passes.codegen;

import jspy.InternalCompilerError;
import jspy.model.js.JSIdentifier;
import jspy.model.py.PyCall;
import jspy.model.py.PyExpression;
import jspy.model.py.PyName;
import jspy.model.py.PyStatement;
import jspy.scope.ScopeResolver;
import jspy.trans.TranslationOptions;
import jspy.trans.issues.UnresolvedBindingIssue;
import jspy.trans.passes.structure.StructuralAnnotations;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State shared by the statement and expression translators for one translation unit.
 */
public class CodeGenContext {

	/**
	 * Names that need no declaration: they are translated to Python constants or library references.
	 */
	public static final Set<String> KNOWN_GLOBALS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"undefined", "NaN", "Infinity", "Math", "console", "Date")));

	private final StructuralAnnotations annotations;
	private final TranslationOptions options;
	private final ScopeResolver resolver;
	private final TempAllocator temps;
	private final RequiredSymbols symbols;

	// loop id -> statements to run before a continue that targets the loop
	private final Map<Integer, List<PyStatement>> continuePreludes;

	public CodeGenContext(StructuralAnnotations annotations, TranslationOptions options) {
		this.annotations = annotations;
		this.options = options;
		this.resolver = new ScopeResolver();
		this.temps = new TempAllocator();
		this.symbols = new RequiredSymbols();
		this.continuePreludes = new HashMap<>();
	}

	public StructuralAnnotations getAnnotations() {
		return annotations;
	}

	public TranslationOptions getOptions() {
		return options;
	}

	public ScopeResolver getResolver() {
		return resolver;
	}

	public TempAllocator getTemps() {
		return temps;
	}

	public RequiredSymbols getSymbols() {
		return symbols;
	}

	public PyName freshTemp() {
		return new PyName(temps.next());
	}

	public PyCall callRuntime(String symbol, PyExpression... arguments) {
		return new PyCall(symbols.runtime(symbol), Arrays.asList(arguments));
	}

	/**
	 * True if the identifier refers to a library global rather than a user binding.
	 */
	public boolean isKnownGlobal(String name) {
		return KNOWN_GLOBALS.contains(name) && !resolver.isDeclared(name);
	}

	/**
	 * Resolves an identifier that is read or written, enforcing strict bindings when enabled.
	 */
	public PyName resolveBinding(JSIdentifier identifier) {
		String name = identifier.getName();
		if (!resolver.isDeclared(name) && options.isStrictBindings()) {
			throw new UnresolvedBindingIssue(identifier, name);
		}
		return new PyName(resolver.lookup(name));
	}

	public void setContinuePrelude(int loopId, List<PyStatement> prelude) {
		continuePreludes.put(loopId, Collections.unmodifiableList(prelude));
	}

	public List<PyStatement> getContinuePrelude(int loopId) {
		List<PyStatement> prelude = continuePreludes.get(loopId);
		if (prelude == null) {
			throw new InternalCompilerError("continue targets loop " + loopId + " which is not being translated");
		}
		return prelude;
	}
}
