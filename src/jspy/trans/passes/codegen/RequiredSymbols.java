package jspy.trans.passes.codegen;

import jspy.InternalCompilerError;
import jspy.model.py.PyName;
import jspy.model.py.PyRuntime;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runtime symbols and standard library modules referenced by generated code. Entries are only ever added.
 */
public class RequiredSymbols {

	private final Set<String> runtimeSymbols = new TreeSet<>();
	private final Set<PyRuntime.StdlibModule> stdlibModules = EnumSet.noneOf(PyRuntime.StdlibModule.class);

	/**
	 * Records a use of a runtime library symbol and returns a reference to it.
	 */
	public PyName runtime(String symbol) {
		if (!PyRuntime.ALL.contains(symbol)) {
			throw new InternalCompilerError("unknown runtime symbol " + symbol);
		}
		runtimeSymbols.add(symbol);
		return new PyName(symbol);
	}

	/**
	 * Records a use of a standard library module and returns a reference to its alias.
	 */
	public PyName stdlib(PyRuntime.StdlibModule module) {
		stdlibModules.add(module);
		return new PyName(module.getAlias());
	}

	public Set<String> getRuntimeSymbols() {
		return Collections.unmodifiableSet(runtimeSymbols);
	}

	public Set<PyRuntime.StdlibModule> getStdlibModules() {
		return Collections.unmodifiableSet(stdlibModules);
	}

	public boolean isEmpty() {
		return runtimeSymbols.isEmpty() && stdlibModules.isEmpty();
	}
}
