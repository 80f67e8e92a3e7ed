package jspy.trans.passes.imports;

import jspy.model.py.PyImport;
import jspy.model.py.PyImportFrom;
import jspy.model.py.PyModule;
import jspy.model.py.PyRuntime;
import jspy.model.py.builder.PyModuleBuilder;
import jspy.trans.passes.codegen.RequiredSymbols;
import jspy.trans.passes.codegen.TranslationResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Prepends the import statements a translated body needs: aliased standard library modules sorted by module
 * name, then a single import of the runtime symbols in sorted order.
 */
public class ImportEmissionPass {
	private ImportEmissionPass() {}

	public static PyModule perform(String moduleName, TranslationResult result, String runtimeModule) {
		RequiredSymbols symbols = result.getRequiredSymbols();
		PyModuleBuilder module = new PyModuleBuilder(moduleName);

		List<PyRuntime.StdlibModule> modules = new ArrayList<>(symbols.getStdlibModules());
		modules.sort(Comparator.comparing(PyRuntime.StdlibModule::getModuleName));
		for (PyRuntime.StdlibModule stdlib : modules) {
			module.addStatement(new PyImport(stdlib.getModuleName(), stdlib.getAlias()));
		}
		if (!symbols.getRuntimeSymbols().isEmpty()) {
			// getRuntimeSymbols is a sorted set
			module.addStatement(new PyImportFrom(runtimeModule, new ArrayList<>(symbols.getRuntimeSymbols())));
		}

		module.addAll(result.getBody());
		return module.getModule();
	}
}
