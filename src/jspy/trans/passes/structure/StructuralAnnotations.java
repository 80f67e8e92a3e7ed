package jspy.trans.passes.structure;

import jspy.InternalCompilerError;
import jspy.model.js.JSNode;
import jspy.model.js.JSStatement;
import jspy.scope.UID;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Side tables produced by {@link StructuralAnalysisPass}. Keys are node UIDs; the input tree is never modified.
 *
 * "Function roots" are the program node and every function declaration.
 */
public class StructuralAnnotations {

	private final Map<UID, Integer> loopIds = new HashMap<>();
	private final Map<UID, Integer> enclosingLoopIds = new HashMap<>();
	private final Set<UID> insideDispatch = new HashSet<>();
	private final Map<UID, Set<String>> hoistedNames = new HashMap<>();
	private final Map<UID, Set<String>> functionNames = new HashMap<>();
	private final Map<UID, Set<String>> freeAssignedNames = new HashMap<>();

	void setLoopId(JSStatement loop, int id) {
		if (loopIds.containsKey(loop.getUID())) {
			throw new InternalCompilerError("loop id assigned twice");
		}
		loopIds.put(loop.getUID(), id);
	}

	void setEnclosingLoopId(JSStatement statement, Integer id) {
		if (id != null) {
			enclosingLoopIds.put(statement.getUID(), id);
		}
	}

	void setInsideDispatch(JSStatement statement) {
		insideDispatch.add(statement.getUID());
	}

	void setFunctionRoot(JSNode root, Set<String> hoisted, Set<String> functions, Set<String> freeAssigned) {
		hoistedNames.put(root.getUID(), Collections.unmodifiableSet(new LinkedHashSet<>(hoisted)));
		functionNames.put(root.getUID(), Collections.unmodifiableSet(new LinkedHashSet<>(functions)));
		freeAssignedNames.put(root.getUID(), Collections.unmodifiableSet(new LinkedHashSet<>(freeAssigned)));
	}

	/**
	 * @return the id assigned to a while, do-while, for or for-in statement
	 */
	public int getLoopId(JSStatement loop) {
		Integer id = loopIds.get(loop.getUID());
		if (id == null) {
			throw new InternalCompilerError("no loop id for " + loop);
		}
		return id;
	}

	/**
	 * @return the id of the innermost loop enclosing the statement within its function, or null if there is none
	 */
	public Integer getEnclosingLoopId(JSStatement statement) {
		return enclosingLoopIds.get(statement.getUID());
	}

	/**
	 * @return true if the innermost jump target enclosing the statement is a switch
	 */
	public boolean isInsideDispatch(JSStatement statement) {
		return insideDispatch.contains(statement.getUID());
	}

	/**
	 * @return the var-declared names of a function root in first-declaration order, without parameters
	 */
	public Set<String> getHoistedNames(JSNode functionRoot) {
		return lookupRoot(hoistedNames, functionRoot);
	}

	/**
	 * @return names of the function declarations that appear directly in a function root's body
	 */
	public Set<String> getFunctionNames(JSNode functionRoot) {
		return lookupRoot(functionNames, functionRoot);
	}

	/**
	 * @return names assigned inside a function root that the function itself does not declare
	 */
	public Set<String> getFreeAssignedNames(JSNode functionRoot) {
		return lookupRoot(freeAssignedNames, functionRoot);
	}

	private static Set<String> lookupRoot(Map<UID, Set<String>> table, JSNode functionRoot) {
		Set<String> result = table.get(functionRoot.getUID());
		if (result == null) {
			throw new InternalCompilerError("not a function root: " + functionRoot);
		}
		return result;
	}
}
