package jspy.scope;

import jspy.InternalCompilerError;

/**
 * Tracks JavaScript function scopes during translation and maps original identifiers to the names used in the
 * generated Python.
 *
 * The resolver starts with a single root scope for the program. Each translation owns its own instance.
 */
public class ScopeResolver {

	/**
	 * Where a name is bound, relative to the innermost scope.
	 */
	public enum Binding {
		LOCAL,
		ENCLOSING_FUNCTION,
		MODULE,
		UNDECLARED,
	}

	private ChainMap<String, String> current;
	private int depth;

	public ScopeResolver() {
		this.current = new ChainMap<>(null);
		this.depth = 0;
	}

	public void enterScope() {
		current = new ChainMap<>(current);
		depth++;
	}

	public void exitScope() {
		if (depth == 0) {
			throw new InternalCompilerError("cannot exit the root scope");
		}
		current = current.getParent();
		depth--;
	}

	/**
	 * @return the number of scopes entered and not yet exited
	 */
	public int getDepth() {
		return depth;
	}

	/**
	 * Declares a name in the innermost scope. Declaring a name twice yields the same result.
	 */
	public String declare(String name) {
		String resolved = IdentifierSanitizer.sanitize(name);
		current.put(name, resolved);
		return resolved;
	}

	public String lookup(String name) {
		String resolved = current.get(name);
		if (resolved != null) {
			return resolved;
		}
		return IdentifierSanitizer.sanitize(name);
	}

	public boolean isDeclared(String name) {
		return current.containsKey(name);
	}

	public Binding getBinding(String name) {
		int hops = current.hopsTo(name);
		if (hops < 0) {
			return Binding.UNDECLARED;
		}
		if (hops == 0) {
			return Binding.LOCAL;
		}
		return hops == depth ? Binding.MODULE : Binding.ENCLOSING_FUNCTION;
	}
}
