package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSVariableDeclaration extends JSStatement {

	public enum Kind {
		VAR,
		LET,
		CONST,
	}

	private final Kind kind;
	private final List<JSVariableDeclarator> declarations;

	public JSVariableDeclaration(SourceLocation location, Kind kind, List<JSVariableDeclarator> declarations) {
		super(location);
		this.kind = kind;
		this.declarations = declarations;
	}

	public Kind getDeclarationKind() {
		return kind;
	}

	public List<JSVariableDeclarator> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, declarations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSVariableDeclaration other = (JSVariableDeclaration) obj;
		return Objects.equals(kind, other.kind) &&
				Objects.equals(declarations, other.declarations);
	}
}
