package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * An object literal entry. Keys are kept as text whatever form they were written in.
 */
public class JSObjectProperty extends JSNode {

	public enum Kind {
		INIT,
		GET,
		SET,
	}

	private final String key;
	private final JSExpression value;
	private final Kind kind;

	public JSObjectProperty(SourceLocation location, String key, JSExpression value, Kind kind) {
		super(location);
		this.key = key;
		this.value = value;
		this.kind = kind;
	}

	public String getKey() {
		return key;
	}

	public JSExpression getValue() {
		return value;
	}

	public Kind getPropertyKind() {
		return kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value, kind);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSObjectProperty other = (JSObjectProperty) obj;
		return Objects.equals(key, other.key) &&
				Objects.equals(value, other.value) &&
				Objects.equals(kind, other.kind);
	}
}
