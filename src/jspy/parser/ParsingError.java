package jspy.parser;

import jspy.util.SourceLocation;

/**
 * A syntax error reported by the JavaScript front end, or a construct the front end cannot represent.
 */
public class ParsingError extends Exception {

	private static final long serialVersionUID = -3398213905118127054L;

	private final SourceLocation location;
	private final String reason;

	public ParsingError(SourceLocation location, String reason) {
		super(reason + " " + location.prettyString());
		this.location = location;
		this.reason = reason;
	}

	public ParsingError(SourceLocation location, String reason, Throwable cause) {
		this(location, reason);
		initCause(cause);
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}
}
