package jspy;

/**
 * Invalid command line flag or configuration file value
 */
public class JSPyOptionException extends Exception {

	private static final long serialVersionUID = 4105172283511738241L;

	public JSPyOptionException(String msg) {
		super(msg);
	}

	public JSPyOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
