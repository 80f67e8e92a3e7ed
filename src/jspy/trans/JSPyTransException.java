package jspy.trans;

/**
 * Aborts a translation. The message holds the formatted issues that stopped it.
 */
public class JSPyTransException extends RuntimeException {

	private static final long serialVersionUID = 6285173406628925531L;

	public JSPyTransException(String formattedIssues) {
		super(formattedIssues);
	}
}
