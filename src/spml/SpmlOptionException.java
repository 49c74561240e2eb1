package spml;

/**
 * A problem with the command line or the configuration file.
 */
@SuppressWarnings("serial")
public class SpmlOptionException extends Exception {
	public SpmlOptionException(String message) {
		super(message);
	}
}
