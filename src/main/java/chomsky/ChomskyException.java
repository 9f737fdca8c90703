package chomsky;

/**
 * Base class of all errors raised while reading or normalizing a grammar.
 */
public class ChomskyException extends RuntimeException {

	public ChomskyException(String message) {
		super(message);
	}
}
