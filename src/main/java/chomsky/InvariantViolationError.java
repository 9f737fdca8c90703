package chomsky;

/**
 * Thrown when an internal invariant doesn't hold. This is a programming error, never a problem
 * of the user supplied grammar.
 */
public class InvariantViolationError extends ChomskyException {

	public InvariantViolationError(String message) {
		super(message);
	}
}
