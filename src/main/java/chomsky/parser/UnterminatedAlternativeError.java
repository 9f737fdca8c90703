package chomsky.parser;

/**
 * The line ends with a <code>|</code> that isn't followed by an alternative.
 * Use an explicit ε to add an empty alternative.
 */
public class UnterminatedAlternativeError extends GrammarParseException {

	public UnterminatedAlternativeError(int lineIndex, String line) {
		super(lineIndex, line, "trailing '|' without a following alternative (write ε for the empty word)");
	}
}
