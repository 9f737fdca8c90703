package chomsky.parser;

/**
 * There is nothing in front of the arrow.
 */
public class EmptyHeadError extends GrammarParseException {

	public EmptyHeadError(int lineIndex, String line) {
		super(lineIndex, line, "missing non terminal in front of the arrow");
	}
}
