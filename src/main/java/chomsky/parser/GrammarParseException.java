package chomsky.parser;

import chomsky.ChomskyException;

import static chomsky.util.Utils.toPrintableRepresentation;

/**
 * An error thrown after encountering a line that isn't a valid production, located by the index
 * of the line in the parsed text.
 */
public class GrammarParseException extends ChomskyException {

	/**
	 * Zero based index of the offending line in the parsed text (blank lines included)
	 */
	public final int lineIndex;
	/**
	 * Raw text of the offending line
	 */
	public final String line;

	public GrammarParseException(int lineIndex, String line, String message) {
		super(String.format("Error at line %d (\"%s\"): %s", lineIndex + 1, toPrintableRepresentation(line), message));
		this.lineIndex = lineIndex;
		this.line = line;
	}

	/**
	 * Error that isn't caused by a specific line
	 */
	protected GrammarParseException(String message) {
		super(message);
		this.lineIndex = -1;
		this.line = "";
	}
}
