package chomsky.parser;

/**
 * The line doesn't have the form <pre>HEAD → ALT | … | ALT</pre>, e.g. because it lacks an arrow.
 */
public class MalformedProductionError extends GrammarParseException {

	public MalformedProductionError(int lineIndex, String line, String reason) {
		super(lineIndex, line, reason);
	}
}
