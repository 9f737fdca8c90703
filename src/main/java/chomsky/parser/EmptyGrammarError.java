package chomsky.parser;

/**
 * The parsed text doesn't contain a single production.
 */
public class EmptyGrammarError extends GrammarParseException {

	public EmptyGrammarError() {
		super("The grammar doesn't contain any production");
	}
}
