package chomsky.normalize;

import chomsky.grammar.Grammar;

/**
 * A single step of the conversion into Chomsky normal form.
 *
 * Implementations are stateless: {@link #apply(Grammar)} never modifies the passed grammar and
 * creates everything it needs (like fresh names) for each call.
 */
public interface NormalizationStage {

	/**
	 * Human readable description of the step, used as the label of its snapshot
	 */
	String label();

	Grammar apply(Grammar grammar);
}
