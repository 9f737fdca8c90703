package chomsky.normalize;

import java.util.List;

import chomsky.grammar.Grammar;

import static chomsky.util.Utils.join;

/**
 * Result of a conversion: the grammar in Chomsky normal form and the snapshots of all stages.
 * The last snapshot contains the final grammar.
 */
public class ConversionResult {

	private final Grammar grammar;

	private final List<Snapshot> steps;

	public ConversionResult(Grammar grammar, List<Snapshot> steps) {
		this.grammar = grammar;
		this.steps = steps;
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public List<Snapshot> getSteps() {
		return steps;
	}

	/**
	 * All steps, each with its label, separated by empty lines
	 */
	public String formatSteps(){
		return join(steps, "\n\n");
	}

	@Override
	public String toString() {
		return grammar.format();
	}
}
