package chomsky.normalize;

import java.util.ArrayList;
import java.util.List;

import chomsky.grammar.FreshNameGenerator;
import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;

/**
 * Insert a new start non terminal with a <pre>S0 → S</pre> rule (assuming <pre>S</pre> is the
 * current start non terminal). The new start non terminal is named <code>S0</code>, or
 * <code>S1</code>, <code>S2</code>, … if the name is already taken, and never appears on a right
 * hand side.
 */
public class StartSymbolIsolation implements NormalizationStage {

	public static final String LABEL = "Add a new start symbol";

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		NonTerminal start = new FreshNameGenerator(grammar).createNumbered("S", 0);
		List<Production> productions = new ArrayList<>();
		productions.add(new Production(start, grammar.getStart()));
		productions.addAll(grammar.getProductions());
		return new Grammar(start, productions);
	}
}
