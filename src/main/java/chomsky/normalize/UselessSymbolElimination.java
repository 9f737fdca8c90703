package chomsky.normalize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.stream.Collectors;

import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;

import static chomsky.normalize.CNFConverter.LOG;

/**
 * Removes the non generating symbols and afterwards the symbols that are unreachable in the
 * remaining grammar. The order matters: removing non generating symbols can make other symbols
 * unreachable.
 */
public class UselessSymbolElimination implements NormalizationStage {

	public static final String LABEL = "Remove useless symbols";

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		return removeUnreachable(removeNonGenerating(grammar));
	}

	/**
	 * Drops every production that uses a non generating non terminal (on either side).
	 */
	public static Grammar removeNonGenerating(Grammar grammar){
		Set<NonTerminal> generating = grammar.calculateGenerating();
		List<Production> productions = grammar.getProductions().stream()
				.filter(p -> generating.contains(p.left) && generating.containsAll(p.nonTerminals))
				.collect(Collectors.toList());
		logRemoved("non generating", grammar, generating);
		return new Grammar(grammar.getStart(), productions);
	}

	/**
	 * Drops every production whose left hand side isn't reachable from the start non terminal.
	 */
	public static Grammar removeUnreachable(Grammar grammar){
		Set<NonTerminal> reachable = grammar.calculateReachable();
		List<Production> productions = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (reachable.contains(production.left)){
				productions.add(production);
			}
		}
		logRemoved("unreachable", grammar, reachable);
		return new Grammar(grammar.getStart(), productions);
	}

	private static void logRemoved(String kind, Grammar grammar, Set<NonTerminal> kept){
		if (LOG.isLoggable(Level.FINE)){
			Set<NonTerminal> removed = new LinkedHashSet<>(grammar.getNonTerminals());
			removed.removeAll(kept);
			if (!removed.isEmpty()){
				LOG.fine(String.format("Removed %s non terminals %s", kind, removed));
			}
		}
	}
}
