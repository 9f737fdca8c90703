package chomsky.normalize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;

/**
 * Removes all unit productions (<pre>A → B</pre>).
 *
 * Each non terminal A gets the non unit productions of all non terminals in its unit closure,
 * i.e. of all non terminals B with <pre>A ⇒* B</pre> using only unit productions. Cycles of unit
 * productions are fine, the closure visits every non terminal once.
 */
public class UnitProductionElimination implements NormalizationStage {

	public static final String LABEL = "Remove unit productions";

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		Graph<NonTerminal, DefaultEdge> unitGraph = grammar.dependencyGraph(Production::isUnitProduction);
		List<Production> productions = new ArrayList<>();
		for (NonTerminal head : grammar.getHeads()) {
			for (NonTerminal member : unitClosure(unitGraph, head)) {
				for (Production production : grammar.getProductionsOf(member)) {
					if (!production.isUnitProduction()){
						productions.add(production.withLeft(head));
					}
				}
			}
		}
		return new Grammar(grammar.getStart(), productions);
	}

	/**
	 * Unit closure of the passed non terminal in breadth first order, starting with the non
	 * terminal itself.
	 */
	public static Set<NonTerminal> calculateUnitClosure(Grammar grammar, NonTerminal nonTerminal){
		return unitClosure(grammar.dependencyGraph(Production::isUnitProduction), nonTerminal);
	}

	private static Set<NonTerminal> unitClosure(Graph<NonTerminal, DefaultEdge> unitGraph, NonTerminal nonTerminal){
		Set<NonTerminal> closure = new LinkedHashSet<>();
		new BreadthFirstIterator<>(unitGraph, nonTerminal).forEachRemaining(closure::add);
		return closure;
	}
}
