package chomsky.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.DepthFirstIterator;

import static chomsky.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * A grammar is immutable: every transformation creates a new grammar. The sets of symbols are
 * derived from the productions (plus the start non terminal), therefore every symbol used in a
 * production is part of the grammar. Duplicate productions are removed, the first occurrence
 * determines the position.
 *
 * Use the {@link GrammarBuilder} or the {@link chomsky.parser.GrammarParser} to create grammars
 * from scratch.
 */
public class Grammar implements Serializable {

	/**
	 * Symbols in this grammar, symbols = nonTerminals ∪ terminals
	 */
	private final Set<Symbol> symbols;
	/**
	 * Non terminals in the grammar, the start non terminal is always the first
	 */
	private final Set<NonTerminal> nonTerminals;

	private final List<Production> productions;

	private final Set<Terminal> terminals;

	private final NonTerminal start;

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	/**
	 * Create a new Grammar object
	 *
	 * @param start start non terminal
	 * @param productions productions in their output order, duplicates are dropped
	 */
	public Grammar(NonTerminal start, Collection<Production> productions) {
		this.start = start;
		this.productions = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(productions)));
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		Set<Terminal> terminals = new LinkedHashSet<>();
		Map<NonTerminal, List<Production>> perNonTerminal = new LinkedHashMap<>();
		nonTerminals.add(start);
		for (Production production : this.productions) {
			nonTerminals.add(production.left);
			perNonTerminal.computeIfAbsent(production.left, n -> new ArrayList<>()).add(production);
		}
		for (Production production : this.productions) {
			nonTerminals.addAll(production.nonTerminals);
			terminals.addAll(production.terminals);
		}
		Set<Symbol> symbols = new LinkedHashSet<>(nonTerminals);
		symbols.addAll(terminals);
		this.nonTerminals = Collections.unmodifiableSet(nonTerminals);
		this.terminals = Collections.unmodifiableSet(terminals);
		this.symbols = Collections.unmodifiableSet(symbols);
		this.productionsPerNonTerminal = perNonTerminal;
	}

	public NonTerminal getStart() {
		return start;
	}

	public List<Production> getProductions() {
		return productions;
	}

	public Set<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	public Set<Symbol> getSymbols() {
		return symbols;
	}

	/**
	 * Productions that have the passed non terminal on their left side, in grammar order
	 */
	public List<Production> getProductionsOf(NonTerminal nonTerminal) {
		return Collections.unmodifiableList(productionsPerNonTerminal.getOrDefault(nonTerminal, Collections.emptyList()));
	}

	public boolean hasProductions(NonTerminal nonTerminal){
		return productionsPerNonTerminal.containsKey(nonTerminal);
	}

	/**
	 * Non terminals that have at least one production, the start non terminal first (if it has
	 * productions), the others in the order of their first production.
	 */
	public List<NonTerminal> getHeads(){
		List<NonTerminal> heads = new ArrayList<>();
		if (hasProductions(start)){
			heads.add(start);
		}
		for (NonTerminal nonTerminal : productionsPerNonTerminal.keySet()){
			if (!nonTerminal.equals(start)){
				heads.add(nonTerminal);
			}
		}
		return heads;
	}

	/**
	 * Symbols that appear on the right hand side of at least one production
	 */
	public Set<Symbol> getSymbolsInBodies(){
		Set<Symbol> bodySymbols = new LinkedHashSet<>();
		for (Production production : productions) {
			bodySymbols.addAll(production.right);
		}
		return bodySymbols;
	}

	/**
	 * Names of all symbols, used to avoid collisions when new non terminals are introduced
	 */
	public Set<String> names(){
		Set<String> names = new HashSet<>();
		for (Symbol symbol : symbols) {
			names.add(symbol.text());
		}
		return names;
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	public Set<NonTerminal> calculateNullable(){
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : productions) {
				if (epsSet.contains(prod.left) || !prod.terminals.isEmpty()){
					continue;
				}
				if (epsSet.containsAll(prod.nonTerminals)){
					somethingChanged = epsSet.add(prod.left) || somethingChanged;
				}
			}
		} while (somethingChanged);
		return epsSet;
	}

	/**
	 * Calculate the non terminals that derive at least one terminal word (terminals are generating
	 * by definition and therefore not part of the result).
	 */
	public Set<NonTerminal> calculateGenerating(){
		Set<NonTerminal> generating = new LinkedHashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : productions) {
				if (!generating.contains(prod.left) && generating.containsAll(prod.nonTerminals)){
					somethingChanged = generating.add(prod.left) || somethingChanged;
				}
			}
		} while (somethingChanged);
		return generating;
	}

	/**
	 * Calculate the non terminals reachable from the start non terminal (including itself).
	 */
	public Set<NonTerminal> calculateReachable(){
		Set<NonTerminal> reached = new LinkedHashSet<>();
		DepthFirstIterator<NonTerminal, DefaultEdge> iterator =
				new DepthFirstIterator<>(dependencyGraph(p -> true), start);
		iterator.forEachRemaining(reached::add);
		return reached;
	}

	/**
	 * Graph with an edge <code>A → B</code> for every non terminal B on the right hand side of a
	 * production of A that passes the filter. Contains every non terminal of the grammar as a vertex.
	 */
	public Graph<NonTerminal, DefaultEdge> dependencyGraph(Predicate<Production> productionFilter){
		Graph<NonTerminal, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		nonTerminals.forEach(graph::addVertex);
		for (Production production : productions) {
			if (productionFilter.test(production)){
				for (NonTerminal nonTerminal : production.nonTerminals) {
					graph.addEdge(production.left, nonTerminal);
				}
			}
		}
		return graph;
	}

	/**
	 * Is every production either <pre>A → B C</pre> or <pre>A → a</pre>, with the only exception
	 * of <pre>S → ε</pre> for the start non terminal S that doesn't appear on any right hand side?
	 */
	public boolean isInChomskyNormalForm(){
		for (Production production : productions) {
			if (production.isEpsilonProduction()){
				if (!production.left.equals(start) || getSymbolsInBodies().contains(start)){
					return false;
				}
			} else if (!production.hasChomskyShape()){
				return false;
			}
		}
		return true;
	}

	/**
	 * Formats the grammar, one line per non terminal with productions:
	 * <pre>HEAD → ALT | ALT | …</pre>
	 */
	public String format(){
		List<String> lines = new ArrayList<>();
		for (NonTerminal head : getHeads()) {
			List<String> alternatives = new ArrayList<>();
			for (Production production : getProductionsOf(head)) {
				alternatives.add(production.formatRightSide());
			}
			lines.add(head + " → " + join(alternatives, " | "));
		}
		return join(lines, "\n");
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return format();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar)obj;
		return start.equals(other.start) && productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return start.hashCode() * 31 + productions.hashCode();
	}
}
