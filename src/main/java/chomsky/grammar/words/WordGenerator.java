package chomsky.grammar.words;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;
import chomsky.grammar.Symbol;
import chomsky.grammar.Terminal;

/**
 * Generates all words of a grammar's language up to a maximum length.
 *
 * The word sets of the non terminals are computed by a fix point iteration: the sets only grow and
 * are bounded by the number of words with at most <code>maxLength</code> terminals, so the
 * iteration terminates for every grammar (including grammars with epsilon and unit cycles).
 */
public class WordGenerator {

	private final Grammar grammar;

	private final int maxLength;

	public WordGenerator(Grammar grammar, int maxLength) {
		if (maxLength < 0){
			throw new IllegalArgumentException("The maximum word length can't be negative");
		}
		this.grammar = grammar;
		this.maxLength = maxLength;
	}

	/**
	 * Words derivable from the start non terminal in length first, lexicographic order.
	 */
	public SortedSet<TerminalSequence> generate(){
		return new TreeSet<>(calculateWordSets().get(grammar.getStart()));
	}

	/**
	 * The first <code>maxWords</code> words of {@link #generate()}
	 */
	public List<TerminalSequence> generate(int maxWords){
		List<TerminalSequence> words = new ArrayList<>();
		for (TerminalSequence word : generate()) {
			if (words.size() == maxWords){
				break;
			}
			words.add(word);
		}
		return words;
	}

	/**
	 * For every non terminal the set of words with at most <code>maxLength</code> terminals
	 * derivable from it.
	 */
	public Map<NonTerminal, Set<TerminalSequence>> calculateWordSets(){
		Map<NonTerminal, Set<TerminalSequence>> words = new HashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			words.put(nonTerminal, new HashSet<>());
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production production : grammar.getProductions()) {
				Set<TerminalSequence> produced = wordsOfRightSide(production.right, words);
				somethingChanged = words.get(production.left).addAll(produced) || somethingChanged;
			}
		} while (somethingChanged);
		return words;
	}

	private Set<TerminalSequence> wordsOfRightSide(List<Symbol> right, Map<NonTerminal, Set<TerminalSequence>> words){
		Set<TerminalSequence> current = new HashSet<>();
		current.add(TerminalSequence.EMPTY);
		for (Symbol symbol : right) {
			Set<TerminalSequence> next = new HashSet<>();
			if (symbol instanceof Terminal){
				for (TerminalSequence prefix : current) {
					if (prefix.length() < maxLength){
						next.add(prefix.append((Terminal)symbol));
					}
				}
			} else {
				for (TerminalSequence prefix : current) {
					for (TerminalSequence suffix : words.get(symbol)) {
						if (prefix.length() + suffix.length() <= maxLength){
							next.add(prefix.append(suffix));
						}
					}
				}
			}
			if (next.isEmpty()){
				return next;
			}
			current = next;
		}
		return current;
	}
}
