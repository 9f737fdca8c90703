package chomsky.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import chomsky.grammar.FreshNameGenerator;
import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;
import chomsky.grammar.Symbol;
import chomsky.grammar.Terminal;

/**
 * Brings every production with a right hand side of two or more symbols into the form
 * <pre>A → B C</pre>.
 *
 * Terminals in such right hand sides are replaced by <code>T_a</code> non terminals with a single
 * <pre>T_a → a</pre> production, one per terminal for the whole grammar. Right hand sides with
 * n ≥ 3 symbols are split into a chain using n - 2 new non terminals <code>A_1</code>,
 * <code>A_2</code>, … (numbered per left hand side A):
 * <pre>A → X1 A_1, A_1 → X2 A_2, …, A_(n-2) → X(n-1) Xn</pre>
 * Productions with shorter right hand sides are kept as they are.
 */
public class Binarization implements NormalizationStage {

	public static final String LABEL = "Chomsky Normal Form";

	public static final String TERMINAL_PREFIX = "T_";

	public static final String CHAIN_SEPARATOR = "_";

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		FreshNameGenerator names = new FreshNameGenerator(grammar);
		Map<Terminal, NonTerminal> terminalNonTerminals = new LinkedHashMap<>();
		List<Production> productions = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (production.rightSize() <= 1){
				productions.add(production);
				continue;
			}
			List<NonTerminal> right = new ArrayList<>();
			for (Symbol symbol : production.right) {
				if (symbol instanceof Terminal){
					right.add(terminalNonTerminals.computeIfAbsent((Terminal)symbol,
							t -> names.create(TERMINAL_PREFIX + t.value)));
				} else {
					right.add((NonTerminal)symbol);
				}
			}
			NonTerminal left = production.left;
			while (right.size() > 2){
				NonTerminal rest = names.createNumbered(production.left.name + CHAIN_SEPARATOR);
				productions.add(new Production(left, right.get(0), rest));
				right = right.subList(1, right.size());
				left = rest;
			}
			productions.add(new Production(left, right));
		}
		for (Map.Entry<Terminal, NonTerminal> entry : terminalNonTerminals.entrySet()) {
			productions.add(new Production(entry.getValue(), entry.getKey()));
		}
		return new Grammar(grammar.getStart(), productions);
	}
}
