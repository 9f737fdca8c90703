package chomsky.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import chomsky.InvariantViolationError;
import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Production;
import chomsky.grammar.Symbol;

/**
 * Removes all epsilon productions.
 *
 * Every production is replaced by all variants that omit a subset of its nullable non terminals.
 * Variants with an empty right hand side are dropped, the only epsilon production of the result
 * is <pre>S0 → ε</pre> for a nullable start non terminal <pre>S0</pre>.
 */
public class EpsilonProductionElimination implements NormalizationStage {

	public static final String LABEL = "Remove ε-productions";

	/**
	 * Maximum number of nullable symbols on a single right hand side (the variants are counted
	 * with a long bit mask)
	 */
	private static final int MAX_NULLABLE_POSITIONS = 62;

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public Grammar apply(Grammar grammar) {
		Set<NonTerminal> nullable = grammar.calculateNullable();
		List<Production> productions = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (!production.isEpsilonProduction()){
				productions.addAll(withoutNullableSymbols(production, nullable));
			}
		}
		NonTerminal start = grammar.getStart();
		if (nullable.contains(start)){
			int insertionIndex = 0;
			for (int i = 0; i < productions.size(); i++) {
				if (productions.get(i).left.equals(start)){
					insertionIndex = i + 1;
				}
			}
			productions.add(insertionIndex, new Production(start));
		}
		return new Grammar(start, productions);
	}

	/**
	 * All non empty variants of the production that omit some of its nullable non terminals,
	 * beginning with the production itself.
	 */
	static List<Production> withoutNullableSymbols(Production production, Set<NonTerminal> nullable){
		List<Integer> nullablePositions = new ArrayList<>();
		for (int i = 0; i < production.right.size(); i++) {
			if (nullable.contains(production.right.get(i))){
				nullablePositions.add(i);
			}
		}
		if (nullablePositions.size() > MAX_NULLABLE_POSITIONS){
			throw new InvariantViolationError(String.format("Too many nullable symbols in %s", production));
		}
		List<Production> variants = new ArrayList<>();
		for (long mask = 0; mask < (1L << nullablePositions.size()); mask++) {
			List<Symbol> right = new ArrayList<>();
			int positionIndex = 0;
			for (int i = 0; i < production.right.size(); i++) {
				if (positionIndex < nullablePositions.size() && nullablePositions.get(positionIndex) == i){
					boolean omitted = ((mask >> positionIndex) & 1) == 1;
					positionIndex++;
					if (omitted){
						continue;
					}
				}
				right.add(production.right.get(i));
			}
			if (!right.isEmpty()){
				variants.add(new Production(production.left, right));
			}
		}
		return variants;
	}
}
