package chomsky.grammar;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import chomsky.InvariantViolationError;

/**
 * Creates non terminal names that collide neither with the names of a grammar nor with names
 * created before by the same generator.
 *
 * Each normalization stage creates its own instance, there is no shared counter.
 */
public class FreshNameGenerator {

	private final Set<String> usedNames;
	/**
	 * For each prefix the next number to try
	 */
	private final Map<String, Integer> nextNumberForPrefix = new HashMap<>();

	public FreshNameGenerator(Collection<String> usedNames) {
		this.usedNames = new HashSet<>(usedNames);
	}

	public FreshNameGenerator(Grammar grammar) {
		this(grammar.names());
	}

	/**
	 * Returns the preferred name if it is still unused, otherwise the preferred name followed by the
	 * smallest number ≥ 2 that results in an unused name.
	 */
	public NonTerminal create(String preferredName){
		if (usedNames.add(preferredName)){
			return new NonTerminal(preferredName);
		}
		return createNumbered(preferredName, 2);
	}

	/**
	 * Returns the prefix followed by the smallest unused number, numbering starts with 1.
	 */
	public NonTerminal createNumbered(String prefix){
		return createNumbered(prefix, 1);
	}

	/**
	 * Returns the prefix followed by the smallest unused number that is at least
	 * <code>firstNumber</code>. Numbers handed out before for the same prefix aren't tried again.
	 */
	public NonTerminal createNumbered(String prefix, int firstNumber){
		int number = Math.max(firstNumber, nextNumberForPrefix.getOrDefault(prefix, firstNumber));
		while (number >= 0) {
			String name = prefix + number;
			number++;
			if (usedNames.add(name)){
				nextNumberForPrefix.put(prefix, number);
				return new NonTerminal(name);
			}
		}
		throw new InvariantViolationError(String.format("No fresh name left for prefix '%s'", prefix));
	}

	public boolean isUsed(String name){
		return usedNames.contains(name);
	}
}
