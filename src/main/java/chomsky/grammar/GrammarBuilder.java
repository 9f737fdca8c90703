package chomsky.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import chomsky.ChomskyException;

/**
 * Allows the simple creation of grammars.
 *
 * The entries of a right hand side are
 * <ul>
 *     <li>strings: names of non terminals</li>
 *     <li>characters: terminals</li>
 *     <li>{@link Symbol} instances: used as they are (e.g. terminals with longer literals)</li>
 *     <li>"": equivalent to ε, contributes nothing to the right hand side</li>
 *     <li>arrays of the above: flattened</li>
 * </ul>
 * <pre>
 * new GrammarBuilder().add("S", "A", "B").add("S", 'a').add("A", 'a', "A").add("A", "").add("B", 'b')
 * </pre>
 */
public class GrammarBuilder {

	private final List<Production> productions = new ArrayList<>();

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 * @return self
	 */
	public GrammarBuilder add(String left, Object... right){
		if (left.isEmpty()){
			throw new ChomskyException("The left hand side of a production can't be empty");
		}
		return add(new NonTerminal(left), flatten(right));
	}

	/**
	 * Adds a new production with already converted symbols.
	 *
	 * @param left defining non terminal on the left hand side of the production
	 * @param right right hand side of the production, empty for an epsilon production
	 * @return self
	 */
	public GrammarBuilder add(NonTerminal left, List<? extends Symbol> right){
		productions.add(new Production(left, right));
		return this;
	}

	private List<Symbol> flatten(Object[] arr){
		List<Symbol> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof Symbol){
				ret.add((Symbol)sub);
			} else if (sub instanceof String){
				if (!((String) sub).isEmpty()){
					ret.add(new NonTerminal((String)sub));
				}
			} else if (sub instanceof Character){
				ret.add(new Terminal((Character)sub));
			} else if (sub instanceof Object[]){
				ret.addAll(flatten((Object[])sub));
			} else {
				throw new ChomskyException(String.format("Right part of production object list has unsupported type: %s",
						sub == null ? "null" : sub.getClass().getSimpleName()));
			}
		}
		return ret;
	}

	public boolean isEmpty(){
		return productions.isEmpty();
	}

	/**
	 * Create a grammar with the passed start non terminal.
	 */
	public Grammar toGrammar(String startNonTerminal) {
		return new Grammar(new NonTerminal(startNonTerminal), productions);
	}

	/**
	 * Create a grammar whose start non terminal is the left hand side of the first production.
	 */
	public Grammar toGrammar() {
		if (productions.isEmpty()){
			throw new ChomskyException("A grammar needs at least one production");
		}
		return new Grammar(productions.get(0).left, productions);
	}

	/**
	 * Helper to write longer terminal sequences, each character becomes a terminal.
	 */
	public static Object[] string(String str){
		Object[] arr = new Object[str.length()];
		char[] chars = str.toCharArray();
		for (int i = 0; i < chars.length; i++){
			arr[i] = chars[i];
		}
		return arr;
	}

	@Override
	public String toString() {
		return Arrays.toString(productions.toArray());
	}
}
