package chomsky.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar production with a left and a right hand side.
 *
 * Two productions are equal if they have the same left and right hand sides.
 */
public final class Production implements Serializable {

	/**
	 * Printed in place of an empty right hand side
	 */
	public static final String EPSILON = "ε";

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(NonTerminal left, List<? extends Symbol> right) {
		this.left = Objects.requireNonNull(left);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : this.right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else {
				terminals.add((Terminal)symbol);
			}
		}
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public Production(NonTerminal left, Symbol... right) {
		this(left, Arrays.asList(right));
	}

	/**
	 * The same right hand side with another left hand side
	 */
	public Production withLeft(NonTerminal newLeft){
		return new Production(newLeft, right);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return EPSILON;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Is the right hand side exactly one non terminal?
	 */
	public boolean isUnitProduction(){
		return right.size() == 1 && right.get(0) instanceof NonTerminal;
	}

	/**
	 * Does the production have one of the two shapes allowed in Chomsky normal form
	 * (<pre>A → a</pre> or <pre>A → B C</pre>)? The epsilon production of the start symbol isn't covered here.
	 */
	public boolean hasChomskyShape(){
		if (right.size() == 1){
			return right.get(0).isTerminal();
		}
		return right.size() == 2 && terminals.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}
}
