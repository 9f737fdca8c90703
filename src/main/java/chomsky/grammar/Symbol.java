package chomsky.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are ordered by their kind first (non terminals before terminals) and by their text second.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Name of a non terminal or literal of a terminal
	 */
	public abstract String text();

	public abstract boolean isTerminal();

	@Override
	public int hashCode() {
		if (isTerminal()){
			return -text().hashCode() - 1;
		}
		return text().hashCode() + 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).text().equals(text());
	}

	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()){
			return isTerminal() ? 1 : -1;
		}
		return text().compareTo(o.text());
	}

	@Override
	public String toString() {
		return text();
	}
}
