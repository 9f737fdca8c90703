package chomsky.grammar.words;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import chomsky.grammar.Terminal;

/**
 * An immutable sequence of terminals, i.e. a word of a grammar's language.
 *
 * Sequences are ordered by length first and lexicographically by the terminals second.
 */
public final class TerminalSequence implements Serializable, Comparable<TerminalSequence> {

	public static final TerminalSequence EMPTY = new TerminalSequence(Collections.emptyList());

	public final List<Terminal> terminals;

	public TerminalSequence(List<Terminal> terminals) {
		this.terminals = Collections.unmodifiableList(new ArrayList<>(terminals));
	}

	public int length(){
		return terminals.size();
	}

	public boolean isEmpty(){
		return terminals.isEmpty();
	}

	public TerminalSequence append(Terminal terminal){
		List<Terminal> list = new ArrayList<>(terminals);
		list.add(terminal);
		return new TerminalSequence(list);
	}

	public TerminalSequence append(TerminalSequence other){
		if (other.isEmpty()){
			return this;
		}
		List<Terminal> list = new ArrayList<>(terminals);
		list.addAll(other.terminals);
		return new TerminalSequence(list);
	}

	@Override
	public int compareTo(TerminalSequence o) {
		if (length() != o.length()){
			return Integer.compare(length(), o.length());
		}
		for (int i = 0; i < length(); i++) {
			int cmp = terminals.get(i).compareTo(o.terminals.get(i));
			if (cmp != 0){
				return cmp;
			}
		}
		return 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TerminalSequence && ((TerminalSequence)obj).terminals.equals(terminals);
	}

	@Override
	public int hashCode() {
		return terminals.hashCode();
	}

	/**
	 * Concatenated terminal literals, "ε" for the empty word
	 */
	public String format(){
		return isEmpty() ? "ε" : toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Terminal terminal : terminals) {
			builder.append(terminal.value);
		}
		return builder.toString();
	}
}
