package chomsky.normalize;

import java.io.Serializable;

import chomsky.grammar.Grammar;

/**
 * The grammar as it looks after a normalization stage, together with the stage's label.
 */
public final class Snapshot implements Serializable {

	public final String label;

	public final Grammar grammar;

	public Snapshot(String label, Grammar grammar) {
		this.label = label;
		this.grammar = grammar;
	}

	/**
	 * Rendered grammar, one <pre>HEAD → ALT | ALT</pre> line per non terminal
	 */
	public String text(){
		return grammar.format();
	}

	@Override
	public String toString() {
		return label + ":\n" + text();
	}
}
