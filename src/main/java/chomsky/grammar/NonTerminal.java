package chomsky.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * A non terminal symbol.
 *
 * Unlike a terminal it doesn't know its productions, they are stored in the {@link Grammar} so that
 * every grammar value stays independent of the others.
 */
public final class NonTerminal extends Symbol implements Serializable {

	/**
	 * Name of the non terminal, starts with an uppercase letter when it comes from grammar text
	 */
	public final String name;

	public NonTerminal(String name) {
		this.name = Objects.requireNonNull(name);
		if (name.isEmpty()){
			throw new IllegalArgumentException("A non terminal needs a non empty name");
		}
	}

	@Override
	public String text() {
		return name;
	}

	@Override
	public boolean isTerminal() {
		return false;
	}
}
