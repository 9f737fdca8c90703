package chomsky.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * A terminal symbol
 */
public final class Terminal extends Symbol implements Serializable {

	/**
	 * Literal this terminal stands for, a single character in compact grammar notation
	 */
	public final String value;

	public Terminal(String value) {
		this.value = Objects.requireNonNull(value);
		if (value.isEmpty()){
			throw new IllegalArgumentException("A terminal needs a non empty literal");
		}
	}

	public Terminal(char value) {
		this(String.valueOf(value));
	}

	@Override
	public String text() {
		return value;
	}

	@Override
	public boolean isTerminal() {
		return true;
	}
}
