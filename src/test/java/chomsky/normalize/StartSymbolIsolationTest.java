package chomsky.normalize;

import org.junit.jupiter.api.Test;

import chomsky.GrammarMatcher;
import chomsky.grammar.Grammar;

import static chomsky.parser.GrammarParser.parse;
import static org.junit.jupiter.api.Assertions.*;

public class StartSymbolIsolationTest {

	private final StartSymbolIsolation stage = new StartSymbolIsolation();

	@Test
	public void testNewStartSymbol(){
		Grammar grammar = stage.apply(parse("S -> aS | b"));
		new GrammarMatcher(grammar).start("S0").text("S0 → S\nS → a S | b").run();
		assertFalse(grammar.getSymbolsInBodies().contains(grammar.getStart()));
	}

	@Test
	public void testNameCollision(){
		Grammar grammar = stage.apply(parse("S0 -> aS0 | S1\nS1 -> b"));
		new GrammarMatcher(grammar).start("S2").hasExactly("S2", "S0").run();
	}

	@Test
	public void testInputIsNotModified(){
		Grammar original = parse("S -> aS | b");
		stage.apply(original);
		assertEquals("S → a S | b", original.format());
		assertEquals("S", original.getStart().name);
	}
}
