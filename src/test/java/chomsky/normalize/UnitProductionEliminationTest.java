package chomsky.normalize;

import java.time.Duration;
import java.util.Arrays;
import java.util.ArrayList;

import org.junit.jupiter.api.Test;

import chomsky.GrammarMatcher;
import chomsky.grammar.Grammar;
import chomsky.grammar.GrammarBuilder;
import chomsky.grammar.NonTerminal;

import static chomsky.parser.GrammarParser.parse;
import static org.junit.jupiter.api.Assertions.*;

public class UnitProductionEliminationTest {

	private final UnitProductionElimination stage = new UnitProductionElimination();

	@Test
	public void testCycle(){
		Grammar grammar = new GrammarBuilder().add("A", "B").add("B", "A").add("B", 'b').toGrammar();
		Grammar result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> stage.apply(grammar));
		new GrammarMatcher(result)
				.hasExactly("A", "b")
				.hasExactly("B", "b")
				.noUnitProductions()
				.run();
	}

	@Test
	public void testUnitClosure(){
		Grammar grammar = parse("A -> B | a\nB -> C | A\nC -> cA\nD -> A");
		assertEquals(Arrays.asList(new NonTerminal("A"), new NonTerminal("B"), new NonTerminal("C")),
				new ArrayList<>(UnitProductionElimination.calculateUnitClosure(grammar, new NonTerminal("A"))));
		assertEquals(Arrays.asList(new NonTerminal("C")),
				new ArrayList<>(UnitProductionElimination.calculateUnitClosure(grammar, new NonTerminal("C"))));
	}

	@Test
	public void testChain(){
		new GrammarMatcher(stage.apply(parse("S -> A | aS\nA -> B\nB -> b | cC\nC -> c")))
				.text("S → a S | b | c C\nA → b | c C\nB → b | c C\nC → c")
				.noUnitProductions()
				.run();
	}

	@Test
	public void testSelfLoop(){
		new GrammarMatcher(stage.apply(parse("S -> S | a"))).hasExactly("S", "a").run();
	}

	@Test
	public void testStartEpsilonIsKept(){
		new GrammarMatcher(stage.apply(parse("S0 -> S | ε\nS -> a")))
				.hasExactly("S0", "ε", "a")
				.hasExactly("S", "a")
				.run();
	}

	@Test
	public void testOnlyUnitCycleLeavesNoProductions(){
		Grammar result = stage.apply(parse("S -> aA | b\nA -> B\nB -> A"));
		new GrammarMatcher(result).hasExactly("S", "a A", "b").run();
		assertFalse(result.hasProductions(new NonTerminal("A")));
		assertTrue(result.getNonTerminals().contains(new NonTerminal("A")));
	}
}
