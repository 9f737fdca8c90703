package chomsky.normalize;

import org.junit.jupiter.api.Test;

import chomsky.GrammarMatcher;
import chomsky.grammar.Grammar;

import static chomsky.parser.GrammarParser.parse;

public class EpsilonProductionEliminationTest {

	private static Grammar isolateAndEliminate(String grammar){
		return new EpsilonProductionElimination().apply(new StartSymbolIsolation().apply(parse(grammar)));
	}

	@Test
	public void testExample(){
		new GrammarMatcher(isolateAndEliminate("S -> AB | a\nA -> aA | ε\nB -> b"))
				.text("S0 → S\nS → A B | B | a\nA → a A | a\nB → b")
				.noStrayEpsilon()
				.run();
	}

	@Test
	public void testNullableStartKeepsSingleEpsilon(){
		new GrammarMatcher(isolateAndEliminate("S -> aSb | ε"))
				.text("S0 → S | ε\nS → a S b | a b")
				.noStrayEpsilon()
				.run();
	}

	@Test
	public void testAllSubsetsOfNullablePositions(){
		new GrammarMatcher(isolateAndEliminate("S -> ABC\nA -> a | ε\nB -> b | ε\nC -> c | ε"))
				.hasExactly("S0", "S", "ε")
				.hasExactly("S", "A B C", "B C", "A C", "C", "A B", "B", "A")
				.hasExactly("A", "a")
				.noStrayEpsilon()
				.run();
	}

	@Test
	public void testIndirectlyNullable(){
		new GrammarMatcher(isolateAndEliminate("S -> AbA\nA -> B | a\nB -> ε | CC\nC -> ε"))
				.hasExactly("S", "A b A", "b A", "A b", "b")
				.hasExactly("A", "B", "a")
				.hasExactly("B", "C C", "C")
				.hasExactly("S0", "S")
				.noStrayEpsilon()
				.run();
	}

	@Test
	public void testDuplicateVariantsCollapse(){
		new GrammarMatcher(isolateAndEliminate("S -> AA | a\nA -> a | ε"))
				.hasExactly("S", "A A", "A", "a")
				.run();
	}

	@Test
	public void testWithoutIsolatedStart(){
		new GrammarMatcher(new EpsilonProductionElimination().apply(parse("S -> a | ε")))
				.text("S → a | ε")
				.run();
	}
}
