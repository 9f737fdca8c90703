package chomsky.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import chomsky.GrammarMatcher;
import chomsky.grammar.Grammar;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Terminal;

import static chomsky.parser.GrammarParser.parse;
import static chomsky.parser.GrammarParser.tokenize;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarParserTest {

	@Test
	public void testParseBasic(){
		Grammar grammar = parse("S -> AB | a\nA -> aA | ε\nB -> b");
		new GrammarMatcher(grammar)
				.start("S")
				.hasExactly("S", "A B", "a")
				.hasExactly("A", "a A", "ε")
				.hasExactly("B", "b")
				.text("S → A B | a\nA → a A | ε\nB → b")
				.run();
		assertEquals(2, grammar.getTerminals().size());
	}

	@Test
	public void testArrowsAndEpsilonMarkers(){
		new GrammarMatcher(parse("S → A\nA -> E\nB → ε | b"))
				.hasExactly("S", "A")
				.hasExactly("A", "ε")
				.hasExactly("B", "ε", "b")
				.run();
	}

	@Test
	public void testEpsilonMarkersInsideAnAlternativeAreDropped(){
		new GrammarMatcher(parse("S -> a ε b | aEb | εε")).hasExactly("S", "a b", "ε").run();
	}

	@Test
	public void testWhitespaceSeparatedTokens(){
		Grammar grammar = parse("Expr -> Expr + Term | Term\nTerm -> id | ( Expr )");
		new GrammarMatcher(grammar).start("Expr").hasExactly("Expr", "Expr + Term", "Term").run();
		assertTrue(grammar.getTerminals().contains(new Terminal("id")));
		assertTrue(grammar.getNonTerminals().contains(new NonTerminal("Term")));
	}

	@Test
	public void testTokenize(){
		assertEquals(Arrays.asList("a", "A", "B", "c"), tokenize("aABc"));
		assertEquals(Arrays.asList("S0", "a", "B'", "A12"), tokenize("S0aB'A12"));
		assertEquals(Arrays.asList("a", "1", "b"), tokenize("a1b"));
		assertEquals(Arrays.asList("T_a", "A_1"), tokenize(" T_a  A_1 "));
		assertEquals(Arrays.asList("(", "S", ")", "S"), tokenize("(S)S"));
		assertEquals(Arrays.asList("S_1"), tokenize("S_1"));
		assertEquals(Arrays.asList("a", "T_b", "+", "A_1"), tokenize("aT_b+A_1"));
		assertTrue(tokenize("   ").isEmpty());
	}

	@Test
	public void testBlankLinesAndWindowsLineEnds(){
		Grammar grammar = parse("\n  \nS -> aS | b\r\n\r\nX -> x\n");
		new GrammarMatcher(grammar).start("S").hasExactly("S", "a S", "b").hasExactly("X", "x").run();
	}

	@Test
	public void testUndefinedNonTerminalIsKept(){
		Grammar grammar = parse("S -> a | Bc");
		assertTrue(grammar.getNonTerminals().contains(new NonTerminal("B")));
		assertFalse(grammar.hasProductions(new NonTerminal("B")));
	}

	@Test
	public void testMultipleLinesForOneHead(){
		new GrammarMatcher(parse("S -> a\nS -> b | a")).hasExactly("S", "a", "b").run();
	}

	@Test
	public void testMissingArrow(){
		MalformedProductionError error = assertThrows(MalformedProductionError.class, () -> parse("S -> a\nA = b"));
		assertEquals(1, error.lineIndex);
		assertEquals("A = b", error.line);
		assertTrue(error.getMessage().contains("line 2"), error.getMessage());
		assertTrue(error.getMessage().contains("A = b"), error.getMessage());
	}

	@Test
	public void testEmptyHead(){
		EmptyHeadError error = assertThrows(EmptyHeadError.class, () -> parse("S -> a\n\n  -> b"));
		assertEquals(2, error.lineIndex);
		assertEquals("  -> b", error.line);
	}

	@ParameterizedTest
	@ValueSource(strings = {"S -> a |", "S -> a | b |   ", "S → ε |"})
	public void testTrailingDisjunction(String line){
		UnterminatedAlternativeError error = assertThrows(UnterminatedAlternativeError.class, () -> parse(line));
		assertEquals(0, error.lineIndex);
		assertEquals(line, error.line);
	}

	@ParameterizedTest
	@ValueSource(strings = {"S", "S a b", "s -> a", "E -> a", "ε -> a", "A B -> c", "S ->", "S ->   ",
			"S -> a || b", "S -> | a", "S -> a -> b", "1 -> a"})
	public void testMalformedLines(String line){
		assertThrows(MalformedProductionError.class, () -> parse("A -> a\n" + line));
	}

	@Test
	public void testEmptyInput(){
		assertThrows(EmptyGrammarError.class, () -> parse(""));
		assertThrows(EmptyGrammarError.class, () -> parse(" \n\t\n"));
	}

	@Test
	public void testFirstErrorWins(){
		GrammarParseException error = assertThrows(GrammarParseException.class, () -> parse("S -> a\nS -> b |\nX"));
		assertTrue(error instanceof UnterminatedAlternativeError);
		assertEquals(1, error.lineIndex);
	}

	@Test
	public void testWarnAboutMultiLetterHeads(){
		List<LogRecord> records = new ArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				records.add(record);
			}

			@Override
			public void flush() {
			}

			@Override
			public void close() {
			}
		};
		GrammarParser.LOG.addHandler(handler);
		try {
			new GrammarMatcher(parse("S -> Expr\nExpr -> a")).hasExactly("S", "x p r").run();
		} finally {
			GrammarParser.LOG.removeHandler(handler);
		}
		assertEquals(1, records.size());
		assertEquals(Level.WARNING, records.get(0).getLevel());
		assertTrue(records.get(0).getMessage().contains("'Expr'"), records.get(0).getMessage());
	}
}
