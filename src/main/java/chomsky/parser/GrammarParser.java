package chomsky.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import chomsky.grammar.Grammar;
import chomsky.grammar.GrammarBuilder;
import chomsky.grammar.NonTerminal;
import chomsky.grammar.Symbol;
import chomsky.grammar.Terminal;

/**
 * Parses grammars written as one production family per line:
 * <pre>
 * S -> AB | a
 * A → a A | ε
 * B -> b
 * </pre>
 *
 * Lexical convention:
 * <ul>
 *     <li>An alternative that contains whitespace consists of whitespace separated tokens.</li>
 *     <li>An alternative without whitespace consists of single character tokens, an uppercase
 *     letter takes the digits, apostrophes and underscores directly following it with it, after an
 *     underscore also letters (<code>S0</code>, <code>B'</code>, <code>T_a</code>).</li>
 *     <li>Tokens starting with an uppercase letter are non terminals, all others are terminals.</li>
 *     <li><code>ε</code> and <code>E</code> denote the empty word, they contribute nothing to a right
 *     hand side.</li>
 * </ul>
 * Multi letter names like <code>Expr</code> are therefore only recognized in alternatives written
 * with whitespace (<code>S -&gt; Expr b</code>, not <code>S -&gt; Exprb</code>), a warning is logged
 * for heads with such names.
 * The start non terminal is the head of the first production.
 */
public class GrammarParser {

	public static final Logger LOG = Logger.getLogger("GrammarParser");

	public static final List<String> ARROWS = Collections.unmodifiableList(Arrays.asList("->", "→"));

	public static final List<String> EPSILON_MARKERS = Collections.unmodifiableList(Arrays.asList("ε", "E"));

	public static final String DISJUNCTION = "|";

	private GrammarParser() {
	}

	/**
	 * Parse the passed grammar text.
	 *
	 * @throws GrammarParseException for the first line that isn't a valid production
	 */
	public static Grammar parse(String text){
		GrammarBuilder builder = new GrammarBuilder();
		String[] lines = text.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (!lines[i].trim().isEmpty()) {
				parseLine(i, lines[i], builder);
			}
		}
		if (builder.isEmpty()){
			throw new EmptyGrammarError();
		}
		return builder.toGrammar();
	}

	/**
	 * Parse a single non blank line and add its productions to the builder.
	 */
	static void parseLine(int lineIndex, String line, GrammarBuilder builder){
		int arrowStart = -1;
		String arrow = null;
		for (String candidate : ARROWS) {
			int index = line.indexOf(candidate);
			if (index != -1 && (arrowStart == -1 || index < arrowStart)){
				arrowStart = index;
				arrow = candidate;
			}
		}
		if (arrow == null){
			throw new MalformedProductionError(lineIndex, line, "missing arrow ('->' or '→')");
		}
		String head = line.substring(0, arrowStart).trim();
		String body = line.substring(arrowStart + arrow.length());
		if (head.isEmpty()){
			throw new EmptyHeadError(lineIndex, line);
		}
		if (containsWhitespace(head)){
			throw new MalformedProductionError(lineIndex, line, String.format("head '%s' has to be a single non terminal", head));
		}
		if (EPSILON_MARKERS.contains(head)){
			throw new MalformedProductionError(lineIndex, line, String.format("'%s' denotes the empty word and can't be a head", head));
		}
		if (!isNonTerminalToken(head)){
			throw new MalformedProductionError(lineIndex, line,
					String.format("head '%s' is not a non terminal (non terminals start with an uppercase letter)", head));
		}
		for (String candidate : ARROWS) {
			if (body.contains(candidate)){
				throw new MalformedProductionError(lineIndex, line, "more than one arrow");
			}
		}
		if (body.trim().isEmpty()){
			throw new MalformedProductionError(lineIndex, line, "missing right hand side (write ε for the empty word)");
		}
		if (tokenize(head).size() > 1 && LOG.isLoggable(Level.WARNING)){
			LOG.warning(String.format("line %d: non terminal '%s' is split into %s in alternatives without whitespace, "
					+ "separate the symbols by spaces to use it", lineIndex + 1, head, tokenize(head)));
		}
		NonTerminal left = new NonTerminal(head);
		String[] alternatives = body.split(Pattern.quote(DISJUNCTION), -1);
		for (int i = 0; i < alternatives.length; i++) {
			String alternative = alternatives[i].trim();
			if (alternative.isEmpty()){
				if (i == alternatives.length - 1){
					throw new UnterminatedAlternativeError(lineIndex, line);
				}
				throw new MalformedProductionError(lineIndex, line,
						String.format("alternative %d is empty (write ε for the empty word)", i + 1));
			}
			List<Symbol> right = toSymbols(tokenize(alternative));
			builder.add(left, right);
			if (LOG.isLoggable(Level.FINE)){
				LOG.fine(String.format("line %d: %s → %s", lineIndex + 1, left, right.isEmpty() ? "ε" : right));
			}
		}
	}

	/**
	 * Split an alternative into its tokens.
	 */
	public static List<String> tokenize(String alternative){
		String trimmed = alternative.trim();
		List<String> tokens = new ArrayList<>();
		if (trimmed.isEmpty()){
			return tokens;
		}
		if (containsWhitespace(trimmed)){
			tokens.addAll(Arrays.asList(trimmed.split("\\s+")));
			return tokens;
		}
		int i = 0;
		while (i < trimmed.length()){
			int codePoint = trimmed.codePointAt(i);
			int end = i + Character.charCount(codePoint);
			if (Character.isUpperCase(codePoint)){
				boolean afterUnderscore = false;
				while (end < trimmed.length()){
					char c = trimmed.charAt(end);
					if (c == '_'){
						afterUnderscore = true;
					} else if (!(Character.isDigit(c) || c == '\'' || (afterUnderscore && Character.isLetter(c)))){
						break;
					}
					end++;
				}
			}
			tokens.add(trimmed.substring(i, end));
			i = end;
		}
		return tokens;
	}

	/**
	 * Classify the tokens, epsilon markers are dropped.
	 */
	public static List<Symbol> toSymbols(List<String> tokens){
		List<Symbol> symbols = new ArrayList<>();
		for (String token : tokens) {
			if (EPSILON_MARKERS.contains(token)){
				continue;
			}
			if (isNonTerminalToken(token)){
				symbols.add(new NonTerminal(token));
			} else {
				symbols.add(new Terminal(token));
			}
		}
		return symbols;
	}

	public static boolean isNonTerminalToken(String token){
		return !token.isEmpty() && Character.isUpperCase(token.codePointAt(0));
	}

	private static boolean containsWhitespace(String str){
		for (int i = 0; i < str.length(); i++) {
			if (Character.isWhitespace(str.charAt(i))){
				return true;
			}
		}
		return false;
	}
}
