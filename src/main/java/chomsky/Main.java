package chomsky;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import chomsky.grammar.Grammar;
import chomsky.grammar.words.TerminalSequence;
import chomsky.grammar.words.WordGenerator;
import chomsky.normalize.CNFConverter;
import chomsky.normalize.ConversionResult;
import chomsky.normalize.Snapshot;
import chomsky.parser.GrammarParser;

/**
 * Command line interface:
 * <pre>
 * chomsky GRAMMAR_FILE|-            print the steps and the grammar in Chomsky normal form
 * chomsky --words [N] GRAMMAR_FILE|-  print the words of the grammar up to length N
 * </pre>
 */
public class Main {

	public static void main(String[] args) {
		try {
			configureLogging(Config.logLevel());
			System.exit(run(args));
		} catch (ChomskyException e) {
			System.err.println(e.getMessage());
			System.exit(1);
		} catch (IOException e) {
			System.err.println("Can't read the grammar: " + e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.exit(1);
		}
	}

	static int run(String[] args) throws IOException {
		if (args.length == 0 || args[0].equals("--help")){
			usage();
			return args.length == 0 ? 1 : 0;
		}
		if (args[0].equals("--words")){
			int maxLength = Config.maxWordLength();
			String file;
			if (args.length == 3){
				maxLength = parseMaxLength(args[1]);
				file = args[2];
			} else if (args.length == 2){
				file = args[1];
			} else {
				usage();
				return 1;
			}
			printWords(GrammarParser.parse(read(file)), maxLength);
			return 0;
		}
		if (args.length != 1){
			usage();
			return 1;
		}
		ConversionResult result = CNFConverter.convert(read(args[0]));
		if (Config.showSteps()){
			for (Snapshot step : result.getSteps()) {
				System.out.println("--- " + step.label);
				System.out.println(step.text());
			}
			System.out.println();
		}
		System.out.println("CNF:");
		System.out.println(result.getGrammar().format());
		return 0;
	}

	private static int parseMaxLength(String arg){
		int maxLength;
		try {
			maxLength = Integer.parseInt(arg);
		} catch (NumberFormatException e){
			throw new ChomskyException(String.format("Invalid maximum word length \"%s\"", arg));
		}
		if (maxLength < 0){
			throw new ChomskyException(String.format("The maximum word length can't be negative, got %d", maxLength));
		}
		return maxLength;
	}

	private static void printWords(Grammar grammar, int maxLength){
		int maxWords = Config.maxWords();
		for (TerminalSequence word : new WordGenerator(grammar, maxLength).generate(maxWords)) {
			System.out.println(word.format());
		}
	}

	private static String read(String file) throws IOException {
		if (file.equals("-")){
			InputStream in = System.in;
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		return new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8);
	}

	private static void usage(){
		System.err.println("Usage: chomsky GRAMMAR_FILE|-");
		System.err.println("       chomsky --words [MAX_LENGTH] GRAMMAR_FILE|-");
	}

	private static void configureLogging(Level level){
		Logger root = Logger.getLogger("");
		root.setLevel(level);
		for (Handler handler : root.getHandlers()) {
			if (handler instanceof ConsoleHandler){
				handler.setLevel(level);
			}
		}
	}
}
