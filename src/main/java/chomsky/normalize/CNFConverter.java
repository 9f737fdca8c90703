package chomsky.normalize;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import chomsky.InvariantViolationError;
import chomsky.grammar.Grammar;
import chomsky.parser.GrammarParser;

/**
 * Converts context free grammars into Chomsky normal form.
 *
 * The stages run in a fixed order, each one gets the grammar produced by its predecessor. A
 * conversion only uses its own grammar values, therefore independent conversions can run
 * concurrently.
 */
public class CNFConverter {

	public static final Logger LOG = Logger.getLogger("Normalization");

	public static final List<NormalizationStage> STAGES = Collections.unmodifiableList(Arrays.asList(
			new StartSymbolIsolation(),
			new EpsilonProductionElimination(),
			new UnitProductionElimination(),
			new UselessSymbolElimination(),
			new Binarization()));

	private CNFConverter() {
	}

	/**
	 * Parse and convert the passed grammar text.
	 *
	 * @throws chomsky.parser.GrammarParseException if the text isn't a valid grammar
	 */
	public static ConversionResult convert(String text){
		return convert(GrammarParser.parse(text));
	}

	public static ConversionResult convert(Grammar grammar){
		StepRecorder recorder = new StepRecorder();
		Grammar current = grammar;
		for (NormalizationStage stage : STAGES) {
			current = stage.apply(current);
			recorder.record(stage.label(), current);
			if (LOG.isLoggable(Level.FINE)){
				LOG.fine(String.format("%s: %d productions, %d non terminals", stage.label(),
						current.getProductions().size(), current.getNonTerminals().size()));
			}
			if (LOG.isLoggable(Level.FINER)){
				LOG.finer(current.format());
			}
		}
		if (!current.isInChomskyNormalForm()){
			throw new InvariantViolationError("Result isn't in Chomsky normal form:\n" + current.longDescription());
		}
		return new ConversionResult(current, recorder.getSnapshots());
	}
}
