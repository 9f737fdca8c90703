package chomsky.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import chomsky.grammar.Grammar;

/**
 * Collects the snapshots of a single conversion in the order of the stages.
 */
public class StepRecorder {

	private final List<Snapshot> snapshots = new ArrayList<>();

	public Snapshot record(String label, Grammar grammar){
		Snapshot snapshot = new Snapshot(label, grammar);
		snapshots.add(snapshot);
		return snapshot;
	}

	/**
	 * Recorded snapshots, later recordings don't show up in the returned list
	 */
	public List<Snapshot> getSnapshots(){
		return Collections.unmodifiableList(new ArrayList<>(snapshots));
	}

	public int size(){
		return snapshots.size();
	}
}
