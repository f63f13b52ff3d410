package edu.isi.wfst;

import java.util.Collections;
import java.util.List;

// what the cache knows about one state of a lazy automaton
public class CacheState<W> {
	public static final int FINAL_CACHED = 0x01;
	public static final int TRANSITIONS_CACHED = 0x02;
	// the entry exists and holds data
	public static final int INIT = 0x04;
	// touched since the last collection
	public static final int RECENT = 0x08;

	private int flags = 0;
	private W finalWeight;
	private List<Transition<W>> trs;
	private int niepsilons = 0;
	private int noepsilons = 0;
	private int refCount = 0;

	public boolean hasFlags(int f) { return (flags & f) == f; }
	void setFlags(int f) { flags |= f; }
	void clearFlags(int f) { flags &= ~f; }
	public int getFlags() { return flags; }

	public W getFinalWeight() { return finalWeight; }
	void setFinalWeight(W w) {
		finalWeight = w;
		setFlags(FINAL_CACHED | INIT);
	}
	public List<Transition<W>> getTransitions() { return trs; }
	void setTransitions(List<Transition<W>> ts) {
		trs = Collections.unmodifiableList(ts);
		niepsilons = 0;
		noepsilons = 0;
		for (Transition<W> t : ts) {
			if (t.getILabel() == Transition.EPSILON)
				niepsilons++;
			if (t.getOLabel() == Transition.EPSILON)
				noepsilons++;
		}
		setFlags(TRANSITIONS_CACHED | INIT);
	}
	public int numTransitions() { return trs == null ? 0 : trs.size(); }
	public int numInputEpsilons() { return niepsilons; }
	public int numOutputEpsilons() { return noepsilons; }

	public int getRefCount() { return refCount; }
	void incrementRefCount() { refCount++; }
	void decrementRefCount() {
		if (refCount > 0)
			refCount--;
	}
}
