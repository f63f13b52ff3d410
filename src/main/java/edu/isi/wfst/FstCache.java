package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-state storage for a lazy automaton. With garbage collection on, once the number
 * of cached transitions passes the limit, states that were not touched since the
 * previous collection and are not pinned get dropped; they are recomputed if asked for
 * again. Not thread-safe.
 */
public class FstCache<W> {
	private final CacheOptions opts;
	private final ArrayList<CacheState<W>> states = new ArrayList<CacheState<W>>();
	private boolean startCached = false;
	private int start = Transition.NO_STATE;
	private long cachedTransitions = 0;
	private int collections = 0;

	public FstCache(CacheOptions opts) {
		this.opts = opts;
	}

	public boolean hasStart() { return startCached; }
	public int getStart() { return start; }
	void setStart(int s) {
		start = s;
		startCached = true;
	}

	/** the entry for s, or null if nothing is cached for it */
	public CacheState<W> peek(int s) {
		if (s < 0 || s >= states.size())
			return null;
		return states.get(s);
	}
	private CacheState<W> getOrCreate(int s) {
		while (states.size() <= s)
			states.add(null);
		CacheState<W> cs = states.get(s);
		if (cs == null) {
			cs = new CacheState<W>();
			states.set(s, cs);
		}
		cs.setFlags(CacheState.RECENT);
		return cs;
	}
	public boolean hasFinal(int s) {
		CacheState<W> cs = peek(s);
		return cs != null && cs.hasFlags(CacheState.FINAL_CACHED);
	}
	public boolean hasTransitions(int s) {
		CacheState<W> cs = peek(s);
		return cs != null && cs.hasFlags(CacheState.TRANSITIONS_CACHED);
	}
	public W getFinalWeight(int s) {
		CacheState<W> cs = states.get(s);
		cs.setFlags(CacheState.RECENT);
		return cs.getFinalWeight();
	}
	public List<Transition<W>> getTransitions(int s) {
		CacheState<W> cs = states.get(s);
		cs.setFlags(CacheState.RECENT);
		return cs.getTransitions();
	}
	void setFinalWeight(int s, W w) {
		getOrCreate(s).setFinalWeight(w);
	}
	void setTransitions(int s, List<Transition<W>> ts) {
		CacheState<W> cs = getOrCreate(s);
		cachedTransitions -= cs.numTransitions();
		cs.setTransitions(ts);
		cachedTransitions += ts.size();
		if (opts.isGc() && cachedTransitions > opts.getGcLimit())
			collect(s);
	}

	/** keeps s in the cache until a matching {@link #unpin} */
	public void pin(int s) {
		getOrCreate(s).incrementRefCount();
	}
	public void unpin(int s) {
		CacheState<W> cs = peek(s);
		if (cs != null)
			cs.decrementRefCount();
	}

	// drop cold, unpinned states; keep is the state being filled right now
	private void collect(int keep) {
		boolean debug = false;
		int dropped = 0;
		for (int s = 0; s < states.size(); s++) {
			CacheState<W> cs = states.get(s);
			if (cs == null || s == keep)
				continue;
			if (!cs.hasFlags(CacheState.RECENT) && cs.getRefCount() == 0) {
				cachedTransitions -= cs.numTransitions();
				states.set(s, null);
				dropped++;
			}
			else
				cs.clearFlags(CacheState.RECENT);
		}
		collections++;
		if (debug) Debug.debug(debug, "Collection "+collections+" dropped "+dropped+" states; "+cachedTransitions+" transitions remain");
	}

	public long getCachedTransitions() { return cachedTransitions; }
	public int getCollections() { return collections; }
	/** number of states with an entry */
	public int numCachedStates() {
		int n = 0;
		for (CacheState<W> cs : states)
			if (cs != null)
				n++;
		return n;
	}
}
