package edu.isi.wfst;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;

/**
 * Replaces labels by (old, new) pairs, input and output side separately. Labels with no
 * pair keep their value. Symbol tables are left as they are.
 */
public class Relabel {
	private Relabel() {}

	/** each pair is {old, new}; an old label may appear only once per side */
	public static <W> void relabel(MutableFst<W> fst, int[][] ipairs, int[][] opairs) throws ConfigureException {
		relabel(fst, pairMap(ipairs, "input"), pairMap(opairs, "output"));
	}

	public static <W> void relabel(MutableFst<W> fst, TIntIntHashMap imap, TIntIntHashMap omap) {
		boolean debug = false;
		int changed = 0;
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(fst.numTransitions(s));
			boolean touched = false;
			for (Transition<W> t : fst.transitions(s)) {
				int il = imap.containsKey(t.getILabel()) ? imap.get(t.getILabel()) : t.getILabel();
				int ol = omap.containsKey(t.getOLabel()) ? omap.get(t.getOLabel()) : t.getOLabel();
				if (il != t.getILabel() || ol != t.getOLabel()) {
					out.add(new Transition<W>(il, ol, t.getWeight(), t.getNextState()));
					touched = true;
					changed++;
				}
				else
					out.add(t);
			}
			// setTransitions recounts the epsilons
			if (touched)
				fst.setTransitions(s, out);
		}
		if (debug) Debug.debug(debug, "Relabeled "+changed+" transitions");
	}

	static TIntIntHashMap pairMap(int[][] pairs, String side) throws ConfigureException {
		TIntIntHashMap map = new TIntIntHashMap();
		if (pairs == null)
			return map;
		for (int[] p : pairs) {
			if (p.length != 2)
				throw new ConfigureException("Relabeling pair on the "+side+" side has "+p.length+" entries, not 2");
			if (p[0] < 0 || p[1] < 0)
				throw new ConfigureException("Negative label in "+side+" pair "+p[0]+" "+p[1]);
			if (map.containsKey(p[0]))
				throw new ConfigureException("Label "+p[0]+" is relabeled twice on the "+side+" side");
			map.put(p[0], p[1]);
		}
		return map;
	}
}
