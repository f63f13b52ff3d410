package edu.isi.wfst;

import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;

/**
 * Removes epsilon transitions into final states that lead nowhere else, folding their
 * weight into the source's final weight. Connects the result.
 */
public class RmFinalEpsilon {
	private RmFinalEpsilon() {}

	public static <W> void rmFinalEpsilon(MutableFst<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		boolean[] coaccess = new SccVisitor(fst).getCoaccess();
		TIntHashSet finals = new TIntHashSet();
		for (int s = 0; s < fst.numStates(); s++) {
			if (!fst.isFinal(s))
				continue;
			boolean future = false;
			for (Transition<W> t : fst.transitions(s)) {
				if (coaccess[t.getNextState()]) {
					future = true;
					break;
				}
			}
			if (!future)
				finals.add(s);
		}
		for (int s = 0; s < fst.numStates(); s++) {
			W w = null;
			ArrayList<Transition<W>> kept = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s)) {
				if (finals.contains(t.getNextState()) && t.isEpsilon()) {
					if (w == null)
						w = fst.finalWeight(s);
					w = sr.plus(w, sr.times(t.getWeight(), fst.finalWeight(t.getNextState())));
				}
				else
					kept.add(t);
			}
			if (w != null) {
				if (!sr.isZero(w))
					fst.setFinal(s, w);
				fst.setTransitions(s, kept);
			}
		}
		Connect.connect(fst);
	}
}
