package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;

// drops exact duplicate transitions of each state; survivors are sorted by labels and destination
public class TransitionUnique {
	private TransitionUnique() {}

	public static <W> void unique(MutableFst<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			if (fst.numTransitions(s) < 2)
				continue;
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.transitions(s));
			Collections.sort(l, TransitionSum.LABELS_AND_DEST);
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(l.size());
			for (Transition<W> t : l) {
				boolean dup = false;
				// duplicates sit in one run of equal labels and destination
				for (int i = out.size()-1; i >= 0 && TransitionSum.LABELS_AND_DEST.compare(out.get(i), t) == 0; i--) {
					if (sr.equal(out.get(i).getWeight(), t.getWeight())) {
						dup = true;
						break;
					}
				}
				if (!dup)
					out.add(t);
			}
			fst.setTransitions(s, out);
		}
	}
}
