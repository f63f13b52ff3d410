package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;

/**
 * Merges transitions of a state that agree on labels and destination into one,
 * summing their weights. Transitions come out sorted by (ilabel, olabel, destination).
 */
public class TransitionSum {
	private TransitionSum() {}

	static final Comparator<Transition<?>> LABELS_AND_DEST = new Comparator<Transition<?>>() {
		public int compare(Transition<?> a, Transition<?> b) {
			if (a.getILabel() != b.getILabel())
				return a.getILabel() < b.getILabel() ? -1 : 1;
			if (a.getOLabel() != b.getOLabel())
				return a.getOLabel() < b.getOLabel() ? -1 : 1;
			if (a.getNextState() != b.getNextState())
				return a.getNextState() < b.getNextState() ? -1 : 1;
			return 0;
		}
	};

	public static <W> void sum(MutableFst<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			if (fst.numTransitions(s) < 2)
				continue;
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.transitions(s));
			Collections.sort(l, LABELS_AND_DEST);
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(l.size());
			for (Transition<W> t : l) {
				if (!out.isEmpty() && LABELS_AND_DEST.compare(out.get(out.size()-1), t) == 0) {
					Transition<W> last = out.get(out.size()-1);
					out.set(out.size()-1, last.withWeight(sr.plus(last.getWeight(), t.getWeight())));
				}
				else
					out.add(t);
			}
			fst.setTransitions(s, out);
		}
	}
}
