package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Whether two automata are the same up to state numbering, weights compared within
 * delta. Transitions of paired states are matched after sorting by labels and weight,
 * so automata whose states have several transitions with identical labels and weights
 * but different futures may be reported as different.
 */
public class Isomorphic {
	private Isomorphic() {}

	public static <W> boolean isomorphic(ExpandedFst<W> a, ExpandedFst<W> b) {
		return isomorphic(a, b, Semiring.KDELTA);
	}

	public static <W> boolean isomorphic(ExpandedFst<W> a, ExpandedFst<W> b, float delta) {
		boolean debug = false;
		final Semiring<W> sr = a.getSemiring();
		if (a.numStates() != b.numStates())
			return false;
		if (a.start() == Transition.NO_STATE || b.start() == Transition.NO_STATE)
			return a.start() == b.start();
		int n = a.numStates();
		int[] map = new int[n];
		int[] back = new int[n];
		for (int i = 0; i < n; i++) {
			map[i] = -1;
			back[i] = -1;
		}
		Comparator<Transition<W>> cmp = new Comparator<Transition<W>>() {
			public int compare(Transition<W> x, Transition<W> y) {
				int c = TransitionSort.ILABEL.comparator().compare(x, y);
				if (c != 0)
					return c;
				return sr.format(sr.quantize(x.getWeight(), Semiring.KDELTA)).compareTo(sr.format(sr.quantize(y.getWeight(), Semiring.KDELTA)));
			}
		};
		TIntArrayList queue = new TIntArrayList();
		map[a.start()] = b.start();
		back[b.start()] = a.start();
		queue.add(a.start());
		for (int h = 0; h < queue.size(); h++) {
			int s1 = queue.get(h);
			int s2 = map[s1];
			if (!sr.approxEqual(a.finalWeight(s1), b.finalWeight(s2), delta)) {
				if (debug) Debug.debug(debug, "Final weights of "+s1+" and "+s2+" differ");
				return false;
			}
			if (a.numTransitions(s1) != b.numTransitions(s2))
				return false;
			List<Transition<W>> t1 = new ArrayList<Transition<W>>(a.transitions(s1));
			List<Transition<W>> t2 = new ArrayList<Transition<W>>(b.transitions(s2));
			Collections.sort(t1, cmp);
			Collections.sort(t2, cmp);
			for (int i = 0; i < t1.size(); i++) {
				Transition<W> x = t1.get(i);
				Transition<W> y = t2.get(i);
				if (x.getILabel() != y.getILabel() || x.getOLabel() != y.getOLabel())
					return false;
				if (!sr.approxEqual(x.getWeight(), y.getWeight(), delta))
					return false;
				int d1 = x.getNextState();
				int d2 = y.getNextState();
				if (map[d1] == -1 && back[d2] == -1) {
					map[d1] = d2;
					back[d2] = d1;
					queue.add(d1);
				}
				else if (map[d1] != d2)
					return false;
			}
		}
		return true;
	}
}
