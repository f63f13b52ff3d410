package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;

/**
 * Orders each state's transitions. Matchers need transitions sorted on the side they
 * match. The sort is stable.
 */
public enum TransitionSort {
	// by input label, then output label
	ILABEL(new Comparator<Transition<?>>() {
		public int compare(Transition<?> a, Transition<?> b) {
			if (a.getILabel() != b.getILabel())
				return a.getILabel() < b.getILabel() ? -1 : 1;
			if (a.getOLabel() != b.getOLabel())
				return a.getOLabel() < b.getOLabel() ? -1 : 1;
			return 0;
		}
	}),
	// by output label, then input label
	OLABEL(new Comparator<Transition<?>>() {
		public int compare(Transition<?> a, Transition<?> b) {
			if (a.getOLabel() != b.getOLabel())
				return a.getOLabel() < b.getOLabel() ? -1 : 1;
			if (a.getILabel() != b.getILabel())
				return a.getILabel() < b.getILabel() ? -1 : 1;
			return 0;
		}
	});

	private final Comparator<Transition<?>> cmp;
	private TransitionSort(Comparator<Transition<?>> cmp) {
		this.cmp = cmp;
	}
	public Comparator<Transition<?>> comparator() { return cmp; }

	public static TransitionSort get(String s) throws ConfigureException {
		for (TransitionSort t : TransitionSort.values()) {
			if (t.toString().equalsIgnoreCase(s))
				return t;
		}
		throw new ConfigureException("Invalid sort type ("+s+"); valid values are ilabel olabel");
	}

	public static <W> void sort(MutableFst<W> fst, TransitionSort type) {
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.transitions(s));
			Collections.sort(l, type.cmp);
			fst.setTransitions(s, l);
		}
	}
}
