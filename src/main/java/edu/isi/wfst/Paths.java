package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists every accepting path of an acyclic automaton. The number of paths can be
 * exponential in the size of the automaton; this is meant for small ones.
 */
public class Paths {
	private Paths() {}

	public static <W> List<Path<W>> paths(ExpandedFst<W> fst) throws ConfigureException {
		if (fst.start() == Transition.NO_STATE)
			return new ArrayList<Path<W>>();
		if (TopSort.topOrder(fst) == null)
			throw new ConfigureException("Path enumeration needs an acyclic automaton");
		ArrayList<Path<W>> out = new ArrayList<Path<W>>();
		walk(fst, fst.start(), new TIntArrayList(), new TIntArrayList(), fst.getSemiring().one(), out);
		return out;
	}

	private static <W> void walk(ExpandedFst<W> fst, int s, TIntArrayList il, TIntArrayList ol, W w, List<Path<W>> out) {
		Semiring<W> sr = fst.getSemiring();
		W fw = fst.finalWeight(s);
		if (!sr.isZero(fw))
			out.add(new Path<W>(il.toArray(), ol.toArray(), sr.times(w, fw)));
		for (Transition<W> t : fst.transitions(s)) {
			if (t.getILabel() != Transition.EPSILON)
				il.add(t.getILabel());
			if (t.getOLabel() != Transition.EPSILON)
				ol.add(t.getOLabel());
			walk(fst, t.getNextState(), il, ol, sr.times(w, t.getWeight()), out);
			if (t.getILabel() != Transition.EPSILON)
				il.removeAt(il.size()-1);
			if (t.getOLabel() != Transition.EPSILON)
				ol.removeAt(ol.size()-1);
		}
	}
}
