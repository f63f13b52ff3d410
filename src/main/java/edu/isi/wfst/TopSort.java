package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Topological sorting of states. On an automaton with a cycle nothing is changed and
 * the sort reports failure.
 */
public class TopSort {
	private TopSort() {}

	/**
	 * Renumbers the states of fst so every transition goes from a lower to a higher id.
	 * Returns false, leaving fst untouched, if fst has a cycle. An automaton that is
	 * already in topological order keeps its numbering.
	 */
	public static <W> boolean topSort(MutableFst<W> fst) {
		if (isTopSorted(fst))
			return true;
		int[] order = topOrder(fst);
		if (order == null)
			return false;
		stateSort(fst, order);
		return true;
	}

	/** every transition goes from a lower to a higher state id */
	public static <W> boolean isTopSorted(ExpandedFst<W> fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Transition<W> t : fst.transitions(s))
				if (t.getNextState() <= s)
					return false;
		return true;
	}

	/**
	 * order[s] = the topological rank of s, or null if fst is cyclic. The search starts
	 * at the start state, so states it cannot reach are ranked before it.
	 */
	public static <W> int[] topOrder(ExpandedFst<W> fst) {
		int n = fst.numStates();
		// 0 white, 1 grey, 2 black
		byte[] color = new byte[n];
		TIntArrayList finish = new TIntArrayList(n);
		TIntArrayList fstate = new TIntArrayList();
		TIntArrayList fnext = new TIntArrayList();
		int start = fst.start();
		for (int k = -1; k < n; k++) {
			int root = k == -1 ? start : k;
			if (root < 0 || color[root] != 0)
				continue;
			color[root] = 1;
			fstate.add(root);
			fnext.add(0);
			while (fstate.size() > 0) {
				int top = fstate.size()-1;
				int v = fstate.get(top);
				int i = fnext.get(top);
				List<Transition<W>> trs = fst.transitions(v);
				if (i < trs.size()) {
					fnext.set(top, i+1);
					int w = trs.get(i).getNextState();
					if (color[w] == 1)
						return null;
					if (color[w] == 0) {
						color[w] = 1;
						fstate.add(w);
						fnext.add(0);
					}
				}
				else {
					color[v] = 2;
					finish.add(v);
					fstate.removeAt(top);
					fnext.removeAt(top);
				}
			}
		}
		int[] order = new int[n];
		for (int i = 0; i < n; i++)
			order[finish.get(i)] = n-1-i;
		return order;
	}

	/** moves state s to position order[s]; order must be a permutation */
	public static <W> void stateSort(MutableFst<W> fst, int[] order) {
		int n = fst.numStates();
		if (order.length != n)
			throw new IllegalArgumentException("Order has "+order.length+" entries for "+n+" states");
		ArrayList<List<Transition<W>>> trs = new ArrayList<List<Transition<W>>>(n);
		ArrayList<W> finals = new ArrayList<W>(n);
		for (int s = 0; s < n; s++) {
			trs.add(null);
			finals.add(null);
		}
		for (int s = 0; s < n; s++) {
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s))
				l.add(t.withNextState(order[t.getNextState()]));
			trs.set(order[s], l);
			finals.set(order[s], fst.finalWeight(s));
		}
		int start = fst.start();
		for (int s = 0; s < n; s++) {
			fst.setTransitions(s, trs.get(s));
			fst.setFinal(s, finals.get(s));
		}
		if (start != Transition.NO_STATE)
			fst.setStart(order[start]);
	}
}
