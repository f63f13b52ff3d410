package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly connected components (Tarjan, without recursion) plus accessibility and
 * coaccessibility of every state of an expanded automaton. Components are numbered in
 * topological order: transitions never go from a higher to a lower component.
 */
public class SccVisitor {
	private final int[] scc;
	private final boolean[] access;
	private final boolean[] coaccess;
	private int nscc = 0;
	private boolean acyclic = true;

	public <W> SccVisitor(ExpandedFst<W> fst) {
		int n = fst.numStates();
		scc = new int[n];
		access = new boolean[n];
		coaccess = new boolean[n];
		if (n == 0)
			return;
		int[] index = new int[n];
		int[] low = new int[n];
		boolean[] onstack = new boolean[n];
		for (int i = 0; i < n; i++)
			index[i] = -1;
		int counter = 0;
		TIntArrayStack stack = new TIntArrayStack();
		// dfs frames: state and next transition to look at
		TIntArrayList fstate = new TIntArrayList();
		TIntArrayList fnext = new TIntArrayList();
		int start = fst.start();
		for (int k = -1; k < n; k++) {
			int root = k == -1 ? start : k;
			if (root < 0 || index[root] != -1)
				continue;
			index[root] = low[root] = counter++;
			stack.push(root);
			onstack[root] = true;
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
					if (w == v)
						acyclic = false;
					if (index[w] == -1) {
						index[w] = low[w] = counter++;
						stack.push(w);
						onstack[w] = true;
						fstate.add(w);
						fnext.add(0);
					}
					else if (onstack[w] && index[w] < low[v])
						low[v] = index[w];
				}
				else {
					fstate.removeAt(top);
					fnext.removeAt(top);
					if (top > 0) {
						int p = fstate.get(top-1);
						if (low[v] < low[p])
							low[p] = low[v];
					}
					if (low[v] == index[v]) {
						int size = 0;
						int x;
						do {
							x = stack.pop();
							onstack[x] = false;
							scc[x] = nscc;
							size++;
						} while (x != v);
						if (size > 1)
							acyclic = false;
						nscc++;
					}
				}
			}
		}
		// tarjan finishes sinks first; flip to topological numbering
		for (int s = 0; s < n; s++)
			scc[s] = nscc-1-scc[s];

		if (start >= 0) {
			TIntArrayList q = new TIntArrayList();
			access[start] = true;
			q.add(start);
			for (int h = 0; h < q.size(); h++) {
				for (Transition<W> t : fst.transitions(q.get(h))) {
					if (!access[t.getNextState()]) {
						access[t.getNextState()] = true;
						q.add(t.getNextState());
					}
				}
			}
		}
		// coaccessibility over the reversed graph
		ArrayList<TIntArrayList> preds = new ArrayList<TIntArrayList>(n);
		for (int s = 0; s < n; s++)
			preds.add(new TIntArrayList());
		TIntArrayList q = new TIntArrayList();
		for (int s = 0; s < n; s++) {
			for (Transition<W> t : fst.transitions(s))
				preds.get(t.getNextState()).add(s);
			if (fst.isFinal(s)) {
				coaccess[s] = true;
				q.add(s);
			}
		}
		for (int h = 0; h < q.size(); h++) {
			TIntArrayList ps = preds.get(q.get(h));
			for (int j = 0; j < ps.size(); j++) {
				int p = ps.get(j);
				if (!coaccess[p]) {
					coaccess[p] = true;
					q.add(p);
				}
			}
		}
	}

	public int[] getScc() { return scc; }
	public int numSccs() { return nscc; }
	public boolean[] getAccess() { return access; }
	public boolean[] getCoaccess() { return coaccess; }
	/** no cycles anywhere, self loops included */
	public boolean isAcyclic() { return acyclic; }
}
