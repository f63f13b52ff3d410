package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

/**
 * Trims an automaton to the states that are both reachable from the start and able to
 * reach a final state.
 */
public class Connect {
	private Connect() {}

	public static <W> void connect(MutableFst<W> fst) {
		boolean debug = false;
		SccVisitor v = new SccVisitor(fst);
		boolean[] access = v.getAccess();
		boolean[] coaccess = v.getCoaccess();
		TIntArrayList dead = new TIntArrayList();
		for (int s = 0; s < fst.numStates(); s++)
			if (!access[s] || !coaccess[s])
				dead.add(s);
		if (debug) Debug.debug(debug, "Removing "+dead.size()+" of "+fst.numStates()+" states");
		if (dead.size() == fst.numStates())
			fst.deleteAllStates();
		else
			fst.deleteStates(dead.toArray());
	}
}
