package edu.isi.wfst;

/**
 * Prefers taking epsilons on both sides together. When only one side moves alone it
 * keeps doing so: filter state 1 while the first is moving alone, 2 while the second is.
 */
public class MatchComposeFilter<W> implements ComposeFilter<W, CharFilterState> {
	private final Fst<W> fst1;
	private final Fst<W> fst2;
	private CharFilterState fs;
	private boolean alleps1;
	private boolean noeps1;
	private boolean alleps2;
	private boolean noeps2;

	public MatchComposeFilter(Fst<W> fst1, Fst<W> fst2) {
		this.fst1 = fst1;
		this.fst2 = fst2;
	}
	public CharFilterState start() { return CharFilterState.get(0); }

	public void setState(int s1, int s2, CharFilterState fs) throws FstException {
		this.fs = fs;
		int ne1 = fst1.numOutputEpsilons(s1);
		alleps1 = fst1.numTransitions(s1) == ne1 && !fst1.isFinal(s1);
		noeps1 = ne1 == 0;
		int ne2 = fst2.numInputEpsilons(s2);
		alleps2 = fst2.numTransitions(s2) == ne2 && !fst2.isFinal(s2);
		noeps2 = ne2 == 0;
	}
	public CharFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		int state = fs.getState();
		if (t2.getILabel() == Transition.NO_LABEL) {
			// first moves alone
			if (state == 0) {
				if (noeps2)
					return CharFilterState.get(0);
				return alleps2 ? CharFilterState.BLOCKED : CharFilterState.get(1);
			}
			return state == 1 ? CharFilterState.get(1) : CharFilterState.BLOCKED;
		}
		if (t1.getOLabel() == Transition.NO_LABEL) {
			// second moves alone
			if (state == 0) {
				if (noeps1)
					return CharFilterState.get(0);
				return alleps1 ? CharFilterState.BLOCKED : CharFilterState.get(2);
			}
			return state == 2 ? CharFilterState.get(2) : CharFilterState.BLOCKED;
		}
		if (t1.getOLabel() == Transition.EPSILON)
			return state == 0 ? CharFilterState.get(0) : CharFilterState.BLOCKED;
		return CharFilterState.get(0);
	}
	public W filterFinal(W final1, W final2) {
		return fst1.getSemiring().times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.MATCH; }
}
