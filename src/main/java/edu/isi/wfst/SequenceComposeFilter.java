package edu.isi.wfst;

/**
 * Lets the first automaton take its output epsilons first and the second its input
 * epsilons afterwards, never the other way round. Filter state 0 means the first may
 * still move alone; 1 means the second has started moving alone.
 */
public class SequenceComposeFilter<W> implements ComposeFilter<W, CharFilterState> {
	private final Fst<W> fst1;
	private CharFilterState fs;
	// only output epsilons leave s1 and it is not final
	private boolean alleps1;
	// no output epsilon leaves s1
	private boolean noeps1;

	public SequenceComposeFilter(Fst<W> fst1) {
		this.fst1 = fst1;
	}
	public CharFilterState start() { return CharFilterState.get(0); }

	public void setState(int s1, int s2, CharFilterState fs) throws FstException {
		this.fs = fs;
		int na1 = fst1.numTransitions(s1);
		int ne1 = fst1.numOutputEpsilons(s1);
		alleps1 = na1 == ne1 && !fst1.isFinal(s1);
		noeps1 = ne1 == 0;
	}
	public CharFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		if (t1.getOLabel() == Transition.NO_LABEL) {
			if (alleps1)
				return CharFilterState.BLOCKED;
			return CharFilterState.get(noeps1 ? 0 : 1);
		}
		if (t2.getILabel() == Transition.NO_LABEL)
			return fs.getState() != 0 ? CharFilterState.BLOCKED : CharFilterState.get(0);
		return t1.getOLabel() == Transition.EPSILON ? CharFilterState.BLOCKED : CharFilterState.get(0);
	}
	public W filterFinal(W final1, W final2) {
		return fst1.getSemiring().times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.SEQUENCE; }
}
