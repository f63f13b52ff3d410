package edu.isi.wfst;

/**
 * Mirror of {@link SequenceComposeFilter}: the second automaton's input epsilons go
 * first. Filter state 1 means the first has started moving alone.
 */
public class AltSequenceComposeFilter<W> implements ComposeFilter<W, CharFilterState> {
	private final Fst<W> fst2;
	private CharFilterState fs;
	private boolean alleps2;
	private boolean noeps2;

	public AltSequenceComposeFilter(Fst<W> fst2) {
		this.fst2 = fst2;
	}
	public CharFilterState start() { return CharFilterState.get(0); }

	public void setState(int s1, int s2, CharFilterState fs) throws FstException {
		this.fs = fs;
		int na2 = fst2.numTransitions(s2);
		int ne2 = fst2.numInputEpsilons(s2);
		alleps2 = na2 == ne2 && !fst2.isFinal(s2);
		noeps2 = ne2 == 0;
	}
	public CharFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		if (t2.getILabel() == Transition.NO_LABEL) {
			if (alleps2)
				return CharFilterState.BLOCKED;
			return CharFilterState.get(noeps2 ? 0 : 1);
		}
		if (t1.getOLabel() == Transition.NO_LABEL)
			return fs.getState() == 1 ? CharFilterState.BLOCKED : CharFilterState.get(0);
		return t1.getOLabel() == Transition.EPSILON ? CharFilterState.BLOCKED : CharFilterState.get(0);
	}
	public W filterFinal(W final1, W final2) {
		return fst2.getSemiring().times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.ALT_SEQUENCE; }
}
