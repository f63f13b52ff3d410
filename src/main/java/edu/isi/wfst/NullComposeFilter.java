package edu.isi.wfst;

// no implicit self loops: epsilon only matches epsilon, as an ordinary label
public class NullComposeFilter<W> implements ComposeFilter<W, TrivialFilterState> {
	private final Semiring<W> semiring;
	public NullComposeFilter(Semiring<W> semiring) {
		this.semiring = semiring;
	}
	public TrivialFilterState start() { return TrivialFilterState.ALLOW; }
	public void setState(int s1, int s2, TrivialFilterState fs) {}
	public TrivialFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		return TrivialFilterState.get(t1.getOLabel() != Transition.NO_LABEL && t2.getILabel() != Transition.NO_LABEL);
	}
	public W filterFinal(W final1, W final2) {
		return semiring.times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.NULL; }
}
