package edu.isi.wfst;

// never pairs a real output epsilon of the first with a real input epsilon of the second
public class NoMatchComposeFilter<W> implements ComposeFilter<W, TrivialFilterState> {
	private final Semiring<W> semiring;
	public NoMatchComposeFilter(Semiring<W> semiring) {
		this.semiring = semiring;
	}
	public TrivialFilterState start() { return TrivialFilterState.ALLOW; }
	public void setState(int s1, int s2, TrivialFilterState fs) {}
	public TrivialFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		return TrivialFilterState.get(t1.getOLabel() != Transition.EPSILON || t2.getILabel() != Transition.EPSILON);
	}
	public W filterFinal(W final1, W final2) {
		return semiring.times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.NO_MATCH; }
}
