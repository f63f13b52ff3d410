package edu.isi.wfst;

// lets every pair through. Only correct when no epsilon path can be doubled
public class TrivialComposeFilter<W> implements ComposeFilter<W, TrivialFilterState> {
	private final Semiring<W> semiring;
	public TrivialComposeFilter(Semiring<W> semiring) {
		this.semiring = semiring;
	}
	public TrivialFilterState start() { return TrivialFilterState.ALLOW; }
	public void setState(int s1, int s2, TrivialFilterState fs) {}
	public TrivialFilterState filterTransition(Transition<W> t1, Transition<W> t2) {
		return TrivialFilterState.ALLOW;
	}
	public W filterFinal(W final1, W final2) {
		return semiring.times(final1, final2);
	}
	public ComposeFilterType getType() { return ComposeFilterType.TRIVIAL; }
}
