package edu.isi.wfst;

// product of two filter states, for running two filters side by side. Blocked if either is
public final class PairFilterState<A extends FilterState, B extends FilterState> implements FilterState {
	private final A state1;
	private final B state2;

	public PairFilterState(A state1, B state2) {
		this.state1 = state1;
		this.state2 = state2;
	}
	public A getState1() { return state1; }
	public B getState2() { return state2; }
	public boolean isBlocked() {
		return state1.isBlocked() || state2.isBlocked();
	}
	public boolean equals(Object o) {
		if (!(o instanceof PairFilterState))
			return false;
		PairFilterState<?, ?> p = (PairFilterState<?, ?>)o;
		return state1.equals(p.state1) && state2.equals(p.state2);
	}
	public int hashCode() {
		return 31*state1.hashCode() + state2.hashCode();
	}
	public String toString() {
		return "("+state1+", "+state2+")";
	}
}
