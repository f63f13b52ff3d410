package edu.isi.wfst;

/**
 * One arc: input label, output label, weight, destination. Immutable; the with*
 * methods make modified copies.
 */
public final class Transition<W> {
	/** the reserved no-symbol label */
	public static final int EPSILON = 0;
	/** label of the implicit self loop a matcher offers for epsilon; never stored in an automaton */
	public static final int NO_LABEL = -1;
	/** "no state", e.g. the start of an empty automaton */
	public static final int NO_STATE = -1;

	private final int ilabel;
	private final int olabel;
	private final W weight;
	private final int nextState;

	public Transition(int ilabel, int olabel, W weight, int nextState) {
		this.ilabel = ilabel;
		this.olabel = olabel;
		this.weight = weight;
		this.nextState = nextState;
	}
	public int getILabel() { return ilabel; }
	public int getOLabel() { return olabel; }
	public W getWeight() { return weight; }
	public int getNextState() { return nextState; }

	public boolean isEpsilon() {
		return ilabel == EPSILON && olabel == EPSILON;
	}
	public Transition<W> withWeight(W w) {
		return new Transition<W>(ilabel, olabel, w, nextState);
	}
	public Transition<W> withNextState(int n) {
		return new Transition<W>(ilabel, olabel, weight, n);
	}
	public Transition<W> withLabels(int il, int ol) {
		return new Transition<W>(il, ol, weight, nextState);
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Transition))
			return false;
		Transition<?> t = (Transition<?>)o;
		return ilabel == t.ilabel && olabel == t.olabel && nextState == t.nextState && weight.equals(t.weight);
	}
	public int hashCode() {
		int h = ilabel;
		h = 31*h + olabel;
		h = 31*h + nextState;
		return 31*h + weight.hashCode();
	}
	public String toString() {
		return ilabel+":"+olabel+"/"+weight+" -> "+nextState;
	}
}
