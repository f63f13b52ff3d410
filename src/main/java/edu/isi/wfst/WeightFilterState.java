package edu.isi.wfst;

// carries a weight, e.g. one already pushed forward and still owed. null weight is blocked
public final class WeightFilterState<W> implements FilterState {
	private final W weight;

	public WeightFilterState(W weight) {
		this.weight = weight;
	}
	public static <W> WeightFilterState<W> blocked() {
		return new WeightFilterState<W>(null);
	}
	public W getWeight() { return weight; }
	public boolean isBlocked() { return weight == null; }
	public boolean equals(Object o) {
		if (!(o instanceof WeightFilterState))
			return false;
		WeightFilterState<?> w = (WeightFilterState<?>)o;
		return weight == null ? w.weight == null : weight.equals(w.weight);
	}
	public int hashCode() {
		return weight == null ? 0 : weight.hashCode();
	}
	public String toString() {
		return weight == null ? "blocked" : weight.toString();
	}
}
