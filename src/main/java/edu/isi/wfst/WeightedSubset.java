package edu.isi.wfst;

import java.util.Arrays;
import java.util.List;

/**
 * A determinized state: input states, sorted and distinct, each with the residual
 * weight still owed on it. Two subsets are the same state when states and (quantized)
 * residuals are equal.
 */
public final class WeightedSubset<W> {
	private final int[] states;
	private final List<W> weights;
	private final int hash;

	public WeightedSubset(int[] states, List<W> weights) {
		this.states = states;
		this.weights = weights;
		hash = 31*Arrays.hashCode(states) + weights.hashCode();
	}
	public int size() { return states.length; }
	public int getState(int i) { return states[i]; }
	public W getWeight(int i) { return weights.get(i); }

	public boolean equals(Object o) {
		if (!(o instanceof WeightedSubset))
			return false;
		WeightedSubset<?> w = (WeightedSubset<?>)o;
		return hash == w.hash && Arrays.equals(states, w.states) && weights.equals(w.weights);
	}
	public int hashCode() { return hash; }
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < states.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(states[i]).append("/").append(weights.get(i));
		}
		return sb.append("}").toString();
	}
}
