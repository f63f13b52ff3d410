package edu.isi.wfst;

import java.util.Arrays;

// one accepting path: its input labels, output labels (epsilons left out) and total weight
public class Path<W> {
	private final int[] ilabels;
	private final int[] olabels;
	private final W weight;

	public Path(int[] ilabels, int[] olabels, W weight) {
		this.ilabels = ilabels;
		this.olabels = olabels;
		this.weight = weight;
	}
	public int[] getILabels() { return ilabels.clone(); }
	public int[] getOLabels() { return olabels.clone(); }
	public W getWeight() { return weight; }

	public boolean equals(Object o) {
		if (!(o instanceof Path))
			return false;
		Path<?> p = (Path<?>)o;
		return Arrays.equals(ilabels, p.ilabels) && Arrays.equals(olabels, p.olabels) && weight.equals(p.weight);
	}
	public int hashCode() {
		return 31*(31*Arrays.hashCode(ilabels) + Arrays.hashCode(olabels)) + weight.hashCode();
	}
	public String toString() {
		return Arrays.toString(ilabels)+":"+Arrays.toString(olabels)+"/"+weight;
	}
}
