package edu.isi.wfst;

import java.util.Arrays;

/**
 * A string of labels, or the special infinite string that plays zero in the string
 * semirings. Immutable.
 */
public final class StringWeight {
	public static final StringWeight INFINITY = new StringWeight(null);
	public static final StringWeight EPSILON = new StringWeight(new int[0]);

	// null means infinity
	private final int[] labels;
	private int hsh = 0;

	private StringWeight(int[] labels) {
		this.labels = labels;
	}
	public static StringWeight of(int... labels) {
		if (labels.length == 0)
			return EPSILON;
		return new StringWeight(labels.clone());
	}
	// single label; epsilon gives the empty string
	public static StringWeight ofLabel(int label) {
		if (label == Transition.EPSILON)
			return EPSILON;
		return new StringWeight(new int[] {label});
	}

	public boolean isInfinity() { return labels == null; }
	public boolean isEmpty() { return labels != null && labels.length == 0; }
	public int size() { return labels == null ? 0 : labels.length; }
	public int get(int i) { return labels[i]; }
	public int[] getLabels() {
		return labels == null ? new int[0] : labels.clone();
	}

	public StringWeight concat(StringWeight o) {
		if (isInfinity() || o.isInfinity())
			return INFINITY;
		if (isEmpty())
			return o;
		if (o.isEmpty())
			return this;
		int[] n = Arrays.copyOf(labels, labels.length+o.labels.length);
		System.arraycopy(o.labels, 0, n, labels.length, o.labels.length);
		return new StringWeight(n);
	}
	public StringWeight subString(int from, int to) {
		if (isInfinity())
			return this;
		if (from == 0 && to == labels.length)
			return this;
		return of(Arrays.copyOfRange(labels, from, to));
	}
	public StringWeight reverse() {
		if (isInfinity() || labels.length < 2)
			return this;
		int[] n = new int[labels.length];
		for (int i = 0; i < labels.length; i++)
			n[i] = labels[labels.length-1-i];
		return new StringWeight(n);
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof StringWeight))
			return false;
		StringWeight s = (StringWeight)o;
		if (labels == null || s.labels == null)
			return labels == s.labels;
		return Arrays.equals(labels, s.labels);
	}
	public int hashCode() {
		if (hsh == 0)
			hsh = labels == null ? -1 : Arrays.hashCode(labels)+1;
		return hsh;
	}
	// shorter strings first, then label by label
	public int compareTo(StringWeight o) {
		if (isInfinity() || o.isInfinity()) {
			if (isInfinity() && o.isInfinity())
				return 0;
			return isInfinity() ? 1 : -1;
		}
		if (labels.length != o.labels.length)
			return labels.length < o.labels.length ? -1 : 1;
		for (int i = 0; i < labels.length; i++) {
			if (labels[i] != o.labels[i])
				return labels[i] < o.labels[i] ? -1 : 1;
		}
		return 0;
	}
	public String toString() {
		if (labels == null)
			return "Infinity";
		if (labels.length == 0)
			return "Epsilon";
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < labels.length; i++) {
			if (i > 0)
				sb.append('_');
			sb.append(labels[i]);
		}
		return sb.toString();
	}
}
