package edu.isi.wfst;

// (state of first, state of second, filter state)
public final class ComposeStateTuple<F extends FilterState> {
	private final int s1;
	private final int s2;
	private final F fs;

	public ComposeStateTuple(int s1, int s2, F fs) {
		this.s1 = s1;
		this.s2 = s2;
		this.fs = fs;
	}
	public int getState1() { return s1; }
	public int getState2() { return s2; }
	public F getFilterState() { return fs; }

	public boolean equals(Object o) {
		if (!(o instanceof ComposeStateTuple))
			return false;
		ComposeStateTuple<?> t = (ComposeStateTuple<?>)o;
		return s1 == t.s1 && s2 == t.s2 && fs.equals(t.fs);
	}
	public int hashCode() {
		return (s1*7853 + s2)*31 + fs.hashCode();
	}
	public String toString() {
		return "("+s1+", "+s2+", "+fs+")";
	}
}
