package edu.isi.wfst;

/**
 * A small counter. -1 is the blocked value. The narrower variants only differ in the
 * range they accept.
 */
public class IntegerFilterState implements FilterState {
	public static final int NO_STATE = -1;
	public static final IntegerFilterState BLOCKED = new IntegerFilterState(NO_STATE);

	private final int state;

	public IntegerFilterState(int state) {
		if (state < NO_STATE || state > maxValue())
			throw new IllegalArgumentException(getClass().getSimpleName()+" value "+state+" out of range");
		this.state = state;
	}
	protected int maxValue() { return Integer.MAX_VALUE; }

	public int getState() { return state; }
	public boolean isBlocked() { return state == NO_STATE; }

	public boolean equals(Object o) {
		if (o == null || o.getClass() != getClass())
			return false;
		return ((IntegerFilterState)o).state == state;
	}
	public int hashCode() { return state; }
	public String toString() { return Integer.toString(state); }
}
