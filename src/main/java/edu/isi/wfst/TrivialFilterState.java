package edu.isi.wfst;

// two values: allowed, or blocked
public final class TrivialFilterState implements FilterState {
	public static final TrivialFilterState ALLOW = new TrivialFilterState(true);
	public static final TrivialFilterState BLOCKED = new TrivialFilterState(false);

	private final boolean state;
	private TrivialFilterState(boolean state) {
		this.state = state;
	}
	public static TrivialFilterState get(boolean allow) {
		return allow ? ALLOW : BLOCKED;
	}
	public boolean isBlocked() { return !state; }
	public String toString() { return state ? "allow" : "blocked"; }
}
