package edu.isi.wfst;

// byte-sized counter; what the epsilon-sequencing filters use
public class CharFilterState extends IntegerFilterState {
	public static final CharFilterState BLOCKED = new CharFilterState(NO_STATE);
	private static final CharFilterState[] SMALL = new CharFilterState[] {
		new CharFilterState(0), new CharFilterState(1), new CharFilterState(2)
	};
	public CharFilterState(int state) {
		super(state);
	}
	public static CharFilterState get(int state) {
		if (state >= 0 && state < SMALL.length)
			return SMALL[state];
		if (state == NO_STATE)
			return BLOCKED;
		return new CharFilterState(state);
	}
	protected int maxValue() { return Byte.MAX_VALUE; }
}
