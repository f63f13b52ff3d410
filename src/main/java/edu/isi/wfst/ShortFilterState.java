package edu.isi.wfst;

public class ShortFilterState extends IntegerFilterState {
	public static final ShortFilterState BLOCKED = new ShortFilterState(NO_STATE);
	public ShortFilterState(int state) {
		super(state);
	}
	protected int maxValue() { return Short.MAX_VALUE; }
}
