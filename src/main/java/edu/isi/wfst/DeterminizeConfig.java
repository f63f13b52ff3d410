package edu.isi.wfst;

public class DeterminizeConfig {
	private float delta = Semiring.KDELTA;
	private DeterminizeType type = DeterminizeType.FUNCTIONAL;
	// 0 is no limit. Non-functional determinization need not terminate without one
	private int stateLimit = 0;
	// input label of the transitions that carry leftover output to a super final state
	private int subsequentialLabel = Transition.EPSILON;
	private CacheOptions cacheOptions = new CacheOptions();

	public float getDelta() { return delta; }
	public DeterminizeType getType() { return type; }
	public int getStateLimit() { return stateLimit; }
	public int getSubsequentialLabel() { return subsequentialLabel; }
	public CacheOptions getCacheOptions() { return cacheOptions; }

	public DeterminizeConfig setDelta(float d) { delta = d; return this; }
	public DeterminizeConfig setType(DeterminizeType t) { type = t; return this; }
	public DeterminizeConfig setStateLimit(int l) { stateLimit = l; return this; }
	public DeterminizeConfig setSubsequentialLabel(int l) { subsequentialLabel = l; return this; }
	public DeterminizeConfig setCacheOptions(CacheOptions o) { cacheOptions = o; return this; }
}
