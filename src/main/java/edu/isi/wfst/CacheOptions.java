package edu.isi.wfst;

// whether a lazy automaton may throw away cached states, and how much it keeps before
// it starts. The limit counts cached transitions.
public class CacheOptions {
	public static final long DEFAULT_GC_LIMIT = 1 << 20;

	private boolean gc = false;
	private long gcLimit = DEFAULT_GC_LIMIT;

	public CacheOptions() {}
	public CacheOptions(boolean gc, long gcLimit) {
		this.gc = gc;
		this.gcLimit = gcLimit;
	}
	public boolean isGc() { return gc; }
	public long getGcLimit() { return gcLimit; }
	public CacheOptions setGc(boolean b) { gc = b; return this; }
	public CacheOptions setGcLimit(long l) { gcLimit = l; return this; }
}
