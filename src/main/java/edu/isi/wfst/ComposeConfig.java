package edu.isi.wfst;

// knobs for composition. connect only applies to the eager form
public class ComposeConfig {
	private ComposeFilterType filterType = ComposeFilterType.AUTO;
	private boolean connect = true;
	private CacheOptions cacheOptions = new CacheOptions();

	public ComposeFilterType getFilterType() { return filterType; }
	public boolean isConnect() { return connect; }
	public CacheOptions getCacheOptions() { return cacheOptions; }

	public ComposeConfig setFilterType(ComposeFilterType t) { filterType = t; return this; }
	public ComposeConfig setConnect(boolean b) { connect = b; return this; }
	public ComposeConfig setCacheOptions(CacheOptions o) { cacheOptions = o; return this; }
}
