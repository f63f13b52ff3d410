package edu.isi.wfst;

public class FactorWeightConfig {
	private float delta = Semiring.KDELTA;
	private boolean factorFinalWeights = true;
	private boolean factorTransitionWeights = true;
	// labels of the transitions a factored final weight turns into
	private int finalILabel = Transition.EPSILON;
	private int finalOLabel = Transition.EPSILON;
	private boolean incrementFinalILabel = false;
	private boolean incrementFinalOLabel = false;
	private CacheOptions cacheOptions = new CacheOptions();

	public float getDelta() { return delta; }
	public boolean isFactorFinalWeights() { return factorFinalWeights; }
	public boolean isFactorTransitionWeights() { return factorTransitionWeights; }
	public int getFinalILabel() { return finalILabel; }
	public int getFinalOLabel() { return finalOLabel; }
	public boolean isIncrementFinalILabel() { return incrementFinalILabel; }
	public boolean isIncrementFinalOLabel() { return incrementFinalOLabel; }
	public CacheOptions getCacheOptions() { return cacheOptions; }

	public FactorWeightConfig setDelta(float d) { delta = d; return this; }
	public FactorWeightConfig setFactorFinalWeights(boolean b) { factorFinalWeights = b; return this; }
	public FactorWeightConfig setFactorTransitionWeights(boolean b) { factorTransitionWeights = b; return this; }
	public FactorWeightConfig setFinalILabel(int l) { finalILabel = l; return this; }
	public FactorWeightConfig setFinalOLabel(int l) { finalOLabel = l; return this; }
	public FactorWeightConfig setIncrementFinalILabel(boolean b) { incrementFinalILabel = b; return this; }
	public FactorWeightConfig setIncrementFinalOLabel(boolean b) { incrementFinalOLabel = b; return this; }
	public FactorWeightConfig setCacheOptions(CacheOptions o) { cacheOptions = o; return this; }
}
