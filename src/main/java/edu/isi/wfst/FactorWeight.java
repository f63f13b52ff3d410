package edu.isi.wfst;

/**
 * Rewrites an automaton so that every transition and final weight is one the factor
 * iterator calls done, by spreading big weights over chains of transitions. Path weights
 * are preserved.
 */
public class FactorWeight {
	public static <W> LazyFst<W> factorWeightLazy(Fst<W> fst, FactorIterator<W> factor, FactorWeightConfig config) throws ConfigureException {
		FactorWeightOp<W> op = new FactorWeightOp<W>(fst, factor, config);
		return new LazyFst<W>(fst.getSemiring(), op, config.getCacheOptions(), fst.getInputSymbols(), fst.getOutputSymbols());
	}
	public static <W> VectorFst<W> factorWeight(Fst<W> fst, FactorIterator<W> factor, FactorWeightConfig config) throws FstException {
		return factorWeightLazy(fst, factor, config).expand();
	}
	public static <W> VectorFst<W> factorWeight(Fst<W> fst, FactorIterator<W> factor) throws FstException {
		return factorWeight(fst, factor, new FactorWeightConfig());
	}
}
