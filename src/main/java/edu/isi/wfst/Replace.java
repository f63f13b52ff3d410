package edu.isi.wfst;

import java.util.Map;

/**
 * Recursive replacement: starting from the root automaton, every transition whose
 * output label is a nonterminal is replaced by the automaton of that label, nesting as
 * deep as the nonterminals do. Recursive grammars give infinite results; use the lazy
 * form for those and explore only what is needed.
 */
public class Replace {
	private Replace() {}

	public static <W> LazyFst<W> replaceLazy(Map<Integer, ? extends Fst<W>> fsts, int rootLabel, boolean epsilonOnReplace) throws FstException {
		ReplaceFstOp<W> op = new ReplaceFstOp<W>(fsts, rootLabel, epsilonOnReplace);
		Fst<W> root = op.getRoot();
		return new LazyFst<W>(op.getSemiring(), op, new CacheOptions(), root.getInputSymbols(), root.getOutputSymbols());
	}

	public static <W> VectorFst<W> replace(Map<Integer, ? extends Fst<W>> fsts, int rootLabel, boolean epsilonOnReplace) throws FstException {
		VectorFst<W> ret = replaceLazy(fsts, rootLabel, epsilonOnReplace).expand();
		Connect.connect(ret);
		return ret;
	}
}
