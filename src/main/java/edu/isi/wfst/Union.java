package edu.isi.wfst;

/**
 * fst1 := fst1 | fst2. The states of fst2 are appended; a new start state reaches both
 * old start states by epsilon.
 */
public class Union {
	private Union() {}

	public static <W> void union(MutableFst<W> fst1, ExpandedFst<W> fst2) throws IncompatibleSymbolTablesException {
		SymbolTable isyms = Fsts.mergeSymbols(fst1.getInputSymbols(), fst2.getInputSymbols(), "Union");
		SymbolTable osyms = Fsts.mergeSymbols(fst1.getOutputSymbols(), fst2.getOutputSymbols(), "Union");
		int start2 = fst2.start();
		if (start2 == Transition.NO_STATE)
			return;
		Semiring<W> sr = fst1.getSemiring();
		int offset = fst1.numStates();
		int start1 = fst1.start();
		fst1.addStates(fst2.numStates());
		for (int s = 0; s < fst2.numStates(); s++) {
			fst1.setFinal(s+offset, fst2.finalWeight(s));
			for (Transition<W> t : fst2.transitions(s))
				fst1.addTransition(s+offset, t.withNextState(t.getNextState()+offset));
		}
		if (start1 == Transition.NO_STATE) {
			fst1.setStart(start2+offset);
		}
		else {
			int ns = fst1.addState();
			fst1.addTransition(ns, new Transition<W>(Transition.EPSILON, Transition.EPSILON, sr.one(), start1));
			fst1.addTransition(ns, new Transition<W>(Transition.EPSILON, Transition.EPSILON, sr.one(), start2+offset));
			fst1.setStart(ns);
		}
		fst1.setInputSymbols(isyms);
		fst1.setOutputSymbols(osyms);
	}
}
