package edu.isi.wfst;

/**
 * fst1 := fst1 fst2. Final states of fst1 get an epsilon transition, carrying their
 * final weight, to the start of the appended copy of fst2, and stop being final.
 */
public class Concat {
	private Concat() {}

	public static <W> void concat(MutableFst<W> fst1, ExpandedFst<W> fst2) throws IncompatibleSymbolTablesException {
		SymbolTable isyms = Fsts.mergeSymbols(fst1.getInputSymbols(), fst2.getInputSymbols(), "Concat");
		SymbolTable osyms = Fsts.mergeSymbols(fst1.getOutputSymbols(), fst2.getOutputSymbols(), "Concat");
		Semiring<W> sr = fst1.getSemiring();
		int start1 = fst1.start();
		if (start1 == Transition.NO_STATE)
			return;
		int start2 = fst2.start();
		if (start2 == Transition.NO_STATE) {
			fst1.deleteAllStates();
			return;
		}
		int n1 = fst1.numStates();
		fst1.addStates(fst2.numStates());
		for (int s = 0; s < fst2.numStates(); s++) {
			fst1.setFinal(s+n1, fst2.finalWeight(s));
			for (Transition<W> t : fst2.transitions(s))
				fst1.addTransition(s+n1, t.withNextState(t.getNextState()+n1));
		}
		for (int s = 0; s < n1; s++) {
			W fw = fst1.finalWeight(s);
			if (!sr.isZero(fw)) {
				fst1.setFinal(s, sr.zero());
				fst1.addTransition(s, new Transition<W>(Transition.EPSILON, Transition.EPSILON, fw, start2+n1));
			}
		}
		fst1.setInputSymbols(isyms);
		fst1.setOutputSymbols(osyms);
	}
}
