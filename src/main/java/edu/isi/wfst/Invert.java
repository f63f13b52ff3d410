package edu.isi.wfst;

import java.util.ArrayList;

// swaps input and output labels, and the symbol tables with them
public class Invert {
	private Invert() {}

	public static <W> void invert(MutableFst<W> fst) {
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s))
				l.add(t.withLabels(t.getOLabel(), t.getILabel()));
			fst.setTransitions(s, l);
		}
		SymbolTable i = fst.getInputSymbols();
		fst.setInputSymbols(fst.getOutputSymbols());
		fst.setOutputSymbols(i);
	}
}
