package edu.isi.wfst;

import java.util.ArrayList;

/**
 * Packs labels and/or weights of each transition into a single label, turning a
 * transducer into an acceptor or a weighted automaton into an unweighted one, so that
 * acceptor algorithms can treat them. Decoding with the same table restores them.
 */
public class Encode {
	private Encode() {}

	public static <W> void encode(MutableFst<W> fst, EncodeTable<W> table) {
		boolean debug = false;
		Semiring<W> sr = fst.getSemiring();
		boolean labels = table.isEncodeLabels();
		boolean weights = table.isEncodeWeights();
		table.setSymbols(fst.getInputSymbols(), fst.getOutputSymbols());
		int n = fst.numStates();
		int superfinal = Transition.NO_STATE;
		for (int s = 0; s < n; s++) {
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s)) {
				int l = table.encode(t.getILabel(), labels ? t.getOLabel() : Transition.EPSILON, weights ? t.getWeight() : sr.one());
				out.add(new Transition<W>(l, labels ? l : t.getOLabel(), weights ? sr.one() : t.getWeight(), t.getNextState()));
			}
			if (weights && fst.isFinal(s)) {
				// the final weight moves onto a transition
				if (superfinal == Transition.NO_STATE) {
					superfinal = fst.addState();
					fst.setFinal(superfinal, sr.one());
				}
				int l = table.encode(Transition.EPSILON, Transition.EPSILON, fst.finalWeight(s));
				out.add(new Transition<W>(l, labels ? l : Transition.EPSILON, sr.one(), superfinal));
				fst.setFinal(s, sr.zero());
			}
			fst.setTransitions(s, out);
		}
		if (labels) {
			fst.setInputSymbols(null);
			fst.setOutputSymbols(null);
		}
		if (debug) Debug.debug(debug, "Encoding table has "+table.size()+" entries");
	}

	public static <W> void decode(MutableFst<W> fst, EncodeTable<W> table) throws MalformedFstException {
		boolean labels = table.isEncodeLabels();
		boolean weights = table.isEncodeWeights();
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s)) {
				EncodeTable.Tuple<W> e = table.decode(t.getILabel());
				out.add(new Transition<W>(e.ilabel, labels ? e.olabel : t.getOLabel(), weights ? e.weight : t.getWeight(), t.getNextState()));
			}
			fst.setTransitions(s, out);
		}
		if (labels) {
			fst.setInputSymbols(table.getInputSymbols());
			fst.setOutputSymbols(table.getOutputSymbols());
		}
		if (weights)
			RmFinalEpsilon.rmFinalEpsilon(fst);
	}
}
