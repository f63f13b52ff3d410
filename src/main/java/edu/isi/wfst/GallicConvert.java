package edu.isi.wfst;

import java.util.List;

/**
 * Moves output labels into the weights and back. A transducer becomes an acceptor over
 * its input labels whose gallic weights carry the output string, so acceptor
 * algorithms (determinization, minimization) can run on it.
 */
public class GallicConvert {

	public static <G, W> VectorFst<G> toGallic(ExpandedFst<W> fst, GallicAlgebra<G, W> algebra) {
		Semiring<W> base = fst.getSemiring();
		VectorFst<G> ofst = new VectorFst<G>(algebra.getSemiring());
		ofst.addStates(fst.numStates());
		ofst.setStart(fst.start());
		ofst.setInputSymbols(fst.getInputSymbols());
		ofst.setOutputSymbols(fst.getInputSymbols());
		for (int s = 0; s < fst.numStates(); s++) {
			W f = fst.finalWeight(s);
			if (!base.isZero(f))
				ofst.setFinal(s, algebra.gallic(StringWeight.EPSILON, f));
			for (Transition<W> t : fst.transitions(s)) {
				G w = base.isZero(t.getWeight()) ? algebra.getSemiring().zero()
					: algebra.gallic(StringWeight.ofLabel(t.getOLabel()), t.getWeight());
				ofst.addTransition(s, new Transition<G>(t.getILabel(), t.getILabel(), w, t.getNextState()));
			}
		}
		return ofst;
	}

	/**
	 * Back to a transducer over the base semiring. Every gallic weight must have been
	 * factored to at most one element with at most one label; a final weight that still
	 * owes a label turns into a transition to a new super final state, with
	 * superfinalLabel on the input side.
	 */
	public static <G, W> VectorFst<W> fromGallic(ExpandedFst<G> gfst, GallicAlgebra<G, W> algebra, SymbolTable osyms, int superfinalLabel) throws MalformedFstException {
		Semiring<W> base = algebra.getBase();
		VectorFst<W> ofst = new VectorFst<W>(base);
		ofst.addStates(gfst.numStates());
		ofst.setStart(gfst.start());
		ofst.setInputSymbols(gfst.getInputSymbols());
		ofst.setOutputSymbols(osyms);
		int superfinal = Transition.NO_STATE;
		for (int s = 0; s < gfst.numStates(); s++) {
			for (Transition<G> t : gfst.transitions(s)) {
				GallicWeight<W> e = single(algebra, t.getWeight(), s);
				if (e == null)
					ofst.addTransition(s, new Transition<W>(t.getILabel(), Transition.EPSILON, base.zero(), t.getNextState()));
				else
					ofst.addTransition(s, new Transition<W>(t.getILabel(), label(e, s), e.getWeight(), t.getNextState()));
			}
			GallicWeight<W> f = single(algebra, gfst.finalWeight(s), s);
			if (f == null)
				continue;
			int l = label(f, s);
			if (l == Transition.EPSILON) {
				ofst.setFinal(s, f.getWeight());
				continue;
			}
			if (superfinal == Transition.NO_STATE) {
				superfinal = ofst.addState();
				ofst.setFinal(superfinal, base.one());
			}
			ofst.addTransition(s, new Transition<W>(superfinalLabel, l, f.getWeight(), superfinal));
		}
		return ofst;
	}

	// null for zero
	private static <G, W> GallicWeight<W> single(GallicAlgebra<G, W> algebra, G g, int s) throws MalformedFstException {
		List<GallicWeight<W>> es = algebra.elements(g);
		if (es.isEmpty())
			return null;
		if (es.size() > 1)
			throw new MalformedFstException("Weight "+algebra.getSemiring().format(g)+" at state "+s+" has "+es.size()+" alternatives; factor it first");
		return es.get(0);
	}
	private static <W> int label(GallicWeight<W> e, int s) throws MalformedFstException {
		StringWeight str = e.getString();
		if (str.size() > 1)
			throw new MalformedFstException("Weight at state "+s+" has output string "+str+" of more than one label; factor it first");
		return str.size() == 0 ? Transition.EPSILON : str.get(0);
	}
}
