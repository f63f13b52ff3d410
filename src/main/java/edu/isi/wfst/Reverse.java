package edu.isi.wfst;

/**
 * The reversal of an automaton: every transition flipped, weights mapped into the
 * reverse semiring. A new start state 0 has epsilon transitions to the old final
 * states carrying their final weights; the old start becomes the only final state.
 * State s of the input is state s+1 of the result.
 */
public class Reverse {
	private Reverse() {}

	public static <W> VectorFst<W> reverse(ExpandedFst<W> ifst) {
		Semiring<W> sr = ifst.getSemiring();
		Semiring<W> rsr = sr.reverseSemiring();
		VectorFst<W> ofst = new VectorFst<W>(rsr);
		ofst.setInputSymbols(ifst.getInputSymbols());
		ofst.setOutputSymbols(ifst.getOutputSymbols());
		int istart = ifst.start();
		if (istart == Transition.NO_STATE)
			return ofst;
		int n = ifst.numStates();
		int super_initial = ofst.addState();
		ofst.addStates(n);
		ofst.setStart(super_initial);
		for (int s = 0; s < n; s++) {
			if (s == istart)
				ofst.setFinal(s+1, rsr.one());
			W fw = ifst.finalWeight(s);
			if (!sr.isZero(fw))
				ofst.addTransition(super_initial, new Transition<W>(Transition.EPSILON, Transition.EPSILON, sr.reverse(fw), s+1));
			for (Transition<W> t : ifst.transitions(s))
				ofst.addTransition(t.getNextState()+1, new Transition<W>(t.getILabel(), t.getOLabel(), sr.reverse(t.getWeight()), s+1));
		}
		return ofst;
	}
}
