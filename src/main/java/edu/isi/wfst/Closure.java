package edu.isi.wfst;

/**
 * Kleene closure in place. Final states loop back to the start by epsilon; for STAR a
 * new final start state accepts the empty string.
 */
public class Closure {
	private Closure() {}

	public static <W> void closure(MutableFst<W> fst, ClosureType type) {
		Semiring<W> sr = fst.getSemiring();
		int start = fst.start();
		if (start != Transition.NO_STATE) {
			for (int s = 0; s < fst.numStates(); s++) {
				W fw = fst.finalWeight(s);
				if (!sr.isZero(fw))
					fst.addTransition(s, new Transition<W>(Transition.EPSILON, Transition.EPSILON, fw, start));
			}
		}
		if (type == ClosureType.STAR) {
			int ns = fst.addState();
			fst.setFinal(ns, sr.one());
			if (start != Transition.NO_STATE)
				fst.addTransition(ns, new Transition<W>(Transition.EPSILON, Transition.EPSILON, sr.one(), start));
			fst.setStart(ns);
		}
	}
}
