package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Reweights with a potential per state: toward the start, w' = d[s]^-1 * w * d[n] and
 * final' = d[s]^-1 * final; toward the finals, w' = d[s] * w * d[n]^-1 and
 * final' = d[s] * final. Path weights change only by the start state's potential, which
 * is then put back on the start.
 */
public class Reweight {
	private Reweight() {}

	public static <W> void reweight(MutableFst<W> fst, List<W> potential, ReweightType type) throws FstException {
		Semiring<W> sr = fst.getSemiring();
		if (fst.numStates() == 0)
			return;
		if (type == ReweightType.TO_INITIAL && !sr.hasProperties(Semiring.LEFT_SEMIRING))
			throw new ConfigureException("Reweighting to the start needs a left semiring, not "+sr);
		if (type == ReweightType.TO_FINAL && !sr.hasProperties(Semiring.RIGHT_SEMIRING))
			throw new ConfigureException("Reweighting to the finals needs a right semiring, not "+sr);
		for (int s = 0; s < fst.numStates(); s++) {
			W ds = s < potential.size() ? potential.get(s) : sr.zero();
			if (sr.isZero(ds))
				continue;
			List<Transition<W>> trs = fst.transitions(s);
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(trs.size());
			for (Transition<W> t : trs) {
				int n = t.getNextState();
				W dn = n < potential.size() ? potential.get(n) : sr.zero();
				if (sr.isZero(dn)) {
					out.add(t);
					continue;
				}
				W w;
				if (type == ReweightType.TO_INITIAL)
					w = sr.divide(sr.times(t.getWeight(), dn), ds, DivideType.LEFT);
				else
					w = sr.divide(sr.times(ds, t.getWeight()), dn, DivideType.RIGHT);
				out.add(t.withWeight(w));
			}
			fst.setTransitions(s, out);
			W f = fst.finalWeight(s);
			if (!sr.isZero(f)) {
				if (type == ReweightType.TO_INITIAL)
					fst.setFinal(s, sr.divide(f, ds, DivideType.LEFT));
				else
					fst.setFinal(s, sr.times(ds, f));
			}
		}
		int start = fst.start();
		if (start == Transition.NO_STATE)
			return;
		W d0 = start < potential.size() ? potential.get(start) : sr.zero();
		if (sr.isZero(d0) || sr.isOne(d0))
			return;
		// what the start state's paths lost
		W owed = type == ReweightType.TO_INITIAL ? d0 : sr.divide(sr.one(), d0, DivideType.RIGHT);
		if (!hasIncoming(fst, start)) {
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
			for (Transition<W> t : fst.transitions(start))
				out.add(t.withWeight(sr.times(owed, t.getWeight())));
			fst.setTransitions(start, out);
			W f = fst.finalWeight(start);
			if (!sr.isZero(f))
				fst.setFinal(start, sr.times(owed, f));
		}
		else {
			int s = fst.addState();
			fst.addTransition(s, new Transition<W>(Transition.EPSILON, Transition.EPSILON, owed, start));
			fst.setStart(s);
		}
	}

	private static <W> boolean hasIncoming(ExpandedFst<W> fst, int state) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Transition<W> t : fst.transitions(s))
				if (t.getNextState() == state)
					return true;
		return false;
	}
}
