package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Weight pushing: moves weight as far as possible toward the start (or the final
 * states) without changing any path weight. Pushing toward the start uses each state's
 * distance to the finals as its potential.
 */
public class Push {
	private Push() {}

	public static <W> void push(MutableFst<W> fst, ReweightType type) throws FstException {
		push(fst, type, false, Semiring.KDELTA);
	}

	/**
	 * @param removeTotalWeight also divide the total weight out of the start state, so
	 *                          the pushed automaton sums to one
	 */
	public static <W> void push(MutableFst<W> fst, ReweightType type, boolean removeTotalWeight, float delta) throws FstException {
		boolean debug = false;
		if (fst.start() == Transition.NO_STATE)
			return;
		Semiring<W> sr = fst.getSemiring();
		List<W> distance = ShortestDistance.shortestDistance(fst, type == ReweightType.TO_INITIAL,
								     new ShortestDistanceConfig().setDelta(delta));
		if (debug) Debug.debug(debug, "Potentials "+distance);
		W total;
		if (type == ReweightType.TO_INITIAL)
			total = distance.get(fst.start());
		else {
			total = sr.zero();
			for (int s = 0; s < distance.size(); s++)
				total = sr.plus(total, sr.times(distance.get(s), fst.finalWeight(s)));
		}
		Reweight.reweight(fst, distance, type);
		if (removeTotalWeight && !sr.isZero(total))
			divideStart(fst, total);
	}

	// divide w out of every path through the start state
	private static <W> void divideStart(MutableFst<W> fst, W w) throws FstException {
		Semiring<W> sr = fst.getSemiring();
		int start = fst.start();
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
		for (Transition<W> t : fst.transitions(start))
			out.add(t.withWeight(sr.divide(t.getWeight(), w, DivideType.LEFT)));
		fst.setTransitions(start, out);
		W f = fst.finalWeight(start);
		if (!sr.isZero(f))
			fst.setFinal(start, sr.divide(f, w, DivideType.LEFT));
	}
}
