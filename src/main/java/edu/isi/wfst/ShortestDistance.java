package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Generalized single-source shortest distance: for every state, the plus-sum over all
 * paths from the source of the times-product of their weights. Works in any semiring
 * where the relaxation converges (k-closed semirings, or acyclic input); convergence is
 * judged with the configured delta.
 */
public class ShortestDistance {
	private ShortestDistance() {}

	/**
	 * Distance from the start to every state, or with reverse set, from every state to
	 * the final states (final weights included).
	 */
	public static <W> List<W> shortestDistance(ExpandedFst<W> fst, boolean reverse) throws ConfigureException {
		return shortestDistance(fst, reverse, new ShortestDistanceConfig());
	}

	public static <W> List<W> shortestDistance(ExpandedFst<W> fst, boolean reverse, ShortestDistanceConfig config) throws ConfigureException {
		if (!reverse)
			return shortestDistance(fst, config);
		Semiring<W> sr = fst.getSemiring();
		VectorFst<W> rfst = Reverse.reverse(fst);
		Semiring<W> rsr = rfst.getSemiring();
		List<W> rdist = shortestDistance(rfst, new ShortestDistanceConfig().setQueueType(config.getQueueType()).setDelta(config.getDelta()));
		ArrayList<W> dist = new ArrayList<W>(fst.numStates());
		for (int s = 0; s < fst.numStates(); s++) {
			if (s+1 < rdist.size())
				dist.add(rsr.reverse(rdist.get(s+1)));
			else
				dist.add(sr.zero());
		}
		return dist;
	}

	/**
	 * Distances between every pair of states, d.get(p).get(q) for paths from p to q, by
	 * Floyd-Warshall with the closure of each pivot's loops. Needs a semiring with
	 * closure; quadratic in memory and cubic in time.
	 */
	public static <W> List<List<W>> allPairs(ExpandedFst<W> fst) throws UnsupportedSemiringOperationException {
		Semiring<W> sr = fst.getSemiring();
		int n = fst.numStates();
		ArrayList<List<W>> d = new ArrayList<List<W>>(n);
		for (int p = 0; p < n; p++) {
			ArrayList<W> row = new ArrayList<W>(n);
			for (int q = 0; q < n; q++)
				row.add(sr.zero());
			d.add(row);
		}
		for (int p = 0; p < n; p++)
			for (Transition<W> t : fst.transitions(p)) {
				List<W> row = d.get(p);
				row.set(t.getNextState(), sr.plus(row.get(t.getNextState()), t.getWeight()));
			}
		for (int k = 0; k < n; k++) {
			List<W> dk = d.get(k);
			W loop = sr.closure(dk.get(k));
			for (int i = 0; i < n; i++) {
				if (i == k)
					continue;
				List<W> di = d.get(i);
				W via = sr.times(di.get(k), loop);
				if (sr.isZero(via))
					continue;
				for (int j = 0; j < n; j++)
					if (j != k)
						di.set(j, sr.plus(di.get(j), sr.times(via, dk.get(j))));
			}
			for (int i = 0; i < n; i++) {
				if (i == k)
					continue;
				dk.set(i, sr.times(loop, dk.get(i)));
				d.get(i).set(k, sr.times(d.get(i).get(k), loop));
			}
			dk.set(k, loop);
		}
		return d;
	}

	/** forward distances from config's source (the start state by default) */
	public static <W> List<W> shortestDistance(ExpandedFst<W> fst, ShortestDistanceConfig config) throws ConfigureException {
		boolean debug = false;
		Semiring<W> sr = fst.getSemiring();
		int n = fst.numStates();
		ArrayList<W> d = new ArrayList<W>(n);
		ArrayList<W> r = new ArrayList<W>(n);
		for (int s = 0; s < n; s++) {
			d.add(sr.zero());
			r.add(sr.zero());
		}
		int source = config.getSource() == Transition.NO_STATE ? fst.start() : config.getSource();
		if (source == Transition.NO_STATE)
			return d;
		StateQueue queue = AutoQueue.create(config.getQueueType(), fst, d);
		boolean[] enqueued = new boolean[n];
		d.set(source, sr.one());
		r.set(source, sr.one());
		queue.enqueue(source);
		enqueued[source] = true;
		int pops = 0;
		while (!queue.isEmpty()) {
			int s = queue.dequeue();
			enqueued[s] = false;
			pops++;
			W rs = r.get(s);
			r.set(s, sr.zero());
			for (Transition<W> t : fst.transitions(s)) {
				int ns = t.getNextState();
				W nd = d.get(ns);
				W w = sr.times(rs, t.getWeight());
				W sum = sr.plus(nd, w);
				if (!sr.approxEqual(nd, sum, config.getDelta())) {
					d.set(ns, sum);
					r.set(ns, sr.plus(r.get(ns), w));
					if (!enqueued[ns]) {
						queue.enqueue(ns);
						enqueued[ns] = true;
					}
					else
						queue.update(ns);
				}
			}
		}
		if (debug) Debug.debug(debug, pops+" dequeues for "+n+" states");
		return d;
	}

	/** plus-sum of the weights of all accepting paths */
	public static <W> W totalWeight(ExpandedFst<W> fst) throws ConfigureException {
		Semiring<W> sr = fst.getSemiring();
		if (fst.start() == Transition.NO_STATE)
			return sr.zero();
		List<W> d = shortestDistance(fst, false);
		W sum = sr.zero();
		for (int s = 0; s < d.size(); s++)
			sum = sr.plus(sum, sr.times(d.get(s), fst.finalWeight(s)));
		return sum;
	}
}
