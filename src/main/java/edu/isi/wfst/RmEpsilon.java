package edu.isi.wfst;

import gnu.trove.iterator.TIntObjectIterator;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes transitions that are epsilon on both sides. Each state gets, in their place,
 * the non-epsilon transitions and final weights of everything it reached through
 * epsilons, weighted by the epsilon distance. Path weights are unchanged.
 */
public class RmEpsilon {
	private RmEpsilon() {}

	public static <W> void rmEpsilon(MutableFst<W> fst) throws ConfigureException {
		rmEpsilon(fst, new RmEpsilonConfig());
	}

	public static <W> void rmEpsilon(MutableFst<W> fst, RmEpsilonConfig config) throws ConfigureException {
		boolean debug = false;
		Semiring<W> sr = fst.getSemiring();
		if (!sr.hasClosure() || !sr.isDivisible())
			throw new ConfigureException("Epsilon removal needs closure and division, which "+sr+" does not have");
		if (config.getQueueType() != QueueType.AUTO && config.getQueueType() != QueueType.FIFO && config.getQueueType() != QueueType.LIFO)
			throw new ConfigureException("Epsilon removal runs with a FIFO or LIFO queue, not "+config.getQueueType());
		int n = fst.numStates();
		// weight of the epsilon self loops of each state, closed
		ArrayList<W> loops = new ArrayList<W>(n);
		for (int s = 0; s < n; s++) {
			W l = sr.zero();
			for (Transition<W> t : fst.transitions(s))
				if (t.isEpsilon() && t.getNextState() == s)
					l = sr.plus(l, t.getWeight());
			try {
				loops.add(sr.isZero(l) ? sr.one() : sr.closure(l));
			}
			catch (UnsupportedSemiringOperationException e) {
				throw new ConfigureException("Can't close epsilon loop at state "+s, e);
			}
		}
		ArrayList<List<Transition<W>>> newTransitions = new ArrayList<List<Transition<W>>>(n);
		ArrayList<W> newFinals = new ArrayList<W>(n);
		int removed = 0;
		for (int s = 0; s < n; s++) {
			TIntObjectHashMap<W> dist = epsilonDistance(fst, s, loops, config);
			ArrayList<Transition<W>> trs = new ArrayList<Transition<W>>();
			W f = sr.zero();
			for (TIntObjectIterator<W> it = dist.iterator(); it.hasNext();) {
				it.advance();
				int q = it.key();
				W d = it.value();
				for (Transition<W> t : fst.transitions(q)) {
					if (t.isEpsilon())
						continue;
					trs.add(t.withWeight(sr.times(d, t.getWeight())));
				}
				f = sr.plus(f, sr.times(d, fst.finalWeight(q)));
			}
			for (Transition<W> t : fst.transitions(s))
				if (t.isEpsilon())
					removed++;
			newTransitions.add(trs);
			newFinals.add(f);
		}
		for (int s = 0; s < n; s++) {
			fst.setTransitions(s, newTransitions.get(s));
			fst.setFinal(s, newFinals.get(s));
		}
		if (debug) Debug.debug(debug, "Removed "+removed+" epsilon transitions");
		if (config.isConnect())
			Connect.connect(fst);
	}

	/**
	 * Sum over epsilon-only paths from source to every state they reach, source itself
	 * included. Self loops are folded in through the closures in loops.
	 */
	private static <W> TIntObjectHashMap<W> epsilonDistance(ExpandedFst<W> fst, int source, List<W> loops, RmEpsilonConfig config) {
		Semiring<W> sr = fst.getSemiring();
		TIntObjectHashMap<W> d = new TIntObjectHashMap<W>();
		TIntObjectHashMap<W> r = new TIntObjectHashMap<W>();
		StateQueue queue = config.getQueueType() == QueueType.LIFO ? new LifoQueue() : new FifoQueue();
		d.put(source, loops.get(source));
		r.put(source, loops.get(source));
		queue.enqueue(source);
		while (!queue.isEmpty()) {
			int q = queue.dequeue();
			W rq = r.remove(q);
			if (rq == null)
				continue;
			for (Transition<W> t : fst.transitions(q)) {
				int nq = t.getNextState();
				if (!t.isEpsilon() || nq == q)
					continue;
				W w = sr.times(sr.times(rq, t.getWeight()), loops.get(nq));
				W nd = d.containsKey(nq) ? d.get(nq) : sr.zero();
				W sum = sr.plus(nd, w);
				if (!sr.approxEqual(nd, sum, config.getDelta())) {
					d.put(nq, sum);
					W rn = r.get(nq);
					if (rn == null) {
						r.put(nq, w);
						queue.enqueue(nq);
					}
					else
						r.put(nq, sr.plus(rn, w));
				}
			}
		}
		return d;
	}
}
