package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;

/**
 * The n best accepting paths under the semiring's natural order. Needs a path semiring
 * (tropical, boolean), where plus picks one of its arguments.
 *
 * The result automaton fans out of its start state into one chain per path, in
 * ascending weight order. An empty accepting path makes the start state final.
 */
public class ShortestPath {
	private ShortestPath() {}

	public static <W> VectorFst<W> shortestPath(ExpandedFst<W> fst, int n, boolean unique) throws FstException {
		return shortestPath(fst, n, unique, new ShortestPathConfig());
	}

	public static <W> VectorFst<W> shortestPath(ExpandedFst<W> fst, int n, boolean unique, ShortestPathConfig config) throws FstException {
		List<List<Transition<W>>> found = search(fst, n, unique, config);
		Semiring<W> sr = fst.getSemiring();
		VectorFst<W> ofst = new VectorFst<W>(sr);
		ofst.setInputSymbols(fst.getInputSymbols());
		ofst.setOutputSymbols(fst.getOutputSymbols());
		if (found.isEmpty())
			return ofst;
		int start = ofst.addState();
		ofst.setStart(start);
		for (List<Transition<W>> path : found) {
			int s = start;
			// last entry is the final weight, as a transition to NO_STATE
			for (int i = 0; i < path.size()-1; i++) {
				int next = ofst.addState();
				ofst.addTransition(s, path.get(i).withNextState(next));
				s = next;
			}
			ofst.setFinal(s, sr.plus(ofst.finalWeight(s), path.get(path.size()-1).getWeight()));
		}
		return ofst;
	}

	/** the same paths as label sequences with their weights, best first */
	public static <W> List<Path<W>> paths(ExpandedFst<W> fst, int n, boolean unique) throws FstException {
		return paths(fst, n, unique, new ShortestPathConfig());
	}

	public static <W> List<Path<W>> paths(ExpandedFst<W> fst, int n, boolean unique, ShortestPathConfig config) throws FstException {
		Semiring<W> sr = fst.getSemiring();
		ArrayList<Path<W>> out = new ArrayList<Path<W>>();
		for (List<Transition<W>> path : search(fst, n, unique, config)) {
			TIntArrayList il = new TIntArrayList();
			TIntArrayList ol = new TIntArrayList();
			W w = sr.one();
			for (Transition<W> t : path) {
				if (t.getILabel() != Transition.EPSILON && t.getILabel() != Transition.NO_LABEL)
					il.add(t.getILabel());
				if (t.getOLabel() != Transition.EPSILON && t.getOLabel() != Transition.NO_LABEL)
					ol.add(t.getOLabel());
				w = sr.times(w, t.getWeight());
			}
			out.add(new Path<W>(il.toArray(), ol.toArray(), w));
		}
		return out;
	}

	// a partial path in the search: where it is, what it weighs, how it got there
	private static class Node<W> {
		final int state;
		final W weight;
		final W priority;
		final Node<W> parent;
		final Transition<W> via;
		final int order;
		Node(int state, W weight, W priority, Node<W> parent, Transition<W> via, int order) {
			this.state = state;
			this.weight = weight;
			this.priority = priority;
			this.parent = parent;
			this.via = via;
			this.order = order;
		}
	}

	/**
	 * Best-first search over partial paths, each prioritized by its weight times the
	 * distance still to go. In unique mode a partial path is dropped when one with the
	 * same state and the same output so far was already expanded, and a complete path
	 * when its output string was already found.
	 */
	private static <W> List<List<Transition<W>>> search(ExpandedFst<W> fst, int n, boolean unique, ShortestPathConfig config) throws FstException {
		boolean debug = false;
		final Semiring<W> sr = fst.getSemiring();
		if (!sr.hasProperties(Semiring.PATH))
			throw new ConfigureException("Shortest path needs a path semiring, not "+sr);
		ArrayList<List<Transition<W>>> found = new ArrayList<List<Transition<W>>>();
		if (n <= 0 || fst.start() == Transition.NO_STATE)
			return found;
		if (n == 1 && !unique)
			return singleShortestPath(fst, config);
		List<W> rdist = ShortestDistance.shortestDistance(fst, true,
								  new ShortestDistanceConfig().setDelta(config.getDelta()).setQueueType(config.getQueueType()));
		PriorityQueue<Node<W>> heap = new PriorityQueue<Node<W>>(16, new Comparator<Node<W>>() {
				public int compare(Node<W> a, Node<W> b) {
					if (sr.naturalLess(a.priority, b.priority))
						return -1;
					if (sr.naturalLess(b.priority, a.priority))
						return 1;
					return a.order < b.order ? -1 : a.order > b.order ? 1 : 0;
				}
			});
		int order = 0;
		int s0 = fst.start();
		if (sr.isZero(rdist.get(s0)))
			return found;
		heap.add(new Node<W>(s0, sr.one(), rdist.get(s0), null, null, order++));
		int[] pops = new int[fst.numStates()];
		HashSet<String> seen = new HashSet<String>();
		while (!heap.isEmpty() && found.size() < n) {
			Node<W> node = heap.poll();
			if (node.state == Transition.NO_STATE) {
				// complete path
				List<Transition<W>> path = unwind(node);
				if (unique && !seen.add("final "+outputLabels(path)))
					continue;
				found.add(path);
				continue;
			}
			if (unique) {
				if (!seen.add(node.state+" "+outputLabels(unwind(node))))
					continue;
			}
			else if (++pops[node.state] > n)
				continue;
			W fw = fst.finalWeight(node.state);
			if (!sr.isZero(fw)) {
				W w = sr.times(node.weight, fw);
				heap.add(new Node<W>(Transition.NO_STATE, w, w, node, new Transition<W>(Transition.NO_LABEL, Transition.NO_LABEL, fw, Transition.NO_STATE), order++));
			}
			for (Transition<W> t : fst.transitions(node.state)) {
				W rd = rdist.get(t.getNextState());
				if (sr.isZero(rd))
					continue;
				W w = sr.times(node.weight, t.getWeight());
				heap.add(new Node<W>(t.getNextState(), w, sr.times(w, rd), node, t, order++));
			}
		}
		if (debug) Debug.debug(debug, "Found "+found.size()+" of "+n+" paths after "+order+" pushes");
		return found;
	}

	private static <W> List<Transition<W>> unwind(Node<W> node) {
		ArrayList<Transition<W>> path = new ArrayList<Transition<W>>();
		for (Node<W> x = node; x.via != null; x = x.parent)
			path.add(x.via);
		Collections.reverse(path);
		return path;
	}

	// the output string, epsilons left out
	private static <W> String outputLabels(List<Transition<W>> path) {
		StringBuilder ol = new StringBuilder();
		for (Transition<W> t : path)
			if (t.getOLabel() > 0)
				ol.append(t.getOLabel()).append(' ');
		return ol.toString();
	}

	/**
	 * One best path by relaxation in best-first order, remembering for each state the
	 * transition its best distance came through.
	 */
	private static <W> List<List<Transition<W>>> singleShortestPath(ExpandedFst<W> fst, ShortestPathConfig config) {
		Semiring<W> sr = fst.getSemiring();
		int n = fst.numStates();
		ArrayList<W> d = new ArrayList<W>(n);
		ArrayList<Transition<W>> via = new ArrayList<Transition<W>>(n);
		for (int s = 0; s < n; s++) {
			d.add(sr.zero());
			via.add(null);
		}
		int[] parent = new int[n];
		boolean[] enqueued = new boolean[n];
		ShortestFirstQueue<W> queue = new ShortestFirstQueue<W>(d, sr.naturalOrder());
		int s0 = fst.start();
		d.set(s0, sr.one());
		parent[s0] = Transition.NO_STATE;
		queue.enqueue(s0);
		enqueued[s0] = true;
		int best = Transition.NO_STATE;
		W bestWeight = sr.zero();
		while (!queue.isEmpty()) {
			int s = queue.dequeue();
			enqueued[s] = false;
			W ds = d.get(s);
			W fw = sr.times(ds, fst.finalWeight(s));
			if (!sr.isZero(fw) && (best == Transition.NO_STATE || sr.naturalLess(fw, bestWeight))) {
				best = s;
				bestWeight = fw;
			}
			for (Transition<W> t : fst.transitions(s)) {
				int ns = t.getNextState();
				W w = sr.times(ds, t.getWeight());
				if (sr.isZero(w))
					continue;
				W nd = d.get(ns);
				if (!sr.isZero(nd) && (sr.approxEqual(nd, sr.plus(nd, w), config.getDelta()) || ns == s0))
					continue;
				d.set(ns, w);
				parent[ns] = s;
				via.set(ns, t);
				if (!enqueued[ns]) {
					queue.enqueue(ns);
					enqueued[ns] = true;
				}
				else
					queue.update(ns);
			}
		}
		ArrayList<List<Transition<W>>> found = new ArrayList<List<Transition<W>>>();
		if (best == Transition.NO_STATE)
			return found;
		ArrayList<Transition<W>> path = new ArrayList<Transition<W>>();
		path.add(new Transition<W>(Transition.NO_LABEL, Transition.NO_LABEL, fst.finalWeight(best), Transition.NO_STATE));
		for (int s = best; parent[s] != Transition.NO_STATE; s = parent[s])
			path.add(via.get(s));
		Collections.reverse(path);
		found.add(path);
		return found;
	}
}
