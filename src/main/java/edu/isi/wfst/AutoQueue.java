package edu.isi.wfst;

import java.util.List;

/**
 * Picks a discipline from the automaton: topological order when it is acyclic,
 * best-first when the semiring has the path property and distances are supplied,
 * otherwise components in topological order with FIFO inside each.
 */
public class AutoQueue implements StateQueue {
	private final StateQueue queue;

	public <W> AutoQueue(ExpandedFst<W> fst, List<W> distance) {
		boolean debug = false;
		SccVisitor v = new SccVisitor(fst);
		Semiring<W> sr = fst.getSemiring();
		if (v.isAcyclic()) {
			queue = new TopOrderQueue(TopSort.topOrder(fst));
		}
		else if (distance != null && sr.hasProperties(Semiring.PATH)) {
			queue = new ShortestFirstQueue<W>(distance, sr.naturalOrder());
		}
		else {
			queue = SccQueue.fifo(v);
		}
		if (debug) Debug.debug(debug, "Auto queue chose "+queue.getType());
	}
	/** the discipline actually in use */
	public QueueType getChosenType() { return queue.getType(); }

	public int head() { return queue.head(); }
	public void enqueue(int s) { queue.enqueue(s); }
	public int dequeue() { return queue.dequeue(); }
	public void update(int s) { queue.update(s); }
	public boolean isEmpty() { return queue.isEmpty(); }
	public void clear() { queue.clear(); }
	public QueueType getType() { return QueueType.AUTO; }

	/** a fresh queue of the given type for fst */
	public static <W> StateQueue create(QueueType type, ExpandedFst<W> fst, List<W> distance) throws ConfigureException {
		switch (type) {
		case TRIVIAL: return new TrivialQueue();
		case FIFO: return new FifoQueue();
		case LIFO: return new LifoQueue();
		case SHORTEST_FIRST:
			if (distance == null)
				throw new ConfigureException("Shortest first queue needs a distance vector");
			return new ShortestFirstQueue<W>(distance, fst.getSemiring().naturalOrder());
		case TOP_ORDER: return new TopOrderQueue(fst);
		case STATE_ORDER: return new StateOrderQueue();
		case SCC: return SccQueue.fifo(new SccVisitor(fst));
		default: return new AutoQueue(fst, distance);
		}
	}
}
