package edu.isi.wfst;

/**
 * Visits states by a precomputed topological rank. Only usable on acyclic automata.
 */
public class TopOrderQueue implements StateQueue {
	// rank of each state, and the state holding each rank (or -1)
	private final int[] order;
	private final int[] byRank;
	private int front;
	private int back;

	/** order[s] is the rank of state s */
	public TopOrderQueue(int[] order) {
		this.order = order;
		byRank = new int[order.length];
		for (int i = 0; i < byRank.length; i++)
			byRank[i] = Transition.NO_STATE;
		front = 0;
		back = -1;
	}
	/** ranks from a topological sort of fst; throws if fst has a cycle */
	public TopOrderQueue(ExpandedFst<?> fst) throws ConfigureException {
		this(rank(fst));
	}
	private static int[] rank(ExpandedFst<?> fst) throws ConfigureException {
		int[] order = TopSort.topOrder(fst);
		if (order == null)
			throw new ConfigureException("Top order queue requires an acyclic automaton");
		return order;
	}

	public int head() {
		return isEmpty() ? Transition.NO_STATE : byRank[front];
	}
	public void enqueue(int s) {
		int r = order[s];
		if (front > back) {
			front = r;
			back = r;
		}
		else if (r > back)
			back = r;
		else if (r < front)
			front = r;
		byRank[r] = s;
	}
	public int dequeue() {
		if (isEmpty())
			return Transition.NO_STATE;
		int s = byRank[front];
		byRank[front] = Transition.NO_STATE;
		while (front <= back && byRank[front] == Transition.NO_STATE)
			front++;
		return s;
	}
	public void update(int s) {}
	public boolean isEmpty() { return front > back; }
	public void clear() {
		for (int i = front; i <= back && i >= 0; i++)
			byRank[i] = Transition.NO_STATE;
		front = 0;
		back = -1;
	}
	public QueueType getType() { return QueueType.TOP_ORDER; }
}
