package edu.isi.wfst;

import java.util.ArrayList;

/**
 * Queue of queues: one sub-queue per strongly connected component, components served in
 * topological order. Inside a component the sub-queue's own discipline applies.
 */
public class SccQueue implements StateQueue {
	private final int[] scc;
	private final ArrayList<StateQueue> queues;
	private int front = 0;
	private int back = -1;

	/** scc[s] is the topologically ordered component of s; one queue per component */
	public SccQueue(int[] scc, ArrayList<StateQueue> queues) {
		this.scc = scc;
		this.queues = queues;
	}
	/** FIFO inside every component */
	public static SccQueue fifo(SccVisitor v) {
		ArrayList<StateQueue> qs = new ArrayList<StateQueue>(v.numSccs());
		for (int i = 0; i < v.numSccs(); i++)
			qs.add(new FifoQueue());
		return new SccQueue(v.getScc(), qs);
	}

	public int head() {
		while (front <= back && queues.get(front).isEmpty())
			front++;
		if (front > back)
			return Transition.NO_STATE;
		return queues.get(front).head();
	}
	public void enqueue(int s) {
		int c = scc[s];
		if (front > back) {
			front = c;
			back = c;
		}
		else if (c > back)
			back = c;
		else if (c < front)
			front = c;
		queues.get(c).enqueue(s);
	}
	public int dequeue() {
		if (head() == Transition.NO_STATE)
			return Transition.NO_STATE;
		return queues.get(front).dequeue();
	}
	public void update(int s) {
		queues.get(scc[s]).update(s);
	}
	public boolean isEmpty() {
		return head() == Transition.NO_STATE;
	}
	public void clear() {
		for (int i = front; i <= back && i >= 0; i++)
			queues.get(i).clear();
		front = 0;
		back = -1;
	}
	public QueueType getType() { return QueueType.SCC; }
}
