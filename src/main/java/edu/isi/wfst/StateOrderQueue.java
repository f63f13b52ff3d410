package edu.isi.wfst;

import java.util.BitSet;

// visits queued states lowest id first
public class StateOrderQueue implements StateQueue {
	private final BitSet enqueued = new BitSet();

	public int head() {
		int s = enqueued.nextSetBit(0);
		return s < 0 ? Transition.NO_STATE : s;
	}
	public void enqueue(int s) {
		enqueued.set(s);
	}
	public int dequeue() {
		int s = head();
		if (s != Transition.NO_STATE)
			enqueued.clear(s);
		return s;
	}
	public void update(int s) {}
	public boolean isEmpty() { return enqueued.isEmpty(); }
	public void clear() { enqueued.clear(); }
	public QueueType getType() { return QueueType.STATE_ORDER; }
}
