package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

public class FifoQueue implements StateQueue {
	private final TIntArrayList items = new TIntArrayList();
	private int front = 0;

	public int head() {
		return isEmpty() ? Transition.NO_STATE : items.get(front);
	}
	public void enqueue(int s) {
		items.add(s);
	}
	public int dequeue() {
		if (isEmpty())
			return Transition.NO_STATE;
		int s = items.get(front++);
		// reclaim the consumed prefix now and then
		if (front > 1024 && front*2 > items.size()) {
			items.remove(0, front);
			front = 0;
		}
		return s;
	}
	public void update(int s) {}
	public boolean isEmpty() { return front >= items.size(); }
	public void clear() {
		items.resetQuick();
		front = 0;
	}
	public QueueType getType() { return QueueType.FIFO; }
}
