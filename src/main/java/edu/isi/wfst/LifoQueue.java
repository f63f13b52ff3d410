package edu.isi.wfst;

import gnu.trove.stack.array.TIntArrayStack;

public class LifoQueue implements StateQueue {
	private final TIntArrayStack items = new TIntArrayStack();

	public int head() {
		return isEmpty() ? Transition.NO_STATE : items.peek();
	}
	public void enqueue(int s) {
		items.push(s);
	}
	public int dequeue() {
		if (isEmpty())
			return Transition.NO_STATE;
		return items.pop();
	}
	public void update(int s) {}
	public boolean isEmpty() { return items.size() == 0; }
	public void clear() { items.clear(); }
	public QueueType getType() { return QueueType.LIFO; }
}
