package edu.isi.wfst;

// holds at most one state. For traversals that never have more than one pending
public class TrivialQueue implements StateQueue {
	private int front = Transition.NO_STATE;

	public int head() { return front; }
	public void enqueue(int s) {
		if (front != Transition.NO_STATE && front != s)
			throw new IllegalStateException("Trivial queue already holds state "+front+"; cannot add "+s);
		front = s;
	}
	public int dequeue() {
		int s = front;
		front = Transition.NO_STATE;
		return s;
	}
	public void update(int s) {}
	public boolean isEmpty() { return front == Transition.NO_STATE; }
	public void clear() { front = Transition.NO_STATE; }
	public QueueType getType() { return QueueType.TRIVIAL; }
}
