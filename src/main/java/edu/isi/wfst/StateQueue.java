package edu.isi.wfst;

/**
 * The frontier of a traversal. The discipline decides which pending state comes out
 * next; for the algorithms that take one it changes the order of work, not the result.
 */
public interface StateQueue {
	/** next state to come out, or {@link Transition#NO_STATE} when empty */
	public int head();
	public void enqueue(int s);
	/** removes and returns the head, or {@link Transition#NO_STATE} when empty */
	public int dequeue();
	/** s is already queued but its priority may have changed */
	public void update(int s);
	public boolean isEmpty();
	public void clear();
	public QueueType getType();
}
