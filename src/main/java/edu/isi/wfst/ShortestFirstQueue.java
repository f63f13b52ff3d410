package edu.isi.wfst;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.Comparator;
import java.util.List;

/**
 * Best-first queue: the head is the state whose current distance is least in the
 * given order. A binary heap that remembers where each state sits, so {@link #update}
 * can move a state after its distance improves.
 *
 * The distance list is read live; callers change an entry and then call update.
 */
public class ShortestFirstQueue<W> implements StateQueue {
	private final List<W> distance;
	private final Comparator<W> order;
	private int[] heap = new int[16];
	private int size = 0;
	// state -> index in heap
	private final TIntIntHashMap pos = new TIntIntHashMap(16, 0.5f, -1, -1);

	public ShortestFirstQueue(List<W> distance, Comparator<W> order) {
		this.distance = distance;
		this.order = order;
	}

	private boolean less(int a, int b) {
		return order.compare(distance.get(a), distance.get(b)) < 0;
	}
	private void place(int i, int s) {
		heap[i] = s;
		pos.put(s, i);
	}
	private void siftUp(int i) {
		int s = heap[i];
		while (i > 0) {
			int p = (i-1)/2;
			if (!less(s, heap[p]))
				break;
			place(i, heap[p]);
			i = p;
		}
		place(i, s);
	}
	private void siftDown(int i) {
		int s = heap[i];
		while (true) {
			int c = 2*i+1;
			if (c >= size)
				break;
			if (c+1 < size && less(heap[c+1], heap[c]))
				c++;
			if (!less(heap[c], s))
				break;
			place(i, heap[c]);
			i = c;
		}
		place(i, s);
	}

	public int head() {
		return size == 0 ? Transition.NO_STATE : heap[0];
	}
	public void enqueue(int s) {
		if (pos.containsKey(s)) {
			update(s);
			return;
		}
		if (size == heap.length) {
			int[] n = new int[size*2];
			System.arraycopy(heap, 0, n, 0, size);
			heap = n;
		}
		heap[size] = s;
		pos.put(s, size);
		size++;
		siftUp(size-1);
	}
	public int dequeue() {
		if (size == 0)
			return Transition.NO_STATE;
		int s = heap[0];
		pos.remove(s);
		size--;
		if (size > 0) {
			place(0, heap[size]);
			siftDown(0);
		}
		return s;
	}
	public void update(int s) {
		int i = pos.get(s);
		if (i == -1)
			return;
		siftUp(i);
		siftDown(pos.get(s));
	}
	public boolean isEmpty() { return size == 0; }
	public void clear() {
		size = 0;
		pos.clear();
	}
	public QueueType getType() { return QueueType.SHORTEST_FIRST; }
}
