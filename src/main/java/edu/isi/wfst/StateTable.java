package edu.isi.wfst;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;

/**
 * Hands out dense ids for the tuples a lazy construction works with (state pairs in
 * composition, weighted subsets in determinization, ...). Ids are never reused.
 */
public class StateTable<T> {
	private final TObjectIntHashMap<T> ids = new TObjectIntHashMap<T>(16, 0.5f, -1);
	private final ArrayList<T> tuples = new ArrayList<T>();

	/** id of t, assigning the next one if t is new */
	public int findId(T t) {
		int id = ids.get(t);
		if (id == -1) {
			id = tuples.size();
			ids.put(t, id);
			tuples.add(t);
		}
		return id;
	}
	/** -1 if t has no id yet */
	public int peekId(T t) {
		return ids.get(t);
	}
	public T findTuple(int id) {
		return tuples.get(id);
	}
	public int size() {
		return tuples.size();
	}
}
