package edu.isi.wfst;

import java.util.Arrays;
import java.util.HashMap;

/**
 * Equivalence classes over states 0..n-1, refined by splitting classes whose members
 * disagree on a key. Class ids are dense and reassigned in order of first member on
 * every split.
 */
public class Partition {
	private int[] classes;
	private int numClasses;

	public Partition(int numStates) {
		classes = new int[numStates];
		numClasses = numStates == 0 ? 0 : 1;
	}
	public int classOf(int s) { return classes[s]; }
	public int numClasses() { return numClasses; }
	public int numStates() { return classes.length; }

	/**
	 * Splits every class by keys[s]; states stay together only if they were together and
	 * their keys are equal. Returns true if any class split.
	 */
	public boolean refine(Object[] keys) {
		HashMap<Object, Integer> ids = new HashMap<Object, Integer>();
		int[] next = new int[classes.length];
		for (int s = 0; s < classes.length; s++) {
			Object k = Arrays.asList(classes[s], keys[s]);
			Integer id = ids.get(k);
			if (id == null) {
				id = ids.size();
				ids.put(k, id);
			}
			next[s] = id;
		}
		boolean changed = ids.size() != numClasses;
		classes = next;
		numClasses = ids.size();
		return changed;
	}
}
