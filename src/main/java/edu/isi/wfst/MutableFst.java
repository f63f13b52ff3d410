package edu.isi.wfst;

import java.util.List;

/**
 * An expanded automaton that can be built and edited in place. Algorithms that work
 * "in place" take one of these.
 */
public interface MutableFst<W> extends ExpandedFst<W> {
	/** adds a non-final state with no transitions and returns its id */
	public int addState();

	/** adds n states; returns the id of the first */
	public int addStates(int n);

	public void setStart(int s);

	/** zero makes s non-final */
	public void setFinal(int s, W w);

	public void addTransition(int s, Transition<W> t);

	/** replaces the transition at position i of state s */
	public void setTransition(int s, int i, Transition<W> t);

	/** replaces all transitions of s */
	public void setTransitions(int s, List<Transition<W>> ts);

	public void deleteTransitions(int s);

	/**
	 * Removes the given states and every transition into them. Remaining states keep
	 * their relative order and are renumbered densely; a deleted start becomes
	 * {@link Transition#NO_STATE}.
	 */
	public void deleteStates(int[] states);

	public void deleteAllStates();

	public void setInputSymbols(SymbolTable t);

	public void setOutputSymbols(SymbolTable t);
}
