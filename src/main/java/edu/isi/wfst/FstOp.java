package edu.isi.wfst;

import java.util.List;

/**
 * The computation behind a lazy automaton. Each method is called at most once per
 * state while the state stays cached; the cache takes care of the rest.
 */
public interface FstOp<W> {
	public int computeStart() throws FstException;
	public W computeFinalWeight(int s) throws FstException;
	public List<Transition<W>> computeTransitions(int s) throws FstException;
}
