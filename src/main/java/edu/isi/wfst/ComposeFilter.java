package edu.isi.wfst;

/**
 * Decides which pairs of matched transitions a composition may take, and remembers
 * what it needs to decide in a filter state that becomes part of each composed state.
 * Its job is to keep epsilon paths from being counted more than once.
 *
 * In {@link #filterTransition} either transition may be a matcher's implicit self loop,
 * recognisable by {@link Transition#NO_LABEL} on the matched side.
 */
public interface ComposeFilter<W, F extends FilterState> {
	public F start();
	/** called before any pair leaving composed state (s1, s2, fs) is filtered */
	public void setState(int s1, int s2, F fs) throws FstException;
	public F filterTransition(Transition<W> t1, Transition<W> t2);
	/** final weight of the current composed state given the final weights of its parts; zero if not final */
	public W filterFinal(W final1, W final2);
	public ComposeFilterType getType();
}
