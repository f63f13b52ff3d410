package edu.isi.wfst;

import java.util.List;

/**
 * Looks up the transitions of a state by label on one side, without scanning them all.
 *
 * Asking for {@link Transition#EPSILON} also produces, first, an implicit self loop
 * that consumes nothing on the matched side: {@code (NO_LABEL, EPSILON, one, s)} for an
 * input matcher, {@code (EPSILON, NO_LABEL, one, s)} for an output matcher. It lets the
 * other automaton of a composition move on an epsilon while this one stays put. Asking
 * for {@link Transition#NO_LABEL} returns the real epsilon transitions without the loop.
 */
public interface Matcher<W> {
	public Fst<W> getFst();
	public MatchType getMatchType();
	public List<Transition<W>> find(int s, int label) throws FstException;
	/** cost of using this matcher at s; lower is cheaper */
	public int priority(int s) throws FstException;
}
