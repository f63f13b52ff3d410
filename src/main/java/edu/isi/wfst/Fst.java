package edu.isi.wfst;

import java.util.List;

/**
 * Read access to a weighted transducer. Every representation (vector, const, lazy)
 * answers these the same way, so every algorithm can consume any of them.
 *
 * Lazy automata compute states on first access and may fail while doing so, hence the
 * checked exceptions; the expanded representations narrow them away.
 */
public interface Fst<W> {
	public Semiring<W> getSemiring();

	/** the start state, or {@link Transition#NO_STATE} for the empty automaton */
	public int start() throws FstException;

	/** final weight of s; the semiring zero when s is not final */
	public W finalWeight(int s) throws FstException;

	public boolean isFinal(int s) throws FstException;

	/** outgoing transitions of s, in their stored order. The list must not be modified */
	public List<Transition<W>> transitions(int s) throws FstException;

	public int numTransitions(int s) throws FstException;

	public int numInputEpsilons(int s) throws FstException;

	public int numOutputEpsilons(int s) throws FstException;

	/** may be null */
	public SymbolTable getInputSymbols();

	/** may be null */
	public SymbolTable getOutputSymbols();
}
