package edu.isi.wfst;

// rewrites transitions and final weights one at a time, see TransitionMap
public interface TransitionMapper<W> {
	public Transition<W> map(Transition<W> t) throws FstException;
	/** the new final weight; not called for non-final states */
	public W mapFinal(W w) throws FstException;
}
