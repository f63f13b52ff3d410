package edu.isi.wfst;

import java.util.List;

// an automaton whose states are all there already, numbered 0..numStates()-1
public interface ExpandedFst<W> extends Fst<W> {
	public int numStates();

	public int start();
	public W finalWeight(int s);
	public boolean isFinal(int s);
	public List<Transition<W>> transitions(int s);
	public int numTransitions(int s);
	public int numInputEpsilons(int s);
	public int numOutputEpsilons(int s);
}
