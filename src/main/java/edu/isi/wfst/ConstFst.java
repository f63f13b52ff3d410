package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compact immutable automaton. All transitions live in one list; each state records
 * where its slice starts, how long it is, and how many of its transitions have epsilon
 * input/output. Nothing changes after construction, so instances can be shared freely
 * between threads.
 */
public final class ConstFst<W> implements ExpandedFst<W> {
	private final Semiring<W> semiring;
	private final int start;
	private final List<W> finals;
	private final int[] pos;
	private final int[] ntrs;
	private final int[] niepsilons;
	private final int[] noepsilons;
	private final List<Transition<W>> trs;
	private final SymbolTable isyms;
	private final SymbolTable osyms;

	/** flattens any expanded automaton */
	public ConstFst(ExpandedFst<W> fst) {
		semiring = fst.getSemiring();
		int n = fst.numStates();
		ArrayList<W> fw = new ArrayList<W>(n);
		pos = new int[n];
		ntrs = new int[n];
		niepsilons = new int[n];
		noepsilons = new int[n];
		int total = 0;
		for (int s = 0; s < n; s++)
			total += fst.numTransitions(s);
		ArrayList<Transition<W>> all = new ArrayList<Transition<W>>(total);
		int off = 0;
		for (int s = 0; s < n; s++) {
			fw.add(fst.finalWeight(s));
			pos[s] = off;
			ntrs[s] = fst.numTransitions(s);
			niepsilons[s] = fst.numInputEpsilons(s);
			noepsilons[s] = fst.numOutputEpsilons(s);
			for (Transition<W> t : fst.transitions(s))
				all.add(t);
			off += ntrs[s];
		}
		finals = fw;
		trs = Collections.unmodifiableList(all);
		start = fst.start();
		isyms = fst.getInputSymbols();
		osyms = fst.getOutputSymbols();
	}

	// used by the binary reader, which already has everything laid out
	ConstFst(Semiring<W> semiring, int start, List<W> finals, int[] pos, int[] ntrs, int[] niepsilons, int[] noepsilons,
			List<Transition<W>> all, SymbolTable isyms, SymbolTable osyms) {
		this.semiring = semiring;
		this.start = start;
		this.finals = finals;
		this.pos = pos;
		this.ntrs = ntrs;
		this.niepsilons = niepsilons;
		this.noepsilons = noepsilons;
		this.trs = Collections.unmodifiableList(all);
		this.isyms = isyms;
		this.osyms = osyms;
	}

	private void check(int s) {
		if (s < 0 || s >= finals.size())
			throw new IllegalArgumentException("State "+s+" out of range; automaton has "+finals.size()+" states");
	}

	public Semiring<W> getSemiring() { return semiring; }
	public int numStates() { return finals.size(); }
	public int start() { return start; }
	public W finalWeight(int s) {
		check(s);
		return finals.get(s);
	}
	public boolean isFinal(int s) {
		return !semiring.isZero(finalWeight(s));
	}
	public List<Transition<W>> transitions(int s) {
		check(s);
		return trs.subList(pos[s], pos[s]+ntrs[s]);
	}
	public int numTransitions(int s) {
		check(s);
		return ntrs[s];
	}
	public int numInputEpsilons(int s) {
		check(s);
		return niepsilons[s];
	}
	public int numOutputEpsilons(int s) {
		check(s);
		return noepsilons[s];
	}
	/** total number of transitions */
	public int numTransitions() {
		return trs.size();
	}
	/** offset of the first transition of s in the shared array */
	public int transitionOffset(int s) {
		check(s);
		return pos[s];
	}
	public SymbolTable getInputSymbols() { return isyms; }
	public SymbolTable getOutputSymbols() { return osyms; }
}
