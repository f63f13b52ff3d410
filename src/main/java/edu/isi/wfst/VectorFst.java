package edu.isi.wfst;

import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The growable, editable automaton. States are held in a list and transitions in a list
 * per state. This is what algorithms build their results into.
 */
public class VectorFst<W> implements MutableFst<W> {

	// one state's worth of data
	private static class VState<W> {
		W finalWeight;
		ArrayList<Transition<W>> trs = new ArrayList<Transition<W>>();
		int niepsilons = 0;
		int noepsilons = 0;
		VState(W zero) {
			finalWeight = zero;
		}
		void add(Transition<W> t) {
			if (t.getILabel() == Transition.EPSILON)
				niepsilons++;
			if (t.getOLabel() == Transition.EPSILON)
				noepsilons++;
			trs.add(t);
		}
		void recount() {
			niepsilons = 0;
			noepsilons = 0;
			for (Transition<W> t : trs) {
				if (t.getILabel() == Transition.EPSILON)
					niepsilons++;
				if (t.getOLabel() == Transition.EPSILON)
					noepsilons++;
			}
		}
	}

	private final Semiring<W> semiring;
	private final ArrayList<VState<W>> states = new ArrayList<VState<W>>();
	private int start = Transition.NO_STATE;
	private SymbolTable isyms = null;
	private SymbolTable osyms = null;

	public VectorFst(Semiring<W> semiring) {
		this.semiring = semiring;
	}

	/** deep copy of any expanded automaton, symbol tables included */
	public VectorFst(ExpandedFst<W> fst) {
		this(fst.getSemiring());
		for (int s = 0; s < fst.numStates(); s++) {
			VState<W> st = new VState<W>(fst.finalWeight(s));
			for (Transition<W> t : fst.transitions(s))
				st.add(t);
			states.add(st);
		}
		start = fst.start();
		isyms = fst.getInputSymbols();
		osyms = fst.getOutputSymbols();
	}

	private VState<W> state(int s) {
		if (s < 0 || s >= states.size())
			throw new IllegalArgumentException("State "+s+" out of range; automaton has "+states.size()+" states");
		return states.get(s);
	}

	public Semiring<W> getSemiring() { return semiring; }
	public int numStates() { return states.size(); }
	public int start() { return start; }
	public W finalWeight(int s) { return state(s).finalWeight; }
	public boolean isFinal(int s) { return !semiring.isZero(state(s).finalWeight); }
	public List<Transition<W>> transitions(int s) {
		return Collections.unmodifiableList(state(s).trs);
	}
	public int numTransitions(int s) { return state(s).trs.size(); }
	public int numInputEpsilons(int s) { return state(s).niepsilons; }
	public int numOutputEpsilons(int s) { return state(s).noepsilons; }
	public SymbolTable getInputSymbols() { return isyms; }
	public SymbolTable getOutputSymbols() { return osyms; }

	public int addState() {
		states.add(new VState<W>(semiring.zero()));
		return states.size()-1;
	}
	public int addStates(int n) {
		int first = states.size();
		states.ensureCapacity(first+n);
		for (int i = 0; i < n; i++)
			states.add(new VState<W>(semiring.zero()));
		return first;
	}
	public void setStart(int s) {
		if (s != Transition.NO_STATE)
			state(s);
		start = s;
	}
	public void setFinal(int s, W w) {
		state(s).finalWeight = w;
	}
	public void addTransition(int s, Transition<W> t) {
		state(s).add(t);
	}
	public void setTransition(int s, int i, Transition<W> t) {
		VState<W> st = state(s);
		Transition<W> old = st.trs.set(i, t);
		if (old.getILabel() != t.getILabel() || old.getOLabel() != t.getOLabel())
			st.recount();
	}
	public void setTransitions(int s, List<Transition<W>> ts) {
		VState<W> st = state(s);
		st.trs = new ArrayList<Transition<W>>(ts);
		st.recount();
	}
	public void deleteTransitions(int s) {
		VState<W> st = state(s);
		st.trs = new ArrayList<Transition<W>>();
		st.niepsilons = 0;
		st.noepsilons = 0;
	}
	public void deleteStates(int[] dstates) {
		if (dstates.length == 0)
			return;
		TIntHashSet doomed = new TIntHashSet(dstates);
		int[] newid = new int[states.size()];
		ArrayList<VState<W>> kept = new ArrayList<VState<W>>(states.size()-doomed.size());
		for (int s = 0; s < states.size(); s++) {
			if (doomed.contains(s))
				newid[s] = Transition.NO_STATE;
			else {
				newid[s] = kept.size();
				kept.add(states.get(s));
			}
		}
		for (VState<W> st : kept) {
			ArrayList<Transition<W>> ntrs = new ArrayList<Transition<W>>(st.trs.size());
			for (Transition<W> t : st.trs) {
				int n = t.getNextState();
				if (n < 0 || n >= newid.length || newid[n] == Transition.NO_STATE)
					continue;
				ntrs.add(n == newid[n] ? t : t.withNextState(newid[n]));
			}
			st.trs = ntrs;
			st.recount();
		}
		states.clear();
		states.addAll(kept);
		if (start != Transition.NO_STATE)
			start = newid[start];
	}
	public void deleteAllStates() {
		states.clear();
		start = Transition.NO_STATE;
	}
	public void setInputSymbols(SymbolTable t) { isyms = t; }
	public void setOutputSymbols(SymbolTable t) { osyms = t; }

	/** total number of transitions */
	public int numTransitions() {
		int n = 0;
		for (VState<W> st : states)
			n += st.trs.size();
		return n;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append("VectorFst("+semiring.getName()+", start="+start+")\n");
		for (int s = 0; s < states.size(); s++) {
			VState<W> st = states.get(s);
			for (Transition<W> t : st.trs)
				sb.append(s+"\t"+t.getNextState()+"\t"+t.getILabel()+"\t"+t.getOLabel()+"\t"+semiring.format(t.getWeight())+"\n");
			if (!semiring.isZero(st.finalWeight))
				sb.append(s+"\t"+semiring.format(st.finalWeight)+"\n");
		}
		return sb.toString();
	}
}
