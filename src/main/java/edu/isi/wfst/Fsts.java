package edu.isi.wfst;

import gnu.trove.set.hash.TIntHashSet;

import java.util.List;

/**
 * Static helpers: building simple automata, structural checks, and the symbol table
 * compatibility test binary operations share.
 */
public class Fsts {
	private Fsts() {}

	/** a chain accepting exactly labels, each transition weighted by the matching entry of weights */
	public static <W> VectorFst<W> linearAcceptor(Semiring<W> sr, int[] labels, List<W> weights) {
		return linearTransducer(sr, labels, labels, weights);
	}
	/** a chain with transitions of weight one, final weight one */
	public static <W> VectorFst<W> linearAcceptor(Semiring<W> sr, int... labels) {
		return linearTransducer(sr, labels, labels, null);
	}
	/**
	 * A chain mapping ilabels to olabels position by position. The shorter side is padded
	 * with epsilons. weights may be null (all one) and otherwise needs one entry per
	 * transition.
	 */
	public static <W> VectorFst<W> linearTransducer(Semiring<W> sr, int[] ilabels, int[] olabels, List<W> weights) {
		int n = Math.max(ilabels.length, olabels.length);
		if (weights != null && weights.size() != n)
			throw new IllegalArgumentException("Need "+n+" weights, got "+weights.size());
		VectorFst<W> fst = new VectorFst<W>(sr);
		int s = fst.addState();
		fst.setStart(s);
		for (int i = 0; i < n; i++) {
			int il = i < ilabels.length ? ilabels[i] : Transition.EPSILON;
			int ol = i < olabels.length ? olabels[i] : Transition.EPSILON;
			int ns = fst.addState();
			fst.addTransition(s, new Transition<W>(il, ol, weights == null ? sr.one() : weights.get(i), ns));
			s = ns;
		}
		fst.setFinal(s, sr.one());
		return fst;
	}

	/** replaces the contents of dst with a copy of src */
	public static <W> void copy(ExpandedFst<W> src, MutableFst<W> dst) {
		dst.deleteAllStates();
		dst.addStates(src.numStates());
		for (int s = 0; s < src.numStates(); s++) {
			dst.setTransitions(s, src.transitions(s));
			dst.setFinal(s, src.finalWeight(s));
		}
		if (src.start() != Transition.NO_STATE)
			dst.setStart(src.start());
		dst.setInputSymbols(src.getInputSymbols());
		dst.setOutputSymbols(src.getOutputSymbols());
	}

	/** every transition has equal input and output labels */
	public static <W> boolean isAcceptor(ExpandedFst<W> fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Transition<W> t : fst.transitions(s))
				if (t.getILabel() != t.getOLabel())
					return false;
		return true;
	}
	/**
	 * No two transitions of a state share an input label. Epsilon counts as an ordinary
	 * label, as in determinization, so a single epsilon transition (the one a
	 * determinized transducer uses to emit leftover output) is allowed.
	 */
	public static <W> boolean isDeterministic(ExpandedFst<W> fst) {
		TIntHashSet seen = new TIntHashSet();
		for (int s = 0; s < fst.numStates(); s++) {
			seen.clear();
			for (Transition<W> t : fst.transitions(s))
				if (!seen.add(t.getILabel()))
					return false;
		}
		return true;
	}
	/** no transition with epsilon on both sides */
	public static <W> boolean isEpsilonFree(ExpandedFst<W> fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Transition<W> t : fst.transitions(s))
				if (t.isEpsilon())
					return false;
		return true;
	}
	/** transitions of every state sorted by input (or output) label */
	public static <W> boolean isSorted(ExpandedFst<W> fst, boolean output) {
		for (int s = 0; s < fst.numStates(); s++) {
			int last = Integer.MIN_VALUE;
			for (Transition<W> t : fst.transitions(s)) {
				int l = output ? t.getOLabel() : t.getILabel();
				if (l < last)
					return false;
				last = l;
			}
		}
		return true;
	}
	public static <W> int numTransitions(ExpandedFst<W> fst) {
		int n = 0;
		for (int s = 0; s < fst.numStates(); s++)
			n += fst.numTransitions(s);
		return n;
	}
	/** true when there is no start state */
	public static <W> boolean isEmpty(Fst<W> fst) throws FstException {
		return fst.start() == Transition.NO_STATE;
	}

	/** checks that the start state and every destination exist, and that labels and weights are sane */
	public static <W> void verify(ExpandedFst<W> fst) throws MalformedFstException {
		int n = fst.numStates();
		int start = fst.start();
		if (start != Transition.NO_STATE && (start < 0 || start >= n))
			throw new MalformedFstException("Start state "+start+" does not exist; automaton has "+n+" states");
		if (start == Transition.NO_STATE && n > 0)
			throw new MalformedFstException("Automaton has "+n+" states but no start state");
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < n; s++) {
			if (!sr.isMember(fst.finalWeight(s)))
				throw new MalformedFstException("State "+s+" has invalid final weight "+fst.finalWeight(s));
			for (Transition<W> t : fst.transitions(s)) {
				if (t.getNextState() < 0 || t.getNextState() >= n)
					throw new MalformedFstException("Transition "+t+" of state "+s+" leads to non-existent state "+t.getNextState());
				if (t.getILabel() < 0 || t.getOLabel() < 0)
					throw new MalformedFstException("Transition "+t+" of state "+s+" has a negative label");
				if (!sr.isMember(t.getWeight()))
					throw new MalformedFstException("Transition "+t+" of state "+s+" has an invalid weight");
			}
		}
	}

	/**
	 * The table to give a result whose labels come from two places. Either may be absent;
	 * if both are present they have to agree.
	 */
	public static SymbolTable mergeSymbols(SymbolTable a, SymbolTable b, String what) throws IncompatibleSymbolTablesException {
		if (a == null)
			return b;
		if (b == null)
			return a;
		if (!a.equals(b))
			throw new IncompatibleSymbolTablesException(what+": symbol tables "+a.getName()+" and "+b.getName()+" do not match");
		return a;
	}
}
