package edu.isi.wfst;

/**
 * Epsilon removal, determinization and minimization in one call, each step only where it
 * is sure to terminate. Transducers are determinized with their label pairs encoded as
 * acceptor labels. In an idempotent semiring, a cyclic automaton whose cycles carry
 * weights is determinized with the weights encoded too, which keeps it finite but may
 * leave it non-deterministic. In any other semiring a cyclic, non-deterministic
 * automaton is not determinized at all.
 */
public class Optimize {
	private Optimize() {}

	public static <W> void optimize(MutableFst<W> fst) throws FstException {
		boolean debug = false;
		Semiring<W> sr = fst.getSemiring();
		boolean acceptor = Fsts.isAcceptor(fst);
		if (!Fsts.isEpsilonFree(fst))
			RmEpsilon.rmEpsilon(fst);
		TransitionSum.sum(fst);
		if (Fsts.isDeterministic(fst)) {
			Minimize.minimize(fst);
			return;
		}
		int labels = acceptor ? 0 : EncodeTable.ENCODE_LABELS;
		SccVisitor scc = new SccVisitor(fst);
		if (!sr.hasProperties(Semiring.IDEMPOTENT)) {
			if (scc.isAcyclic())
				determinizeMinimize(fst, labels);
			else {
				if (debug) Debug.debug(debug, "Cyclic non-deterministic input in "+sr+"; left undeterminized");
			}
		}
		else if (!scc.isAcyclic() && !isUnweighted(fst) && !hasUnweightedCycles(fst, scc)) {
			determinizeMinimize(fst, labels | EncodeTable.ENCODE_WEIGHTS);
			TransitionSum.sum(fst);
		}
		else
			determinizeMinimize(fst, labels);
	}

	// flags 0 for no encoding
	private static <W> void determinizeMinimize(MutableFst<W> fst, int flags) throws FstException {
		EncodeTable<W> table = null;
		if (flags != 0) {
			table = new EncodeTable<W>(flags);
			Encode.encode(fst, table);
		}
		Fsts.copy(Determinize.determinize(fst), fst);
		Minimize.minimize(fst);
		if (table != null)
			Encode.decode(fst, table);
	}

	// every transition and final weight is one
	private static <W> boolean isUnweighted(ExpandedFst<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			if (fst.isFinal(s) && !sr.isOne(fst.finalWeight(s)))
				return false;
			for (Transition<W> t : fst.transitions(s))
				if (!sr.isOne(t.getWeight()))
					return false;
		}
		return true;
	}

	// transitions inside a strongly connected component all weigh one
	private static <W> boolean hasUnweightedCycles(ExpandedFst<W> fst, SccVisitor visitor) {
		Semiring<W> sr = fst.getSemiring();
		int[] scc = visitor.getScc();
		for (int s = 0; s < fst.numStates(); s++)
			for (Transition<W> t : fst.transitions(s))
				if (scc[s] == scc[t.getNextState()] && !sr.isOne(t.getWeight()))
					return false;
		return true;
	}
}
