package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.TreeSet;

/**
 * Minimization of deterministic automata. Weights are pushed toward the start and
 * folded into the labels first, so that states are merged only when their futures
 * agree on labels and weights alike. Transducers go through the left gallic semiring,
 * which pushes output labels the same way.
 *
 * Non-deterministic input is accepted with allowNondet in an idempotent semiring; the
 * result then merges bisimilar states and need not be minimal.
 */
public class Minimize {
	private Minimize() {}

	public static <W> void minimize(MutableFst<W> fst) throws FstException {
		minimize(fst, Semiring.KDELTA, false);
	}

	public static <W> void minimize(MutableFst<W> fst, float delta, boolean allowNondet) throws FstException {
		Date startTime = new Date();
		Semiring<W> sr = fst.getSemiring();
		int before = fst.numStates();
		if (!Fsts.isDeterministic(fst)) {
			if (!allowNondet)
				throw new ConfigureException("Minimization needs deterministic input; determinize first or allow non-determinism");
			if (!sr.hasProperties(Semiring.IDEMPOTENT))
				throw new ConfigureException("Minimizing non-deterministic input needs an idempotent semiring, not "+sr);
		}
		if (!Fsts.isAcceptor(fst))
			minimizeTransducer(fst, new GallicSemiring<W>(sr, GallicType.LEFT), delta);
		else if (isWeighted(fst))
			minimizeWeighted(fst, delta);
		else
			acceptorMinimize(fst);
		Debug.dbtime(1, startTime, "minimized "+before+" states to "+fst.numStates());
	}

	private static <W> boolean isWeighted(ExpandedFst<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			if (fst.isFinal(s) && !sr.isOne(fst.finalWeight(s)))
				return true;
			for (Transition<W> t : fst.transitions(s))
				if (!sr.isOne(t.getWeight()))
					return true;
		}
		return false;
	}

	// push, quantize, fold weights into labels, minimize, unfold
	private static <W> void minimizeWeighted(MutableFst<W> fst, float delta) throws FstException {
		Semiring<W> sr = fst.getSemiring();
		Push.push(fst, ReweightType.TO_INITIAL, false, delta);
		TransitionMap.map(fst, TransitionMap.quantize(sr, delta));
		EncodeTable<W> table = new EncodeTable<W>(EncodeTable.ENCODE_LABELS | EncodeTable.ENCODE_WEIGHTS);
		Encode.encode(fst, table);
		acceptorMinimize(fst);
		Encode.decode(fst, table);
	}

	private static <W> void minimizeTransducer(MutableFst<W> fst, GallicSemiring<W> gallic, float delta) throws FstException {
		VectorFst<GallicWeight<W>> gfst = GallicConvert.toGallic(fst, gallic);
		minimizeWeighted(gfst, delta);
		FactorWeightConfig fconfig = new FactorWeightConfig().setDelta(delta);
		VectorFst<GallicWeight<W>> factored = FactorWeight.factorWeight(gfst, new GallicFactor<GallicWeight<W>, W>(gallic), fconfig);
		VectorFst<W> ret = GallicConvert.fromGallic(factored, gallic, fst.getOutputSymbols(), Transition.EPSILON);
		ret.setInputSymbols(fst.getInputSymbols());
		Fsts.copy(ret, fst);
	}

	/**
	 * Merges states with identical futures in an unweighted (or encoded) acceptor:
	 * classes start out split by final weight and are refined by the set of
	 * (label, destination class) pairs until stable.
	 */
	static <W> void acceptorMinimize(MutableFst<W> fst) {
		boolean debug = false;
		Connect.connect(fst);
		int n = fst.numStates();
		if (n == 0)
			return;
		Semiring<W> sr = fst.getSemiring();
		Partition p = new Partition(n);
		Object[] keys = new Object[n];
		for (int s = 0; s < n; s++)
			keys[s] = sr.format(fst.finalWeight(s));
		p.refine(keys);
		int rounds = 0;
		boolean changed = true;
		while (changed) {
			rounds++;
			for (int s = 0; s < n; s++) {
				TreeSet<Long> sig = new TreeSet<Long>();
				for (Transition<W> t : fst.transitions(s))
					sig.add(((long)t.getILabel() << 32) | (p.classOf(t.getNextState()) & 0xffffffffL));
				keys[s] = sig;
			}
			changed = p.refine(keys);
		}
		if (debug) Debug.debug(debug, n+" states in "+p.numClasses()+" classes after "+rounds+" rounds");
		if (p.numClasses() == n)
			return;
		// representative of each class: its first state
		int[] rep = new int[p.numClasses()];
		Arrays.fill(rep, -1);
		for (int s = 0; s < n; s++)
			if (rep[p.classOf(s)] == -1)
				rep[p.classOf(s)] = s;
		VectorFst<W> ofst = new VectorFst<W>(sr);
		ofst.addStates(p.numClasses());
		for (int c = 0; c < p.numClasses(); c++) {
			int s = rep[c];
			ofst.setFinal(c, fst.finalWeight(s));
			TreeSet<Long> done = new TreeSet<Long>();
			ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
			for (Transition<W> t : fst.transitions(s)) {
				int nc = p.classOf(t.getNextState());
				if (done.add(((long)t.getILabel() << 32) | (nc & 0xffffffffL)))
					out.add(t.withNextState(nc));
			}
			ofst.setTransitions(c, out);
		}
		ofst.setStart(p.classOf(fst.start()));
		ofst.setInputSymbols(fst.getInputSymbols());
		ofst.setOutputSymbols(fst.getOutputSymbols());
		Fsts.copy(ofst, fst);
	}
}
