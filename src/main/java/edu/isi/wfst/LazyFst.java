package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;

import java.util.List;

/**
 * An automaton computed on demand: start state, final weights and transitions come from
 * an {@link FstOp} the first time they are asked for and are served from the cache
 * afterwards. Composition, replacement and friends present themselves this way, so a
 * caller that only explores part of the result only pays for that part.
 */
public class LazyFst<W> implements Fst<W> {
	private final Semiring<W> semiring;
	private final FstOp<W> op;
	private final FstCache<W> cache;
	private final SymbolTable isyms;
	private final SymbolTable osyms;

	public LazyFst(Semiring<W> semiring, FstOp<W> op, CacheOptions opts, SymbolTable isyms, SymbolTable osyms) {
		this.semiring = semiring;
		this.op = op;
		this.cache = new FstCache<W>(opts);
		this.isyms = isyms;
		this.osyms = osyms;
	}
	public LazyFst(Semiring<W> semiring, FstOp<W> op) {
		this(semiring, op, new CacheOptions(), null, null);
	}

	public Semiring<W> getSemiring() { return semiring; }
	public FstOp<W> getOp() { return op; }
	public FstCache<W> getCache() { return cache; }

	public int start() throws FstException {
		if (!cache.hasStart())
			cache.setStart(op.computeStart());
		return cache.getStart();
	}
	public W finalWeight(int s) throws FstException {
		if (!cache.hasFinal(s))
			cache.setFinalWeight(s, op.computeFinalWeight(s));
		return cache.getFinalWeight(s);
	}
	public boolean isFinal(int s) throws FstException {
		return !semiring.isZero(finalWeight(s));
	}
	public List<Transition<W>> transitions(int s) throws FstException {
		if (!cache.hasTransitions(s))
			cache.setTransitions(s, op.computeTransitions(s));
		return cache.getTransitions(s);
	}
	public int numTransitions(int s) throws FstException {
		transitions(s);
		return cache.peek(s).numTransitions();
	}
	public int numInputEpsilons(int s) throws FstException {
		transitions(s);
		return cache.peek(s).numInputEpsilons();
	}
	public int numOutputEpsilons(int s) throws FstException {
		transitions(s);
		return cache.peek(s).numOutputEpsilons();
	}
	public SymbolTable getInputSymbols() { return isyms; }
	public SymbolTable getOutputSymbols() { return osyms; }

	/** see {@link FstCache#pin} */
	public void pin(int s) { cache.pin(s); }
	public void unpin(int s) { cache.unpin(s); }

	/**
	 * Everything reachable from the start state, copied into a vector automaton.
	 * States are renumbered in breadth-first order, the start becoming 0.
	 */
	public VectorFst<W> expand() throws FstException {
		return expand(this);
	}

	/** breadth-first copy of the accessible part of any automaton */
	public static <W> VectorFst<W> expand(Fst<W> fst) throws FstException {
		VectorFst<W> ofst = new VectorFst<W>(fst.getSemiring());
		ofst.setInputSymbols(fst.getInputSymbols());
		ofst.setOutputSymbols(fst.getOutputSymbols());
		int s0 = fst.start();
		if (s0 == Transition.NO_STATE)
			return ofst;
		TIntIntHashMap ids = new TIntIntHashMap(16, 0.5f, -1, -1);
		TIntArrayList queue = new TIntArrayList();
		ids.put(s0, ofst.addState());
		queue.add(s0);
		ofst.setStart(0);
		int head = 0;
		while (head < queue.size()) {
			int s = queue.get(head++);
			int os = ids.get(s);
			for (Transition<W> t : fst.transitions(s)) {
				int n = ids.get(t.getNextState());
				if (n == -1) {
					n = ofst.addState();
					ids.put(t.getNextState(), n);
					queue.add(t.getNextState());
				}
				ofst.addTransition(os, t.withNextState(n));
			}
			ofst.setFinal(os, fst.finalWeight(s));
		}
		return ofst;
	}
}
