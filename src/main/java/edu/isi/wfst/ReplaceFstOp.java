package edu.isi.wfst;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * States are (call stack, automaton, state) triples. A transition whose output label
 * names one of the automata is a call: it enters that automaton's start state and pushes
 * the state to come back to. Final states of a called automaton return to the caller
 * with an epsilon transition carrying the final weight.
 */
public class ReplaceFstOp<W> implements FstOp<W> {
	private final ArrayList<Fst<W>> fsts = new ArrayList<Fst<W>>();
	// nonterminal label -> index into fsts
	private final TIntIntHashMap index = new TIntIntHashMap(16, 0.5f, -1, -1);
	private final int root;
	private final boolean epsilonOnReplace;
	private final Semiring<W> semiring;
	private final StateTable<ReplaceStack> stacks = new StateTable<ReplaceStack>();
	private final StateTable<Tuple> table = new StateTable<Tuple>();

	static final class Tuple {
		final int stack;
		final int fst;
		final int state;
		Tuple(int stack, int fst, int state) {
			this.stack = stack;
			this.fst = fst;
			this.state = state;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Tuple))
				return false;
			Tuple t = (Tuple)o;
			return stack == t.stack && fst == t.fst && state == t.state;
		}
		public int hashCode() {
			return (stack*7853 + fst)*31 + state;
		}
	}

	public ReplaceFstOp(Map<Integer, ? extends Fst<W>> fsts, int rootLabel, boolean epsilonOnReplace) throws ConfigureException {
		if (!fsts.containsKey(rootLabel))
			throw new ConfigureException("Root label "+rootLabel+" is not among the "+fsts.size()+" automata to replace");
		Semiring<W> sr = null;
		for (Map.Entry<Integer, ? extends Fst<W>> e : fsts.entrySet()) {
			if (e.getKey() <= 0)
				throw new ConfigureException("Nonterminal label "+e.getKey()+" must be positive");
			if (sr == null)
				sr = e.getValue().getSemiring();
			else if (!sr.getName().equals(e.getValue().getSemiring().getName()))
				throw new ConfigureException("Can't replace across semirings "+sr+" and "+e.getValue().getSemiring());
			index.put(e.getKey(), this.fsts.size());
			this.fsts.add(e.getValue());
		}
		this.semiring = sr;
		this.root = index.get(rootLabel);
		this.epsilonOnReplace = epsilonOnReplace;
		stacks.findId(ReplaceStack.EMPTY);
	}

	public Semiring<W> getSemiring() { return semiring; }
	Fst<W> getRoot() { return fsts.get(root); }

	public int computeStart() throws FstException {
		int s = fsts.get(root).start();
		if (s == Transition.NO_STATE)
			return Transition.NO_STATE;
		return table.findId(new Tuple(0, root, s));
	}

	public W computeFinalWeight(int s) throws FstException {
		Tuple t = table.findTuple(s);
		if (t.stack != 0)
			return semiring.zero();
		return fsts.get(t.fst).finalWeight(t.state);
	}

	public List<Transition<W>> computeTransitions(int s) throws FstException {
		Tuple t = table.findTuple(s);
		Fst<W> fst = fsts.get(t.fst);
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
		ReplaceStack stack = stacks.findTuple(t.stack);
		if (t.stack != 0) {
			W f = fst.finalWeight(t.state);
			if (!semiring.isZero(f)) {
				int next = table.findId(new Tuple(stacks.findId(stack.pop()), stack.topFst(), stack.topReturnState()));
				out.add(new Transition<W>(Transition.EPSILON, Transition.EPSILON, f, next));
			}
		}
		for (Transition<W> tr : fst.transitions(t.state)) {
			int callee = tr.getOLabel() == Transition.EPSILON ? -1 : index.get(tr.getOLabel());
			if (callee == -1) {
				out.add(tr.withNextState(table.findId(new Tuple(t.stack, t.fst, tr.getNextState()))));
				continue;
			}
			int cs = fsts.get(callee).start();
			if (cs == Transition.NO_STATE)
				continue;
			int pushed = stacks.findId(stack.push(t.fst, tr.getNextState()));
			int next = table.findId(new Tuple(pushed, callee, cs));
			int il = epsilonOnReplace ? Transition.EPSILON : tr.getILabel();
			out.add(new Transition<W>(il, Transition.EPSILON, tr.getWeight(), next));
		}
		return out;
	}
}
