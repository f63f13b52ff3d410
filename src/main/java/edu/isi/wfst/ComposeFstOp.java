package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the states of a composition on demand. At each composed state the side with
 * fewer transitions is walked and its labels looked up in the other side's matcher,
 * when both sides can be matched; otherwise the one usable matcher decides.
 */
public class ComposeFstOp<W, F extends FilterState> implements FstOp<W> {
	private final Fst<W> fst1;
	private final Fst<W> fst2;
	private final Semiring<W> semiring;
	// matches fst1's output labels; null if fst1 is not sorted that way
	private final Matcher<W> matcher1;
	// matches fst2's input labels; null if fst2 is not sorted that way
	private final Matcher<W> matcher2;
	private final MatchType matchType;
	private final ComposeFilter<W, F> filter;
	private final StateTable<ComposeStateTuple<F>> table = new StateTable<ComposeStateTuple<F>>();

	public ComposeFstOp(Fst<W> fst1, Fst<W> fst2, ComposeFilter<W, F> filter) throws ConfigureException {
		this.fst1 = fst1;
		this.fst2 = fst2;
		this.semiring = fst1.getSemiring();
		this.filter = filter;
		matcher1 = sortedMatcher(fst1, MatchType.OUTPUT);
		matcher2 = sortedMatcher(fst2, MatchType.INPUT);
		if (matcher1 != null && matcher2 != null)
			matchType = MatchType.BOTH;
		else if (matcher2 != null)
			matchType = MatchType.INPUT;
		else if (matcher1 != null)
			matchType = MatchType.OUTPUT;
		else
			throw new ConfigureException("Composition needs the first automaton sorted by output label or the second sorted by input label");
	}

	private static <W> Matcher<W> sortedMatcher(Fst<W> fst, MatchType type) {
		if (fst instanceof ExpandedFst && !Fsts.isSorted((ExpandedFst<W>)fst, type == MatchType.OUTPUT))
			return null;
		try {
			return new SortedMatcher<W>(fst, type);
		}
		catch (ConfigureException e) {
			throw new IllegalStateException("sortedness checked above", e);
		}
	}

	public MatchType getMatchType() { return matchType; }
	public ComposeFilter<W, F> getFilter() { return filter; }
	public ComposeStateTuple<F> getTuple(int s) { return table.findTuple(s); }

	public int computeStart() throws FstException {
		int s1 = fst1.start();
		if (s1 == Transition.NO_STATE)
			return Transition.NO_STATE;
		int s2 = fst2.start();
		if (s2 == Transition.NO_STATE)
			return Transition.NO_STATE;
		return table.findId(new ComposeStateTuple<F>(s1, s2, filter.start()));
	}

	public W computeFinalWeight(int s) throws FstException {
		ComposeStateTuple<F> t = table.findTuple(s);
		W f1 = fst1.finalWeight(t.getState1());
		if (semiring.isZero(f1))
			return semiring.zero();
		W f2 = fst2.finalWeight(t.getState2());
		if (semiring.isZero(f2))
			return semiring.zero();
		filter.setState(t.getState1(), t.getState2(), t.getFilterState());
		return filter.filterFinal(f1, f2);
	}

	public List<Transition<W>> computeTransitions(int s) throws FstException {
		boolean debug = false;
		ComposeStateTuple<F> t = table.findTuple(s);
		int s1 = t.getState1();
		int s2 = t.getState2();
		filter.setState(s1, s2, t.getFilterState());
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
		boolean walkSecond = matchType == MatchType.OUTPUT
			|| (matchType == MatchType.BOTH && matcher1.priority(s1) > matcher2.priority(s2));
		if (walkSecond) {
			// fst2 walked, fst1 looked up by output label
			Transition<W> loop = new Transition<W>(Transition.NO_LABEL, Transition.EPSILON, semiring.one(), s2);
			addMatches(out, loop, matcher1, s1, false);
			for (Transition<W> t2 : fst2.transitions(s2))
				addMatches(out, t2, matcher1, s1, false);
		}
		else {
			Transition<W> loop = new Transition<W>(Transition.EPSILON, Transition.NO_LABEL, semiring.one(), s1);
			addMatches(out, loop, matcher2, s2, true);
			for (Transition<W> t1 : fst1.transitions(s1))
				addMatches(out, t1, matcher2, s2, true);
		}
		if (debug) Debug.debug(debug, "State "+s+" "+t+" has "+out.size()+" transitions");
		return out;
	}

	// pairs walked with everything matcher finds for it at state ms
	private void addMatches(List<Transition<W>> out, Transition<W> walked, Matcher<W> matcher, int ms, boolean walkedIsFirst) throws FstException {
		int label = walkedIsFirst ? walked.getOLabel() : walked.getILabel();
		for (Transition<W> m : matcher.find(ms, label)) {
			if (walkedIsFirst)
				addTransition(out, walked, m);
			else
				addTransition(out, m, walked);
		}
	}

	private void addTransition(List<Transition<W>> out, Transition<W> t1, Transition<W> t2) {
		F fs = filter.filterTransition(t1, t2);
		if (fs.isBlocked())
			return;
		int next = table.findId(new ComposeStateTuple<F>(t1.getNextState(), t2.getNextState(), fs));
		out.add(new Transition<W>(t1.getILabel(), t2.getOLabel(), semiring.times(t1.getWeight(), t2.getWeight()), next));
	}
}
