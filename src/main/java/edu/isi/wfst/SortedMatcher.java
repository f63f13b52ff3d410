package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary search over transitions sorted on the matched label. Sortedness is checked
 * when the automaton is expanded and taken on trust when it is lazy.
 */
public class SortedMatcher<W> implements Matcher<W> {
	private final Fst<W> fst;
	private final MatchType type;

	public SortedMatcher(Fst<W> fst, MatchType type) throws ConfigureException {
		if (type != MatchType.INPUT && type != MatchType.OUTPUT)
			throw new ConfigureException("Sorted matcher matches on input or output, not "+type);
		if (fst instanceof ExpandedFst && !Fsts.isSorted((ExpandedFst<W>)fst, type == MatchType.OUTPUT))
			throw new ConfigureException("Sorted matcher needs transitions sorted by "+(type == MatchType.INPUT ? "input" : "output")+" label");
		this.fst = fst;
		this.type = type;
	}

	public Fst<W> getFst() { return fst; }
	public MatchType getMatchType() { return type; }

	private int label(Transition<W> t) {
		return type == MatchType.INPUT ? t.getILabel() : t.getOLabel();
	}

	public List<Transition<W>> find(int s, int label) throws FstException {
		List<Transition<W>> trs = fst.transitions(s);
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
		if (label == Transition.EPSILON) {
			W one = fst.getSemiring().one();
			if (type == MatchType.INPUT)
				out.add(new Transition<W>(Transition.NO_LABEL, Transition.EPSILON, one, s));
			else
				out.add(new Transition<W>(Transition.EPSILON, Transition.NO_LABEL, one, s));
		}
		int match = label == Transition.NO_LABEL ? Transition.EPSILON : label;
		// lower bound
		int lo = 0;
		int hi = trs.size();
		while (lo < hi) {
			int mid = (lo+hi) >>> 1;
			if (label(trs.get(mid)) < match)
				lo = mid+1;
			else
				hi = mid;
		}
		for (int i = lo; i < trs.size() && label(trs.get(i)) == match; i++)
			out.add(trs.get(i));
		return out;
	}

	public int priority(int s) throws FstException {
		return fst.numTransitions(s);
	}
}
