package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Weighted subset construction on an acceptor, one subset at a time. Input labels are
 * the labels; epsilon is treated as an ordinary label.
 */
public class DeterminizeFsaOp<W> implements FstOp<W> {
	private final Fst<W> fst;
	private final Semiring<W> semiring;
	private final CommonDivisor<W> divisor;
	private final DeterminizeConfig config;
	private final StateTable<WeightedSubset<W>> table = new StateTable<WeightedSubset<W>>();

	public DeterminizeFsaOp(Fst<W> fst, CommonDivisor<W> divisor, DeterminizeConfig config) {
		this.fst = fst;
		this.semiring = fst.getSemiring();
		this.divisor = divisor;
		this.config = config;
	}

	public WeightedSubset<W> getSubset(int s) { return table.findTuple(s); }

	public int computeStart() throws FstException {
		int s = fst.start();
		if (s == Transition.NO_STATE)
			return Transition.NO_STATE;
		return table.findId(new WeightedSubset<W>(new int[] {s}, Collections.singletonList(semiring.one())));
	}

	public W computeFinalWeight(int s) throws FstException {
		WeightedSubset<W> subset = table.findTuple(s);
		W w = semiring.zero();
		try {
			for (int i = 0; i < subset.size(); i++)
				w = semiring.plus(w, semiring.times(subset.getWeight(i), fst.finalWeight(subset.getState(i))));
		}
		catch (IncompatibleWeightsException e) {
			throw new NonDeterminizableException("Final weights of subset "+subset+" disagree; input is not functional", e);
		}
		return w;
	}

	// destinations reached on one label, before merging
	private static class LabelGroup<W> {
		TIntArrayList states = new TIntArrayList();
		ArrayList<W> weights = new ArrayList<W>();
	}

	public List<Transition<W>> computeTransitions(int s) throws FstException {
		boolean debug = false;
		WeightedSubset<W> subset = table.findTuple(s);
		TIntObjectHashMap<LabelGroup<W>> groups = new TIntObjectHashMap<LabelGroup<W>>();
		for (int i = 0; i < subset.size(); i++) {
			W w = subset.getWeight(i);
			for (Transition<W> t : fst.transitions(subset.getState(i))) {
				LabelGroup<W> g = groups.get(t.getILabel());
				if (g == null) {
					g = new LabelGroup<W>();
					groups.put(t.getILabel(), g);
				}
				g.states.add(t.getNextState());
				g.weights.add(semiring.times(w, t.getWeight()));
			}
		}
		// transitions come out in label order, subsets list their states in order
		int[] labels = groups.keys();
		Arrays.sort(labels);
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>(labels.length);
		try {
			for (int label : labels) {
				LabelGroup<W> g = groups.get(label);
				W d = semiring.zero();
				TIntObjectHashMap<W> merged = new TIntObjectHashMap<W>();
				for (int i = 0; i < g.states.size(); i++) {
					W w = g.weights.get(i);
					d = divisor.commonDivisor(d, w);
					W old = merged.get(g.states.get(i));
					merged.put(g.states.get(i), old == null ? w : semiring.plus(old, w));
				}
				if (semiring.isZero(d))
					continue;
				int[] states = merged.keys();
				Arrays.sort(states);
				ArrayList<W> residuals = new ArrayList<W>(states.length);
				for (int q : states)
					residuals.add(semiring.quantize(semiring.divide(merged.get(q), d, DivideType.LEFT), config.getDelta()));
				int next = table.findId(new WeightedSubset<W>(states, residuals));
				out.add(new Transition<W>(label, label, d, next));
			}
		}
		catch (IncompatibleWeightsException e) {
			throw new NonDeterminizableException("Outputs leaving subset "+subset+" disagree; input is not functional", e);
		}
		if (config.getStateLimit() > 0 && table.size() > config.getStateLimit())
			throw new NonDeterminizableException("Determinization exceeded the state limit of "+config.getStateLimit());
		if (debug) Debug.debug(debug, "Subset "+s+" "+subset+" has "+out.size()+" transitions");
		return out;
	}
}
