package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

/**
 * States are (input state, weight still owed) pairs. A factored transition leads to a
 * pair that owes the rest of its weight; a factored final weight leads to a pair with no
 * input state, which pays the rest off by further steps or as its final weight.
 */
public class FactorWeightOp<W> implements FstOp<W> {
	private final Fst<W> fst;
	private final Semiring<W> semiring;
	private final FactorIterator<W> factor;
	private final FactorWeightConfig config;
	private final StateTable<Element<W>> table = new StateTable<Element<W>>();

	static final class Element<W> {
		final int state;
		final W weight;
		Element(int state, W weight) {
			this.state = state;
			this.weight = weight;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Element))
				return false;
			Element<?> e = (Element<?>)o;
			return state == e.state && weight.equals(e.weight);
		}
		public int hashCode() {
			return state*7853 + weight.hashCode();
		}
	}

	public FactorWeightOp(Fst<W> fst, FactorIterator<W> factor, FactorWeightConfig config) throws ConfigureException {
		if (!config.isFactorFinalWeights() && !config.isFactorTransitionWeights())
			throw new ConfigureException("Factor weight needs final weights or transition weights to factor");
		this.fst = fst;
		this.semiring = fst.getSemiring();
		this.factor = factor;
		this.config = config;
	}

	public int computeStart() throws FstException {
		int s = fst.start();
		if (s == Transition.NO_STATE)
			return Transition.NO_STATE;
		return table.findId(new Element<W>(s, semiring.one()));
	}

	// weight owed at the end of element e
	private W owed(Element<W> e) throws FstException {
		if (e.state == Transition.NO_STATE)
			return e.weight;
		return semiring.times(e.weight, fst.finalWeight(e.state));
	}

	public W computeFinalWeight(int s) throws FstException {
		W w = owed(table.findTuple(s));
		if (config.isFactorFinalWeights() && !factor.done(w))
			return semiring.zero();
		return w;
	}

	public List<Transition<W>> computeTransitions(int s) throws FstException {
		Element<W> e = table.findTuple(s);
		ArrayList<Transition<W>> out = new ArrayList<Transition<W>>();
		if (e.state != Transition.NO_STATE) {
			for (Transition<W> t : fst.transitions(e.state)) {
				W value = semiring.times(e.weight, t.getWeight());
				if (!config.isFactorTransitionWeights() || factor.done(value)) {
					int next = table.findId(new Element<W>(t.getNextState(), semiring.one()));
					out.add(new Transition<W>(t.getILabel(), t.getOLabel(), value, next));
					continue;
				}
				for (Factor<W> f : factor.factors(value)) {
					int next = table.findId(new Element<W>(t.getNextState(), semiring.quantize(f.getRest(), config.getDelta())));
					out.add(new Transition<W>(t.getILabel(), t.getOLabel(), f.getHead(), next));
				}
			}
		}
		if (config.isFactorFinalWeights() && (e.state == Transition.NO_STATE || fst.isFinal(e.state))) {
			int il = config.getFinalILabel();
			int ol = config.getFinalOLabel();
			for (Factor<W> f : factor.factors(owed(e))) {
				int next = table.findId(new Element<W>(Transition.NO_STATE, semiring.quantize(f.getRest(), config.getDelta())));
				out.add(new Transition<W>(il, ol, f.getHead(), next));
				if (config.isIncrementFinalILabel())
					il++;
				if (config.isIncrementFinalOLabel())
					ol++;
			}
		}
		return out;
	}
}
