package edu.isi.wfst;

import java.util.ArrayList;

/**
 * Applies a {@link TransitionMapper} to every transition and final weight in place,
 * and supplies the common mappers.
 */
public class TransitionMap {
	private TransitionMap() {}

	public static <W> void map(MutableFst<W> fst, TransitionMapper<W> mapper) throws FstException {
		Semiring<W> sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s))
				l.add(mapper.map(t));
			fst.setTransitions(s, l);
			W fw = fst.finalWeight(s);
			if (!sr.isZero(fw))
				fst.setFinal(s, mapper.mapFinal(fw));
		}
	}

	/** rounds every weight to the delta grid */
	public static <W> TransitionMapper<W> quantize(final Semiring<W> sr, final float delta) {
		return new TransitionMapper<W>() {
			public Transition<W> map(Transition<W> t) {
				return t.withWeight(sr.quantize(t.getWeight(), delta));
			}
			public W mapFinal(W w) {
				return sr.quantize(w, delta);
			}
		};
	}
	/** every non-zero weight becomes one */
	public static <W> TransitionMapper<W> rmWeight(final Semiring<W> sr) {
		return new TransitionMapper<W>() {
			public Transition<W> map(Transition<W> t) {
				return sr.isZero(t.getWeight()) ? t : t.withWeight(sr.one());
			}
			public W mapFinal(W w) {
				return sr.one();
			}
		};
	}
	/** w := w + c */
	public static <W> TransitionMapper<W> plus(final Semiring<W> sr, final W c) {
		return new TransitionMapper<W>() {
			public Transition<W> map(Transition<W> t) {
				return t.withWeight(sr.plus(t.getWeight(), c));
			}
			public W mapFinal(W w) {
				return sr.plus(w, c);
			}
		};
	}
	/** w := w * c */
	public static <W> TransitionMapper<W> times(final Semiring<W> sr, final W c) {
		return new TransitionMapper<W>() {
			public Transition<W> map(Transition<W> t) {
				return t.withWeight(sr.times(t.getWeight(), c));
			}
			public W mapFinal(W w) {
				return sr.times(w, c);
			}
		};
	}
	/** w := one / w */
	public static <W> TransitionMapper<W> invertWeight(final Semiring<W> sr) {
		return new TransitionMapper<W>() {
			public Transition<W> map(Transition<W> t) throws FstException {
				return t.withWeight(sr.divide(sr.one(), t.getWeight(), DivideType.ANY));
			}
			public W mapFinal(W w) throws FstException {
				return sr.divide(sr.one(), w, DivideType.ANY);
			}
		};
	}
}
