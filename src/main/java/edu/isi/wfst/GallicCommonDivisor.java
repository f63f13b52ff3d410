package edu.isi.wfst;

/**
 * Label divisor on the string half, plus on the base half, taken over every element
 * of both (union) gallic weights.
 */
public class GallicCommonDivisor<G, W> implements CommonDivisor<G> {
	private final GallicAlgebra<G, W> algebra;
	private final LabelCommonDivisor labels = new LabelCommonDivisor();

	public GallicCommonDivisor(GallicAlgebra<G, W> algebra) {
		this.algebra = algebra;
	}
	public G commonDivisor(G a, G b) {
		Semiring<W> base = algebra.getBase();
		StringWeight str = StringWeight.INFINITY;
		W w = base.zero();
		for (GallicWeight<W> e : algebra.elements(a)) {
			str = labels.commonDivisor(str, e.getString());
			w = base.plus(w, e.getWeight());
		}
		for (GallicWeight<W> e : algebra.elements(b)) {
			str = labels.commonDivisor(str, e.getString());
			w = base.plus(w, e.getWeight());
		}
		if (base.isZero(w))
			return algebra.getSemiring().zero();
		return algebra.gallic(str, w);
	}
}
