package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peels the first output label off each alternative of a gallic weight. A weight is
 * done when it has at most one alternative with at most one label.
 */
public class GallicFactor<G, W> implements FactorIterator<G> {
	private final GallicAlgebra<G, W> algebra;

	public GallicFactor(GallicAlgebra<G, W> algebra) {
		this.algebra = algebra;
	}
	public boolean done(G g) {
		List<GallicWeight<W>> es = algebra.elements(g);
		return es.size() == 0 || (es.size() == 1 && es.get(0).getString().size() <= 1);
	}
	public List<Factor<G>> factors(G g) {
		if (done(g))
			return Collections.emptyList();
		Semiring<W> base = algebra.getBase();
		ArrayList<Factor<G>> out = new ArrayList<Factor<G>>();
		for (GallicWeight<W> e : algebra.elements(g)) {
			StringWeight str = e.getString();
			if (str.isEmpty()) {
				out.add(new Factor<G>(algebra.gallic(StringWeight.EPSILON, e.getWeight()), algebra.getSemiring().one()));
				continue;
			}
			out.add(new Factor<G>(algebra.gallic(StringWeight.ofLabel(str.get(0)), e.getWeight()),
					      algebra.gallic(str.subString(1, str.size()), base.one())));
		}
		return out;
	}
}
