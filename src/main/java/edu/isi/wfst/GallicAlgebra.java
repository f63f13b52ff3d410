package edu.isi.wfst;

import java.util.List;

/**
 * What determinization and weight factoring need to know about a gallic-like semiring,
 * whether its weights are single (string, weight) pairs or unions of them.
 */
public interface GallicAlgebra<G, W> {
	/** semiring of the weight half */
	public Semiring<W> getBase();
	/** the semiring G lives in */
	public Semiring<G> getSemiring();
	/** build a G out of one (string, weight) pair */
	public G gallic(StringWeight s, W w);
	/** the pairs G consists of; empty for zero */
	public List<GallicWeight<W>> elements(G g);
}
