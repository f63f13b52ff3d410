package edu.isi.wfst;

import java.util.Comparator;
import java.util.List;

/**
 * The general gallic semiring: unions of restricted gallic weights, ordered by their
 * strings. Needed to determinize transducers that are not functional, since one subset
 * element may then carry several different output strings.
 */
public class GallicUnionSemiring<W> extends UnionSemiring<GallicWeight<W>> implements GallicAlgebra<UnionWeight<GallicWeight<W>>, W> {
	private final GallicSemiring<W> restrict;

	public GallicUnionSemiring(Semiring<W> base) {
		this(new GallicSemiring<W>(base, GallicType.RESTRICT));
	}
	private GallicUnionSemiring(GallicSemiring<W> restrict) {
		super(restrict, new Comparator<GallicWeight<W>>() {
			public int compare(GallicWeight<W> a, GallicWeight<W> b) {
				return a.getString().compareTo(b.getString());
			}
		});
		this.restrict = restrict;
	}
	public GallicSemiring<W> getRestrictSemiring() { return restrict; }
	public Semiring<W> getBase() { return restrict.getBase(); }
	public Semiring<UnionWeight<GallicWeight<W>>> getSemiring() { return this; }

	public UnionWeight<GallicWeight<W>> gallic(StringWeight s, W w) {
		return singleton(new GallicWeight<W>(s, w));
	}
	public List<GallicWeight<W>> elements(UnionWeight<GallicWeight<W>> g) {
		return g.getElements();
	}
	public Semiring<UnionWeight<GallicWeight<W>>> reverseSemiring() {
		Semiring<W> rb = getBase().reverseSemiring();
		if (rb == getBase())
			return this;
		return new GallicUnionSemiring<W>(rb);
	}
	public String getName() {
		return "gallic_"+getBase().getName();
	}
}
