package edu.isi.wfst;

import java.util.Collections;
import java.util.List;

/**
 * Product of a string semiring and a base semiring, as used to encode a transducer as
 * an acceptor.
 */
public class GallicSemiring<W> extends Semiring<GallicWeight<W>> implements GallicAlgebra<GallicWeight<W>, W> {
	private final Semiring<W> base;
	private final GallicType type;
	private final StringSemiring strings;
	private final GallicWeight<W> zero;
	private final GallicWeight<W> one;

	public GallicSemiring(Semiring<W> base, GallicType type) {
		this.base = base;
		this.type = type;
		switch (type) {
		case LEFT: strings = StringSemiring.get(StringType.LEFT); break;
		case RIGHT: strings = StringSemiring.get(StringType.RIGHT); break;
		default: strings = StringSemiring.get(StringType.RESTRICT);
		}
		zero = new GallicWeight<W>(StringWeight.INFINITY, base.zero());
		one = new GallicWeight<W>(StringWeight.EPSILON, base.one());
	}
	public Semiring<W> getBase() { return base; }
	public Semiring<GallicWeight<W>> getSemiring() { return this; }
	public GallicType getType() { return type; }
	public StringSemiring getStringSemiring() { return strings; }

	public GallicWeight<W> gallic(StringWeight s, W w) {
		return new GallicWeight<W>(s, w);
	}
	public List<GallicWeight<W>> elements(GallicWeight<W> g) {
		if (isZero(g))
			return Collections.emptyList();
		return Collections.singletonList(g);
	}

	public GallicWeight<W> zero() { return zero; }
	public GallicWeight<W> one() { return one; }
	public GallicWeight<W> plus(GallicWeight<W> a, GallicWeight<W> b) {
		if (type == GallicType.MIN) {
			if (!base.naturalLess(a.getWeight(), b.getWeight()))
				return b;
			return a;
		}
		return new GallicWeight<W>(strings.plus(a.getString(), b.getString()), base.plus(a.getWeight(), b.getWeight()));
	}
	public GallicWeight<W> times(GallicWeight<W> a, GallicWeight<W> b) {
		return new GallicWeight<W>(strings.times(a.getString(), b.getString()), base.times(a.getWeight(), b.getWeight()));
	}
	public GallicWeight<W> divide(GallicWeight<W> a, GallicWeight<W> b, DivideType dt) throws UnsupportedSemiringOperationException {
		return new GallicWeight<W>(strings.divide(a.getString(), b.getString(), dt), base.divide(a.getWeight(), b.getWeight(), dt));
	}
	public boolean isDivisible() { return base.isDivisible(); }
	public GallicWeight<W> quantize(GallicWeight<W> a, float delta) {
		return new GallicWeight<W>(a.getString(), base.quantize(a.getWeight(), delta));
	}
	public boolean equal(GallicWeight<W> a, GallicWeight<W> b) {
		return a.getString().equals(b.getString()) && base.equal(a.getWeight(), b.getWeight());
	}
	public boolean approxEqual(GallicWeight<W> a, GallicWeight<W> b, float delta) {
		return a.getString().equals(b.getString()) && base.approxEqual(a.getWeight(), b.getWeight(), delta);
	}
	public boolean isMember(GallicWeight<W> a) {
		return a != null && base.isMember(a.getWeight());
	}
	public int properties() {
		int p = strings.properties() & base.properties();
		if (type == GallicType.MIN)
			return (SEMIRING | IDEMPOTENT) & base.properties();
		return p & (SEMIRING | IDEMPOTENT);
	}
	public Semiring<GallicWeight<W>> reverseSemiring() {
		GallicType rt = type;
		if (type == GallicType.LEFT)
			rt = GallicType.RIGHT;
		else if (type == GallicType.RIGHT)
			rt = GallicType.LEFT;
		if (rt == type && base.reverseSemiring() == base)
			return this;
		return new GallicSemiring<W>(base.reverseSemiring(), rt);
	}
	public GallicWeight<W> reverse(GallicWeight<W> a) {
		return new GallicWeight<W>(a.getString().reverse(), base.reverse(a.getWeight()));
	}
	public String getName() {
		switch (type) {
		case LEFT: return "left_gallic_"+base.getName();
		case RIGHT: return "right_gallic_"+base.getName();
		case RESTRICT: return "restricted_gallic_"+base.getName();
		default: return "min_gallic_"+base.getName();
		}
	}
	public String format(GallicWeight<W> a) {
		return strings.format(a.getString())+","+base.format(a.getWeight());
	}
	public GallicWeight<W> parse(String s) throws DataFormatException {
		int i = s.indexOf(',');
		if (i < 0)
			throw new DataFormatException("Bad gallic weight (no comma): "+s);
		return new GallicWeight<W>(strings.parse(s.substring(0, i)), base.parse(s.substring(i+1)));
	}
}
