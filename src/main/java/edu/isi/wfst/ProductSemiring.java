package edu.isi.wfst;

// componentwise product of two semirings
public class ProductSemiring<A, B> extends Semiring<ProductWeight<A, B>> {
	private final Semiring<A> s1;
	private final Semiring<B> s2;
	private final ProductWeight<A, B> zero;
	private final ProductWeight<A, B> one;

	public ProductSemiring(Semiring<A> s1, Semiring<B> s2) {
		this.s1 = s1;
		this.s2 = s2;
		zero = new ProductWeight<A, B>(s1.zero(), s2.zero());
		one = new ProductWeight<A, B>(s1.one(), s2.one());
	}
	public Semiring<A> getSemiring1() { return s1; }
	public Semiring<B> getSemiring2() { return s2; }

	public ProductWeight<A, B> zero() { return zero; }
	public ProductWeight<A, B> one() { return one; }
	public ProductWeight<A, B> plus(ProductWeight<A, B> a, ProductWeight<A, B> b) {
		return new ProductWeight<A, B>(s1.plus(a.getValue1(), b.getValue1()), s2.plus(a.getValue2(), b.getValue2()));
	}
	public ProductWeight<A, B> times(ProductWeight<A, B> a, ProductWeight<A, B> b) {
		return new ProductWeight<A, B>(s1.times(a.getValue1(), b.getValue1()), s2.times(a.getValue2(), b.getValue2()));
	}
	public ProductWeight<A, B> divide(ProductWeight<A, B> a, ProductWeight<A, B> b, DivideType type) throws UnsupportedSemiringOperationException {
		return new ProductWeight<A, B>(s1.divide(a.getValue1(), b.getValue1(), type), s2.divide(a.getValue2(), b.getValue2(), type));
	}
	public boolean isDivisible() { return s1.isDivisible() && s2.isDivisible(); }
	public ProductWeight<A, B> closure(ProductWeight<A, B> a) throws UnsupportedSemiringOperationException {
		return new ProductWeight<A, B>(s1.closure(a.getValue1()), s2.closure(a.getValue2()));
	}
	public boolean hasClosure() { return s1.hasClosure() && s2.hasClosure(); }
	public ProductWeight<A, B> quantize(ProductWeight<A, B> a, float delta) {
		return new ProductWeight<A, B>(s1.quantize(a.getValue1(), delta), s2.quantize(a.getValue2(), delta));
	}
	public boolean equal(ProductWeight<A, B> a, ProductWeight<A, B> b) {
		return s1.equal(a.getValue1(), b.getValue1()) && s2.equal(a.getValue2(), b.getValue2());
	}
	public boolean approxEqual(ProductWeight<A, B> a, ProductWeight<A, B> b, float delta) {
		return s1.approxEqual(a.getValue1(), b.getValue1(), delta) && s2.approxEqual(a.getValue2(), b.getValue2(), delta);
	}
	public boolean isMember(ProductWeight<A, B> a) {
		return a != null && s1.isMember(a.getValue1()) && s2.isMember(a.getValue2());
	}
	// the path property does not survive the product
	public int properties() {
		return s1.properties() & s2.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
	}
	public Semiring<ProductWeight<A, B>> reverseSemiring() {
		if (s1.reverseSemiring() == s1 && s2.reverseSemiring() == s2)
			return this;
		return new ProductSemiring<A, B>(s1.reverseSemiring(), s2.reverseSemiring());
	}
	public ProductWeight<A, B> reverse(ProductWeight<A, B> a) {
		return new ProductWeight<A, B>(s1.reverse(a.getValue1()), s2.reverse(a.getValue2()));
	}
	public String getName() {
		return s1.getName()+"_X_"+s2.getName();
	}
	public String format(ProductWeight<A, B> a) {
		return s1.format(a.getValue1())+","+s2.format(a.getValue2());
	}
	// splits on the last comma, so the first component may itself be a product
	public ProductWeight<A, B> parse(String s) throws DataFormatException {
		int i = s.lastIndexOf(',');
		if (i < 0)
			throw new DataFormatException("Bad product weight (no comma): "+s);
		return new ProductWeight<A, B>(s1.parse(s.substring(0, i)), s2.parse(s.substring(i+1)));
	}
}
