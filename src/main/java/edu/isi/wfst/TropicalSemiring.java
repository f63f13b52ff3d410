package edu.isi.wfst;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends FloatSemiring {
	private static final TropicalSemiring INSTANCE = new TropicalSemiring();
	public static TropicalSemiring get() { return INSTANCE; }

	public Double zero() { return Double.POSITIVE_INFINITY; }
	public Double one() { return 0.0; }
	public Double plus(Double a, Double b) {
		return a < b ? a : b;
	}
	public Double times(Double a, Double b) {
		if (a == Double.POSITIVE_INFINITY || b == Double.POSITIVE_INFINITY)
			return Double.POSITIVE_INFINITY;
		return a + b;
	}
	public Double divide(Double a, Double b, DivideType type) throws UnsupportedSemiringOperationException {
		if (b == Double.POSITIVE_INFINITY)
			throw new UnsupportedSemiringOperationException("Division by zero ("+format(b)+") in the tropical semiring");
		if (a == Double.POSITIVE_INFINITY)
			return a;
		return a - b;
	}
	public boolean isDivisible() { return true; }
	// fewest loops always the best, unless the loop is negative
	public Double closure(Double a) {
		if (a >= 0 && !a.isInfinite())
			return one();
		if (a == Double.POSITIVE_INFINITY)
			return one();
		return Double.NEGATIVE_INFINITY;
	}
	public boolean hasClosure() { return true; }
	public boolean naturalLess(Double a, Double b) {
		return a < b && !equal(a, b);
	}
	public int properties() {
		return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
	}
	public String getName() { return "tropical"; }
	public String getArcType() { return "standard"; }
}
