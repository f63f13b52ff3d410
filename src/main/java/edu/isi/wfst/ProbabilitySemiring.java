package edu.isi.wfst;

// the real semiring: +, *, 0, 1
public class ProbabilitySemiring extends FloatSemiring {
	private static final ProbabilitySemiring INSTANCE = new ProbabilitySemiring();
	public static ProbabilitySemiring get() { return INSTANCE; }

	public Double zero() { return 0.0; }
	public Double one() { return 1.0; }
	public Double plus(Double a, Double b) {
		return a + b;
	}
	public Double times(Double a, Double b) {
		return a * b;
	}
	public Double divide(Double a, Double b, DivideType type) throws UnsupportedSemiringOperationException {
		if (b == 0.0)
			throw new UnsupportedSemiringOperationException("Division by zero in the probability semiring");
		return a / b;
	}
	public boolean isDivisible() { return true; }
	public Double closure(Double a) {
		if (a >= 1.0)
			return Double.POSITIVE_INFINITY;
		return 1.0 / (1.0 - a);
	}
	public boolean hasClosure() { return true; }
	// bigger probabilities are better
	public boolean naturalLess(Double a, Double b) {
		return a > b && !equal(a, b);
	}
	public int properties() {
		return SEMIRING | COMMUTATIVE;
	}
	public String getName() { return "probability"; }
}
