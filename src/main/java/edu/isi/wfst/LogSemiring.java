package edu.isi.wfst;

// log is -log(e^-a + e^-b), +, +INF, 0
public class LogSemiring extends FloatSemiring {
	private static final LogSemiring INSTANCE = new LogSemiring();
	public static LogSemiring get() { return INSTANCE; }

	public Double zero() { return Double.POSITIVE_INFINITY; }
	public Double one() { return 0.0; }
	public Double plus(Double a, Double b) {
		if (a == Double.POSITIVE_INFINITY)
			return b;
		if (b == Double.POSITIVE_INFINITY)
			return a;
		if (a > b)
			return b - Math.log1p(Math.exp(b - a));
		return a - Math.log1p(Math.exp(a - b));
	}
	public Double times(Double a, Double b) {
		if (a == Double.POSITIVE_INFINITY || b == Double.POSITIVE_INFINITY)
			return Double.POSITIVE_INFINITY;
		return a + b;
	}
	public Double divide(Double a, Double b, DivideType type) throws UnsupportedSemiringOperationException {
		if (b == Double.POSITIVE_INFINITY)
			throw new UnsupportedSemiringOperationException("Division by zero ("+format(b)+") in the log semiring");
		if (a == Double.POSITIVE_INFINITY)
			return a;
		return a - b;
	}
	public boolean isDivisible() { return true; }
	// -log(1/(1-p)) for p = exp(-a); diverges once p reaches 1
	public Double closure(Double a) {
		if (a > 0.0)
			return Math.log(-Math.expm1(-a));
		return Double.NEGATIVE_INFINITY;
	}
	public boolean hasClosure() { return true; }
	// not idempotent, but the numeric order is the one everybody means
	public boolean naturalLess(Double a, Double b) {
		return a < b && !equal(a, b);
	}
	public int properties() {
		return SEMIRING | COMMUTATIVE;
	}
	public String getName() { return "log"; }
}
