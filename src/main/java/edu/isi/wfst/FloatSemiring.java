package edu.isi.wfst;

// semirings whose weights are real numbers. These are the only ones the binary
// file format can carry.
public abstract class FloatSemiring extends Semiring<Double> {

	public boolean equal(Double a, Double b) {
		return approxEqual(a, b, KDELTA);
	}
	public boolean approxEqual(Double a, Double b, float delta) {
		double x = a.doubleValue();
		double y = b.doubleValue();
		if (x == y)
			return true;
		return x <= y + delta && y <= x + delta;
	}
	public boolean isMember(Double a) {
		return a != null && !a.isNaN();
	}
	public Double quantize(Double a, float delta) {
		double v = a.doubleValue();
		if (Double.isInfinite(v) || Double.isNaN(v))
			return a;
		return Math.floor(v/delta + 0.5) * delta;
	}
	public String format(Double a) {
		double v = a.doubleValue();
		if (v == Double.POSITIVE_INFINITY)
			return "Infinity";
		if (v == Double.NEGATIVE_INFINITY)
			return "-Infinity";
		if (v == Math.rint(v) && Math.abs(v) < 1e15)
			return Long.toString((long)v);
		return Float.toString((float)v);
	}
	public Double parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equalsIgnoreCase("infinity") || t.equalsIgnoreCase("inf"))
			return Double.POSITIVE_INFINITY;
		if (t.equalsIgnoreCase("-infinity") || t.equalsIgnoreCase("-inf"))
			return Double.NEGATIVE_INFINITY;
		try {
			return Double.valueOf(t);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Bad "+getName()+" weight: "+s, e);
		}
	}
	/** the name OpenFst gives this weight in binary headers */
	public String getArcType() {
		return getName();
	}
}
