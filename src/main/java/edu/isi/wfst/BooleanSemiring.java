package edu.isi.wfst;

// or, and, false, true
public class BooleanSemiring extends Semiring<Boolean> {
	private static final BooleanSemiring INSTANCE = new BooleanSemiring();
	public static BooleanSemiring get() { return INSTANCE; }

	public Boolean zero() { return Boolean.FALSE; }
	public Boolean one() { return Boolean.TRUE; }
	public Boolean plus(Boolean a, Boolean b) {
		return a || b;
	}
	public Boolean times(Boolean a, Boolean b) {
		return a && b;
	}
	public Boolean divide(Boolean a, Boolean b, DivideType type) throws UnsupportedSemiringOperationException {
		if (!b)
			throw new UnsupportedSemiringOperationException("Division by false in the boolean semiring");
		return a;
	}
	public boolean isDivisible() { return true; }
	public Boolean closure(Boolean a) {
		return Boolean.TRUE;
	}
	public boolean hasClosure() { return true; }
	// true is the better weight
	public boolean naturalLess(Boolean a, Boolean b) {
		return a && !b;
	}
	public int properties() {
		return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
	}
	public String getName() { return "boolean"; }
	public String format(Boolean a) {
		return a ? "1" : "0";
	}
	public Boolean parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equals("1") || t.equalsIgnoreCase("true"))
			return Boolean.TRUE;
		if (t.equals("0") || t.equalsIgnoreCase("false"))
			return Boolean.FALSE;
		throw new DataFormatException("Bad boolean weight: "+s);
	}
}
