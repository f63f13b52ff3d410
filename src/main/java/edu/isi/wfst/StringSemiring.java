package edu.isi.wfst;

import java.util.ArrayList;

/**
 * Strings of labels under concatenation. Plus is the longest common prefix (left),
 * longest common suffix (right), or only defined on equal strings (restrict). Zero is
 * the infinite string, one the empty string.
 */
public class StringSemiring extends Semiring<StringWeight> {
	private static final StringSemiring LEFT = new StringSemiring(StringType.LEFT);
	private static final StringSemiring RIGHT = new StringSemiring(StringType.RIGHT);
	private static final StringSemiring RESTRICT = new StringSemiring(StringType.RESTRICT);
	public static StringSemiring get(StringType type) {
		switch (type) {
		case LEFT: return LEFT;
		case RIGHT: return RIGHT;
		default: return RESTRICT;
		}
	}

	private final StringType type;
	private StringSemiring(StringType type) {
		this.type = type;
	}
	public StringType getType() { return type; }

	public StringWeight zero() { return StringWeight.INFINITY; }
	public StringWeight one() { return StringWeight.EPSILON; }

	public StringWeight plus(StringWeight a, StringWeight b) {
		if (a.isInfinity())
			return b;
		if (b.isInfinity())
			return a;
		switch (type) {
		case LEFT: {
			int n = 0;
			while (n < a.size() && n < b.size() && a.get(n) == b.get(n))
				n++;
			return a.subString(0, n);
		}
		case RIGHT: {
			int n = 0;
			while (n < a.size() && n < b.size() && a.get(a.size()-1-n) == b.get(b.size()-1-n))
				n++;
			return a.subString(a.size()-n, a.size());
		}
		default:
			if (!a.equals(b))
				throw new IncompatibleWeightsException("Unequal arguments to restricted string plus: "+a+" and "+b);
			return a;
		}
	}
	public StringWeight times(StringWeight a, StringWeight b) {
		return a.concat(b);
	}
	public StringWeight divide(StringWeight a, StringWeight b, DivideType dt) throws UnsupportedSemiringOperationException {
		if (type == StringType.LEFT && dt != DivideType.LEFT)
			throw new UnsupportedSemiringOperationException("Only left division is defined in the left string semiring");
		if (type == StringType.RIGHT && dt != DivideType.RIGHT)
			throw new UnsupportedSemiringOperationException("Only right division is defined in the right string semiring");
		if (dt == DivideType.ANY)
			throw new UnsupportedSemiringOperationException("Only explicit left or right division is defined in the restricted string semiring");
		if (b.isInfinity())
			throw new UnsupportedSemiringOperationException("Division by the infinite string");
		if (a.isInfinity())
			return a;
		int n = Math.min(b.size(), a.size());
		if (dt == DivideType.LEFT)
			return a.subString(n, a.size());
		return a.subString(0, a.size()-n);
	}
	public boolean isDivisible() { return true; }
	public int properties() {
		switch (type) {
		case LEFT: return LEFT_SEMIRING | IDEMPOTENT;
		case RIGHT: return RIGHT_SEMIRING | IDEMPOTENT;
		default: return SEMIRING | IDEMPOTENT;
		}
	}
	public Semiring<StringWeight> reverseSemiring() {
		if (type == StringType.LEFT)
			return RIGHT;
		if (type == StringType.RIGHT)
			return LEFT;
		return this;
	}
	public StringWeight reverse(StringWeight a) {
		return a.reverse();
	}
	public String getName() {
		switch (type) {
		case LEFT: return "left_string";
		case RIGHT: return "right_string";
		default: return "restricted_string";
		}
	}
	public String format(StringWeight a) {
		return a.toString();
	}
	public StringWeight parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equals("Infinity"))
			return StringWeight.INFINITY;
		if (t.equals("Epsilon") || t.length() == 0)
			return StringWeight.EPSILON;
		String[] parts = t.split("_");
		ArrayList<Integer> l = new ArrayList<Integer>();
		try {
			for (String p : parts)
				l.add(Integer.parseInt(p));
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Bad string weight: "+s, e);
		}
		int[] labels = new int[l.size()];
		for (int i = 0; i < labels.length; i++)
			labels[i] = l.get(i);
		return StringWeight.of(labels);
	}
}
