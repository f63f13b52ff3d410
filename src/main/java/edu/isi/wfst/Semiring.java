package edu.isi.wfst;

import java.io.Serializable;
import java.util.Comparator;

/**
 * The weight algebra. Weights themselves are plain immutable values (a Double, a
 * StringWeight, ...); a Semiring object knows how to combine them. Every automaton
 * carries the semiring its weights belong to.
 *
 * Division and closure are optional: semirings that support them override
 * {@link #divide} and {@link #closure} and report it through {@link #isDivisible()}
 * and {@link #hasClosure()}, so algorithms can refuse up front.
 */
public abstract class Semiring<W> implements Serializable {
	/** default quantization delta, 1/1024 */
	public static final float KDELTA = 1.0f/1024.0f;

	// property bits
	public static final int LEFT_SEMIRING = 1;
	public static final int RIGHT_SEMIRING = 2;
	public static final int SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;
	public static final int COMMUTATIVE = 4;
	public static final int IDEMPOTENT = 8;
	public static final int PATH = 16;

	public abstract W zero();
	public abstract W one();
	public abstract W plus(W a, W b);
	public abstract W times(W a, W b);
	/** bitwise or of the property constants above */
	public abstract int properties();
	/** short name, used in file headers and the cli */
	public abstract String getName();
	/** text form of a weight */
	public abstract String format(W a);
	/** inverse of {@link #format} */
	public abstract W parse(String s) throws DataFormatException;

	/** a / b, from the side named by type */
	public W divide(W a, W b, DivideType type) throws UnsupportedSemiringOperationException {
		throw new UnsupportedSemiringOperationException("Division is not defined in the "+getName()+" semiring");
	}
	public boolean isDivisible() { return false; }

	/** one + a + a^2 + ... */
	public W closure(W a) throws UnsupportedSemiringOperationException {
		throw new UnsupportedSemiringOperationException("Closure is not defined in the "+getName()+" semiring");
	}
	public boolean hasClosure() { return false; }

	/** round to a canonical bucket so weights can be hashed. Identity unless overridden */
	public W quantize(W a, float delta) {
		return a;
	}

	public boolean equal(W a, W b) {
		return a.equals(b);
	}
	public boolean approxEqual(W a, W b, float delta) {
		return equal(a, b);
	}
	public boolean isZero(W a) {
		return equal(a, zero());
	}
	public boolean isOne(W a) {
		return equal(a, one());
	}
	/** false for weights that are not members of the semiring (NaN and friends) */
	public boolean isMember(W a) {
		return a != null;
	}

	/** a < b in the natural order: a + b == a and a != b. Only meaningful for idempotent semirings */
	public boolean naturalLess(W a, W b) {
		return !equal(a, b) && equal(plus(a, b), a);
	}

	public boolean hasProperties(int props) {
		return (properties() & props) == props;
	}

	/** the semiring weights live in after Reverse. Commutative semirings are their own reverse */
	public Semiring<W> reverseSemiring() {
		return this;
	}
	/** maps a weight into {@link #reverseSemiring()} */
	public W reverse(W a) {
		return a;
	}

	/** ascending natural order, lesser (better) weights first */
	public Comparator<W> naturalOrder() {
		return new Comparator<W>() {
			public int compare(W a, W b) {
				if (naturalLess(a, b))
					return -1;
				if (naturalLess(b, a))
					return 1;
				return 0;
			}
		};
	}

	public String toString() {
		return getName();
	}
}
