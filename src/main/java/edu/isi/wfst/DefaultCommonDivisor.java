package edu.isi.wfst;

// the sum; exact for the numeric semirings
public class DefaultCommonDivisor<W> implements CommonDivisor<W> {
	private final Semiring<W> semiring;
	public DefaultCommonDivisor(Semiring<W> semiring) {
		this.semiring = semiring;
	}
	public W commonDivisor(W a, W b) {
		return semiring.plus(a, b);
	}
}
