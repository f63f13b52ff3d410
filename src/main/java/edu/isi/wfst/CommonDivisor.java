package edu.isi.wfst;

/**
 * Picks the weight a determinized transition carries: something that divides every
 * weight of the subset elements reached on that label, leaving them a residual.
 */
public interface CommonDivisor<W> {
	public W commonDivisor(W a, W b);
}
