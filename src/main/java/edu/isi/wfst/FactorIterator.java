package edu.isi.wfst;

import java.util.List;

/**
 * Splits weights that are too big for one transition. done(w) says w needs no
 * splitting; factors(w) lists the ways to peel something off w, each becoming a
 * separate transition, and is empty when done(w).
 */
public interface FactorIterator<W> {
	public boolean done(W w);
	public List<Factor<W>> factors(W w);
}
