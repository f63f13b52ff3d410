package edu.isi.wfst;

/**
 * State of a composition filter. Equal filter states must be equal() and hash alike,
 * since they are part of the composed state's identity. A blocked filter state means
 * the pairing of transitions that produced it must not be taken.
 */
public interface FilterState {
	public boolean isBlocked();
}
