package edu.isi.wfst;

// w = head * rest
public final class Factor<W> {
	private final W head;
	private final W rest;
	public Factor(W head, W rest) {
		this.head = head;
		this.rest = rest;
	}
	public W getHead() { return head; }
	public W getRest() { return rest; }
	public String toString() { return "("+head+", "+rest+")"; }
}
