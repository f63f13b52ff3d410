package edu.isi.wfst;

// a string of output labels paired with a weight. Used to turn a transducer into an
// acceptor whose weights remember the outputs
public class GallicWeight<W> extends ProductWeight<StringWeight, W> {
	public GallicWeight(StringWeight s, W w) {
		super(s, w);
	}
	public StringWeight getString() { return getValue1(); }
	public W getWeight() { return getValue2(); }
}
