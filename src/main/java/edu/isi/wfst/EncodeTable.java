package edu.isi.wfst;

/**
 * Remembers which (input label, output label, weight) triple each encoded label stands
 * for. Encoded labels start at 1 so that no encoded transition is an epsilon. The same
 * table must be handed to {@link Encode#decode}.
 */
public class EncodeTable<W> {
	public static final int ENCODE_LABELS = 1;
	public static final int ENCODE_WEIGHTS = 2;

	static final class Tuple<W> {
		final int ilabel;
		final int olabel;
		final W weight;
		Tuple(int ilabel, int olabel, W weight) {
			this.ilabel = ilabel;
			this.olabel = olabel;
			this.weight = weight;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Tuple))
				return false;
			Tuple<?> t = (Tuple<?>)o;
			return ilabel == t.ilabel && olabel == t.olabel && weight.equals(t.weight);
		}
		public int hashCode() {
			return (ilabel*7853 + olabel)*31 + weight.hashCode();
		}
	}

	private final int flags;
	private final StateTable<Tuple<W>> table = new StateTable<Tuple<W>>();
	// symbol tables of the automaton before encoding
	private SymbolTable isyms;
	private SymbolTable osyms;

	public EncodeTable(int flags) {
		if ((flags & (ENCODE_LABELS | ENCODE_WEIGHTS)) == 0)
			throw new IllegalArgumentException("Encode table needs ENCODE_LABELS, ENCODE_WEIGHTS or both");
		this.flags = flags;
	}
	public int getFlags() { return flags; }
	public boolean isEncodeLabels() { return (flags & ENCODE_LABELS) != 0; }
	public boolean isEncodeWeights() { return (flags & ENCODE_WEIGHTS) != 0; }
	public int size() { return table.size(); }

	int encode(int ilabel, int olabel, W weight) {
		return table.findId(new Tuple<W>(ilabel, olabel, weight))+1;
	}
	Tuple<W> decode(int label) throws MalformedFstException {
		if (label < 1 || label > table.size())
			throw new MalformedFstException("Label "+label+" is not in the encoding table ("+table.size()+" entries)");
		return table.findTuple(label-1);
	}

	void setSymbols(SymbolTable isyms, SymbolTable osyms) {
		this.isyms = isyms;
		this.osyms = osyms;
	}
	SymbolTable getInputSymbols() { return isyms; }
	SymbolTable getOutputSymbols() { return osyms; }
}
