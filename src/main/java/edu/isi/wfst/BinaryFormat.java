package edu.isi.wfst;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;

/**
 * OpenFst's binary layout for the "vector" and "const" automaton types, little-endian.
 * Weights are stored as 32-bit floats, so only the float semirings (tropical, log,
 * probability) can be written.
 */
public class BinaryFormat {
	private BinaryFormat() {}

	public static final int MAGIC = 2125659606;
	public static final int VECTOR_VERSION = 2;
	public static final int CONST_VERSION = 2;
	static final int HAS_ISYMBOLS = 1;
	static final int HAS_OSYMBOLS = 2;
	// expanded and mutable bits of the properties word
	static final long EXPANDED = 0x1L;
	static final long MUTABLE = 0x2L;

	public static final String VECTOR = "vector";
	public static final String CONST = "const";

	/** a float semiring from an arc type name */
	public static FloatSemiring semiringForArcType(String arcType) throws ConfigureException {
		if (arcType.equals("standard") || arcType.equals("tropical"))
			return TropicalSemiring.get();
		if (arcType.equals("log"))
			return LogSemiring.get();
		if (arcType.equals("probability"))
			return ProbabilitySemiring.get();
		throw new ConfigureException("No float semiring for arc type "+arcType);
	}

	private static FloatSemiring floatSemiring(ExpandedFst<?> fst) throws ConfigureException {
		if (!(fst.getSemiring() instanceof FloatSemiring))
			throw new ConfigureException("Only tropical, log and probability weights can be written in binary, not "+fst.getSemiring());
		return (FloatSemiring)fst.getSemiring();
	}

	/** writes in the vector layout, or the const layout when constLayout is set */
	public static <W> void write(ExpandedFst<W> fst, OutputStream os, boolean constLayout) throws IOException, ConfigureException {
		FloatSemiring sr = floatSemiring(fst);
		DataOutputStream out = new DataOutputStream(os);
		int flags = 0;
		if (fst.getInputSymbols() != null)
			flags |= HAS_ISYMBOLS;
		if (fst.getOutputSymbols() != null)
			flags |= HAS_OSYMBOLS;
		long narcs = Fsts.numTransitions(fst);
		LittleEndian.writeInt(out, MAGIC);
		LittleEndian.writeString(out, constLayout ? CONST : VECTOR);
		LittleEndian.writeString(out, sr.getArcType());
		LittleEndian.writeInt(out, constLayout ? CONST_VERSION : VECTOR_VERSION);
		LittleEndian.writeInt(out, flags);
		LittleEndian.writeLong(out, constLayout ? EXPANDED : EXPANDED | MUTABLE);
		LittleEndian.writeLong(out, fst.start());
		LittleEndian.writeLong(out, fst.numStates());
		LittleEndian.writeLong(out, narcs);
		if (fst.getInputSymbols() != null)
			fst.getInputSymbols().writeBinary(out);
		if (fst.getOutputSymbols() != null)
			fst.getOutputSymbols().writeBinary(out);
		if (constLayout) {
			int pos = 0;
			for (int s = 0; s < fst.numStates(); s++) {
				LittleEndian.writeFloat(out, toFloat(fst.finalWeight(s)));
				LittleEndian.writeInt(out, pos);
				LittleEndian.writeInt(out, fst.numTransitions(s));
				LittleEndian.writeInt(out, fst.numInputEpsilons(s));
				LittleEndian.writeInt(out, fst.numOutputEpsilons(s));
				pos += fst.numTransitions(s);
			}
			for (int s = 0; s < fst.numStates(); s++)
				for (Transition<W> t : fst.transitions(s))
					writeTransition(out, t);
		}
		else {
			for (int s = 0; s < fst.numStates(); s++) {
				LittleEndian.writeFloat(out, toFloat(fst.finalWeight(s)));
				LittleEndian.writeLong(out, fst.numTransitions(s));
				for (Transition<W> t : fst.transitions(s))
					writeTransition(out, t);
			}
		}
		out.flush();
	}

	// float semirings hold their weights as Double
	private static float toFloat(Object w) {
		return ((Double)w).floatValue();
	}

	private static <W> void writeTransition(DataOutputStream out, Transition<W> t) throws IOException {
		LittleEndian.writeInt(out, t.getILabel());
		LittleEndian.writeInt(out, t.getOLabel());
		LittleEndian.writeFloat(out, toFloat(t.getWeight()));
		LittleEndian.writeInt(out, t.getNextState());
	}

	// counts bytes so errors can say where they happened
	private static class CountingInputStream extends FilterInputStream {
		long count = 0;
		CountingInputStream(InputStream in) {
			super(in);
		}
		public int read() throws IOException {
			int b = super.read();
			if (b >= 0)
				count++;
			return b;
		}
		public int read(byte[] b, int off, int len) throws IOException {
			int n = super.read(b, off, len);
			if (n > 0)
				count += n;
			return n;
		}
		public long skip(long n) throws IOException {
			long k = super.skip(n);
			count += k;
			return k;
		}
	}

	/** true if the stream starts with the automaton magic number; the stream must support mark */
	public static boolean isBinary(BufferedInputStream in) throws IOException {
		in.mark(4);
		byte[] b = new byte[4];
		int n = 0;
		while (n < 4) {
			int k = in.read(b, n, 4-n);
			if (k < 0)
				break;
			n += k;
		}
		in.reset();
		if (n < 4)
			return false;
		int magic = (b[0] & 0xff) | (b[1] & 0xff) << 8 | (b[2] & 0xff) << 16 | (b[3] & 0xff) << 24;
		return magic == MAGIC;
	}

	/**
	 * Reads either layout. Vector files come back as a {@link VectorFst}, const files as a
	 * {@link ConstFst}; the semiring follows the arc type in the header.
	 */
	public static ExpandedFst<Double> read(InputStream is) throws IOException, DataFormatException, ConfigureException {
		CountingInputStream counter = new CountingInputStream(is);
		DataInputStream in = new DataInputStream(counter);
		try {
			return read(in, counter);
		}
		catch (EOFException e) {
			throw new DataFormatException("File ends early, at byte "+counter.count, e);
		}
	}

	private static ExpandedFst<Double> read(DataInputStream in, CountingInputStream counter) throws IOException, DataFormatException, ConfigureException {
		int magic = LittleEndian.readInt(in);
		if (magic != MAGIC)
			throw new DataFormatException("Bad magic number "+magic+"; not a binary automaton");
		String type = LittleEndian.readString(in);
		String arcType = LittleEndian.readString(in);
		int version = LittleEndian.readInt(in);
		int flags = LittleEndian.readInt(in);
		LittleEndian.readLong(in);
		long start = LittleEndian.readLong(in);
		long numStates = LittleEndian.readLong(in);
		long numArcs = LittleEndian.readLong(in);
		if (numStates < 0 || numStates > Integer.MAX_VALUE || numArcs < 0 || numArcs > Integer.MAX_VALUE)
			throw new DataFormatException("Unusable sizes in header: "+numStates+" states, "+numArcs+" transitions");
		if (start < -1 || start >= numStates)
			throw new DataFormatException("Start state "+start+" out of range for "+numStates+" states");
		FloatSemiring sr = semiringForArcType(arcType);
		SymbolTable isyms = (flags & HAS_ISYMBOLS) != 0 ? SymbolTable.readBinary(in) : null;
		SymbolTable osyms = (flags & HAS_OSYMBOLS) != 0 ? SymbolTable.readBinary(in) : null;
		int n = (int)numStates;
		if (type.equals(VECTOR)) {
			if (version != VECTOR_VERSION)
				throw new DataFormatException("Unsupported vector version "+version);
			VectorFst<Double> fst = new VectorFst<Double>(sr);
			fst.addStates(n);
			if (start >= 0)
				fst.setStart((int)start);
			fst.setInputSymbols(isyms);
			fst.setOutputSymbols(osyms);
			for (int s = 0; s < n; s++) {
				fst.setFinal(s, (double)LittleEndian.readFloat(in));
				long k = LittleEndian.readLong(in);
				if (k < 0 || k > numArcs)
					throw new DataFormatException("State "+s+" claims "+k+" transitions, at byte "+counter.count);
				ArrayList<Transition<Double>> trs = new ArrayList<Transition<Double>>((int)k);
				for (long i = 0; i < k; i++)
					trs.add(readTransition(in, n, counter));
				fst.setTransitions(s, trs);
			}
			return fst;
		}
		if (type.equals(CONST)) {
			if (version != CONST_VERSION)
				throw new DataFormatException("Unsupported const version "+version);
			ArrayList<Double> finals = new ArrayList<Double>(n);
			int[] pos = new int[n];
			int[] ntrs = new int[n];
			int[] niepsilons = new int[n];
			int[] noepsilons = new int[n];
			for (int s = 0; s < n; s++) {
				finals.add((double)LittleEndian.readFloat(in));
				pos[s] = LittleEndian.readInt(in);
				ntrs[s] = LittleEndian.readInt(in);
				niepsilons[s] = LittleEndian.readInt(in);
				noepsilons[s] = LittleEndian.readInt(in);
				if (pos[s] < 0 || ntrs[s] < 0 || (long)pos[s]+ntrs[s] > numArcs)
					throw new DataFormatException("State "+s+" has transitions outside the table, at byte "+counter.count);
			}
			ArrayList<Transition<Double>> all = new ArrayList<Transition<Double>>((int)numArcs);
			for (long i = 0; i < numArcs; i++)
				all.add(readTransition(in, n, counter));
			return new ConstFst<Double>(sr, (int)start, finals, pos, ntrs, niepsilons, noepsilons, all, isyms, osyms);
		}
		throw new DataFormatException("Unknown automaton type "+type);
	}

	private static Transition<Double> readTransition(DataInputStream in, int numStates, CountingInputStream counter) throws IOException, DataFormatException {
		int il = LittleEndian.readInt(in);
		int ol = LittleEndian.readInt(in);
		double w = LittleEndian.readFloat(in);
		int next = LittleEndian.readInt(in);
		if (il < 0 || ol < 0)
			throw new DataFormatException("Negative label at byte "+counter.count);
		if (next < 0 || next >= numStates)
			throw new DataFormatException("Transition to missing state "+next+" at byte "+counter.count);
		return new Transition<Double>(il, ol, w, next);
	}
}
