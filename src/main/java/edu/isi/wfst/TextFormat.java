package edu.isi.wfst;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;

/**
 * The AT&amp;T text format. One record per line:
 * <pre>
 * src dst ilabel olabel [weight]     transition (acceptors: src dst label [weight])
 * state [weight]                     final state
 * </pre>
 * The source of the first line is the start state. A missing weight means one. Labels
 * are numbers, or symbols when a symbol table is given for that side.
 */
public class TextFormat {
	private TextFormat() {}

	public static <W> void write(ExpandedFst<W> fst, Writer w, boolean acceptor) throws IOException {
		write(fst, w, acceptor, fst.getInputSymbols(), fst.getOutputSymbols());
	}

	public static <W> void write(ExpandedFst<W> fst, Writer w, boolean acceptor, SymbolTable isyms, SymbolTable osyms) throws IOException {
		int start = fst.start();
		if (start == Transition.NO_STATE) {
			w.flush();
			return;
		}
		writeState(fst, start, w, acceptor, isyms, osyms);
		for (int s = 0; s < fst.numStates(); s++)
			if (s != start)
				writeState(fst, s, w, acceptor, isyms, osyms);
		w.flush();
	}

	private static <W> void writeState(ExpandedFst<W> fst, int s, Writer w, boolean acceptor, SymbolTable isyms, SymbolTable osyms) throws IOException {
		Semiring<W> sr = fst.getSemiring();
		for (Transition<W> t : fst.transitions(s)) {
			StringBuilder sb = new StringBuilder();
			sb.append(s).append('\t').append(t.getNextState()).append('\t').append(label(t.getILabel(), isyms));
			if (!acceptor)
				sb.append('\t').append(label(t.getOLabel(), osyms));
			if (!sr.isOne(t.getWeight()))
				sb.append('\t').append(sr.format(t.getWeight()));
			w.write(sb.append('\n').toString());
		}
		W f = fst.finalWeight(s);
		if (sr.isZero(f))
			return;
		if (sr.isOne(f))
			w.write(s+"\n");
		else
			w.write(s+"\t"+sr.format(f)+"\n");
	}

	private static String label(int l, SymbolTable syms) throws IOException {
		if (syms == null)
			return Integer.toString(l);
		String s = syms.find(l);
		if (s == null)
			throw new IOException("Label "+l+" missing from symbol table "+syms.getName());
		return s;
	}

	public static <W> VectorFst<W> read(BufferedReader br, Semiring<W> sr, boolean acceptor) throws IOException, DataFormatException {
		return read(br, sr, acceptor, null, null);
	}

	public static <W> VectorFst<W> read(BufferedReader br, Semiring<W> sr, boolean acceptor, SymbolTable isyms, SymbolTable osyms) throws IOException, DataFormatException {
		boolean debug = false;
		VectorFst<W> fst = new VectorFst<W>(sr);
		fst.setInputSymbols(isyms);
		fst.setOutputSymbols(acceptor ? isyms : osyms);
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			line = line.trim();
			if (line.length() == 0)
				continue;
			String[] f = line.split("\\s+");
			int arity = acceptor ? 3 : 4;
			if (f.length > arity+1 || (f.length > 2 && f.length < arity))
				throw new DataFormatException("Line "+lineno+": can't read \""+line+"\" as a transition or a final state");
			int src = state(f[0], lineno);
			ensure(fst, src);
			if (fst.start() == Transition.NO_STATE)
				fst.setStart(src);
			if (f.length <= 2) {
				W w = f.length == 2 ? weight(sr, f[1], lineno) : sr.one();
				fst.setFinal(src, w);
				continue;
			}
			int dst = state(f[1], lineno);
			ensure(fst, dst);
			int il = label(f[2], isyms, lineno);
			int ol = acceptor ? il : label(f[3], osyms, lineno);
			W w = f.length == arity+1 ? weight(sr, f[arity], lineno) : sr.one();
			fst.addTransition(src, new Transition<W>(il, ol, w, dst));
		}
		if (debug) Debug.debug(debug, "Read "+fst.numStates()+" states from "+lineno+" lines");
		return fst;
	}

	private static <W> void ensure(VectorFst<W> fst, int s) {
		if (s >= fst.numStates())
			fst.addStates(s+1-fst.numStates());
	}
	private static int state(String s, int lineno) throws DataFormatException {
		try {
			int n = Integer.parseInt(s);
			if (n < 0)
				throw new DataFormatException("Line "+lineno+": negative state "+n);
			return n;
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Line "+lineno+": bad state "+s, e);
		}
	}
	private static int label(String s, SymbolTable syms, int lineno) throws DataFormatException {
		if (syms != null) {
			int l = syms.find(s);
			if (l == -1)
				throw new DataFormatException("Line "+lineno+": symbol "+s+" not in table "+syms.getName());
			return l;
		}
		try {
			int l = Integer.parseInt(s);
			if (l < 0)
				throw new DataFormatException("Line "+lineno+": negative label "+l);
			return l;
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Line "+lineno+": bad label "+s, e);
		}
	}
	private static <W> W weight(Semiring<W> sr, String s, int lineno) throws DataFormatException {
		try {
			return sr.parse(s);
		}
		catch (DataFormatException e) {
			throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
		}
	}
}
