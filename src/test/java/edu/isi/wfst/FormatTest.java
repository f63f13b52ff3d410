package edu.isi.wfst;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class FormatTest {

	private static final double EPS = 1e-6;

	private static VectorFst<Double> sample() {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 2, 0.5, 1));
		fst.addTransition(1, tr(3, 3, 0.0, 2));
		fst.setFinal(2, 1.5);
		return fst;
	}

	private static String text(ExpandedFst<Double> fst, boolean acceptor) throws Exception {
		StringWriter w = new StringWriter();
		TextFormat.write(fst, w, acceptor);
		return w.toString();
	}

	private static VectorFst<Double> parse(String s, boolean acceptor) throws Exception {
		return TextFormat.read(new BufferedReader(new StringReader(s)), TropicalSemiring.get(), acceptor);
	}

	@Test
	public void testWriteText() throws Exception {
		assertEquals("0\t1\t1\t2\t0.5\n1\t2\t3\t3\n2\t1.5\n", text(sample(), false));
		VectorFst<Double> acc = Fsts.linearAcceptor(TropicalSemiring.get(), new int[] {4, 5}, Arrays.asList(0.0, 2.0));
		assertEquals("0\t1\t4\n1\t2\t5\t2\n2\n", text(acc, true));
	}

	@Test
	public void testTextRoundTrip() throws Exception {
		VectorFst<Double> back = parse(text(sample(), false), false);
		assertTrue(Isomorphic.isomorphic(sample(), back));
		assertEquals(0, back.start());
	}

	@Test
	public void testStartWrittenFirst() throws Exception {
		VectorFst<Double> fst = sample();
		fst.setStart(1);
		String s = text(fst, false);
		assertTrue(s.startsWith("1\t2\t3\t3\n"));
		VectorFst<Double> back = parse(s, false);
		assertEquals(1, back.start());
		assertEquals(3, back.numStates());
	}

	@Test
	public void testReadTextDetails() throws Exception {
		// blank lines and spaces are fine; a bare state is final with weight one
		VectorFst<Double> fst = parse("0 1 7\n\n1 2 8 3.25\n2\n1 0.5\n", true);
		assertEquals(3, fst.numStates());
		assertEquals(7, fst.transitions(0).get(0).getOLabel());
		assertEquals(3.25, fst.transitions(1).get(0).getWeight(), EPS);
		assertEquals(0.0, fst.finalWeight(2), EPS);
		assertEquals(0.5, fst.finalWeight(1), EPS);
		assertFalse(fst.isFinal(0));
		assertEquals(0, parse("", false).numStates());
	}

	@Test
	public void testReadTextErrorsNameTheLine() throws Exception {
		String[] bad = {"0 1 2 3\n0 1 x 3\n", "0 1 2 3\n0 1 2 3 4 5\n", "0 1 2 3\n-1 2 3 3\n", "0 1 2 3\n1 2 3 3 heavy\n"};
		for (String s : bad) {
			try {
				parse(s, false);
				fail("accepted "+s);
			}
			catch (DataFormatException e) {
				assertTrue(e.getMessage(), e.getMessage().startsWith("Line 2"));
			}
		}
	}

	@Test
	public void testTextWithSymbols() throws Exception {
		SymbolTable in = new SymbolTable("in");
		in.addSymbol("a");
		in.addSymbol("b");
		SymbolTable out = new SymbolTable("out");
		out.addSymbol("x");
		VectorFst<Double> fst = tropical();
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(2, 1, 0.0, 1));
		fst.addTransition(0, tr(1, 0, 0.0, 1));
		fst.setFinal(1, 0.0);
		fst.setInputSymbols(in);
		fst.setOutputSymbols(out);
		String s = text(fst, false);
		assertEquals("0\t1\tb\tx\n0\t1\ta\t<eps>\n1\n", s);
		VectorFst<Double> back = TextFormat.read(new BufferedReader(new StringReader(s)), TropicalSemiring.get(), false, in, out);
		assertTrue(Isomorphic.isomorphic(fst, back));
		assertEquals(in, back.getInputSymbols());
		try {
			TextFormat.read(new BufferedReader(new StringReader("0 1 c x\n")), TropicalSemiring.get(), false, in, out);
			fail("unknown symbol accepted");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().contains("c"));
		}
	}

	private static byte[] binary(ExpandedFst<Double> fst, boolean constLayout) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		BinaryFormat.write(fst, bytes, constLayout);
		return bytes.toByteArray();
	}

	@Test
	public void testBinaryRoundTrip() throws Exception {
		byte[] b = binary(sample(), false);
		assertTrue(BinaryFormat.isBinary(new BufferedInputStream(new ByteArrayInputStream(b))));
		ExpandedFst<Double> back = BinaryFormat.read(new ByteArrayInputStream(b));
		assertTrue(back instanceof VectorFst);
		assertEquals("tropical", back.getSemiring().getName());
		assertTrue(Isomorphic.isomorphic(sample(), back));
		// magic number first, little-endian
		assertEquals((byte)(BinaryFormat.MAGIC & 0xff), b[0]);
	}

	@Test
	public void testConstRoundTrip() throws Exception {
		VectorFst<Double> fst = sample();
		fst.addTransition(0, tr(0, 0, 0.25, 2));
		SymbolTable syms = new SymbolTable("labels");
		syms.addSymbol("one");
		syms.addSymbol("two");
		syms.addSymbol("three");
		fst.setInputSymbols(syms);
		ExpandedFst<Double> back = BinaryFormat.read(new ByteArrayInputStream(binary(fst, true)));
		assertTrue(back instanceof ConstFst);
		assertTrue(Isomorphic.isomorphic(fst, back));
		assertEquals(1, back.numInputEpsilons(0));
		assertEquals(syms, back.getInputSymbols());
		assertEquals("labels", back.getInputSymbols().getName());
		assertNull(back.getOutputSymbols());
	}

	@Test
	public void testLogArcType() throws Exception {
		VectorFst<Double> fst = new VectorFst<Double>(LogSemiring.get());
		Fsts.copy(sample(), fst);
		ExpandedFst<Double> back = BinaryFormat.read(new ByteArrayInputStream(binary(fst, false)));
		assertEquals("log", back.getSemiring().getName());
		assertSame(TropicalSemiring.get(), BinaryFormat.semiringForArcType("standard"));
	}

	@Test
	public void testNotBinary() throws Exception {
		assertFalse(BinaryFormat.isBinary(new BufferedInputStream(new ByteArrayInputStream("0 1 2 3\n".getBytes("UTF-8")))));
		assertFalse(BinaryFormat.isBinary(new BufferedInputStream(new ByteArrayInputStream(new byte[] {1, 2}))));
		try {
			BinaryFormat.read(new ByteArrayInputStream("0 1 2 3\n0\n".getBytes("UTF-8")));
			fail("text read as binary");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().contains("magic"));
		}
	}

	@Test(expected = DataFormatException.class)
	public void testTruncatedBinary() throws Exception {
		byte[] b = binary(sample(), false);
		BinaryFormat.read(new ByteArrayInputStream(Arrays.copyOf(b, b.length-6)));
	}

	@Test(expected = ConfigureException.class)
	public void testBooleanWeightsNotWritable() throws Exception {
		VectorFst<Boolean> fst = new VectorFst<Boolean>(BooleanSemiring.get());
		fst.addState();
		fst.setStart(0);
		BinaryFormat.write(fst, new ByteArrayOutputStream(), false);
	}

	@Test
	public void testSymbolTableText() throws Exception {
		SymbolTable t = new SymbolTable("words");
		t.addSymbol("the");
		t.addSymbol("cat", 17);
		StringWriter w = new StringWriter();
		t.writeText(w);
		assertEquals("<eps>\t0\nthe\t1\ncat\t17\n", w.toString());
		SymbolTable back = SymbolTable.readText(new BufferedReader(new StringReader(w.toString())), "words");
		assertEquals(t, back);
		assertEquals(18, back.getAvailableKey());
		assertEquals(18, back.addSymbol("dog"));
		try {
			SymbolTable.readText(new BufferedReader(new StringReader("a 1\nb 1\n")), "dup");
			fail("duplicate key accepted");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().startsWith("Line 2"));
		}
	}

	@Test
	public void testSymbolTableBinary() throws Exception {
		SymbolTable t = new SymbolTable("words");
		t.addSymbol("the");
		t.addSymbol("cat");
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		t.writeBinary(new DataOutputStream(bytes));
		SymbolTable back = SymbolTable.readBinary(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));
		assertEquals(t, back);
		assertEquals("words", back.getName());
		assertEquals(2, back.find("cat"));
		assertEquals("the", back.find(1));
	}
}
