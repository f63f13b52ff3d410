package edu.isi.wfst;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.TreeMap;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class WfstTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File textFile(String name, String contents) throws Exception {
		File f = folder.newFile(name);
		Writer w = new OutputStreamWriter(new FileOutputStream(f), "utf-8");
		w.write(contents);
		w.close();
		return f;
	}

	private static JSAPResult parse(String... argv) throws Exception {
		return Wfst.processParameters(new JSAP(), argv);
	}

	@Test
	public void testParameters() throws Exception {
		JSAPResult config = parse("--nshortest", "3", "-m", "log", "shortestpath", "in.fst", "out.fst");
		assertTrue(config.success());
		assertEquals(3, config.getInt("nshortest"));
		assertEquals("log", config.getString("semiring"));
		assertEquals("text", config.getString("format"));
		assertEquals(2, config.getFileArray("files").length);
		assertEquals(Wfst.CMD.SHORTESTPATH, Wfst.CMD.get(config.getString("command")));
	}

	@Test(expected = ConfigureException.class)
	public void testWrongFileCount() throws Exception {
		parse("compose", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testUnknownCommand() throws Exception {
		parse("frobnicate", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testNonPositiveNShortest() throws Exception {
		parse("--nshortest", "0", "shortestpath", "a.fst");
	}

	@Test
	public void testComposeFromFiles() throws Exception {
		// neither side sorted on the shared labels; the command sorts the second
		File a = textFile("a.txt", "0 1 1 11 0.5\n0 1 2 10\n1 0.25\n");
		File b = textFile("b.txt", "0 1 11 21\n0 1 10 20 1\n1\n");
		JSAPResult config = parse("compose", a.getPath(), b.getPath());
		ArrayList<VectorFst<Double>> in = new ArrayList<VectorFst<Double>>();
		in.add(Wfst.readFst(a, TropicalSemiring.get(), false, "utf-8"));
		in.add(Wfst.readFst(b, TropicalSemiring.get(), false, "utf-8"));
		VectorFst<Double> out = Wfst.run(Wfst.CMD.COMPOSE, in, config);
		TreeMap<String, Double> m = pathMap(out);
		assertEquals(2, m.size());
		assertEquals(0.75, m.get("[1]:[21]"), 1e-6);
		assertEquals(1.25, m.get("[2]:[20]"), 1e-6);
		assertTrue(Fsts.isSorted(in.get(1), false));
	}

	@Test
	public void testTopSortCommandWarnsOnCycle() throws Exception {
		File a = textFile("a.txt", "0 1 1 1\n1 0 2 2\n1\n");
		JSAPResult config = parse("topsort", a.getPath());
		ArrayList<VectorFst<Double>> in = new ArrayList<VectorFst<Double>>();
		in.add(Wfst.readFst(a, TropicalSemiring.get(), false, "utf-8"));
		VectorFst<Double> orig = new VectorFst<Double>(in.get(0));
		// prints a warning and hands the automaton back as it was
		VectorFst<Double> out = Wfst.run(Wfst.CMD.TOPSORT, in, config);
		assertEquals(orig.start(), out.start());
		assertEquals(0, out.transitions(1).get(0).getNextState());
		assertTrue(Isomorphic.isomorphic(orig, out));
	}

	@Test
	public void testOptimizeCommand() throws Exception {
		File a = textFile("a.txt", "0 1 1 1 1\n0 2 1 1 2\n1 3 2 2\n2 3 3 3 1\n3\n");
		JSAPResult config = parse("optimize", a.getPath());
		assertEquals(Wfst.CMD.OPTIMIZE, Wfst.CMD.get(config.getString("command")));
		ArrayList<VectorFst<Double>> in = new ArrayList<VectorFst<Double>>();
		in.add(Wfst.readFst(a, TropicalSemiring.get(), false, "utf-8"));
		VectorFst<Double> out = Wfst.run(Wfst.CMD.OPTIMIZE, in, config);
		assertTrue(Fsts.isDeterministic(out));
		TreeMap<String, Double> m = pathMap(out);
		assertEquals(2, m.size());
		assertEquals(1.0, m.get("[1, 2]:[1, 2]"), 1e-6);
		assertEquals(3.0, m.get("[1, 3]:[1, 3]"), 1e-6);
	}

	@Test
	public void testBinaryOutputReadsBack() throws Exception {
		File a = textFile("a.txt", "0 1 1 1 0.5\n0 1 2 2 1.5\n1\n");
		JSAPResult config = parse("-f", "const", "shortestpath", a.getPath());
		ArrayList<VectorFst<Double>> in = new ArrayList<VectorFst<Double>>();
		in.add(Wfst.readFst(a, TropicalSemiring.get(), false, "utf-8"));
		VectorFst<Double> best = Wfst.run(Wfst.CMD.SHORTESTPATH, in, config);
		File out = folder.newFile("best.fst");
		FileOutputStream os = new FileOutputStream(out);
		Wfst.writeFst(best, os, config.getString("format"), false, "utf-8");
		os.close();
		VectorFst<Double> back = Wfst.readFst(out, LogSemiring.get(), false, "utf-8");
		// binary input keeps its own semiring
		assertEquals("tropical", back.getSemiring().getName());
		assertEquals(0.5, pathMap(back).get("[1]:[1]"), 1e-6);
	}

	@Test
	public void testTextOutput() throws Exception {
		VectorFst<Double> fst = Fsts.linearAcceptor(TropicalSemiring.get(), 3, 4);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Wfst.writeFst(fst, bytes, "text", true, "utf-8");
		assertEquals("0\t1\t3\n1\t2\t4\n2\n", bytes.toString("utf-8"));
	}

	@Test
	public void testSyntaxErrorNamesFile() throws Exception {
		File a = textFile("broken.txt", "0 1 1 1\n0 x\n");
		try {
			Wfst.readFst(a, TropicalSemiring.get(), false, "utf-8");
			fail("bad final weight accepted");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().startsWith("broken.txt: Line 2"));
		}
	}

	@Test
	public void testInfo() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 2, 0.0, 1));
		fst.addTransition(1, tr(0, 0, 0.0, 0));
		fst.setFinal(1, 0.0);
		String info = Wfst.info(fst);
		assertTrue(info.contains("states\t2\n"));
		assertTrue(info.contains("transitions\t2\n"));
		assertTrue(info.contains("strongly connected components\t1\n"));
		assertTrue(info.contains("acceptor\tfalse\n"));
		assertTrue(info.contains("epsilon-free\tfalse\n"));
		assertTrue(info.contains("acyclic\tfalse\n"));
	}

	@Test
	public void testMessageChainsCauses() throws Exception {
		Exception e = new ConfigureException("outer", new DataFormatException("inner"));
		assertEquals("outer: inner", Wfst.message(e));
		assertEquals("same", Wfst.message(new FstException("same", new FstException("same"))));
	}
}
