package edu.isi.wfst;

import java.util.Arrays;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class MinimizeTest {

	// 0 -1-> 1 -2-> 3, 0 -3-> 2 -2-> 3; states 1 and 2 have the same future
	private static VectorFst<Double> diamond(double w1, double w2) {
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.addTransition(0, tr(3, 3, 0.0, 2));
		fst.addTransition(1, tr(2, 2, w1, 3));
		fst.addTransition(2, tr(2, 2, w2, 3));
		fst.setFinal(3, 0.0);
		return fst;
	}

	@Test
	public void testUnweightedMerge() throws Exception {
		VectorFst<Double> fst = diamond(0.0, 0.0);
		Minimize.minimize(fst);
		assertEquals(3, fst.numStates());
		assertEquals(3, fst.numTransitions());
		assertSameRelation(diamond(0.0, 0.0), fst);
	}

	@Test
	public void testWeightedMergeAfterPush() throws Exception {
		VectorFst<Double> fst = diamond(1.0, 2.0);
		Minimize.minimize(fst);
		assertEquals(3, fst.numStates());
		assertSameRelation(diamond(1.0, 2.0), fst);
	}

	@Test
	public void testDistinctFuturesStay() throws Exception {
		VectorFst<Double> fst = diamond(0.0, 0.0);
		fst.setTransition(2, 0, tr(4, 4, 0.0, 3));
		Minimize.minimize(fst);
		assertEquals(4, fst.numStates());
	}

	@Test
	public void testTransducer() throws Exception {
		// 1:5 2:6 and 3:7 2:6 share their tail
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 5, 0.0, 1));
		fst.addTransition(0, tr(3, 7, 0.0, 2));
		fst.addTransition(1, tr(2, 6, 1.0, 3));
		fst.addTransition(2, tr(2, 6, 1.0, 3));
		fst.setFinal(3, 0.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Minimize.minimize(fst);
		assertSameRelation(orig, fst);
	}

	@Test
	public void testNonDeterministicRejected() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.addTransition(0, tr(1, 1, 0.0, 2));
		fst.setFinal(1, 0.0);
		fst.setFinal(2, 0.0);
		try {
			Minimize.minimize(fst);
			fail("non-deterministic input accepted");
		}
		catch (ConfigureException e) {
			assertTrue(e.getMessage().contains("deterministic"));
		}
		Minimize.minimize(fst, Semiring.KDELTA, true);
		assertEquals(2, fst.numStates());
		assertEquals(1, fst.numTransitions(fst.start()));
	}

	@Test(expected = ConfigureException.class)
	public void testNonDeterministicNeedsIdempotent() throws Exception {
		VectorFst<Double> fst = new VectorFst<Double>(LogSemiring.get());
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.setFinal(1, 0.0);
		Minimize.minimize(fst, Semiring.KDELTA, true);
	}

	@Test
	public void testEncodeDecode() throws Exception {
		VectorFst<Double> fst = Fsts.linearTransducer(TropicalSemiring.get(), new int[] {1, 2, 1}, new int[] {5, 6, 5}, Arrays.asList(1.0, 2.0, 1.0));
		fst.setFinal(3, 0.5);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		EncodeTable<Double> table = new EncodeTable<Double>(EncodeTable.ENCODE_LABELS | EncodeTable.ENCODE_WEIGHTS);
		Encode.encode(fst, table);
		assertTrue(Fsts.isAcceptor(fst));
		// two distinct transitions plus the final weight
		assertEquals(3, table.size());
		assertEquals(5, fst.numStates());
		for (int s = 0; s < fst.numStates(); s++) {
			if (fst.isFinal(s))
				assertEquals(0.0, fst.finalWeight(s), 1e-6);
			for (Transition<Double> t : fst.transitions(s))
				assertEquals(0.0, t.getWeight(), 1e-6);
		}
		assertEquals(fst.transitions(0).get(0).getILabel(), fst.transitions(2).get(0).getILabel());
		Encode.decode(fst, table);
		assertTrue(Isomorphic.isomorphic(orig, fst));
	}

	@Test
	public void testEncodeLabelsOnly() throws Exception {
		VectorFst<Double> fst = Fsts.linearTransducer(TropicalSemiring.get(), new int[] {1, 2}, new int[] {5, 6}, Arrays.asList(1.0, 2.0));
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		EncodeTable<Double> table = new EncodeTable<Double>(EncodeTable.ENCODE_LABELS);
		Encode.encode(fst, table);
		assertEquals(2, table.size());
		assertEquals(3, fst.numStates());
		assertEquals(2.0, fst.transitions(1).get(0).getWeight(), 1e-6);
		Encode.decode(fst, table);
		assertTrue(Isomorphic.isomorphic(orig, fst));
	}

	@Test(expected = MalformedFstException.class)
	public void testDecodeUnknownLabel() throws Exception {
		VectorFst<Double> fst = linearAcceptor(7);
		Encode.decode(fst, new EncodeTable<Double>(EncodeTable.ENCODE_LABELS));
	}

	private static VectorFst<Double> linearAcceptor(int... labels) {
		return Fsts.linearAcceptor(TropicalSemiring.get(), labels);
	}

	@Test
	public void testPartitionRefine() throws Exception {
		Partition p = new Partition(4);
		assertEquals(1, p.numClasses());
		assertTrue(p.refine(new Object[] {"a", "b", "a", "b"}));
		assertEquals(2, p.numClasses());
		assertEquals(p.classOf(0), p.classOf(2));
		assertTrue(p.classOf(0) != p.classOf(1));
		// same keys again: nothing splits
		assertFalse(p.refine(new Object[] {"a", "b", "a", "b"}));
		// keys only split within existing classes
		assertTrue(p.refine(new Object[] {"x", "x", "y", "x"}));
		assertEquals(3, p.numClasses());
		assertEquals(p.classOf(1), p.classOf(3));
		assertEquals(0, new Partition(0).numClasses());
	}
}
