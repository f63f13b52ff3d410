package edu.isi.wfst;

import java.util.TreeMap;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class OptimizeTest {

	private static final double EPS = 1e-6;

	@Test
	public void testAcyclicAcceptor() throws Exception {
		// 1 2 through two middles, 1 3 through one of them
		VectorFst<Double> fst = tropical();
		fst.addStates(5);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 1.0, 1));
		fst.addTransition(0, tr(1, 1, 2.0, 2));
		fst.addTransition(1, tr(2, 2, 0.0, 3));
		fst.addTransition(2, tr(2, 2, 0.0, 4));
		fst.addTransition(2, tr(3, 3, 1.0, 4));
		fst.setFinal(3, 0.0);
		fst.setFinal(4, 0.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Optimize.optimize(fst);
		assertTrue(Fsts.isDeterministic(fst));
		assertEquals(3, fst.numStates());
		assertSameRelation(orig, fst);
		TreeMap<String, Double> m = pathMap(fst);
		assertEquals(1.0, m.get("[1, 2]:[1, 2]"), EPS);
		assertEquals(3.0, m.get("[1, 3]:[1, 3]"), EPS);
	}

	@Test
	public void testTransducerDeterminizedOnLabelPairs() throws Exception {
		// 1:5 then 2:6 or 3:7, spelled out twice
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 5, 0.0, 1));
		fst.addTransition(0, tr(1, 5, 0.0, 2));
		fst.addTransition(1, tr(2, 6, 0.0, 3));
		fst.addTransition(2, tr(3, 7, 0.0, 3));
		fst.setFinal(3, 0.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Optimize.optimize(fst);
		assertEquals(3, fst.numStates());
		assertTrue(Fsts.isDeterministic(fst));
		assertFalse(Fsts.isAcceptor(fst));
		assertSameRelation(orig, fst);
	}

	@Test
	public void testRemovesEpsilons() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(0, 0, 0.5, 1));
		fst.addTransition(1, tr(1, 1, 1.0, 2));
		fst.setFinal(2, 0.0);
		Optimize.optimize(fst);
		assertTrue(Fsts.isEpsilonFree(fst));
		TreeMap<String, Double> m = pathMap(fst);
		assertEquals(1, m.size());
		assertEquals(1.5, m.get("[1]:[1]"), EPS);
	}

	@Test
	public void testDeterministicInputIsOnlyMinimized() throws Exception {
		// a diamond whose two halves agree
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.addTransition(0, tr(2, 2, 0.0, 2));
		fst.addTransition(1, tr(3, 3, 0.0, 3));
		fst.addTransition(2, tr(3, 3, 0.0, 3));
		fst.setFinal(3, 0.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Optimize.optimize(fst);
		assertEquals(3, fst.numStates());
		assertSameRelation(orig, fst);
	}

	@Test
	public void testCyclicLogInputNotDeterminized() throws Exception {
		// determinizing this in the log semiring would not terminate
		VectorFst<Double> fst = new VectorFst<Double>(LogSemiring.get());
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 1.0, 0));
		fst.addTransition(0, tr(1, 1, 2.0, 1));
		fst.setFinal(1, 0.0);
		Optimize.optimize(fst);
		assertEquals(2, fst.numStates());
		assertEquals(2, fst.numTransitions(0));
		assertFalse(Fsts.isDeterministic(fst));
	}

	@Test
	public void testEmpty() throws Exception {
		VectorFst<Double> fst = tropical();
		Optimize.optimize(fst);
		assertEquals(0, fst.numStates());
	}
}
