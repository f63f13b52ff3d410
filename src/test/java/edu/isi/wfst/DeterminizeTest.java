package edu.isi.wfst;

import java.util.List;
import java.util.TreeMap;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class DeterminizeTest {

	private static final double EPS = 1e-6;

	@Test
	public void testMergesTransitionsOnSameLabel() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(2, 2, 1.0, 1));
		fst.addTransition(0, tr(2, 2, 3.0, 2));
		fst.setFinal(1, 0.0);
		fst.setFinal(2, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertEquals(2, det.numStates());
		assertTrue(Fsts.isDeterministic(det));
		assertEquals(1, det.numTransitions(det.start()));
		Transition<Double> t = det.transitions(det.start()).get(0);
		assertEquals(1.0, t.getWeight(), EPS);
		assertEquals(0.0, det.finalWeight(t.getNextState()), EPS);
	}

	@Test
	public void testKeepsBestWeightPerString() throws Exception {
		// a b / 1 and a b / 2 through different middles, a c / 5
		VectorFst<Double> fst = tropical();
		fst.addStates(5);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 0.0, 1));
		fst.addTransition(0, tr(1, 1, 1.0, 2));
		fst.addTransition(1, tr(2, 2, 1.0, 3));
		fst.addTransition(2, tr(2, 2, 1.0, 4));
		fst.addTransition(2, tr(3, 3, 4.0, 4));
		fst.setFinal(3, 0.0);
		fst.setFinal(4, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertTrue(Fsts.isDeterministic(det));
		TreeMap<String, Double> m = pathMap(det);
		assertEquals(2, m.size());
		assertEquals(1.0, m.get("[1, 2]:[1, 2]"), EPS);
		assertEquals(5.0, m.get("[1, 3]:[1, 3]"), EPS);
		assertEquals(2, Paths.paths(det).size());
	}

	@Test
	public void testLazyDeterminizationExpandsOnDemand() throws Exception {
		VectorFst<Double> fst = Fsts.linearAcceptor(TropicalSemiring.get(), 1, 2, 3);
		LazyFst<Double> lazy = Determinize.lazy(fst, new DeterminizeConfig());
		lazy.transitions(lazy.start());
		assertEquals(1, lazy.getCache().numCachedStates());
		assertTrue(Isomorphic.isomorphic(fst, lazy.expand()));
	}

	@Test
	public void testFunctionalTransducer() throws Exception {
		// 1 2 -> 10 / 1 and 1 3 -> 10 / 3: the output is known after the first symbol
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 1.0, 1));
		fst.addTransition(0, tr(1, 0, 3.0, 2));
		fst.addTransition(1, tr(2, 0, 0.0, 3));
		fst.addTransition(2, tr(3, 10, 0.0, 3));
		fst.setFinal(3, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertTrue(Fsts.isDeterministic(det));
		assertSameRelation(fst, det);
	}

	@Test
	public void testDelayedOutputGoesToFinalTransition() throws Exception {
		// 1 -> 10 and 1 2 -> 20: the output for 1 is only known at the end
		VectorFst<Double> fst = tropical();
		fst.addStates(4);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 0.0, 1));
		fst.addTransition(0, tr(1, 20, 0.0, 2));
		fst.addTransition(2, tr(2, 0, 0.0, 3));
		fst.setFinal(1, 0.0);
		fst.setFinal(3, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertSameRelation(fst, det);
		assertEquals(1, det.numTransitions(det.start()));
		// the pending 10 leaves on an epsilon input transition, which is no choice
		assertTrue(Fsts.isDeterministic(det));
		VectorFst<Double> min = new VectorFst<Double>(det);
		Minimize.minimize(min);
		assertSameRelation(fst, min);
	}

	@Test
	public void testMinimizeAfterDeterminize() throws Exception {
		// 1 2 -> 10 12 / 1 and 1 3 -> 11 13 / 2: outputs wait for the second symbol
		VectorFst<Double> fst = tropical();
		fst.addStates(5);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 1.0, 1));
		fst.addTransition(0, tr(1, 11, 2.0, 2));
		fst.addTransition(1, tr(2, 12, 0.0, 3));
		fst.addTransition(2, tr(3, 13, 0.0, 4));
		fst.setFinal(3, 0.0);
		fst.setFinal(4, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertTrue(Fsts.isDeterministic(det));
		assertSameRelation(fst, det);
		VectorFst<Double> min = new VectorFst<Double>(det);
		Minimize.minimize(min);
		assertTrue(Fsts.isDeterministic(min));
		assertTrue(min.numStates() <= det.numStates());
		TreeMap<String, Double> m = pathMap(min);
		assertEquals(2, m.size());
		assertEquals(1.0, m.get("[1, 2]:[10, 12]"), EPS);
		assertEquals(2.0, m.get("[1, 3]:[11, 13]"), EPS);
	}

	@Test
	public void testEpsilonOnlyTransducerStaysDeterministic() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(0, 0, 0.0, 1));
		fst.setFinal(1, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst);
		assertTrue(Fsts.isDeterministic(det));
		assertSameRelation(fst, det);
	}

	@Test
	public void testNonFunctionalInputFails() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 1.0, 1));
		fst.addTransition(0, tr(1, 20, 2.0, 2));
		fst.setFinal(1, 0.0);
		fst.setFinal(2, 0.0);
		try {
			Determinize.determinize(fst);
			fail("two outputs for one input should not determinize functionally");
		}
		catch (NonDeterminizableException e) {
			assertTrue(e.getMessage().contains("functional"));
		}
	}

	@Test
	public void testDisambiguateKeepsBestOutput() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 1.0, 1));
		fst.addTransition(0, tr(1, 20, 2.0, 2));
		fst.setFinal(1, 0.0);
		fst.setFinal(2, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst, new DeterminizeConfig().setType(DeterminizeType.DISAMBIGUATE));
		List<Path<Double>> paths = Paths.paths(det);
		assertEquals(1, paths.size());
		assertArrayEquals(new int[] {1}, paths.get(0).getILabels());
		assertArrayEquals(new int[] {10}, paths.get(0).getOLabels());
		assertEquals(1.0, paths.get(0).getWeight(), EPS);
	}

	@Test
	public void testNonFunctionalKeepsAllOutputs() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 10, 1.0, 1));
		fst.addTransition(0, tr(1, 20, 2.0, 2));
		fst.setFinal(1, 0.0);
		fst.setFinal(2, 0.0);
		VectorFst<Double> det = Determinize.determinize(fst, new DeterminizeConfig().setType(DeterminizeType.NON_FUNCTIONAL));
		assertSameRelation(fst, det);
		assertEquals(1, det.numTransitions(det.start()));
	}

	@Test
	public void testStateLimit() throws Exception {
		VectorFst<Double> fst = Fsts.linearAcceptor(TropicalSemiring.get(), 1, 2, 3, 4, 5);
		try {
			Determinize.determinize(fst, new DeterminizeConfig().setStateLimit(2));
			fail("state limit should stop determinization");
		}
		catch (NonDeterminizableException e) {
			assertTrue(e.getMessage().contains("2"));
		}
	}

	@Test(expected = ConfigureException.class)
	public void testNeedsDivisibleSemiring() throws Exception {
		VectorFst<StringWeight> fst = new VectorFst<StringWeight>(StringSemiring.get(StringType.RIGHT));
		fst.addStates(1);
		fst.setStart(0);
		Determinize.determinize(fst);
	}
}
