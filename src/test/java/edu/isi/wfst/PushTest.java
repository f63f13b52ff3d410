package edu.isi.wfst;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class PushTest {

	private static final double EPS = 1e-6;

	// 0 -1/1-> 1 -2/2-> 2, final 3
	private static VectorFst<Double> chain() {
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 1.0, 1));
		fst.addTransition(1, tr(2, 2, 2.0, 2));
		fst.setFinal(2, 3.0);
		return fst;
	}

	@Test
	public void testPushToInitial() throws Exception {
		VectorFst<Double> fst = chain();
		Push.push(fst, ReweightType.TO_INITIAL);
		assertEquals(3, fst.numStates());
		assertEquals(6.0, fst.transitions(0).get(0).getWeight(), EPS);
		assertEquals(0.0, fst.transitions(1).get(0).getWeight(), EPS);
		assertEquals(0.0, fst.finalWeight(2), EPS);
		assertSameRelation(chain(), fst);
	}

	@Test
	public void testPushToFinal() throws Exception {
		VectorFst<Double> fst = chain();
		Push.push(fst, ReweightType.TO_FINAL);
		assertEquals(0.0, fst.transitions(0).get(0).getWeight(), EPS);
		assertEquals(0.0, fst.transitions(1).get(0).getWeight(), EPS);
		assertEquals(6.0, fst.finalWeight(2), EPS);
		assertSameRelation(chain(), fst);
	}

	@Test
	public void testRemoveTotalWeight() throws Exception {
		VectorFst<Double> fst = chain();
		Push.push(fst, ReweightType.TO_INITIAL, true, Semiring.KDELTA);
		List<Path<Double>> paths = Paths.paths(fst);
		assertEquals(1, paths.size());
		assertEquals(0.0, paths.get(0).getWeight(), EPS);
	}

	@Test
	public void testBranchesKeepDifferences() throws Exception {
		// two branches of 4 and 7; pushing leaves the difference on the costlier one
		VectorFst<Double> fst = tropical();
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 1.0, 1));
		fst.addTransition(0, tr(2, 2, 5.0, 2));
		fst.setFinal(1, 3.0);
		fst.setFinal(2, 2.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Push.push(fst, ReweightType.TO_INITIAL, true, Semiring.KDELTA);
		assertEquals(0.0, fst.transitions(0).get(0).getWeight(), EPS);
		assertEquals(3.0, fst.transitions(0).get(1).getWeight(), EPS);
		assertEquals(0.0, fst.finalWeight(1), EPS);
		assertEquals(0.0, fst.finalWeight(2), EPS);
		Push.push(orig, ReweightType.TO_INITIAL);
		assertEquals(4.0, orig.transitions(0).get(0).getWeight(), EPS);
	}

	@Test
	public void testStartWithIncomingGetsNewStart() throws Exception {
		VectorFst<Double> fst = tropical();
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, 1.0, 0));
		fst.addTransition(0, tr(2, 2, 2.0, 1));
		fst.setFinal(1, 0.0);
		VectorFst<Double> orig = new VectorFst<Double>(fst);
		Push.push(fst, ReweightType.TO_INITIAL);
		assertEquals(3, fst.numStates());
		assertEquals(2, fst.start());
		Transition<Double> t = fst.transitions(2).get(0);
		assertTrue(t.isEpsilon());
		assertEquals(2.0, t.getWeight(), EPS);
		assertEquals(1.0, fst.transitions(0).get(0).getWeight(), EPS);
		assertEquals(0.0, fst.transitions(0).get(1).getWeight(), EPS);
		assertEquals(ShortestDistance.shortestDistance(orig, true, new ShortestDistanceConfig()).get(0),
			     ShortestDistance.shortestDistance(fst, true, new ShortestDistanceConfig()).get(2), EPS);
	}

	@Test
	public void testLogPushNormalizes() throws Exception {
		// probabilities 0.2 and 0.6 out of the start: pushed they become 0.25 and 0.75
		VectorFst<Double> fst = new VectorFst<Double>(LogSemiring.get());
		fst.addStates(2);
		fst.setStart(0);
		fst.addTransition(0, tr(1, 1, -Math.log(0.2), 1));
		fst.addTransition(0, tr(2, 2, -Math.log(0.6), 1));
		fst.setFinal(1, 0.0);
		Push.push(fst, ReweightType.TO_INITIAL, true, Semiring.KDELTA);
		assertEquals(0.25, Math.exp(-fst.transitions(0).get(0).getWeight()), 1e-4);
		assertEquals(0.75, Math.exp(-fst.transitions(0).get(1).getWeight()), 1e-4);
	}

	@Test
	public void testEmptyIsUntouched() throws Exception {
		VectorFst<Double> fst = tropical();
		Push.push(fst, ReweightType.TO_INITIAL, true, Semiring.KDELTA);
		assertEquals(0, fst.numStates());
	}
}
