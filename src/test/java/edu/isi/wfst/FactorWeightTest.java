package edu.isi.wfst;

import java.util.Arrays;
import java.util.TreeMap;

import org.junit.Test;
import static org.junit.Assert.*;
import static edu.isi.wfst.TestUtil.*;

public class FactorWeightTest {

	private static final double EPS = 1e-6;

	private static GallicSemiring<Double> left() {
		return new GallicSemiring<Double>(TropicalSemiring.get(), GallicType.LEFT);
	}

	@Test
	public void testGallicRoundTrip() throws Exception {
		VectorFst<Double> fst = Fsts.linearTransducer(TropicalSemiring.get(), new int[] {1, 2}, new int[] {5}, Arrays.asList(1.0, 2.0));
		fst.setFinal(2, 0.5);
		GallicSemiring<Double> gs = left();
		VectorFst<GallicWeight<Double>> g = GallicConvert.toGallic(fst, gs);
		assertTrue(Fsts.isAcceptor(g));
		GallicWeight<Double> w = g.transitions(0).get(0).getWeight();
		assertEquals(StringWeight.of(5), w.getString());
		assertEquals(1.0, w.getWeight(), EPS);
		assertTrue(g.transitions(1).get(0).getWeight().getString().isEmpty());
		VectorFst<Double> back = GallicConvert.fromGallic(g, gs, null, Transition.EPSILON);
		assertTrue(Isomorphic.isomorphic(fst, back));
	}

	@Test
	public void testFactorsLongStrings() throws Exception {
		GallicSemiring<Double> gs = left();
		VectorFst<GallicWeight<Double>> g = new VectorFst<GallicWeight<Double>>(gs);
		g.addStates(2);
		g.setStart(0);
		g.addTransition(0, new Transition<GallicWeight<Double>>(1, 1, gs.gallic(StringWeight.of(7, 8), 1.0), 1));
		g.setFinal(1, gs.gallic(StringWeight.of(5), 2.0));
		VectorFst<GallicWeight<Double>> f = FactorWeight.factorWeight(g, new GallicFactor<GallicWeight<Double>, Double>(gs));
		GallicFactor<GallicWeight<Double>, Double> factor = new GallicFactor<GallicWeight<Double>, Double>(gs);
		for (int s = 0; s < f.numStates(); s++) {
			assertTrue(factor.done(f.finalWeight(s)));
			for (Transition<GallicWeight<Double>> t : f.transitions(s))
				assertTrue(factor.done(t.getWeight()));
		}
		VectorFst<Double> fst = GallicConvert.fromGallic(f, gs, null, Transition.EPSILON);
		TreeMap<String, Double> m = pathMap(fst);
		assertEquals(1, m.size());
		assertEquals(3.0, m.get("[1]:[7, 8, 5]"), EPS);
	}

	@Test
	public void testFinalWeightsOnly() throws Exception {
		GallicSemiring<Double> gs = left();
		VectorFst<GallicWeight<Double>> g = new VectorFst<GallicWeight<Double>>(gs);
		g.addStates(1);
		g.setStart(0);
		g.setFinal(0, gs.gallic(StringWeight.of(3, 4), 1.0));
		FactorWeightConfig config = new FactorWeightConfig().setFactorTransitionWeights(false).setFinalILabel(9);
		VectorFst<GallicWeight<Double>> f = FactorWeight.factorWeight(g, new GallicFactor<GallicWeight<Double>, Double>(gs), config);
		assertTrue(gs.isZero(f.finalWeight(f.start())));
		Transition<GallicWeight<Double>> t = f.transitions(f.start()).get(0);
		assertEquals(9, t.getILabel());
		assertEquals(StringWeight.of(3), t.getWeight().getString());
		VectorFst<Double> fst = GallicConvert.fromGallic(f, gs, null, 9);
		assertEquals(1.0, pathMap(fst).get("[9, 9]:[3, 4]"), EPS);
	}

	@Test(expected = ConfigureException.class)
	public void testNothingToFactor() throws Exception {
		FactorWeight.factorWeight(new VectorFst<GallicWeight<Double>>(left()), new GallicFactor<GallicWeight<Double>, Double>(left()),
					  new FactorWeightConfig().setFactorFinalWeights(false).setFactorTransitionWeights(false));
	}

	@Test(expected = MalformedFstException.class)
	public void testUnfactoredWeightRejected() throws Exception {
		GallicSemiring<Double> gs = left();
		VectorFst<GallicWeight<Double>> g = new VectorFst<GallicWeight<Double>>(gs);
		g.addStates(2);
		g.setStart(0);
		g.addTransition(0, new Transition<GallicWeight<Double>>(1, 1, gs.gallic(StringWeight.of(7, 8), 1.0), 1));
		g.setFinal(1, gs.one());
		GallicConvert.fromGallic(g, gs, null, Transition.EPSILON);
	}
}
