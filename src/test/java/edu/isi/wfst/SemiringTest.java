package edu.isi.wfst;

import java.util.Comparator;

import org.junit.Test;
import static org.junit.Assert.*;

public class SemiringTest {

	private static final double EPS = 1e-6;

	@Test
	public void testTropicalAxioms() throws Exception {
		TropicalSemiring sr = TropicalSemiring.get();
		assertEquals(2.0, sr.plus(2.0, 5.0), EPS);
		assertEquals(7.0, sr.times(2.0, 5.0), EPS);
		assertEquals(3.0, sr.plus(sr.zero(), 3.0), EPS);
		assertEquals(3.0, sr.times(sr.one(), 3.0), EPS);
		assertTrue(sr.isZero(sr.times(sr.zero(), 3.0)));
		assertEquals(3.0, sr.divide(5.0, 2.0, DivideType.LEFT), EPS);
		assertEquals(0.0, sr.closure(4.0), EPS);
		assertTrue(sr.hasProperties(Semiring.PATH | Semiring.IDEMPOTENT | Semiring.COMMUTATIVE));
		assertEquals("standard", sr.getArcType());
	}

	@Test
	public void testTropicalDivisionByZeroFails() {
		try {
			TropicalSemiring.get().divide(1.0, Double.POSITIVE_INFINITY, DivideType.ANY);
			fail("dividing by zero should fail");
		}
		catch (UnsupportedSemiringOperationException e) {
			assertTrue(e.getMessage().contains("tropical"));
		}
	}

	@Test
	public void testLogPlusAddsProbabilities() throws Exception {
		LogSemiring sr = LogSemiring.get();
		double a = -Math.log(0.25);
		double b = -Math.log(0.5);
		assertEquals(-Math.log(0.75), sr.plus(a, b), EPS);
		assertEquals(a+b, sr.times(a, b), EPS);
		assertEquals(b, sr.plus(sr.zero(), b), EPS);
		assertFalse(sr.hasProperties(Semiring.IDEMPOTENT));
	}

	@Test
	public void testLogClosureIsGeometricSum() throws Exception {
		LogSemiring sr = LogSemiring.get();
		// p = 0.5: 1 + p + p^2 + ... = 2
		assertEquals(-Math.log(2.0), sr.closure(-Math.log(0.5)), EPS);
		assertEquals(Double.NEGATIVE_INFINITY, sr.closure(0.0), EPS);
		assertEquals(0.0, sr.closure(Double.POSITIVE_INFINITY), EPS);
	}

	@Test
	public void testProbability() throws Exception {
		ProbabilitySemiring sr = ProbabilitySemiring.get();
		assertEquals(0.75, sr.plus(0.25, 0.5), EPS);
		assertEquals(0.125, sr.times(0.25, 0.5), EPS);
		assertEquals(2.0, sr.closure(0.5), EPS);
		assertEquals(0.5, sr.divide(0.25, 0.5, DivideType.RIGHT), EPS);
		// bigger is better
		assertTrue(sr.naturalLess(0.9, 0.1));
	}

	@Test
	public void testBoolean() throws Exception {
		BooleanSemiring sr = BooleanSemiring.get();
		assertEquals(Boolean.TRUE, sr.plus(true, false));
		assertEquals(Boolean.FALSE, sr.times(true, false));
		assertEquals(Boolean.TRUE, sr.closure(false));
		assertEquals(Boolean.TRUE, sr.parse(sr.format(true)));
	}

	@Test
	public void testQuantize() {
		TropicalSemiring sr = TropicalSemiring.get();
		double q1 = sr.quantize(1.0001, Semiring.KDELTA);
		double q2 = sr.quantize(1.0002, Semiring.KDELTA);
		assertEquals(q1, q2, 0.0);
		assertEquals(Double.POSITIVE_INFINITY, sr.quantize(Double.POSITIVE_INFINITY, Semiring.KDELTA), 0.0);
		assertTrue(sr.approxEqual(1.0, 1.0005, Semiring.KDELTA));
		assertFalse(sr.approxEqual(1.0, 1.1, Semiring.KDELTA));
	}

	@Test
	public void testParseAndFormat() throws Exception {
		TropicalSemiring sr = TropicalSemiring.get();
		assertEquals("3", sr.format(3.0));
		assertEquals("Infinity", sr.format(sr.zero()));
		assertEquals(Double.POSITIVE_INFINITY, sr.parse("inf"), 0.0);
		assertEquals(2.5, sr.parse("2.5"), EPS);
		try {
			sr.parse("two");
			fail("bad weight should not parse");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().contains("two"));
		}
	}

	@Test
	public void testNaturalOrder() {
		Comparator<Double> cmp = TropicalSemiring.get().naturalOrder();
		assertTrue(cmp.compare(1.0, 2.0) < 0);
		assertTrue(cmp.compare(2.0, 1.0) > 0);
		assertEquals(0, cmp.compare(1.0, 1.0));
	}

	@Test
	public void testLeftStringSemiring() throws Exception {
		StringSemiring sr = StringSemiring.get(StringType.LEFT);
		StringWeight a = StringWeight.of(1, 2, 3);
		StringWeight b = StringWeight.of(1, 2, 4);
		// longest common prefix
		assertEquals(StringWeight.of(1, 2), sr.plus(a, b));
		assertEquals(StringWeight.of(1, 2, 3, 1, 2, 4), sr.times(a, b));
		assertEquals(StringWeight.of(3), sr.divide(a, StringWeight.of(1, 2), DivideType.LEFT));
		assertTrue(sr.isZero(sr.times(a, sr.zero())));
		assertEquals(a, sr.plus(a, sr.zero()));
	}

	@Test
	public void testRestrictStringsMustAgree() {
		StringSemiring sr = StringSemiring.get(StringType.RESTRICT);
		assertEquals(StringWeight.of(5), sr.plus(StringWeight.of(5), StringWeight.of(5)));
		try {
			sr.plus(StringWeight.of(5), StringWeight.of(6));
			fail("different strings do not sum in the restricted semiring");
		}
		catch (IncompatibleWeightsException e) {
			// expected
		}
	}

	@Test
	public void testProductSemiring() throws Exception {
		ProductSemiring<Double, Double> sr = new ProductSemiring<Double, Double>(TropicalSemiring.get(), ProbabilitySemiring.get());
		ProductWeight<Double, Double> a = new ProductWeight<Double, Double>(1.0, 0.5);
		ProductWeight<Double, Double> b = new ProductWeight<Double, Double>(2.0, 0.25);
		ProductWeight<Double, Double> p = sr.plus(a, b);
		assertEquals(1.0, p.getValue1(), EPS);
		assertEquals(0.75, p.getValue2(), EPS);
		ProductWeight<Double, Double> t = sr.times(a, b);
		assertEquals(3.0, t.getValue1(), EPS);
		assertEquals(0.125, t.getValue2(), EPS);
		assertTrue(sr.isOne(sr.times(sr.one(), sr.one())));
	}

	@Test
	public void testGallicTimesConcatenatesStrings() throws Exception {
		GallicSemiring<Double> sr = new GallicSemiring<Double>(TropicalSemiring.get(), GallicType.LEFT);
		GallicWeight<Double> a = sr.gallic(StringWeight.of(7), 1.0);
		GallicWeight<Double> b = sr.gallic(StringWeight.of(8), 2.0);
		GallicWeight<Double> t = sr.times(a, b);
		assertEquals(StringWeight.of(7, 8), t.getString());
		assertEquals(3.0, t.getWeight(), EPS);
		GallicWeight<Double> d = sr.divide(t, a, DivideType.LEFT);
		assertEquals(StringWeight.of(8), d.getString());
		assertEquals(2.0, d.getWeight(), EPS);
	}

	@Test
	public void testGallicMinKeepsBestPair() {
		GallicSemiring<Double> sr = new GallicSemiring<Double>(TropicalSemiring.get(), GallicType.MIN);
		GallicWeight<Double> a = sr.gallic(StringWeight.of(7), 3.0);
		GallicWeight<Double> b = sr.gallic(StringWeight.of(8), 1.0);
		assertSame(b, sr.plus(a, b));
		assertSame(b, sr.plus(b, a));
	}

	@Test
	public void testUnionGallicKeepsAlternatives() {
		GallicUnionSemiring<Double> sr = new GallicUnionSemiring<Double>(TropicalSemiring.get());
		UnionWeight<GallicWeight<Double>> a = sr.gallic(StringWeight.of(7), 3.0);
		UnionWeight<GallicWeight<Double>> b = sr.gallic(StringWeight.of(8), 1.0);
		UnionWeight<GallicWeight<Double>> sum = sr.plus(a, b);
		assertEquals(2, sum.size());
		assertEquals(2, sr.elements(sum).size());
		assertTrue(sr.equal(sum, sr.plus(b, a)));
		assertTrue(sr.isZero(sr.times(sum, sr.zero())));
	}
}
