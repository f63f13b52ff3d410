package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class FstTest {

	private TropicalSemiring sr;
	private VectorFst<Double> fst;

	// 0 -1:1/0.5-> 1 -0:2/1-> 2(final 3), 0 -3:3-> 2
	@Before
	public void setUp() {
		sr = TropicalSemiring.get();
		fst = new VectorFst<Double>(sr);
		fst.addStates(3);
		fst.setStart(0);
		fst.addTransition(0, new Transition<Double>(1, 1, 0.5, 1));
		fst.addTransition(1, new Transition<Double>(0, 2, 1.0, 2));
		fst.addTransition(0, new Transition<Double>(3, 3, 0.0, 2));
		fst.setFinal(2, 3.0);
	}

	@Test
	public void testVectorFstBasics() {
		assertEquals(3, fst.numStates());
		assertEquals(0, fst.start());
		assertEquals(3, fst.numTransitions());
		assertEquals(2, fst.numTransitions(0));
		assertEquals(1, fst.numInputEpsilons(1));
		assertEquals(0, fst.numOutputEpsilons(1));
		assertTrue(fst.isFinal(2));
		assertFalse(fst.isFinal(1));
		assertTrue(sr.isZero(fst.finalWeight(0)));
	}

	@Test
	public void testSetTransitionRecountsEpsilons() {
		fst.setTransition(1, 0, new Transition<Double>(4, 0, 1.0, 2));
		assertEquals(0, fst.numInputEpsilons(1));
		assertEquals(1, fst.numOutputEpsilons(1));
		fst.deleteTransitions(1);
		assertEquals(0, fst.numTransitions(1));
		assertEquals(0, fst.numOutputEpsilons(1));
	}

	@Test
	public void testDeleteStatesRenumbers() {
		fst.deleteStates(new int[] {1});
		assertEquals(2, fst.numStates());
		assertEquals(0, fst.start());
		// the transition into the deleted state is gone, the other one retargeted
		assertEquals(1, fst.numTransitions(0));
		assertEquals(1, fst.transitions(0).get(0).getNextState());
		assertTrue(fst.isFinal(1));
	}

	@Test
	public void testDeleteStartState() {
		fst.deleteStates(new int[] {0});
		assertEquals(Transition.NO_STATE, fst.start());
		assertEquals(2, fst.numStates());
	}

	@Test
	public void testCopyConstructorIsIndependent() {
		VectorFst<Double> copy = new VectorFst<Double>(fst);
		copy.addTransition(0, new Transition<Double>(5, 5, 0.0, 0));
		assertEquals(2, fst.numTransitions(0));
		assertEquals(3, copy.numTransitions(0));
	}

	@Test
	public void testConstFstMatchesSource() {
		ConstFst<Double> c = new ConstFst<Double>(fst);
		assertEquals(fst.numStates(), c.numStates());
		assertEquals(fst.start(), c.start());
		assertEquals(fst.numTransitions(), c.numTransitions());
		for (int s = 0; s < fst.numStates(); s++) {
			assertEquals(fst.transitions(s), c.transitions(s));
			assertEquals(fst.finalWeight(s), c.finalWeight(s));
			assertEquals(fst.numInputEpsilons(s), c.numInputEpsilons(s));
			assertEquals(fst.numOutputEpsilons(s), c.numOutputEpsilons(s));
		}
		assertTrue(Isomorphic.isomorphic(fst, c));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testConstFstTransitionsAreReadOnly() {
		ConstFst<Double> c = new ConstFst<Double>(fst);
		c.transitions(0).clear();
	}

	@Test
	public void testStructuralChecks() {
		assertFalse(Fsts.isAcceptor(fst));
		// one epsilon transition out of state 1 is no choice
		assertTrue(Fsts.isDeterministic(fst));
		assertTrue(Fsts.isEpsilonFree(fst));
		assertTrue(Fsts.isSorted(fst, false));
		fst.addTransition(0, new Transition<Double>(2, 2, 0.0, 1));
		assertFalse(Fsts.isSorted(fst, false));
		assertFalse(Fsts.isSorted(fst, true));
		fst.addTransition(1, new Transition<Double>(0, 3, 2.0, 0));
		assertFalse(Fsts.isDeterministic(fst));
		VectorFst<Double> chain = Fsts.linearAcceptor(sr, 4, 5, 6);
		assertTrue(Fsts.isAcceptor(chain));
		assertTrue(Fsts.isDeterministic(chain));
		assertEquals(4, chain.numStates());
	}

	@Test
	public void testLinearTransducerPadsWithEpsilon() {
		List<Double> w = new ArrayList<Double>();
		w.add(1.0);
		w.add(2.0);
		VectorFst<Double> t = Fsts.linearTransducer(sr, new int[] {1, 2}, new int[] {7}, w);
		assertEquals(7, t.transitions(0).get(0).getOLabel());
		assertEquals(Transition.EPSILON, t.transitions(1).get(0).getOLabel());
		assertEquals(2.0, t.transitions(1).get(0).getWeight(), 0.0);
	}

	@Test
	public void testVerifyRejectsDanglingTransition() {
		fst.addTransition(2, new Transition<Double>(1, 1, 0.0, 9));
		try {
			Fsts.verify(fst);
			fail("transition to a missing state should not verify");
		}
		catch (MalformedFstException e) {
			assertTrue(e.getMessage().contains("9"));
		}
	}

	@Test
	public void testSymbolTable() {
		SymbolTable t = new SymbolTable("words");
		assertEquals(0, t.find(SymbolTable.EPSILON_SYMBOL));
		int a = t.addSymbol("a");
		assertEquals(1, a);
		assertEquals(a, t.addSymbol("a"));
		assertEquals(10, t.addSymbol("b", 10));
		assertEquals(11, t.getAvailableKey());
		assertEquals("b", t.find(10));
		assertNull(t.find(5));
		assertEquals(-1, t.find("c"));
		assertEquals(3, t.size());
		try {
			t.addSymbol("c", 10);
			fail("keys are unique");
		}
		catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("10"));
		}
	}

	@Test
	public void testMergeSymbols() throws Exception {
		SymbolTable a = new SymbolTable("a");
		a.addSymbol("x");
		SymbolTable b = new SymbolTable("b");
		b.addSymbol("x");
		assertSame(a, Fsts.mergeSymbols(a, b, "test"));
		assertSame(a, Fsts.mergeSymbols(a, null, "test"));
		b.addSymbol("y");
		try {
			Fsts.mergeSymbols(a, b, "test");
			fail("different tables should not merge");
		}
		catch (IncompatibleSymbolTablesException e) {
			assertTrue(e.getMessage().startsWith("test"));
		}
	}
}
