package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Sets of weights of an element semiring, kept sorted by a comparator. Plus is set union,
 * with elements the comparator calls equal merged by the element semiring's plus; times
 * is the pairwise product.
 */
public class UnionSemiring<E> extends Semiring<UnionWeight<E>> {
	protected final Semiring<E> elem;
	protected final Comparator<E> order;
	private final UnionWeight<E> zero;
	private final UnionWeight<E> one;

	public UnionSemiring(Semiring<E> elem, Comparator<E> order) {
		this.elem = elem;
		this.order = order;
		zero = new UnionWeight<E>(new ArrayList<E>());
		one = singleton(elem.one());
	}
	public Semiring<E> getElementSemiring() { return elem; }

	public UnionWeight<E> singleton(E e) {
		if (elem.isZero(e))
			return zero;
		ArrayList<E> l = new ArrayList<E>(1);
		l.add(e);
		return new UnionWeight<E>(l);
	}

	public UnionWeight<E> zero() { return zero; }
	public UnionWeight<E> one() { return one; }

	// append, merging with the last element when they sort the same
	private void pushBack(ArrayList<E> l, E e) {
		if (!l.isEmpty() && order.compare(l.get(l.size()-1), e) == 0)
			l.set(l.size()-1, elem.plus(l.get(l.size()-1), e));
		else
			l.add(e);
	}
	public UnionWeight<E> plus(UnionWeight<E> a, UnionWeight<E> b) {
		if (a.isEmpty())
			return b;
		if (b.isEmpty())
			return a;
		ArrayList<E> l = new ArrayList<E>(a.size()+b.size());
		int i = 0, j = 0;
		while (i < a.size() || j < b.size()) {
			if (j >= b.size() || (i < a.size() && order.compare(a.get(i), b.get(j)) <= 0))
				pushBack(l, a.get(i++));
			else
				pushBack(l, b.get(j++));
		}
		return new UnionWeight<E>(l);
	}
	public UnionWeight<E> times(UnionWeight<E> a, UnionWeight<E> b) {
		if (a.isEmpty() || b.isEmpty())
			return zero;
		UnionWeight<E> sum = zero;
		for (E x : a.getElements()) {
			ArrayList<E> row = new ArrayList<E>(b.size());
			for (E y : b.getElements())
				row.add(elem.times(x, y));
			Collections.sort(row, order);
			ArrayList<E> merged = new ArrayList<E>(row.size());
			for (E e : row)
				pushBack(merged, e);
			sum = plus(sum, new UnionWeight<E>(merged));
		}
		return sum;
	}
	// only defined when one side is a single element
	public UnionWeight<E> divide(UnionWeight<E> a, UnionWeight<E> b, DivideType dt) throws UnsupportedSemiringOperationException {
		if (b.isEmpty())
			throw new UnsupportedSemiringOperationException("Division by the empty set");
		if (a.isEmpty())
			return zero;
		ArrayList<E> l = new ArrayList<E>();
		if (b.size() == 1) {
			for (E x : a.getElements())
				l.add(elem.divide(x, b.get(0), dt));
		}
		else if (a.size() == 1) {
			for (E y : b.getElements())
				l.add(elem.divide(a.get(0), y, dt));
		}
		else
			throw new UnsupportedSemiringOperationException("Union division is only defined when one argument is a singleton");
		Collections.sort(l, order);
		ArrayList<E> merged = new ArrayList<E>(l.size());
		for (E e : l)
			pushBack(merged, e);
		return new UnionWeight<E>(merged);
	}
	public boolean isDivisible() { return elem.isDivisible(); }
	public UnionWeight<E> quantize(UnionWeight<E> a, float delta) {
		ArrayList<E> l = new ArrayList<E>(a.size());
		for (E e : a.getElements())
			l.add(elem.quantize(e, delta));
		return new UnionWeight<E>(l);
	}
	public boolean equal(UnionWeight<E> a, UnionWeight<E> b) {
		if (a.size() != b.size())
			return false;
		for (int i = 0; i < a.size(); i++)
			if (!elem.equal(a.get(i), b.get(i)))
				return false;
		return true;
	}
	public boolean approxEqual(UnionWeight<E> a, UnionWeight<E> b, float delta) {
		if (a.size() != b.size())
			return false;
		for (int i = 0; i < a.size(); i++)
			if (!elem.approxEqual(a.get(i), b.get(i), delta))
				return false;
		return true;
	}
	public boolean isMember(UnionWeight<E> a) {
		if (a == null)
			return false;
		for (E e : a.getElements())
			if (!elem.isMember(e))
				return false;
		return true;
	}
	public int properties() {
		return elem.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
	}
	public Semiring<UnionWeight<E>> reverseSemiring() {
		if (elem.reverseSemiring() == elem)
			return this;
		return new UnionSemiring<E>(elem.reverseSemiring(), order);
	}
	public UnionWeight<E> reverse(UnionWeight<E> a) {
		ArrayList<E> l = new ArrayList<E>(a.size());
		for (E e : a.getElements())
			l.add(elem.reverse(e));
		Collections.sort(l, order);
		return new UnionWeight<E>(l);
	}
	public String getName() {
		return elem.getName()+"_union";
	}
	public String format(UnionWeight<E> a) {
		if (a.isEmpty())
			return "EmptySet";
		StringBuffer sb = new StringBuffer();
		for (E e : a.getElements()) {
			if (sb.length() > 0)
				sb.append(';');
			sb.append(elem.format(e));
		}
		return sb.toString();
	}
	public UnionWeight<E> parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equals("EmptySet"))
			return zero;
		UnionWeight<E> w = zero;
		for (String p : t.split(";"))
			w = plus(w, singleton(elem.parse(p)));
		return w;
	}
}
