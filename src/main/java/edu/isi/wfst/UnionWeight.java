package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// a sorted set of weights from some other semiring. The empty set is zero. Immutable
public class UnionWeight<E> {
	private final List<E> elements;

	UnionWeight(List<E> sorted) {
		elements = Collections.unmodifiableList(sorted);
	}
	public List<E> getElements() { return elements; }
	public int size() { return elements.size(); }
	public boolean isEmpty() { return elements.isEmpty(); }
	public E get(int i) { return elements.get(i); }

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof UnionWeight))
			return false;
		return elements.equals(((UnionWeight<?>)o).elements);
	}
	public int hashCode() {
		return elements.hashCode();
	}
	public String toString() {
		if (elements.isEmpty())
			return "EmptySet";
		StringBuffer sb = new StringBuffer();
		for (E e : elements) {
			if (sb.length() > 0)
				sb.append(',');
			sb.append(e);
		}
		return sb.toString();
	}

	static <E> UnionWeight<E> of(List<E> sorted) {
		return new UnionWeight<E>(new ArrayList<E>(sorted));
	}
}
