package edu.isi.wfst;

// a pair of weights from two semirings. Immutable
public class ProductWeight<A, B> {
	private final A value1;
	private final B value2;
	public ProductWeight(A value1, B value2) {
		this.value1 = value1;
		this.value2 = value2;
	}
	public A getValue1() { return value1; }
	public B getValue2() { return value2; }
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof ProductWeight))
			return false;
		ProductWeight<?, ?> p = (ProductWeight<?, ?>)o;
		return value1.equals(p.value1) && value2.equals(p.value2);
	}
	public int hashCode() {
		return 31*value1.hashCode() + value2.hashCode();
	}
	public String toString() {
		return value1+","+value2;
	}
}
