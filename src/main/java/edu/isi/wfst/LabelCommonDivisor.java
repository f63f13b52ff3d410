package edu.isi.wfst;

/**
 * At most one label: the first label the two strings agree on, so determinized
 * transitions never emit more than one output symbol.
 */
public class LabelCommonDivisor implements CommonDivisor<StringWeight> {
	public StringWeight commonDivisor(StringWeight a, StringWeight b) {
		if (a.isEmpty() || b.isEmpty())
			return StringWeight.EPSILON;
		if (a.isInfinity()) {
			if (b.isInfinity())
				return StringWeight.INFINITY;
			return StringWeight.ofLabel(b.get(0));
		}
		if (b.isInfinity())
			return StringWeight.ofLabel(a.get(0));
		if (a.get(0) == b.get(0))
			return StringWeight.ofLabel(a.get(0));
		return StringWeight.EPSILON;
	}
}
