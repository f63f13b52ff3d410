package edu.isi.wfst;

// how to treat a transducer that maps one input to several outputs
public enum DeterminizeType { FUNCTIONAL, NON_FUNCTIONAL, DISAMBIGUATE ;
	public static DeterminizeType get(String s) throws ConfigureException {
		if (s.equalsIgnoreCase("functional"))
			return FUNCTIONAL;
		if (s.equalsIgnoreCase("nonfunctional") || s.equalsIgnoreCase("non_functional"))
			return NON_FUNCTIONAL;
		if (s.equalsIgnoreCase("disambiguate"))
			return DISAMBIGUATE;
		throw new ConfigureException("Unknown determinization type "+s+"; expected functional, nonfunctional or disambiguate");
	}
}
