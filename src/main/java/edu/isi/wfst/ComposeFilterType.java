package edu.isi.wfst;

// AUTO picks SEQUENCE
public enum ComposeFilterType { AUTO, NULL, TRIVIAL, SEQUENCE, ALT_SEQUENCE, MATCH, NO_MATCH ;
	public static ComposeFilterType get(String s) throws ConfigureException {
		if (s.equalsIgnoreCase("auto"))
			return AUTO;
		if (s.equalsIgnoreCase("null"))
			return NULL;
		if (s.equalsIgnoreCase("trivial"))
			return TRIVIAL;
		if (s.equalsIgnoreCase("sequence"))
			return SEQUENCE;
		if (s.equalsIgnoreCase("alt_sequence"))
			return ALT_SEQUENCE;
		if (s.equalsIgnoreCase("match"))
			return MATCH;
		if (s.equalsIgnoreCase("no_match"))
			return NO_MATCH;
		throw new ConfigureException("Unknown compose filter "+s+"; expected auto, null, trivial, sequence, alt_sequence, match or no_match");
	}
}
