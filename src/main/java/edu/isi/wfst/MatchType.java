package edu.isi.wfst;

// which side of the transitions a matcher looks at. BOTH and NONE describe what a
// composition can do with its two arguments
public enum MatchType { INPUT, OUTPUT, BOTH, NONE }
