package edu.isi.wfst;

// Kleene star (zero or more repetitions) or plus (one or more)
public enum ClosureType { STAR, PLUS }
