package edu.isi.wfst;

// which string semiring the gallic weight uses. MIN is restricted strings whose plus keeps
// the pair with the better weight instead of failing
public enum GallicType { LEFT, RIGHT, RESTRICT, MIN }
