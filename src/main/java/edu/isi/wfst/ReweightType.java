package edu.isi.wfst;

// where weight ends up when pushed
public enum ReweightType { TO_INITIAL, TO_FINAL }
