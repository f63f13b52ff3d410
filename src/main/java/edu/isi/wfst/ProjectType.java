package edu.isi.wfst;

// which label survives a projection
public enum ProjectType { INPUT, OUTPUT }
