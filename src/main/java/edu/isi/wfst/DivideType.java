package edu.isi.wfst;

// which side a division strips the divisor from. Commutative semirings ignore it.
public enum DivideType { LEFT, RIGHT, ANY }
