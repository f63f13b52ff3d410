package edu.isi.wfst;

// how string plus treats two different strings: longest common prefix, longest common
// suffix, or not at all
public enum StringType { LEFT, RIGHT, RESTRICT }
