package com.cliffc.holes.term;

// Term sorts.  Each sort has its own traversal in the statics.
public enum Sort { EXP, PAT, TYP, TPAT, TSUM, RUL }
