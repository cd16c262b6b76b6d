package com.cliffc.holes;

/** Statics for a small gradually-typed functional language whose programs may
 *  be incomplete: holes, multi-holes and unparseable fragments.
 *
 *  A term goes in, a map from every term id to its statics comes out; see
 *  {@link Memo} for the entry point and {@link com.cliffc.holes.statics.Statics}
 *  for the traversal.
 */
public abstract class Holes {
  // Internal invariant violation.  Never a user error; user errors are data in
  // the info map.  Reaching this is an engine bug.
  public static RuntimeException bug( String msg ) { throw new IllegalStateException("statics bug: "+msg); }

  // Default bound on the memoized entry point
  public static int MEMO_SIZE = 1000;

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
