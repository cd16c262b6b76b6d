package com.cliffc.holes.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing of types,
 *  terms and info maps. */
public final class SB {
  private final StringBuilder _sb = new StringBuilder();
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   c ) { _sb.append(c); return this; }
  public SB p( int    i ) { _sb.append(i); return this; }
  public SB p( long   l ) { _sb.append(l); return this; }
  // Floats print with a trailing '.' when integral, so "3." is not the Int "3"
  public SB p( double d ) {
    if( Double.isNaN(d) || Double.isInfinite(d) ) return p(Double.toString(d));
    if( d==Math.rint(d) && Math.abs(d) < 1e15 ) return p((long)d).p('.');
    _sb.append(d);
    return this;
  }
  // Quoted string, escaping the quote and backslash
  public SB pq( String s ) {
    _sb.append('"');
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      if( c=='"' || c=='\\' ) _sb.append('\\');
      _sb.append(c);
    }
    _sb.append('"');
    return this;
  }
  public SB nl( ) { return p('\n'); }

  // Remove last chars, typically a trailing separator
  public SB unchar( int x ) { _sb.setLength(Math.max(0,_sb.length()-x)); return this; }

  @Override public String toString() { return _sb.toString(); }
}
