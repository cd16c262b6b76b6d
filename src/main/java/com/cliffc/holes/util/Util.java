package com.cliffc.holes.util;

public class Util {
  public static boolean isBlank( String s ) {
    if( s==null ) return true;
    for( int i=0; i<s.length(); i++ )
      if( !Character.isWhitespace(s.charAt(i)) )
        return false;
    return true;
  }

  // Hash mixing, after http://burtleburtle.net/bob/c/lookup3.c.  Mixers are
  // pure, so structural hashes nest freely.
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }
  public static int mix_hash( int a, int b ) {
    int c = 0x9e3779b9;
    a -= c;  a ^= rot(c, 4);  c += b;
    b -= a;  b ^= rot(a, 6);  a += c;
    c -= b;  c ^= rot(b, 8);  b += a;
    a -= c;  a ^= rot(c,16);  c += b;
    b -= a;  b ^= rot(a,19);  a += c;
    c -= b;  c ^= rot(b, 4);
    return c==0 ? 0xcafebabe : c;
  }
  public static int mix_hash( int a, int b, int c ) { return mix_hash(mix_hash(a,b),c); }
  public static int hash( Object[] os ) {
    int h = os.length;
    for( Object o : os ) h = mix_hash(h,o==null ? 0 : o.hashCode());
    return h;
  }
}
