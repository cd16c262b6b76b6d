package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// The unknown type.  Two flavors: Internal is a genuine gap, e.g. the type of
// a hole.  SynSwitch only marks a position as "analyze by synthesizing" and is
// resolved before any type is reported.  See Typ.UNK and Typ.SYNSWITCH.
public final class TypUnknown extends Typ {
  public final boolean _synswitch;
  TypUnknown( boolean synswitch ) { super(TUNK); _synswitch=synswitch; }
  // Internal wins
  static TypUnknown join( TypUnknown u1, TypUnknown u2 ) {
    return u1._synswitch && u2._synswitch ? SYNSWITCH : UNK;
  }
  @Override int compute_hash() { return _synswitch ? 17 : 19; }
  @Override public boolean equals( Object o ) { return this==o; }
  @Override boolean eq0( Typ t ) { return this==t; }
  @Override Typ walk( UnaryOperator<Typ> f ) { return this; }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this); }
  @Override Typ _internalize() { return UNK; }
  @Override Typ join0( Ctx ctx, Typ t ) { throw new IllegalStateException(); } // Handled before heads
  @Override public SB str( SB sb ) { return sb.p(_synswitch ? "?syn" : "?"); }
}
