package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// Primitive types: Int, Float, Bool, String.  Singletons, so identity equality.
public final class TypBase extends Typ {
  public final String _name;
  TypBase( String name ) { super(TBASE); _name=name; }
  @Override int compute_hash() { return _name.hashCode(); }
  @Override public boolean equals( Object o ) { return this==o; }
  @Override boolean eq0( Typ t ) { return this==t; }
  @Override Typ walk( UnaryOperator<Typ> f ) { return this; }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this); }
  @Override Typ join0( Ctx ctx, Typ t ) { return this==t ? this : null; }
  @Override public SB str( SB sb ) { return sb.p(_name); }
}
