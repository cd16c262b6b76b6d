package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.HashSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// A reference to a type variable; either an alias bound in a Ctx, or the
// binder of an enclosing TypRec.
public final class TypVar extends Typ {
  public final String _name;
  private TypVar( String name ) { super(TVAR); _name=name; }
  public static TypVar make( String name ) { return new TypVar(name); }
  @Override int compute_hash() { return _name.hashCode()*31+TVAR; }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof TypVar v && _name.equals(v._name));
  }
  @Override boolean eq0( Typ t ) { return equals(t); }
  @Override Typ walk( UnaryOperator<Typ> f ) { return this; }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this); }
  @Override public Typ subst( Typ s, String x ) { return _name.equals(x) ? s : this; }
  @Override void _free_vars( HashSet<String> bound, HashSet<String> fvs ) {
    if( !bound.contains(_name) ) fvs.add(_name);
  }
  @Override Typ join0( Ctx ctx, Typ t ) { throw new IllegalStateException(); } // Handled before heads
  @Override public SB str( SB sb ) { return sb.p(_name); }
}
