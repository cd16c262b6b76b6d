package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;

import java.util.HashSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// Recursive type: rec name. body, binding 'name' in 'body'.  Equi-recursive;
// a rec is the same type as its one-step unrolling.
public final class TypRec extends Typ {
  public final String _name;
  public final Typ _body;
  private TypRec( String name, Typ body ) { super(TREC); _name=name; _body=body; }
  public static TypRec make( String name, Typ body ) {
    assert !(body instanceof TypVar v && v._name.equals(name)) : "degenerate rec "+name;
    return new TypRec(name,body);
  }
  // One step unrolling: body[this/name]
  public Typ unroll() { return _body.subst(this,_name); }

  @Override int compute_hash() { return Util.mix_hash(TREC,_name.hashCode(),_body.hashCode()); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof TypRec r && _name.equals(r._name) && _body.equals(r._body));
  }
  @Override boolean eq0( Typ t ) {
    TypRec r = (TypRec)t;
    return eq(_body, r._name.equals(_name) ? r._body : r._body.subst(TypVar.make(_name),r._name));
  }
  @Override Typ walk( UnaryOperator<Typ> f ) {
    Typ b = f.apply(_body);
    return b==_body ? this : make(_name,b);
  }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this) || _body.any(p); }
  // Binder shadows.  Substituted types in this language are closed over their
  // own rec names, so no capture-avoiding rename is needed.
  @Override public Typ subst( Typ s, String x ) { return _name.equals(x) ? this : super.subst(s,x); }
  @Override void _free_vars( HashSet<String> bound, HashSet<String> fvs ) {
    boolean added = bound.add(_name);
    _body._free_vars(bound,fvs);
    if( added ) bound.remove(_name);
  }
  @Override Typ join0( Ctx ctx, Typ t ) { throw new IllegalStateException(); } // Handled before heads
  @Override public SB str( SB sb ) { return _body.str(sb.p("rec ").p(_name).p(". ")); }
}
