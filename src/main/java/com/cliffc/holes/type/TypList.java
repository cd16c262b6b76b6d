package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public final class TypList extends Typ {
  public final Typ _elem;
  private TypList( Typ elem ) { super(TLIST); _elem=elem; }
  public static TypList make( Typ elem ) { return new TypList(elem); }
  @Override int compute_hash() { return _elem.hashCode()*7+TLIST; }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof TypList l && _elem.equals(l._elem));
  }
  @Override boolean eq0( Typ t ) { return eq(_elem,((TypList)t)._elem); }
  @Override Typ walk( UnaryOperator<Typ> f ) {
    Typ e = f.apply(_elem);
    return e==_elem ? this : make(e);
  }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this) || _elem.any(p); }
  @Override Typ join0( Ctx ctx, Typ t ) {
    Typ e = join(ctx,_elem,((TypList)t)._elem);
    return e==null ? null : make(e);
  }
  @Override public SB str( SB sb ) { return _elem.str(sb.p('[')).p(']'); }
}
