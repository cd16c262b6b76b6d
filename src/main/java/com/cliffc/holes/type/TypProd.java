package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// Products (tuples).  The zero-length product is unit.
public final class TypProd extends Typ {
  public final Typ[] _ts;
  TypProd( Typ[] ts ) { super(TPROD); _ts=ts; }
  public static TypProd make( Typ... ts ) { return ts.length==0 ? UNIT : new TypProd(ts); }
  public int len() { return _ts.length; }
  public Typ at( int i ) { return _ts[i]; }
  @Override int compute_hash() { return Util.mix_hash(TPROD,Util.hash(_ts)); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypProd p) || p._ts.length!=_ts.length ) return false;
    for( int i=0; i<_ts.length; i++ )
      if( !_ts[i].equals(p._ts[i]) )
        return false;
    return true;
  }
  @Override boolean eq0( Typ t ) {
    TypProd p = (TypProd)t;
    if( p._ts.length!=_ts.length ) return false;
    for( int i=0; i<_ts.length; i++ )
      if( !eq(_ts[i],p._ts[i]) )
        return false;
    return true;
  }
  @Override Typ walk( UnaryOperator<Typ> f ) {
    Typ[] ts = null;
    for( int i=0; i<_ts.length; i++ ) {
      Typ t = f.apply(_ts[i]);
      if( t!=_ts[i] ) {
        if( ts==null ) ts = _ts.clone();
        ts[i] = t;
      }
    }
    return ts==null ? this : make(ts);
  }
  @Override boolean any( Predicate<Typ> p ) {
    if( p.test(this) ) return true;
    for( Typ t : _ts ) if( t.any(p) ) return true;
    return false;
  }
  @Override Typ join0( Ctx ctx, Typ t ) {
    TypProd p = (TypProd)t;
    if( p._ts.length!=_ts.length ) return null;
    Typ[] ts = new Typ[_ts.length];
    for( int i=0; i<_ts.length; i++ )
      if( (ts[i] = join(ctx,_ts[i],p._ts[i]))==null )
        return null;
    return make(ts);
  }
  @Override public SB str( SB sb ) {
    sb.p('(');
    for( Typ t : _ts ) t.str(sb).p(", ");
    if( _ts.length>0 ) sb.unchar(2);
    return sb.p(')');
  }
}
