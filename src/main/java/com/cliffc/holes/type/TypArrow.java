package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public final class TypArrow extends Typ {
  public final Typ _in, _out;
  private TypArrow( Typ in, Typ out ) { super(TARROW); _in=in; _out=out; }
  public static TypArrow make( Typ in, Typ out ) { return new TypArrow(in,out); }
  @Override int compute_hash() { return Util.mix_hash(TARROW,_in.hashCode(),_out.hashCode()); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof TypArrow a && _in.equals(a._in) && _out.equals(a._out));
  }
  @Override boolean eq0( Typ t ) {
    TypArrow a = (TypArrow)t;
    return eq(_in,a._in) && eq(_out,a._out);
  }
  @Override Typ walk( UnaryOperator<Typ> f ) {
    Typ in = f.apply(_in), out = f.apply(_out);
    return in==_in && out==_out ? this : make(in,out);
  }
  @Override boolean any( Predicate<Typ> p ) { return p.test(this) || _in.any(p) || _out.any(p); }
  @Override Typ join0( Ctx ctx, Typ t ) {
    TypArrow a = (TypArrow)t;
    Typ in = join(ctx,_in,a._in);
    if( in==null ) return null;
    Typ out = join(ctx,_out,a._out);
    return out==null ? null : make(in,out);
  }
  @Override public SB str( SB sb ) { return _out.str(_in.str_arg(sb).p(" -> ")); }
}
