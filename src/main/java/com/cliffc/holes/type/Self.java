package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.Arrays;
import java.util.Objects;

/** What a term says about its own type, before reconciling with the mode.
 *  <ul>
 *  <li>Just: a single type;
 *  <li>Joined: branches whose types must join, kept with their sources so an
 *      inconsistency can point at the offending branch;
 *  <li>Multi: a multi-hole, which has no type of its own;
 *  <li>Free: an unbound variable, tag or type variable.
 *  </ul>
 */
public final class Self {
  public enum Kind { JUST, JOINED, MULTI, FREE }
  public enum Free { VARIABLE, TAG, TYPE_VARIABLE }
  // How a joined type is wrapped once the sources join
  public enum Wrap {
    ID, LIST;
    public Typ apply( Typ t ) { return this==ID ? t : TypList.make(t); }
  }

  // A branch contributing to a join
  public static final class Source {
    public final int _id;
    public final Typ _ty;
    public Source( int id, Typ ty ) { _id=id; _ty=ty; }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Source s && _id==s._id && _ty.equals(s._ty));
    }
    @Override public int hashCode() { return _id*31+_ty.hashCode(); }
    @Override public String toString() { return _ty.str(new SB().p(_id).p(':')).toString(); }
  }

  public final Kind _kind;
  public final Typ _ty;         // JUST
  public final Wrap _wrap;      // JOINED
  public final Source[] _srcs;  // JOINED
  public final Free _free;      // FREE

  private Self( Kind kind, Typ ty, Wrap wrap, Source[] srcs, Free free ) {
    _kind=kind; _ty=ty; _wrap=wrap; _srcs=srcs; _free=free;
  }
  public static final Self MULTI = new Self(Kind.MULTI,null,null,null,null);
  public static Self just( Typ t ) { return new Self(Kind.JUST,t,null,null,null); }
  public static Self joined( Wrap wrap, Source[] srcs ) { return new Self(Kind.JOINED,null,wrap,srcs,null); }
  public static Self free( Free free ) { return new Self(Kind.FREE,null,null,null,free); }

  // Branches of an if or match: Just their join, or Joined if they disagree.
  // No branches at all is unknown.
  public static Self match( Ctx ctx, Typ[] tys, int[] ids ) { return join(ctx,Wrap.ID,tys,ids); }
  // Elements of a list literal.  An empty list is a list of unknown.
  public static Self listlit( Ctx ctx, Typ[] tys, int[] ids ) { return join(ctx,Wrap.LIST,tys,ids); }
  private static Self join( Ctx ctx, Wrap wrap, Typ[] tys, int[] ids ) {
    if( tys.length==0 ) return just(wrap.apply(Typ.UNK));
    Typ j = Typ.join_all(ctx,tys);
    if( j!=null ) return just(wrap.apply(j));
    Source[] srcs = new Source[tys.length];
    for( int i=0; i<tys.length; i++ ) srcs[i] = new Source(ids[i],tys[i]);
    return joined(wrap,srcs);
  }

  /** Self for a constructor tag.  An expected sum type (or arrow into one)
   *  carrying the tag wins over the context; otherwise look the tag up. */
  public static Self of_tag( Ctx ctx, Mode mode, String name ) {
    if( mode.is_ana() ) {
      Typ ty = mode._ana;
      TypSum sum = Typ.sum_of(ctx,ty);
      if( sum!=null && sum.has(name) ) {
        Typ arg = sum.arg(name);
        return just(arg==null ? ty : TypArrow.make(arg,ty));
      }
      if( Typ.weak_head_normalize(ctx,ty) instanceof TypArrow a ) {
        sum = Typ.sum_of(ctx,a._out);
        if( sum!=null && sum.arg(name)!=null )
          return just(TypArrow.make(sum.arg(name),a._out));
      }
    }
    Ctx.Entry e = ctx.lookup_tag(name);
    return e==null ? free(Free.TAG) : just(e._typ);
  }

  // Collapse to a single type.  Disagreeing branches and free names are unknown.
  public Typ typ( Ctx ctx ) {
    return switch( _kind ) {
    case JUST -> _ty;
    case JOINED -> {
      Typ[] tys = new Typ[_srcs.length];
      for( int i=0; i<tys.length; i++ ) tys[i] = _srcs[i]._ty;
      Typ j = Typ.join_all(ctx,tys);
      yield j==null ? Typ.UNK : _wrap.apply(j);
    }
    case MULTI, FREE -> Typ.UNK;
    };
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Self s && _kind==s._kind && Objects.equals(_ty,s._ty) &&
      _wrap==s._wrap && Arrays.equals(_srcs,s._srcs) && _free==s._free;
  }
  @Override public int hashCode() {
    return Objects.hash(_kind,_ty,_wrap,Arrays.hashCode(_srcs),_free);
  }
  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    return switch( _kind ) {
    case JUST -> _ty.str(sb.p("Just(")).p(')');
    case JOINED -> {
      sb.p("Joined(").p(_wrap.name());
      for( Source s : _srcs ) sb.p(", ").p(s.toString());
      yield sb.p(')');
    }
    case MULTI -> sb.p("Multi");
    case FREE -> sb.p("Free(").p(_free.name()).p(')');
    };
  }
}
