package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.Objects;

/** Direction of checking: synthesize a type, synthesize the callee of an
 *  application, or analyze against an expected type.
 *
 *  Splitters push an expected type down into the parts of a compound term.
 *  Synthesis splits into synthesis; analysis destructures the expected type,
 *  recovering with unknowns when it has the wrong shape.
 */
public final class Mode {
  public enum Kind { SYN, SYN_FUN, ANA }

  public final Kind _kind;
  public final Typ _ana;        // Expected type, only for ANA

  private Mode( Kind kind, Typ ana ) { _kind=kind; _ana=ana; }
  public static final Mode SYN     = new Mode(Kind.SYN    ,null);
  public static final Mode SYN_FUN = new Mode(Kind.SYN_FUN,null);

  // Analyzing against SynSwitch means synthesizing
  public static Mode ana( Typ t ) {
    return t==Typ.SYNSWITCH ? SYN : new Mode(Kind.ANA,t);
  }

  public boolean is_ana() { return _kind==Kind.ANA; }

  // The mode as recorded: an expectation with SynSwitch parts reads as Unknown
  public Mode internalize() {
    return is_ana() && _ana.has_synswitch() ? new Mode(Kind.ANA,_ana.internalize()) : this;
  }

  // The type a mode expects, SynSwitch-flavored when it expects nothing
  public Typ ty() {
    return switch( _kind ) {
    case SYN     -> Typ.SYNSWITCH;
    case SYN_FUN -> TypArrow.make(Typ.SYNSWITCH,Typ.SYNSWITCH);
    case ANA     -> _ana;
    };
  }

  // Modes for the pattern and body of a function
  public Mode[] of_arrow( Ctx ctx ) {
    if( !is_ana() ) return new Mode[]{SYN,SYN};
    TypArrow a = Typ.matched_arrow(ctx,_ana);
    return new Mode[]{ana(a._in),ana(a._out)};
  }

  // Modes for the elements of a tuple
  public Mode[] of_prod( Ctx ctx, int len ) {
    Mode[] ms = new Mode[len];
    if( !is_ana() ) { java.util.Arrays.fill(ms,SYN); return ms; }
    Typ[] ts = Typ.matched_prod(ctx,len,_ana);
    for( int i=0; i<len; i++ ) ms[i] = ana(ts[i]);
    return ms;
  }

  // Mode for the elements of a list literal
  public Mode of_list( Ctx ctx ) {
    return is_ana() ? ana(Typ.matched_list(ctx,_ana)) : SYN;
  }
  public Mode of_cons_hd( Ctx ctx ) { return of_list(ctx); }
  // The tail of a cons is a list of the head's type when synthesizing
  public Mode of_cons_tl( Ctx ctx, Typ hd ) {
    return ana(TypList.make(is_ana() ? Typ.matched_list(ctx,_ana) : hd));
  }
  // Both sides of a concat are lists, even when synthesizing
  public Mode of_list_concat( Ctx ctx ) {
    return ana(TypList.make(is_ana() ? Typ.matched_list(ctx,_ana) : Typ.SYNSWITCH));
  }

  /** Mode for the function position of an application.  A constructor applied
   *  under an expected sum is analyzed against its arrow type, so the payload
   *  checks against the declared payload type.  Everything else synthesizes a
   *  callee.
   *  @param ctr the constructor name when the callee is a tag, or null */
  public Mode of_ap( Ctx ctx, String ctr ) {
    if( ctr==null || !is_ana() ) return SYN_FUN;
    TypSum sum = Typ.sum_of(ctx,_ana);
    if( sum==null || !sum.has(ctr) ) return SYN_FUN;
    Typ arg = sum.arg(ctr);
    return ana(TypArrow.make(arg==null ? Typ.UNK : arg,_ana));
  }

  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof Mode m && _kind==m._kind && Objects.equals(_ana,m._ana));
  }
  @Override public int hashCode() { return _kind.hashCode()*31 + Objects.hashCode(_ana); }
  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    return switch( _kind ) {
    case SYN     -> sb.p("Syn");
    case SYN_FUN -> sb.p("SynFun");
    case ANA     -> _ana.str(sb.p("Ana(")).p(')');
    };
  }
}
