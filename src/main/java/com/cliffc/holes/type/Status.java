package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;

import java.util.Arrays;
import java.util.Objects;

/** Error status of a term: the reconciliation of its mode and its self.
 *
 *  In-hole statuses are errors; the term's type is replaced by Unknown for
 *  its parent.  Not-in-hole statuses carry the synthesized, expected and
 *  joined types as appropriate.  Inconsistency among branches analyzed
 *  against an expected type is reported but is not in-hole; the expected type
 *  is authoritative.
 */
public final class Status {
  public enum Kind {
    // Not in hole
    SYN_CONSISTENT,             // _syn
    ANA_CONSISTENT,             // _ana, _syn, _join
    ANA_INTERNAL_INCONSISTENT,  // _ana, _srcs
    ANA_EXTERNAL_INCONSISTENT,  // _ana, _syn
    // In hole
    FREE,                       // _free
    SYN_INCONSISTENT_BRANCHES,  // _srcs
    TYPE_INCONSISTENT,          // _syn, _ana
    NO_FUN;                     // _syn; a callee which is not a function
    public boolean in_hole() { return ordinal() >= FREE.ordinal(); }
  }

  public final Kind _kind;
  public final Typ _syn, _ana, _join;
  public final Self.Source[] _srcs;
  public final Self.Free _free;

  private Status( Kind kind, Typ syn, Typ ana, Typ join, Self.Source[] srcs, Self.Free free ) {
    _kind=kind; _syn=syn; _ana=ana; _join=join; _srcs=srcs; _free=free;
  }
  private static Status make( Kind kind, Typ syn, Typ ana, Typ join ) { return new Status(kind,syn,ana,join,null,null); }

  public boolean in_hole() { return _kind.in_hole(); }

  public static Status of( Ctx ctx, Mode mode, Self self ) {
    switch( self._kind ) {
    case FREE:  return new Status(Kind.FREE,null,null,null,null,self._free);
    case MULTI: return make(Kind.SYN_CONSISTENT,Typ.UNK,null,null);
    default: break;
    }
    switch( mode._kind ) {
    case SYN:
    case SYN_FUN: {
      Typ syn;
      if( self._kind==Self.Kind.JUST ) syn = self._ty;
      else {
        Typ j = Typ.join_all(ctx,tys(self._srcs));
        if( j==null ) return new Status(Kind.SYN_INCONSISTENT_BRANCHES,null,null,null,self._srcs,null);
        syn = self._wrap.apply(j);
      }
      if( mode._kind==Mode.Kind.SYN_FUN && !Typ.consistent(ctx,syn,TypArrow.make(Typ.UNK,Typ.UNK)) )
        return make(Kind.NO_FUN,syn,null,null);
      return make(Kind.SYN_CONSISTENT,syn,null,null);
    }
    case ANA: {
      Typ ana = mode._ana;
      if( self._kind==Self.Kind.JUST ) {
        Typ j = Typ.join(ctx,ana,self._ty);
        return j==null
          ? make(Kind.TYPE_INCONSISTENT,self._ty,ana,null)
          : make(Kind.ANA_CONSISTENT,self._ty,ana,j);
      }
      Typ bj = Typ.join_all(ctx,tys(self._srcs));
      if( bj==null ) return new Status(Kind.ANA_INTERNAL_INCONSISTENT,null,ana,null,self._srcs,null);
      Typ syn = self._wrap.apply(bj);
      Typ j = Typ.join(ctx,ana,syn);
      return j==null
        ? make(Kind.ANA_EXTERNAL_INCONSISTENT,syn,ana,null)
        : make(Kind.ANA_CONSISTENT,syn,ana,j);
    }
    default: throw new IllegalStateException();
    }
  }
  private static Typ[] tys( Self.Source[] srcs ) {
    Typ[] tys = new Typ[srcs.length];
    for( int i=0; i<srcs.length; i++ ) tys[i] = srcs[i]._ty;
    return tys;
  }

  // The status as recorded, with any SynSwitch read as Unknown
  public Status internalize() {
    if( !has_synswitch(_syn) && !has_synswitch(_ana) && !has_synswitch(_join) && !has_synswitch(_srcs) )
      return this;
    Self.Source[] srcs = null;
    if( _srcs!=null ) {
      srcs = new Self.Source[_srcs.length];
      for( int i=0; i<srcs.length; i++ ) srcs[i] = new Self.Source(_srcs[i]._id,_srcs[i]._ty.internalize());
    }
    return new Status(_kind,in(_syn),in(_ana),in(_join),srcs,_free);
  }
  private static boolean has_synswitch( Typ t ) { return t!=null && t.has_synswitch(); }
  private static boolean has_synswitch( Self.Source[] srcs ) {
    if( srcs!=null )
      for( Self.Source s : srcs )
        if( s._ty.has_synswitch() ) return true;
    return false;
  }
  private static Typ in( Typ t ) { return t==null ? null : t.internalize(); }

  /** The type passed on to the parent after error recovery.  In-hole terms
   *  are Unknown; otherwise the join, or the expected type if the term is
   *  inconsistent with it. */
  public Typ fixed() {
    return switch( _kind ) {
    case SYN_CONSISTENT -> _syn;
    case ANA_CONSISTENT -> _join;
    case ANA_INTERNAL_INCONSISTENT, ANA_EXTERNAL_INCONSISTENT -> _ana;
    case FREE, SYN_INCONSISTENT_BRANCHES, TYPE_INCONSISTENT, NO_FUN -> Typ.UNK;
    };
  }

  // Human readable message, for editors
  public String msg() {
    SB sb = new SB();
    switch( _kind ) {
    case SYN_CONSISTENT: case ANA_CONSISTENT: return "ok";
    case ANA_INTERNAL_INCONSISTENT: return branches(sb.p("Branches are inconsistent with each other: ")).toString();
    case ANA_EXTERNAL_INCONSISTENT: return _ana.str(_syn.str(sb.p("Branches have type ")).p(", expected ")).toString();
    case FREE: return switch( _free ) {
      case VARIABLE -> "Unbound variable";
      case TAG -> "Unbound constructor";
      case TYPE_VARIABLE -> "Unbound type variable";
      };
    case SYN_INCONSISTENT_BRANCHES: return branches(sb.p("Branches have inconsistent types: ")).toString();
    case TYPE_INCONSISTENT: return _ana.str(_syn.str(sb).p(" is not consistent with ")).toString();
    case NO_FUN: return _syn.str(sb.p("Not a function: ")).toString();
    default: throw new IllegalStateException();
    }
  }
  private SB branches( SB sb ) {
    for( Self.Source s : _srcs ) s._ty.str(sb).p(", ");
    return sb.unchar(2);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Status s && _kind==s._kind && Objects.equals(_syn,s._syn) &&
      Objects.equals(_ana,s._ana) && Objects.equals(_join,s._join) &&
      Arrays.equals(_srcs,s._srcs) && _free==s._free;
  }
  @Override public int hashCode() { return Objects.hash(_kind,_syn,_ana,_join,Arrays.hashCode(_srcs),_free); }
  @Override public String toString() {
    SB sb = new SB().p(in_hole() ? "InHole(" : "NotInHole(").p(_kind.name());
    if( _syn !=null ) _syn .str(sb.p(" syn=" ));
    if( _ana !=null ) _ana .str(sb.p(" ana=" ));
    if( _join!=null ) _join.str(sb.p(" join="));
    if( _srcs!=null ) sb.p(" srcs=").p(Arrays.toString(_srcs));
    if( _free!=null ) sb.p(' ').p(_free.name());
    return sb.p(')').toString();
  }
}
