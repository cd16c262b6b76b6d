package com.cliffc.holes.statics;

import com.cliffc.holes.ctx.CoCtx;
import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.term.Form;
import com.cliffc.holes.term.Term;
import com.cliffc.holes.type.Mode;
import com.cliffc.holes.type.Self;
import com.cliffc.holes.type.Status;
import com.cliffc.holes.type.Typ;
import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/** Statics of one term node.  One Info per node, shared by all its ids.
 *  Infos compare structurally so whole maps can be compared. */
public abstract class Info {
  public final Term _term;
  Info( Term term ) { _term=term; }

  public Form cls() { return _term._form; }
  public abstract boolean is_error();
  public abstract SB str( SB sb );
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public int hashCode() { return _term.hashCode(); }
  @Override public boolean equals( Object o ) {
    return this==o || (o != null && getClass()==o.getClass() && _term.equals(((Info)o)._term) && eq((Info)o));
  }
  abstract boolean eq( Info i );

  // An unparseable node of any sort.  Whitespace is not an error.
  public static final class Invalid extends Info {
    Invalid( Term term ) { super(term); }
    @Override public boolean is_error() { return !Util.isBlank(_term.text()); }
    @Override boolean eq( Info i ) { return true; }
    @Override public SB str( SB sb ) { return sb.p("Invalid ").pq(_term.text()); }
  }

  public static final class Exp extends Info {
    public final Mode _mode;
    public final Self _self;
    public final Ctx _ctx;
    public final CoCtx _co;     // Free variable uses
    public final Status _status;
    public final Typ _ty;       // Fixed type; what the parent sees
    Exp( Term term, Mode mode, Self self, Ctx ctx, CoCtx co, Status status, Typ ty ) {
      super(term); _mode=mode; _self=self; _ctx=ctx; _co=co; _status=status; _ty=ty;
    }
    @Override public boolean is_error() { return _status.in_hole(); }
    @Override boolean eq( Info i ) {
      Exp e = (Exp)i;
      return _mode.equals(e._mode) && _self.equals(e._self) && _ctx.equals(e._ctx) &&
        _co.equals(e._co) && _status.equals(e._status) && _ty.equals(e._ty);
    }
    @Override public SB str( SB sb ) {
      sb.p("Exp ").p(cls()._str).p(' ');
      _ty.str(_self.str(_mode.str(sb).p(' ')).p(" : "));
      return is_error() ? sb.p(' ').p(_status.toString()) : sb;
    }
  }

  public static final class Pat extends Info {
    public final Mode _mode;
    public final Self _self;
    public final Ctx _ctx;      // Context in
    public final Ctx _ctx_out;  // Context extended with this pattern's bindings
    public final Status _status;
    public final Typ _ty;
    public final @Nullable ImmutableList<CoCtx.Use> _uses; // Variable patterns only
    Pat( Term term, Mode mode, Self self, Ctx ctx, Ctx ctx_out, Status status, Typ ty, ImmutableList<CoCtx.Use> uses ) {
      super(term); _mode=mode; _self=self; _ctx=ctx; _ctx_out=ctx_out; _status=status; _ty=ty; _uses=uses;
    }
    @Override public boolean is_error() { return _status.in_hole(); }
    // A variable binding nothing refers to.  A warning, not an error.
    public boolean unused() { return _uses!=null && _uses.isEmpty(); }
    @Override boolean eq( Info i ) {
      Pat p = (Pat)i;
      return _mode.equals(p._mode) && _self.equals(p._self) && _ctx.equals(p._ctx) &&
        _ctx_out.equals(p._ctx_out) && _status.equals(p._status) && _ty.equals(p._ty) &&
        Objects.equals(_uses,p._uses);
    }
    @Override public SB str( SB sb ) {
      sb.p("Pat ").p(cls()._str).p(' ');
      _ty.str(_self.str(_mode.str(sb).p(' ')).p(" : "));
      if( unused() ) sb.p(" unused");
      return is_error() ? sb.p(' ').p(_status.toString()) : sb;
    }
  }

  // Surface types have no mode
  public static final class Ty extends Info {
    public final Self _self;
    public final Ctx _ctx;
    public final Typ _ty;
    Ty( Term term, Self self, Ctx ctx, Typ ty ) { super(term); _self=self; _ctx=ctx; _ty=ty; }
    @Override public boolean is_error() { return _self._kind==Self.Kind.FREE; }
    @Override boolean eq( Info i ) {
      Ty t = (Ty)i;
      return _self.equals(t._self) && _ctx.equals(t._ctx) && _ty.equals(t._ty);
    }
    @Override public SB str( SB sb ) {
      _ty.str(sb.p("Typ ").p(cls()._str).p(' '));
      return is_error() ? sb.p(" free") : sb;
    }
  }

  public static final class Rul extends Info {
    public final Ctx _ctx;
    Rul( Term term, Ctx ctx ) { super(term); _ctx=ctx; }
    @Override public boolean is_error() { return false; }
    @Override boolean eq( Info i ) { return _ctx.equals(((Rul)i)._ctx); }
    @Override public SB str( SB sb ) { return sb.p("Rule"); }
  }

  // Type pattern.  A name shadowing a base or built-in type is an error and
  // binds nothing.
  public static final class TPat extends Info {
    public final Ctx _ctx;
    public final boolean _shadows;
    TPat( Term term, Ctx ctx, boolean shadows ) { super(term); _ctx=ctx; _shadows=shadows; }
    @Override public boolean is_error() { return _shadows; }
    // Binds a type name
    public boolean binds() { return cls()==Form.TP_VAR && !_shadows; }
    @Override boolean eq( Info i ) { TPat t = (TPat)i; return _shadows==t._shadows && _ctx.equals(t._ctx); }
    @Override public SB str( SB sb ) {
      sb.p("TPat ").p(cls()._str);
      return _shadows ? sb.p(" shadows ").p(_term.name()) : sb;
    }
  }

  // One entry of a sum definition.  A tag defined twice is an error on the
  // second one, which is left out of the sum.
  public static final class TSum extends Info {
    public final Ctx _ctx;
    public final @Nullable String _tag;  // Null for holes
    public final @Nullable Typ _arg;     // Payload, if any
    public final boolean _dup;
    TSum( Term term, Ctx ctx, String tag, Typ arg, boolean dup ) { super(term); _ctx=ctx; _tag=tag; _arg=arg; _dup=dup; }
    @Override public boolean is_error() { return _dup; }
    @Override boolean eq( Info i ) {
      TSum t = (TSum)i;
      return _dup==t._dup && Objects.equals(_tag,t._tag) && Objects.equals(_arg,t._arg) && _ctx.equals(t._ctx);
    }
    @Override public SB str( SB sb ) {
      sb.p("TSum ").p(cls()._str);
      if( _tag!=null ) sb.p(' ').p(_tag);
      if( _arg!=null ) _arg.str(sb.p('(')).p(')');
      return _dup ? sb.p(" duplicate") : sb;
    }
  }
}
