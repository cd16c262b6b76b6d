package com.cliffc.holes.statics;

import com.cliffc.holes.Builtins;
import com.cliffc.holes.Holes;
import com.cliffc.holes.ctx.CoCtx;
import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.term.Form;
import com.cliffc.holes.term.Op;
import com.cliffc.holes.term.Term;
import com.cliffc.holes.type.*;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;

/** Bidirectional statics over all term sorts.

   One pass computes, for every node, its mode, self, context, uses and error
   status, and records them in an id-keyed map.  Errors never stop the pass:
   an erroneous node recovers with a fixed type (see Status.fixed) and its
   parent carries on.

   Some nodes are traversed more than once: binders first look at their
   pattern to learn the context for their scope, then revisit it with the
   scope's uses.  Only one pass over any node records; the others pass a null
   map.

   SynSwitch unknowns steer the provisional pattern pass of a let, and the
   definition checked against it, but are never recorded: recorded modes,
   statuses and fixed types read them as plain unknowns.
 */
public abstract class Statics {

  /** Statics of a whole term under an initial context. */
  public static InfoMap mk( @NotNull Ctx ctx, @NotNull Term root ) {
    HashMap<Integer,Info> m = new HashMap<>();
    switch( root.sort() ) {
    case EXP: exp(ctx,Mode.SYN,root,m); break;
    default:  any(ctx,root,m);          break;
    }
    if( Holes.DEBUG ) Holes.p(null,"statics: "+m.size()+" ids");
    return new InfoMap(root,m);
  }

  // Record one shared info under all of a node's ids
  private static void record( HashMap<Integer,Info> m, Term t, Info info ) {
    if( m==null ) return;
    for( int id : t._ids ) {
      Info old = m.put(id,info);
      assert old==null || old.equals(info) : "conflicting statics for id "+id;
    }
  }

  // ---------------------------------------------------------------------
  // Expressions
  static Info.Exp exp( Ctx ctx, Mode mode, Term e, HashMap<Integer,Info> m ) {
    switch( e._form ) {
    case E_INVALID:
      record(m,e,new Info.Invalid(e));
      // The parent sees a hole
      return fin(ctx,mode,e,Self.just(Typ.UNK),CoCtx.EMPTY,null);
    case E_EMPTY_HOLE: return fin(ctx,mode,e,Self.just(Typ.UNK ),CoCtx.EMPTY,m);
    case E_TRIV:       return fin(ctx,mode,e,Self.just(Typ.UNIT),CoCtx.EMPTY,m);
    case E_BOOL:       return fin(ctx,mode,e,Self.just(Typ.BOOL),CoCtx.EMPTY,m);
    case E_INT:        return fin(ctx,mode,e,Self.just(Typ.INT ),CoCtx.EMPTY,m);
    case E_FLOAT:      return fin(ctx,mode,e,Self.just(Typ.FLT ),CoCtx.EMPTY,m);
    case E_STRING:     return fin(ctx,mode,e,Self.just(Typ.STR ),CoCtx.EMPTY,m);

    case E_MULTI_HOLE: {
      CoCtx[] cos = new CoCtx[e.len()];
      for( int i=0; i<cos.length; i++ )
        cos[i] = any(ctx,e.kid(i),m);
      return fin(ctx,mode,e,Self.MULTI,CoCtx.union(cos),m);
    }

    case E_LIST_LIT: {
      Mode em = mode.of_list(ctx);
      Info.Exp[] es = new Info.Exp[e.len()];
      for( int i=0; i<es.length; i++ )
        es[i] = exp(ctx,em,e.kid(i),m);
      return fin(ctx,mode,e,Self.listlit(ctx,tys(es),rep_ids(es)),cos(es),m);
    }

    case E_TAG: return fin(ctx,mode,e,Self.of_tag(ctx,mode,e.name()),CoCtx.EMPTY,m);

    case E_FUN: {
      Mode[] ms = mode.of_arrow(ctx);
      Info.Pat p0 = pat(ctx,ms[0],e.kid(0),false,null,null);
      Info.Exp body = exp(p0._ctx_out,ms[1],e.kid(1),m);
      Info.Pat p = pat(ctx,ms[0],e.kid(0),false,body._co,m);
      Self self = Self.just(TypArrow.make(p._ty,body._ty));
      return fin(ctx,mode,e,self,CoCtx.mk(ctx,p0._ctx_out,body._co),m);
    }

    case E_TUPLE: {
      Mode[] ms = mode.of_prod(ctx,e.len());
      Info.Exp[] es = new Info.Exp[e.len()];
      for( int i=0; i<es.length; i++ )
        es[i] = exp(ctx,ms[i],e.kid(i),m);
      return fin(ctx,mode,e,Self.just(TypProd.make(tys(es))),cos(es),m);
    }

    case E_VAR: {
      Ctx.Entry v = ctx.lookup_var(e.name());
      return v==null
        ? fin(ctx,mode,e,Self.free(Self.Free.VARIABLE),CoCtx.EMPTY,m)
        : fin(ctx,mode,e,Self.just(v._typ),CoCtx.singleton(e.name(),e.rep_id(),mode),m);
    }

    case E_LET:      return let  (ctx,mode,e,m);
    case E_TY_ALIAS: return alias(ctx,mode,e,m);

    case E_AP: {
      Term fn = e.kid(0);
      String ctr = fn._form==Form.E_TAG ? fn.name() : null;
      Info.Exp f = exp(ctx,mode.of_ap(ctx,ctr),fn,m);
      TypArrow ar = Typ.matched_arrow(ctx,f._ty);
      Info.Exp a = exp(ctx,Mode.ana(ar._in),e.kid(1),m);
      return fin(ctx,mode,e,Self.just(ar._out),CoCtx.union(f._co,a._co),m);
    }

    case E_IF: {
      Info.Exp c = exp(ctx,Mode.ana(Typ.BOOL),e.kid(0),m);
      Info.Exp t = exp(ctx,mode,e.kid(1),m);
      Info.Exp f = exp(ctx,mode,e.kid(2),m);
      Info.Exp[] bs = {t,f};
      return fin(ctx,mode,e,Self.match(ctx,tys(bs),rep_ids(bs)),CoCtx.union(c._co,t._co,f._co),m);
    }

    case E_SEQ: {
      Info.Exp e1 = exp(ctx,Mode.SYN,e.kid(0),m);
      Info.Exp e2 = exp(ctx,mode,e.kid(1),m);
      return fin(ctx,mode,e,Self.just(e2._ty),CoCtx.union(e1._co,e2._co),m);
    }

    case E_TEST: {
      Info.Exp t = exp(ctx,Mode.ana(Typ.BOOL),e.kid(0),m);
      return fin(ctx,mode,e,Self.just(Typ.UNIT),t._co,m);
    }

    case E_PARENS: {
      Info.Exp k = exp(ctx,mode,e.kid(0),m);
      return fin(ctx,mode,e,Self.just(k._ty),k._co,m);
    }

    case E_CONS: {
      Info.Exp hd = exp(ctx,mode.of_cons_hd(ctx),e.kid(0),m);
      Info.Exp tl = exp(ctx,mode.of_cons_tl(ctx,hd._ty),e.kid(1),m);
      return fin(ctx,mode,e,Self.just(TypList.make(hd._ty)),CoCtx.union(hd._co,tl._co),m);
    }

    case E_LIST_CONCAT: {
      Mode lm = mode.of_list_concat(ctx);
      Info.Exp[] es = { exp(ctx,lm,e.kid(0),m), exp(ctx,lm,e.kid(1),m) };
      return fin(ctx,mode,e,Self.match(ctx,tys(es),rep_ids(es)),cos(es),m);
    }

    case E_UN_OP: {
      Op op = e.op();
      Info.Exp a = exp(ctx,Mode.ana(op._arg),e.kid(0),m);
      return fin(ctx,mode,e,Self.just(op._ret),a._co,m);
    }

    case E_BIN_OP: {
      Op op = e.op();
      Info.Exp a = exp(ctx,Mode.ana(op._arg),e.kid(0),m);
      Info.Exp b = exp(ctx,Mode.ana(op._arg),e.kid(1),m);
      return fin(ctx,mode,e,Self.just(op._ret),CoCtx.union(a._co,b._co),m);
    }

    case E_MATCH: {
      Info.Exp scrut = exp(ctx,Mode.SYN,e.kid(0),m);
      Mode pm = Mode.ana(scrut._ty);
      CoCtx[] cos = new CoCtx[e.len()];
      cos[0] = scrut._co;
      ArrayList<Info.Exp> bodies = new ArrayList<>();
      for( int i=1; i<e.len(); i++ ) {
        Term r = e.kid(i);
        if( r._form!=Form.RULE ) { cos[i] = any(ctx,r,m); continue; }
        Arm arm = rule(ctx,pm,mode,r,m);
        bodies.add(arm._body);
        cos[i] = arm._co;
      }
      Info.Exp[] bs = bodies.toArray(new Info.Exp[0]);
      return fin(ctx,mode,e,Self.match(ctx,tys(bs),rep_ids(bs)),CoCtx.union(cos),m);
    }

    default: throw Holes.bug("not an expression: "+e._form);
    }
  }

  // Reconcile mode and self, and record
  private static Info.Exp fin( Ctx ctx, Mode mode, Term e, Self self, CoCtx co, HashMap<Integer,Info> m ) {
    Status st = Status.of(ctx,mode,self);
    Info.Exp info = new Info.Exp(e,mode.internalize(),self,ctx,co,st.internalize(),st.fixed().internalize());
    record(m,e,info);
    return info;
  }

  private static Typ[] tys( Info.Exp[] es ) {
    Typ[] ts = new Typ[es.length];
    for( int i=0; i<es.length; i++ ) ts[i] = es[i]._ty;
    return ts;
  }
  private static int[] rep_ids( Info.Exp[] es ) {
    int[] ids = new int[es.length];
    for( int i=0; i<es.length; i++ ) ids[i] = es[i]._term.rep_id();
    return ids;
  }
  private static CoCtx cos( Info.Exp[] es ) {
    CoCtx[] cos = new CoCtx[es.length];
    for( int i=0; i<es.length; i++ ) cos[i] = es[i]._co;
    return CoCtx.union(cos);
  }

  /* Let.  The pattern is first synthesized with SynSwitch unknowns, which
     either bounces the definition back to synthesis or hands it the
     annotation.  The definition's type then flows back into the pattern for
     the body's context.  A recursive definition sees the provisional
     bindings. */
  private static Info.Exp let( Ctx ctx, Mode mode, Term e, HashMap<Integer,Info> m ) {
    Term p = e.kid(0), d = e.kid(1), b = e.kid(2);
    Info.Pat ps = pat(ctx,Mode.SYN,p,true,null,null);
    boolean rec = is_recursive(p,d);
    Ctx dctx = rec ? ps._ctx_out : ctx;
    Info.Exp def = exp(dctx,Mode.ana(ps._ty),d,m);
    Mode pm = Mode.ana(def._ty);
    Info.Pat pa = pat(ctx,pm,p,false,null,null);
    Info.Exp body = exp(pa._ctx_out,mode,b,m);
    pat(ctx,pm,p,false,rec ? CoCtx.union(def._co,body._co) : body._co,m);
    CoCtx co = CoCtx.union(CoCtx.mk(ctx,dctx,def._co),CoCtx.mk(ctx,pa._ctx_out,body._co));
    return fin(ctx,mode,e,Self.just(body._ty),co,m);
  }

  // A let is recursive if it binds functions: a variable (or tuple of them),
  // optionally annotated with an arrow type, defined by a function literal
  // (or a tuple of the same arity of them).
  static boolean is_recursive( Term p, Term d ) {
    p = strip(p,Form.P_PARENS);
    d = strip(d,Form.E_PARENS);
    if( p._form==Form.P_TUPLE )
      return d._form==Form.E_TUPLE && d.len()==p.len() && all_fun_vars(p) && all_funs(d);
    return is_fun_var(p) && strip(d,Form.E_PARENS)._form==Form.E_FUN;
  }
  private static Term strip( Term t, Form parens ) {
    while( t._form==parens ) t = t.kid(0);
    return t;
  }
  private static boolean is_fun_var( Term p ) {
    p = strip(p,Form.P_PARENS);
    if( p._form==Form.P_VAR ) return true;
    return p._form==Form.P_TYPE_ANN &&
      strip(p.kid(0),Form.P_PARENS)._form==Form.P_VAR &&
      strip(p.kid(1),Form.T_PARENS)._form==Form.T_ARROW;
  }
  private static boolean all_fun_vars( Term p ) {
    for( Term k : p._kids ) if( !is_fun_var(k) ) return false;
    return true;
  }
  private static boolean all_funs( Term d ) {
    for( Term k : d._kids ) if( strip(k,Form.E_PARENS)._form!=Form.E_FUN ) return false;
    return true;
  }

  /* Type alias.  The name is abstract while its definition is read; if the
     definition mentions it, the alias is a recursive type.  Other aliases are
     resolved where the definition is written, so shadowing one later cannot
     change this one.  A sum's constructors are bound in the body, and the
     alias is substituted out of the body's type so it cannot escape its
     scope. */
  private static Info.Exp alias( Ctx ctx, Mode mode, Term e, HashMap<Integer,Info> m ) {
    Term tp = e.kid(0), ut = e.kid(1), body = e.kid(2);
    Info.TPat tpi = tpat(ctx,tp,m);
    if( !tpi.binds() ) {
      typ(ctx,ut,m);
      Info.Exp b = exp(ctx,mode,body,m);
      return fin(ctx,mode,e,Self.just(b._ty),b._co,m);
    }
    String name = tp.name();
    Typ pre = ctx.resolve(typ(ctx.extend_tvar(name,tp.rep_id()),ut,null)._ty,name);
    Typ def;
    if( pre instanceof TypVar v && v._name.equals(name) ) def = Typ.UNK; // type T = T
    else if( pre.free_vars().contains(name) ) def = TypRec.make(name,pre);
    else def = pre;
    // Bindings and the expectation from outside mean the shadowed alias
    Typ old = ctx.lookup_alias(name);
    Ctx outer = old==null ? ctx : ctx.subst(old,name);
    Mode bmode = old!=null && mode.is_ana() ? Mode.ana(mode._ana.subst(old,name)) : mode;
    Ctx cdef = outer.extend_alias(name,tp.rep_id(),def);
    typ(cdef,ut,m);
    Ctx cbody = cdef;
    TypSum sum = pre instanceof TypSum s ? s : Typ.sum_of(cdef,def);
    if( sum!=null ) {
      Typ self_ty = TypVar.make(name);
      for( int i=0; i<sum._tags.length; i++ ) {
        Typ a = sum._args[i];
        cbody = cbody.extend_tag(sum._tags[i],ut.rep_id(),a==null ? self_ty : TypArrow.make(a,self_ty));
      }
    }
    Info.Exp b = exp(cbody,bmode,body,m);
    return fin(ctx,mode,e,Self.just(b._ty.subst(def,name)),b._co,m);
  }

  // A match rule: the pattern against the scrutinee, the body in its scope
  private static final class Arm {
    final Info.Exp _body;
    final CoCtx _co;            // Uses escaping the rule
    Arm( Info.Exp body, CoCtx co ) { _body=body; _co=co; }
  }
  private static Arm rule( Ctx ctx, Mode pm, Mode mode, Term r, HashMap<Integer,Info> m ) {
    Info.Pat p0 = pat(ctx,pm,r.kid(0),false,null,null);
    Info.Exp body = exp(p0._ctx_out,mode,r.kid(1),m);
    pat(ctx,pm,r.kid(0),false,body._co,m);
    record(m,r,new Info.Rul(r,ctx));
    return new Arm(body,CoCtx.mk(ctx,p0._ctx_out,body._co));
  }

  // ---------------------------------------------------------------------
  // Patterns

  /** Pattern statics.
   *  @param ss  variables and wildcards are SynSwitch unknowns; only for the
   *             provisional pass of a let, never recorded
   *  @param co  the uses of the pattern's scope, or null if not tracked */
  static Info.Pat pat( Ctx ctx, Mode mode, Term p, boolean ss, CoCtx co, HashMap<Integer,Info> m ) {
    assert !ss || m==null;
    return pat0(ctx,mode,p,ss,co==null ? null : new Uses(co,p),m);
  }

  // Scope uses for the variables of one pattern.  A name bound twice in one
  // pattern is shadowed by its last binding, which takes all the uses.
  private static final class Uses {
    final CoCtx _co;
    final HashMap<String,Integer> _last = new HashMap<>();
    Uses( CoCtx co, Term p ) { _co=co; lasts(p); }
    private void lasts( Term p ) {
      switch( p._form ) {
      case P_VAR: _last.put(p.name(),p.rep_id()); break;
      case P_LIST_LIT: case P_CONS: case P_TUPLE: case P_PARENS: case P_AP:
        for( Term k : p._kids ) lasts(k);
        break;
      case P_TYPE_ANN: lasts(p.kid(0)); break;
      default: break;           // Nothing bound
      }
    }
    ImmutableList<CoCtx.Use> get( Term var ) {
      Integer last = _last.get(var.name());
      return last!=null && last==var.rep_id() ? _co.get(var.name()) : ImmutableList.of();
    }
  }

  private static Typ unk( boolean ss ) { return ss ? Typ.SYNSWITCH : Typ.UNK; }

  private static Info.Pat pat0( Ctx ctx, Mode mode, Term p, boolean ss, Uses u, HashMap<Integer,Info> m ) {
    switch( p._form ) {
    case P_INVALID:
      record(m,p,new Info.Invalid(p));
      return pfin(ctx,ctx,mode,p,Self.just(unk(ss)),null,ss,null);
    case P_EMPTY_HOLE:
    case P_WILD:   return pfin(ctx,ctx,mode,p,Self.just(unk(ss)),null,ss,m);
    case P_INT:    return pfin(ctx,ctx,mode,p,Self.just(Typ.INT ),null,ss,m);
    case P_FLOAT:  return pfin(ctx,ctx,mode,p,Self.just(Typ.FLT ),null,ss,m);
    case P_BOOL:   return pfin(ctx,ctx,mode,p,Self.just(Typ.BOOL),null,ss,m);
    case P_STRING: return pfin(ctx,ctx,mode,p,Self.just(Typ.STR ),null,ss,m);
    case P_TRIV:   return pfin(ctx,ctx,mode,p,Self.just(Typ.UNIT),null,ss,m);

    case P_MULTI_HOLE:
      for( Term k : p._kids ) any(ctx,k,m);
      return pfin(ctx,ctx,mode,p,Self.MULTI,null,ss,m);

    case P_LIST_LIT: {
      Mode em = mode.of_list(ctx);
      Ctx c = ctx;
      Typ[] tys = new Typ[p.len()];
      int[] ids = new int[p.len()];
      for( int i=0; i<tys.length; i++ ) {
        Info.Pat k = pat0(c,em,p.kid(i),ss,u,m);
        tys[i] = k._ty;  ids[i] = p.kid(i).rep_id();  c = k._ctx_out;
      }
      return pfin(ctx,c,mode,p,Self.listlit(ctx,tys,ids),null,ss,m);
    }

    case P_CONS: {
      Info.Pat hd = pat0(ctx,mode.of_cons_hd(ctx),p.kid(0),ss,u,m);
      Info.Pat tl = pat0(hd._ctx_out,mode.of_cons_tl(ctx,hd._ty),p.kid(1),ss,u,m);
      return pfin(ctx,tl._ctx_out,mode,p,Self.just(TypList.make(hd._ty)),null,ss,m);
    }

    case P_VAR: {
      // The binding takes its type from the mode
      Typ bty = Status.of(ctx,mode,Self.just(Typ.UNK)).fixed().internalize();
      Ctx out = ctx.extend_var(p.name(),p.rep_id(),bty);
      return pfin(ctx,out,mode,p,Self.just(unk(ss)),u==null ? null : u.get(p),ss,m);
    }

    case P_TUPLE: {
      Mode[] ms = mode.of_prod(ctx,p.len());
      Ctx c = ctx;
      Typ[] tys = new Typ[p.len()];
      for( int i=0; i<tys.length; i++ ) {
        Info.Pat k = pat0(c,ms[i],p.kid(i),ss,u,m);
        tys[i] = k._ty;  c = k._ctx_out;
      }
      return pfin(ctx,c,mode,p,Self.just(TypProd.make(tys)),null,ss,m);
    }

    case P_PARENS: {
      Info.Pat k = pat0(ctx,mode,p.kid(0),ss,u,m);
      return pfin(ctx,k._ctx_out,mode,p,Self.just(k._ty),null,ss,m);
    }

    case P_TAG: return pfin(ctx,ctx,mode,p,Self.of_tag(ctx,mode,p.name()),null,ss,m);

    case P_AP: {
      Term fn = p.kid(0);
      String ctr = fn._form==Form.P_TAG ? fn.name() : null;
      Info.Pat f = pat0(ctx,mode.of_ap(ctx,ctr),fn,ss,u,m);
      TypArrow ar = Typ.matched_arrow(ctx,f._ty);
      Info.Pat a = pat0(f._ctx_out,Mode.ana(ar._in),p.kid(1),ss,u,m);
      return pfin(ctx,a._ctx_out,mode,p,Self.just(ar._out),null,ss,m);
    }

    case P_TYPE_ANN: {
      Info.Ty t = typ(ctx,p.kid(1),m);
      Info.Pat k = pat0(ctx,Mode.ana(t._ty),p.kid(0),ss,u,m);
      return pfin(ctx,k._ctx_out,mode,p,Self.just(t._ty),null,ss,m);
    }

    default: throw Holes.bug("not a pattern: "+p._form);
    }
  }

  private static Info.Pat pfin( Ctx ctx, Ctx out, Mode mode, Term p, Self self, ImmutableList<CoCtx.Use> uses, boolean ss, HashMap<Integer,Info> m ) {
    Status st = Status.of(ctx,mode,self);
    Info.Pat info = ss
      ? new Info.Pat(p,mode,self,ctx,out,st,st.fixed(),uses)
      : new Info.Pat(p,mode.internalize(),self,ctx,out,st.internalize(),st.fixed().internalize(),uses);
    record(m,p,info);
    return info;
  }

  // ---------------------------------------------------------------------
  // Surface types

  static Info.Ty typ( Ctx ctx, Term t, HashMap<Integer,Info> m ) {
    switch( t._form ) {
    case T_INVALID:
      record(m,t,new Info.Invalid(t));
      return new Info.Ty(t,Self.just(Typ.UNK),ctx,Typ.UNK);
    case T_EMPTY_HOLE: return tfin(ctx,t,Self.just(Typ.UNK ),m);
    case T_INT:        return tfin(ctx,t,Self.just(Typ.INT ),m);
    case T_FLOAT:      return tfin(ctx,t,Self.just(Typ.FLT ),m);
    case T_BOOL:       return tfin(ctx,t,Self.just(Typ.BOOL),m);
    case T_STRING:     return tfin(ctx,t,Self.just(Typ.STR ),m);
    case T_MULTI_HOLE:
      for( Term k : t._kids ) any(ctx,k,m);
      return tfin(ctx,t,Self.MULTI,m);
    case T_LIST:   return tfin(ctx,t,Self.just(TypList.make(typ(ctx,t.kid(0),m)._ty)),m);
    case T_PARENS: return tfin(ctx,t,Self.just(typ(ctx,t.kid(0),m)._ty),m);
    case T_ARROW: {
      Typ in  = typ(ctx,t.kid(0),m)._ty;
      Typ out = typ(ctx,t.kid(1),m)._ty;
      return tfin(ctx,t,Self.just(TypArrow.make(in,out)),m);
    }
    case T_TUPLE: {
      Typ[] ts = new Typ[t.len()];
      for( int i=0; i<ts.length; i++ ) ts[i] = typ(ctx,t.kid(i),m)._ty;
      return tfin(ctx,t,Self.just(TypProd.make(ts)),m);
    }
    case T_VAR: {
      String name = t.name();
      Typ b = Builtins.type(name);
      if( b!=null ) return tfin(ctx,t,Self.just(b),m);
      if( ctx.lookup_tvar(name)!=null ) return tfin(ctx,t,Self.just(TypVar.make(name)),m);
      return tfin(ctx,t,Self.free(Self.Free.TYPE_VARIABLE),m);
    }
    case T_SUM: {
      HashSet<String> seen = new HashSet<>();
      ArrayList<String> tags = new ArrayList<>();
      ArrayList<Typ> args = new ArrayList<>();
      for( Term k : t._kids ) {
        Info.TSum s = tsum(ctx,k,seen,m);
        if( s!=null && s._tag!=null && !s._dup ) { tags.add(s._tag); args.add(s._arg); }
      }
      TypSum sum = TypSum.make(tags.toArray(new String[0]),args.toArray(new Typ[0]));
      return tfin(ctx,t,Self.just(sum),m);
    }
    default: throw Holes.bug("not a type: "+t._form);
    }
  }
  private static Info.Ty tfin( Ctx ctx, Term t, Self self, HashMap<Integer,Info> m ) {
    Info.Ty info = new Info.Ty(t,self,ctx,self.typ(ctx));
    record(m,t,info);
    return info;
  }

  // Type patterns
  static Info.TPat tpat( Ctx ctx, Term tp, HashMap<Integer,Info> m ) {
    Info.TPat info;
    switch( tp._form ) {
    case TP_INVALID:
      record(m,tp,new Info.Invalid(tp));
      return new Info.TPat(tp,ctx,false);
    case TP_EMPTY_HOLE: info = new Info.TPat(tp,ctx,false); break;
    case TP_MULTI_HOLE:
      for( Term k : tp._kids ) any(ctx,k,m);
      info = new Info.TPat(tp,ctx,false);
      break;
    case TP_VAR: info = new Info.TPat(tp,ctx,Builtins.is_type_name(tp.name())); break;
    default: throw Holes.bug("not a type pattern: "+tp._form);
    }
    record(m,tp,info);
    return info;
  }

  // One sum entry; 'seen' collects the tags defined so far.  Null for invalid.
  static Info.TSum tsum( Ctx ctx, Term s, HashSet<String> seen, HashMap<Integer,Info> m ) {
    Info.TSum info;
    switch( s._form ) {
    case TS_INVALID:
      record(m,s,new Info.Invalid(s));
      return null;
    case TS_EMPTY_HOLE: info = new Info.TSum(s,ctx,null,null,false); break;
    case TS_MULTI_HOLE:
      for( Term k : s._kids ) any(ctx,k,m);
      info = new Info.TSum(s,ctx,null,null,false);
      break;
    case TS_TAG: info = new Info.TSum(s,ctx,s.name(),null,!seen.add(s.name())); break;
    case TS_AP: {
      Typ arg = typ(ctx,s.kid(0),m)._ty;
      info = new Info.TSum(s,ctx,s.name(),arg,!seen.add(s.name()));
      break;
    }
    default: throw Holes.bug("not a sum entry: "+s._form);
    }
    record(m,s,info);
    return info;
  }

  // ---------------------------------------------------------------------
  // A term of any sort, synthesized in place; e.g. a piece of a multi-hole.
  // Returns the uses of free variables, for expressions.
  static CoCtx any( Ctx ctx, Term t, HashMap<Integer,Info> m ) {
    switch( t.sort() ) {
    case EXP:  return exp(ctx,Mode.SYN,t,m)._co;
    case PAT:  pat(ctx,Mode.SYN,t,false,null,m);  return CoCtx.EMPTY;
    case TYP:  typ(ctx,t,m);                      return CoCtx.EMPTY;
    case TPAT: tpat(ctx,t,m);                     return CoCtx.EMPTY;
    case TSUM: tsum(ctx,t,new HashSet<>(),m);     return CoCtx.EMPTY;
    case RUL:  return rule(ctx,Mode.SYN,Mode.SYN,t,m)._co;
    default: throw Holes.bug("unknown sort "+t.sort());
    }
  }
}
