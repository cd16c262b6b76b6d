package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Semantic types.

   Unlike a lattice, these types are *gradual*: the Unknown type is consistent
   with everything, and consistency is not transitive.  Consistent types have a
   join, the most specific type consistent with both; inconsistent types have
   none and join to null.

   BNF for the pretty-printed types:
   T = Int | Float | Bool | String |
       ?                  | // Unknown, a gap; ?syn is the SynSwitch flavor
       name               | // Type variable, bound in a Ctx
       [T]                | // List
       T -> T             | // Arrow, right associative
       (T, T, ...)        | // Product; () is unit
       A + B(T) + ...     | // Sum of tags, each with an optional payload
       rec name. T        | // Recursive type, binding name in T

   Types are immutable and compared structurally.  Alpha-equivalence over rec
   binders is {@link #eq}.
*/
public abstract class Typ {
  // Simple types use a simple enum
  static final byte TBASE =1;
  static final byte TUNK  =2;
  static final byte TVAR  =3;
  static final byte TLIST =4;
  static final byte TARROW=5;
  static final byte TPROD =6;
  static final byte TSUM  =7;
  static final byte TREC  =8;

  final byte _type;
  private int _hash;            // Lazily computed, zero if not set

  Typ( byte type ) { _type = type; }

  // Common constants.  Subclasses carry no statics of their own, so class
  // initialization order never sees a half-built constant.
  public static final TypBase INT  = new TypBase("Int"   );
  public static final TypBase FLT  = new TypBase("Float" );
  public static final TypBase BOOL = new TypBase("Bool"  );
  public static final TypBase STR  = new TypBase("String");
  public static final TypUnknown UNK       = new TypUnknown(false); // Internal: a genuine gap
  public static final TypUnknown SYNSWITCH = new TypUnknown(true ); // Redirects analysis to synthesis
  public static final TypProd UNIT = new TypProd(new Typ[0]);

  // ----------
  // Structural hash & equals
  @Override public final int hashCode() {
    if( _hash==0 ) { int h = compute_hash(); _hash = h==0 ? 0xcafebabe : h; }
    return _hash;
  }
  abstract int compute_hash();
  @Override public abstract boolean equals( Object o );

  // Apply 'f' to the immediate child types, rebuilding if any changed.
  abstract Typ walk( UnaryOperator<Typ> f );
  // True if 'p' holds for this or any child type
  abstract boolean any( Predicate<Typ> p );

  // Alpha-equivalence; equal up to renaming rec binders
  public static boolean eq( Typ t1, Typ t2 ) {
    if( t1==t2 ) return true;
    if( t1._type != t2._type ) return false;
    return t1.eq0(t2);
  }
  abstract boolean eq0( Typ t );

  // ----------
  // Printing
  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str( SB sb );
  // Print with parens if this type binds looser than an arrow argument
  SB str_arg( SB sb ) {
    boolean paren = _type==TARROW || _type==TSUM || _type==TREC;
    if( paren ) sb.p('(');
    str(sb);
    return paren ? sb.p(')') : sb;
  }

  // ----------
  // Substitute 's' for the free type variable 'x'.  Rec binders of 'x' shadow.
  public Typ subst( Typ s, String x ) { return walk(t -> t.subst(s,x)); }

  // Free type variables
  public final HashSet<String> free_vars() {
    HashSet<String> fvs = new HashSet<>();
    _free_vars(new HashSet<>(),fvs);
    return fvs;
  }
  void _free_vars( HashSet<String> bound, HashSet<String> fvs ) {
    walk(t -> { t._free_vars(bound,fvs); return t; });
  }

  // SynSwitch is a control-flow marker for modes.  It may never escape into a
  // reported type.
  public final boolean has_synswitch() { return any(t -> t==SYNSWITCH); }
  public final Typ internalize() { return has_synswitch() ? _internalize() : this; }
  Typ _internalize() { return walk(Typ::_internalize); }

  // ----------
  /** Join of two types under a context, or null if inconsistent.  Unknown
   *  absorbs; aliases bound in the context and recursive types are unfolded
   *  as needed. */
  public static @Nullable Typ join( @NotNull Ctx ctx, @NotNull Typ t1, @NotNull Typ t2 ) {
    if( t1 instanceof TypUnknown u1 )
      return t2 instanceof TypUnknown u2 ? TypUnknown.join(u1,u2) : t2;
    if( t2 instanceof TypUnknown ) return t1;
    if( t1 instanceof TypVar v1 && t2 instanceof TypVar v2 && v1._name.equals(v2._name) )
      return t1;
    if( t1 instanceof TypVar v1 ) return join_var(ctx,v1,t2,false);
    if( t2 instanceof TypVar v2 ) return join_var(ctx,v2,t1,true );
    if( t1 instanceof TypRec r1 && t2 instanceof TypRec r2 ) {
      // Join bodies, renaming the 2nd binder to the 1st.  The binder is
      // abstract inside the body.
      Ctx ctx2 = ctx.extend_tvar(r1._name,-1);
      Typ body = join(ctx2,r1._body,r2._body.subst(TypVar.make(r1._name),r2._name));
      return body==null ? null : TypRec.make(r1._name,body);
    }
    if( t1 instanceof TypRec r1 ) return join(ctx,r1.unroll(),t2);
    if( t2 instanceof TypRec r2 ) return join(ctx,t1,r2.unroll());
    if( t1._type != t2._type ) return null;
    return t1.join0(ctx,t2);
  }
  // Same head, join parts
  abstract Typ join0( Ctx ctx, Typ t );

  // Join a type variable against some other type, via its alias.  Abstract or
  // unbound variables only join with themselves.
  private static Typ join_var( Ctx ctx, TypVar v, Typ t, boolean flip ) {
    Typ alias = ctx.lookup_alias(v._name);
    if( alias==null ) return null;
    Typ j = flip ? join(ctx,t,alias) : join(ctx,alias,t);
    if( j==null ) return null;
    // Keep the name, if the join did not refine the alias
    return eq(alias,j) ? v : j;
  }

  public static boolean consistent( Ctx ctx, Typ t1, Typ t2 ) { return join(ctx,t1,t2)!=null; }

  // Fold join over all; null on the first failure.  No types joins to null,
  // callers handle the no-branches case.
  public static @Nullable Typ join_all( Ctx ctx, Typ... ts ) {
    if( ts.length==0 ) return null;
    Typ j = ts[0];
    for( int i=1; i<ts.length && j!=null; i++ )
      j = join(ctx,j,ts[i]);
    return j;
  }

  // ----------
  // Expose the head constructor: unfold aliases and recursive types.
  public static Typ weak_head_normalize( Ctx ctx, Typ t ) {
    for( int cnt=0; ; cnt++ ) {
      assert cnt < 1000 : "unbounded unfolding of "+t;
      if( t instanceof TypVar v ) {
        Typ alias = ctx.lookup_alias(v._name);
        if( alias==null ) return t;
        t = alias;
      } else if( t instanceof TypRec r ) {
        t = r.unroll();
      } else return t;
    }
  }

  // Destructure an arrow; anything else (including Unknown) recovers with an
  // Unknown pair so an ill-typed application still has *a* type.
  public static TypArrow matched_arrow( Ctx ctx, Typ t ) {
    Typ w = weak_head_normalize(ctx,t);
    return w instanceof TypArrow a ? a : TypArrow.make(UNK,UNK);
  }
  public static Typ matched_list( Ctx ctx, Typ t ) {
    Typ w = weak_head_normalize(ctx,t);
    return w instanceof TypList l ? l._elem : UNK;
  }
  public static Typ[] matched_prod( Ctx ctx, int len, Typ t ) {
    Typ w = weak_head_normalize(ctx,t);
    if( w instanceof TypProd p && p._ts.length==len ) return p._ts.clone();
    Typ[] ts = new Typ[len];
    java.util.Arrays.fill(ts,UNK);
    return ts;
  }
  // The sum behind a type, or null
  public static @Nullable TypSum sum_of( Ctx ctx, Typ t ) {
    return weak_head_normalize(ctx,t) instanceof TypSum s ? s : null;
  }
}
