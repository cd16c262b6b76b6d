package com.cliffc.holes.statics;

import com.cliffc.holes.Holes;
import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.term.Term;
import com.cliffc.holes.type.Mode;
import com.cliffc.holes.type.Typ;
import com.cliffc.holes.util.SB;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/** The statics of a term, by id.  Every id in the term has an entry; ids of
 *  one node share one Info.
 *
 *  Typed queries on an id whose info is of another kind (an invalid node, say)
 *  answer as for a hole: Unknown, under synthesis.
 */
public final class InfoMap {
  private final Term _root;
  private final HashMap<Integer,Info> _m;
  InfoMap( Term root, HashMap<Integer,Info> m ) { _root=root; _m=m; }

  public Term root() { return _root; }
  public int size() { return _m.size(); }
  public Set<Integer> ids() { return Collections.unmodifiableSet(_m.keySet()); }
  public @Nullable Info get( int id ) { return _m.get(id); }

  // The map is total over the term; a missing id is a bug in the caller or
  // the engine.
  public Info info( int id ) {
    Info info = _m.get(id);
    if( info==null ) throw Holes.bug("no statics for id "+id);
    return info;
  }
  public boolean is_error( int id ) { return info(id).is_error(); }

  private Info.Exp exp( int id ) { return info(id) instanceof Info.Exp e ? e : null; }
  private Info.Pat pat( int id ) { return info(id) instanceof Info.Pat p ? p : null; }

  // Fixed type of an expression
  public Typ exp_type( int id ) { Info.Exp e = exp(id); return e==null ? Typ.UNK : e._ty; }
  public Typ exp_self_type( int id ) { Info.Exp e = exp(id); return e==null ? Typ.UNK : e._self.typ(e._ctx); }
  public Mode exp_mode( int id ) { Info.Exp e = exp(id); return e==null ? Mode.SYN : e._mode; }
  public Ctx exp_ctx( int id ) { Info.Exp e = exp(id); return e==null ? Ctx.EMPTY : e._ctx; }

  public Typ pat_type( int id ) { Info.Pat p = pat(id); return p==null ? Typ.UNK : p._ty; }
  public Typ pat_self_type( int id ) { Info.Pat p = pat(id); return p==null ? Typ.UNK : p._self.typ(p._ctx); }
  public Mode pat_mode( int id ) { Info.Pat p = pat(id); return p==null ? Mode.SYN : p._mode; }
  // Context after the pattern's bindings
  public Ctx pat_ctx( int id ) { Info.Pat p = pat(id); return p==null ? Ctx.EMPTY : p._ctx_out; }

  // The term node behind each id
  public Map<Integer,Term> terms() {
    TreeMap<Integer,Term> ts = new TreeMap<>();
    for( Map.Entry<Integer,Info> e : _m.entrySet() )
      ts.put(e.getKey(),e.getValue()._term);
    return ts;
  }

  // Ids in error, sorted
  public int[] errors() {
    return _m.entrySet().stream()
      .filter(e -> e.getValue().is_error())
      .mapToInt(Map.Entry::getKey)
      .sorted()
      .toArray();
  }

  @Override public boolean equals( Object o ) { return this==o || (o instanceof InfoMap im && _m.equals(im._m)); }
  @Override public int hashCode() { return _m.hashCode(); }
  @Override public String toString() {
    SB sb = new SB();
    for( Integer id : new TreeSet<>(_m.keySet()) )
      _m.get(id).str(sb.p(id).p(": ")).nl();
    return sb.toString();
  }
}
