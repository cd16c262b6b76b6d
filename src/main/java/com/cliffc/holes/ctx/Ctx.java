package com.cliffc.holes.ctx;

import com.cliffc.holes.type.Typ;
import com.cliffc.holes.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/** Typing context: a persistent, prepend-only stack of bindings.  Extending
 *  shares the parent; lookup walks from the newest binding, so later bindings
 *  shadow earlier ones.  Variables, constructor tags and type variables live
 *  in separate namespaces.
 */
public final class Ctx implements Iterable<Ctx.Entry> {
  public enum EKind { VAR, TAG, TVAR }

  /** A binding.  For VAR and TAG, _typ is the bound type.  For TVAR, _typ is
   *  the aliased type of a Singleton kind, or null for an Abstract kind. */
  public static final class Entry {
    public final EKind _kind;
    public final String _name;
    public final int _id;       // Binding site; built-ins are negative
    public final Typ _typ;
    Entry( EKind kind, String name, int id, Typ typ ) { _kind=kind; _name=name; _id=id; _typ=typ; }
    public boolean is_abstract() { return _kind==EKind.TVAR && _typ==null; }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      return o instanceof Entry e && _kind==e._kind && _id==e._id && _name.equals(e._name) && Objects.equals(_typ,e._typ);
    }
    @Override public int hashCode() { return Objects.hash(_kind,_name,_id,_typ); }
    @Override public String toString() { return str(new SB()).toString(); }
    public SB str( SB sb ) {
      switch( _kind ) {
      case VAR: return _typ.str(sb.p(_name).p(':'));
      case TAG: return _typ.str(sb.p("tag ").p(_name).p(':'));
      default:  return _typ==null ? sb.p("type ").p(_name) : _typ.str(sb.p("type ").p(_name).p(" = "));
      }
    }
  }

  public static final Ctx EMPTY = new Ctx(null,null);

  private final Entry _e;       // Null only for EMPTY
  private final Ctx _par;
  private final int _size;
  private int _hash;
  private Ctx( Entry e, Ctx par ) { _e=e; _par=par; _size = par==null ? 0 : par._size+1; }

  public int size() { return _size; }
  public boolean is_empty() { return _e==null; }

  public Ctx extend( Entry e ) { return new Ctx(e,this); }
  public Ctx extend_var  ( String name, int id, Typ t ) { return extend(new Entry(EKind.VAR ,name,id,t)); }
  public Ctx extend_tag  ( String name, int id, Typ t ) { return extend(new Entry(EKind.TAG ,name,id,t)); }
  public Ctx extend_alias( String name, int id, @NotNull Typ t ) { return extend(new Entry(EKind.TVAR,name,id,t)); }
  public Ctx extend_tvar ( String name, int id ) { return extend(new Entry(EKind.TVAR,name,id,null)); }

  private @Nullable Entry lookup( EKind kind, String name ) {
    for( Ctx c = this; c._e!=null; c = c._par )
      if( c._e._kind==kind && c._e._name.equals(name) )
        return c._e;
    return null;
  }
  public @Nullable Entry lookup_var ( String name ) { return lookup(EKind.VAR ,name); }
  public @Nullable Entry lookup_tag ( String name ) { return lookup(EKind.TAG ,name); }
  public @Nullable Entry lookup_tvar( String name ) { return lookup(EKind.TVAR,name); }
  // The aliased type, or null if unbound or abstract
  public @Nullable Typ lookup_alias( String name ) {
    Entry e = lookup_tvar(name);
    return e==null ? null : e._typ;
  }

  /** Resolve the aliases visible here inside t, except 'skip'.  Alias
   *  definitions are resolved when bound, so they never name another alias
   *  and one substitution per name suffices. */
  public Typ resolve( Typ t, @Nullable String skip ) {
    HashSet<String> seen = new HashSet<>();
    for( Ctx c = this; c._e!=null; c = c._par ) {
      Entry e = c._e;
      if( e._kind!=EKind.TVAR || !seen.add(e._name) ) continue;
      if( e._typ!=null && !e._name.equals(skip) && t.free_vars().contains(e._name) )
        t = t.subst(e._typ,e._name);
    }
    return t;
  }

  /** Rebind the variables and tags bound since the innermost type variable
   *  'name', replacing that name with its definition.  Used before 'name' is
   *  shadowed, so earlier bindings keep their meaning. */
  public Ctx subst( Typ def, String name ) {
    if( _e==null || (_e._kind==EKind.TVAR && _e._name.equals(name)) ) return this;
    Ctx par = _par.subst(def,name);
    Entry e = _e;
    if( e._kind!=EKind.TVAR && e._typ.free_vars().contains(name) )
      e = new Entry(e._kind,e._name,e._id,e._typ.subst(def,name));
    return par==_par && e==_e ? this : new Ctx(e,par);
  }

  // Typ operations under this context
  public @Nullable Typ join( Typ t1, Typ t2 ) { return Typ.join(this,t1,t2); }
  public @Nullable Typ join_all( Typ... ts ) { return Typ.join_all(this,ts); }
  public boolean consistent( Typ t1, Typ t2 ) { return Typ.consistent(this,t1,t2); }

  @NotNull @Override public Iterator<Entry> iterator() { return new Iter(); }
  private class Iter implements Iterator<Entry> {
    private Ctx _c = Ctx.this;
    @Override public boolean hasNext() { return _c._e!=null; }
    @Override public Entry next() {
      if( _c._e==null ) throw new NoSuchElementException();
      Entry e = _c._e;  _c = _c._par;  return e;
    }
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ctx c) || c._size!=_size || c.hashCode()!=hashCode() ) return false;
    for( Ctx a=this, b=c; a!=b; a=a._par, b=b._par )
      if( !a._e.equals(b._e) )
        return false;
    return true;
  }
  @Override public int hashCode() {
    if( _hash==0 ) _hash = _e==null ? 1 : _par.hashCode()*31 + _e.hashCode();
    return _hash;
  }
  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    sb.p('[');
    for( Entry e : this ) e.str(sb).p(", ");
    if( _e!=null ) sb.unchar(2);
    return sb.p(']');
  }
}
