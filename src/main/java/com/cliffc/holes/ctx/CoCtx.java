package com.cliffc.holes.ctx;

import com.cliffc.holes.type.Mode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import java.util.Objects;

/** Co-context: the free variables a term uses, each name mapped to its use
 *  sites in order.  Flows bottom-up; binders consume the uses of the names
 *  they bind.
 */
public final class CoCtx {
  // One use of a variable, with the mode it was used at
  public static final class Use {
    public final int _id;
    public final Mode _mode;
    public Use( int id, Mode mode ) { _id=id; _mode=mode; }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Use u && _id==u._id && _mode.equals(u._mode));
    }
    @Override public int hashCode() { return Objects.hash(_id,_mode); }
    @Override public String toString() { return _id+":"+_mode; }
  }

  public static final CoCtx EMPTY = new CoCtx(ImmutableListMultimap.of());

  private final ImmutableListMultimap<String,Use> _uses;
  private CoCtx( ImmutableListMultimap<String,Use> uses ) { _uses=uses; }

  public static CoCtx singleton( String name, int id, Mode mode ) {
    return new CoCtx(ImmutableListMultimap.of(name,new Use(id,mode)));
  }

  public static CoCtx union( CoCtx... cos ) {
    CoCtx nz = null;
    int cnt = 0;
    for( CoCtx co : cos ) if( !co.is_empty() ) { nz = co; cnt++; }
    if( cnt==0 ) return EMPTY;
    if( cnt==1 ) return nz;
    ImmutableListMultimap.Builder<String,Use> b = ImmutableListMultimap.builder();
    for( CoCtx co : cos ) b.putAll(co._uses);
    return new CoCtx(b.build());
  }

  /** Drop the uses of names bound between 'before' and 'after'.  A name is
   *  newly bound if it resolves to a different binding in 'after'; 'after' is
   *  an extension of 'before', so unchanged names resolve to the very same
   *  entry. */
  public static CoCtx mk( Ctx before, Ctx after, CoCtx co ) {
    if( before==after || co.is_empty() ) return co;
    ImmutableListMultimap.Builder<String,Use> b = ImmutableListMultimap.builder();
    boolean dropped = false;
    for( String name : co._uses.keySet() ) {
      if( before.lookup_var(name) == after.lookup_var(name) ) b.putAll(name,co._uses.get(name));
      else dropped = true;
    }
    return dropped ? new CoCtx(b.build()) : co;
  }

  public ImmutableList<Use> get( String name ) { return _uses.get(name); }
  public boolean is_empty() { return _uses.isEmpty(); }
  public java.util.Set<String> names() { return _uses.keySet(); }

  @Override public boolean equals( Object o ) { return this==o || (o instanceof CoCtx co && _uses.equals(co._uses)); }
  @Override public int hashCode() { return _uses.hashCode(); }
  @Override public String toString() { return _uses.toString(); }
}
