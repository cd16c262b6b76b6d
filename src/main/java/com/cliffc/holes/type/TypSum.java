package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// Labeled sums.  Tags are kept sorted so structural equality ignores
// definition order.  A null payload is a nullary constructor.
public final class TypSum extends Typ {
  public final String[] _tags;  // Sorted, unique
  public final Typ[] _args;     // Parallel to _tags; null for no payload
  private TypSum( String[] tags, Typ[] args ) { super(TSUM); _tags=tags; _args=args; }

  public static TypSum make( String[] tags, Typ[] args ) {
    assert tags.length==args.length;
    Integer[] idx = new Integer[tags.length];
    for( int i=0; i<idx.length; i++ ) idx[i]=i;
    Arrays.sort(idx,(a,b) -> tags[a].compareTo(tags[b]));
    String[] ts = new String[tags.length];
    Typ[] as = new Typ[tags.length];
    for( int i=0; i<idx.length; i++ ) {
      ts[i] = tags[idx[i]];
      as[i] = args[idx[i]];
      assert i==0 || !ts[i].equals(ts[i-1]) : "duplicate tag "+ts[i];
    }
    return new TypSum(ts,as);
  }
  // Nullary constructors only
  public static TypSum make( String... tags ) { return make(tags,new Typ[tags.length]); }

  public int find( String tag ) { return Arrays.binarySearch(_tags,tag); }
  public boolean has( String tag ) { return find(tag) >= 0; }
  // Payload of a tag, or null if nullary or missing
  public Typ arg( String tag ) { int i = find(tag); return i<0 ? null : _args[i]; }
  public String[] sum_tags() { return _tags.clone(); }

  @Override int compute_hash() { return Util.mix_hash(TSUM,Arrays.hashCode(_tags),Util.hash(_args)); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypSum s) || !Arrays.equals(_tags,s._tags) ) return false;
    for( int i=0; i<_args.length; i++ )
      if( !Objects.equals(_args[i],s._args[i]) )
        return false;
    return true;
  }
  @Override boolean eq0( Typ t ) {
    TypSum s = (TypSum)t;
    if( !Arrays.equals(_tags,s._tags) ) return false;
    for( int i=0; i<_args.length; i++ ) {
      if( (_args[i]==null) != (s._args[i]==null) ) return false;
      if( _args[i]!=null && !eq(_args[i],s._args[i]) ) return false;
    }
    return true;
  }
  @Override Typ walk( UnaryOperator<Typ> f ) {
    Typ[] as = null;
    for( int i=0; i<_args.length; i++ ) {
      if( _args[i]==null ) continue;
      Typ a = f.apply(_args[i]);
      if( a!=_args[i] ) {
        if( as==null ) as = _args.clone();
        as[i] = a;
      }
    }
    return as==null ? this : new TypSum(_tags,as);
  }
  @Override boolean any( Predicate<Typ> p ) {
    if( p.test(this) ) return true;
    for( Typ a : _args ) if( a!=null && a.any(p) ) return true;
    return false;
  }
  // Same tags, payload presence agrees, payloads join
  @Override Typ join0( Ctx ctx, Typ t ) {
    TypSum s = (TypSum)t;
    if( !Arrays.equals(_tags,s._tags) ) return null;
    Typ[] as = new Typ[_args.length];
    for( int i=0; i<_args.length; i++ ) {
      if( (_args[i]==null) != (s._args[i]==null) ) return null;
      if( _args[i]!=null && (as[i] = join(ctx,_args[i],s._args[i]))==null ) return null;
    }
    return new TypSum(_tags,as);
  }
  @Override public SB str( SB sb ) {
    if( _tags.length==0 ) return sb.p("+");
    for( int i=0; i<_tags.length; i++ ) {
      sb.p(_tags[i]);
      if( _args[i]!=null ) _args[i].str(sb.p('(')).p(')');
      sb.p(" + ");
    }
    return sb.unchar(3);
  }
}
