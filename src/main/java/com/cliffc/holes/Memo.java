package com.cliffc.holes;

import com.cliffc.holes.statics.InfoMap;
import com.cliffc.holes.statics.Statics;
import com.cliffc.holes.term.Term;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

/** Memoized statics under the built-in context.
 *
 *  Keyed by term structure, so an unchanged term after an edit elsewhere is
 *  not re-checked.  The cache is bounded; an evicted term is simply
 *  recomputed.  Safe for concurrent callers: racing misses may both compute,
 *  and produce equal maps.
 */
public class Memo {
  private final Cache<Term,InfoMap> _cache;

  public Memo() { this(Holes.MEMO_SIZE); }
  public Memo( int size ) {
    _cache = CacheBuilder.newBuilder()
      .maximumSize(size)
      .recordStats()
      .<Term,InfoMap>removalListener(n -> { if( Holes.DEBUG && n.wasEvicted() ) Holes.p(null,"memo evict: "+n.getKey()); })
      .build();
  }

  public InfoMap compute( Term t ) {
    InfoMap m = _cache.getIfPresent(t);
    if( m!=null ) return m;
    m = Statics.mk(Builtins.ctx(),t);
    if( Holes.DEBUG ) Holes.p(null,"memo miss: "+t);
    _cache.put(t,m);
    return m;
  }

  public CacheStats stats() { return _cache.stats(); }
  public long size() { return _cache.size(); }
  public void clear() { _cache.invalidateAll(); }
}
