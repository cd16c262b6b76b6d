package com.cliffc.holes;

import com.cliffc.holes.statics.InfoMap;
import com.cliffc.holes.term.Op;
import com.cliffc.holes.term.TB;
import com.cliffc.holes.term.Term;
import com.cliffc.holes.type.Typ;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestMemo {
  private Memo memo;
  @Before public void reset() { memo = new Memo(); }

  // let y = 2 in (fun x -> x * y) 3
  private static Term sample( TB tb ) {
    return tb.let(tb.pvar("y"),tb.i(2),
                  tb.ap(tb.parens(tb.fun(tb.pvar("x"),tb.binop(Op.TIMES,tb.var("x"),tb.var("y")))),tb.i(3)));
  }

  @Test
  public void testTransparent() {
    Term t1 = sample(new TB()), t2 = sample(new TB());
    assertNotSame(t1,t2);
    InfoMap m1 = memo.compute(t1);
    InfoMap m2 = memo.compute(t2);
    assertSame(m1,m2);
    assertEquals(1,memo.stats().hitCount());
    assertEquals(1,memo.stats().missCount());
    // Same as an uncached run
    assertEquals(new Memo().compute(t1),m1);
    assertSame(Typ.INT,m1.exp_type(t1.rep_id()));
  }

  @Test
  public void testEviction() {
    Memo small = new Memo(1);
    Term a = sample(new TB()), b = sample(new TB(50));
    InfoMap ma = small.compute(a);
    small.compute(b);
    // Holding b pushed a out
    assertEquals(1,small.size());
    assertEquals(1,small.stats().evictionCount());
    small.compute(b);
    assertEquals(1,small.stats().hitCount());
    // a is recomputed, to an equal map
    assertEquals(ma,small.compute(sample(new TB())));
    assertEquals(3,small.stats().missCount());
    assertEquals(2,small.stats().evictionCount());
    small.clear();
    assertEquals(0,small.size());
  }
}
