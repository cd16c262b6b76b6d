package com.cliffc.holes.term;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestTerm {
  @Test
  public void testIds() {
    TB tb = new TB();
    Term t = tb.tuple(tb.i(1),tb.i(2),tb.i(3));
    assertArrayEquals(new int[]{4,5},t._ids);
    assertEquals(4,t.rep_id());
    assertArrayEquals(new int[]{4,5,1,2,3},t.all_ids());
    assertEquals(1,tb.tuple()._ids.length);
    assertEquals(2,tb.multi(tb.hole(),tb.hole())._ids.length);
    assertEquals(1,tb.ptuple(tb.pvar("x"))._ids.length);
  }

  @Test
  public void testEquals() {
    Term a = sample(new TB(), 1), b = sample(new TB(), 1);
    assertNotSame(a,b);
    assertEquals(a,b);
    assertEquals(a.hashCode(),b.hashCode());
    assertNotEquals(a,sample(new TB(),2));
    assertNotEquals(new TB().i(1),new TB(7).i(1));
  }
  // let x = i in x
  private static Term sample( TB tb, long i ) { return tb.let(tb.pvar("x"),tb.i(i),tb.var("x")); }

  @Test
  public void testStr() {
    TB tb = new TB();
    Term t = tb.let(tb.pann(tb.pvar("f"),tb.tarrow(tb.tint(),tb.tint())),
                    tb.fun(tb.pvar("n"),tb.binop(Op.PLUS,tb.var("n"),tb.i(1))),
                    tb.ap(tb.var("f"),tb.i(2)));
    assertEquals("let f : Int -> Int = fun n -> n + 1 in f(2)",t.toString());
    assertEquals("case x | _ => ? end",tb.match(tb.var("x"),tb.rule(tb.pwild(),tb.hole())).toString());
    assertEquals("invalid(\"@\")",tb.invalid("@").toString());
  }
}
