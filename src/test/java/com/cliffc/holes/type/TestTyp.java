package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestTyp {
  private static final Ctx C = Ctx.EMPTY;
  private static final Typ[] SAMPLES = {
    Typ.INT, Typ.FLT, Typ.BOOL, Typ.STR, Typ.UNIT,
    TypList.make(Typ.INT),
    TypArrow.make(Typ.INT,Typ.BOOL),
    TypProd.make(Typ.INT,TypList.make(Typ.STR)),
    TypSum.make(new String[]{"A","B"},new Typ[]{null,Typ.INT}),
  };

  @Test
  public void testUnknownAbsorbs() {
    for( Typ t : SAMPLES ) {
      assertEquals(t,Typ.join(C,Typ.UNK,t));
      assertEquals(t,Typ.join(C,t,Typ.UNK));
      assertTrue(Typ.consistent(C,Typ.SYNSWITCH,t));
      assertTrue(Typ.consistent(C,t,t));
    }
    // Internal wins over SynSwitch
    assertSame(Typ.UNK,Typ.join(C,Typ.UNK,Typ.SYNSWITCH));
    assertSame(Typ.UNK,Typ.join(C,Typ.SYNSWITCH,Typ.UNK));
    assertSame(Typ.SYNSWITCH,Typ.join(C,Typ.SYNSWITCH,Typ.SYNSWITCH));
  }

  @Test
  public void testJoin() {
    assertNull(Typ.join(C,Typ.INT,Typ.BOOL));
    assertEquals(TypList.make(Typ.INT),Typ.join(C,TypList.make(Typ.UNK),TypList.make(Typ.INT)));
    assertEquals(TypArrow.make(Typ.INT,Typ.BOOL),
                 Typ.join(C,TypArrow.make(Typ.UNK,Typ.BOOL),TypArrow.make(Typ.INT,Typ.UNK)));
    assertNull(Typ.join(C,TypProd.make(Typ.INT),TypProd.make(Typ.INT,Typ.INT)));
    assertNull(Typ.join(C,TypSum.make("A","B"),TypSum.make("A","C")));
    // Payload presence must agree
    assertNull(Typ.join(C,TypSum.make(new String[]{"A"},new Typ[]{Typ.INT}),TypSum.make("A")));
    assertNull(Typ.join_all(C));
    assertEquals(Typ.INT,Typ.join_all(C,Typ.UNK,Typ.INT,Typ.UNK));
    assertNull(Typ.join_all(C,Typ.INT,Typ.UNK,Typ.BOOL));
  }

  @Test
  public void testAlias() {
    Ctx ctx = C.extend_alias("T",1,Typ.INT);
    TypVar t = TypVar.make("T");
    assertSame(t,Typ.join(ctx,t,Typ.INT));
    assertSame(t,Typ.join(ctx,Typ.UNK,t));
    assertNull(Typ.join(ctx,t,Typ.BOOL));
    // Unbound and abstract variables only join themselves
    assertNull(Typ.join(C,t,Typ.INT));
    assertNull(Typ.join(C.extend_tvar("T",2),t,Typ.INT));
    assertEquals(t,Typ.join(C,t,TypVar.make("T")));
    // Refined join loses the name
    Ctx ctx2 = C.extend_alias("L",3,TypList.make(Typ.UNK));
    assertEquals(TypList.make(Typ.INT),Typ.join(ctx2,TypVar.make("L"),TypList.make(Typ.INT)));
  }

  // rec L. Nil + Cons((Int, L))
  private static TypRec intlist( String name ) {
    return TypRec.make(name,TypSum.make(new String[]{"Nil","Cons"},
                                        new Typ[]{null,TypProd.make(Typ.INT,TypVar.make(name))}));
  }

  @Test
  public void testRec() {
    TypRec l = intlist("L");
    assertEquals(l,Typ.join(C,l,l));
    assertNotNull(Typ.join(C,l,l.unroll()));
    assertNotNull(Typ.join(C,l.unroll(),l));
    assertTrue(Typ.eq(l,intlist("M")));
    assertNotEquals(l,intlist("M"));
    assertNotNull(Typ.join(C,l,intlist("M")));
    assertNull(Typ.join(C,l,Typ.INT));
    assertEquals(Typ.INT,Typ.matched_prod(C,2,((TypSum)l.unroll()).arg("Cons"))[0]);
    assertTrue(l.free_vars().isEmpty());
    assertTrue(l._body.free_vars().contains("L"));
    assertEquals("rec L. Cons((Int, L)) + Nil",l.toString());
  }

  @Test
  public void testMatched() {
    assertEquals(TypArrow.make(Typ.UNK,Typ.UNK),Typ.matched_arrow(C,Typ.UNK));
    assertEquals(TypArrow.make(Typ.UNK,Typ.UNK),Typ.matched_arrow(C,Typ.INT));
    assertEquals(Typ.INT,Typ.matched_list(C,TypList.make(Typ.INT)));
    assertEquals(Typ.UNK,Typ.matched_list(C,Typ.BOOL));
    Ctx ctx = C.extend_alias("F",1,TypArrow.make(Typ.INT,Typ.BOOL));
    assertEquals(Typ.BOOL,Typ.matched_arrow(ctx,TypVar.make("F"))._out);
    Typ[] ts = Typ.matched_prod(C,3,TypProd.make(Typ.INT,Typ.BOOL));
    assertEquals(3,ts.length);
    assertSame(Typ.UNK,ts[2]);
  }

  @Test
  public void testSynSwitch() {
    Typ t = TypProd.make(Typ.SYNSWITCH,TypList.make(Typ.SYNSWITCH));
    assertTrue(t.has_synswitch());
    assertEquals(TypProd.make(Typ.UNK,TypList.make(Typ.UNK)),t.internalize());
    assertFalse(t.internalize().has_synswitch());
    assertSame(Typ.INT,Typ.INT.internalize());
  }

  @Test
  public void testStr() {
    assertEquals("(Int -> Int) -> Int",TypArrow.make(TypArrow.make(Typ.INT,Typ.INT),Typ.INT).toString());
    assertEquals("Int -> Int -> Int",TypArrow.make(Typ.INT,TypArrow.make(Typ.INT,Typ.INT)).toString());
    assertEquals("()",Typ.UNIT.toString());
    assertEquals("([Int], ?)",TypProd.make(TypList.make(Typ.INT),Typ.UNK).toString());
    assertEquals("A + B(Int)",SAMPLES[8].toString());
    assertArrayEquals(new String[]{"A","B"},((TypSum)SAMPLES[8]).sum_tags());
  }
}
