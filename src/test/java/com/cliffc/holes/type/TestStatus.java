package com.cliffc.holes.type;

import com.cliffc.holes.ctx.Ctx;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestStatus {
  private static final Ctx C = Ctx.EMPTY;
  private static Self.Source[] srcs( Typ... ts ) {
    Self.Source[] ss = new Self.Source[ts.length];
    for( int i=0; i<ts.length; i++ ) ss[i] = new Self.Source(i+1,ts[i]);
    return ss;
  }

  @Test
  public void testSyn() {
    Status st = Status.of(C,Mode.SYN,Self.just(Typ.INT));
    assertEquals(Status.Kind.SYN_CONSISTENT,st._kind);
    assertSame(Typ.INT,st.fixed());

    st = Status.of(C,Mode.SYN,Self.joined(Self.Wrap.LIST,srcs(Typ.INT,Typ.UNK)));
    assertFalse(st.in_hole());
    assertEquals(TypList.make(Typ.INT),st.fixed());

    st = Status.of(C,Mode.SYN,Self.joined(Self.Wrap.ID,srcs(Typ.INT,Typ.BOOL)));
    assertEquals(Status.Kind.SYN_INCONSISTENT_BRANCHES,st._kind);
    assertTrue(st.in_hole());
    assertSame(Typ.UNK,st.fixed());
  }

  @Test
  public void testAna() {
    Mode ana = Mode.ana(Typ.INT);
    // Reflexive
    Status st = Status.of(C,ana,Self.just(Typ.INT));
    assertEquals(Status.Kind.ANA_CONSISTENT,st._kind);
    assertSame(Typ.INT,st.fixed());

    st = Status.of(C,ana,Self.just(Typ.BOOL));
    assertEquals(Status.Kind.TYPE_INCONSISTENT,st._kind);
    assertSame(Typ.UNK,st.fixed());
    assertEquals("Bool is not consistent with Int",st.msg());

    // Disagreeing branches are reported, but the expected type stands
    st = Status.of(C,ana,Self.joined(Self.Wrap.ID,srcs(Typ.INT,Typ.BOOL)));
    assertEquals(Status.Kind.ANA_INTERNAL_INCONSISTENT,st._kind);
    assertFalse(st.in_hole());
    assertSame(Typ.INT,st.fixed());

    st = Status.of(C,ana,Self.joined(Self.Wrap.ID,srcs(Typ.BOOL,Typ.BOOL)));
    assertEquals(Status.Kind.ANA_EXTERNAL_INCONSISTENT,st._kind);
    assertFalse(st.in_hole());
    assertSame(Typ.INT,st.fixed());
  }

  @Test
  public void testFreeMultiSynFun() {
    for( Mode m : new Mode[]{Mode.SYN,Mode.SYN_FUN,Mode.ana(Typ.INT)} ) {
      Status st = Status.of(C,m,Self.free(Self.Free.VARIABLE));
      assertEquals(Status.Kind.FREE,st._kind);
      assertTrue(st.in_hole());
      assertFalse(Status.of(C,m,Self.MULTI).in_hole());
    }
    Status st = Status.of(C,Mode.SYN_FUN,Self.just(Typ.INT));
    assertEquals(Status.Kind.NO_FUN,st._kind);
    assertSame(Typ.UNK,st.fixed());
    assertFalse(Status.of(C,Mode.SYN_FUN,Self.just(Typ.UNK)).in_hole());
    assertFalse(Status.of(C,Mode.SYN_FUN,Self.just(TypArrow.make(Typ.INT,Typ.INT))).in_hole());
  }

  @Test
  public void testModes() {
    assertSame(Mode.SYN,Mode.ana(Typ.SYNSWITCH));
    assertEquals(Mode.ana(Typ.INT),Mode.ana(Typ.INT));
    Mode[] ms = Mode.ana(TypArrow.make(Typ.INT,Typ.BOOL)).of_arrow(C);
    assertEquals(Mode.ana(Typ.INT),ms[0]);
    assertEquals(Mode.ana(Typ.BOOL),ms[1]);
    ms = Mode.SYN.of_prod(C,2);
    assertSame(Mode.SYN,ms[1]);
    assertSame(Mode.SYN,Mode.ana(TypProd.make(Typ.SYNSWITCH,Typ.INT)).of_prod(C,2)[0]);
    assertEquals(Mode.ana(TypList.make(Typ.INT)),Mode.SYN.of_cons_tl(C,Typ.INT));
    // A constructor under its sum is checked against its arrow
    TypSum sum = TypSum.make(new String[]{"A","B"},new Typ[]{null,Typ.INT});
    assertEquals(Mode.ana(TypArrow.make(Typ.INT,sum)),Mode.ana(sum).of_ap(C,"B"));
    assertSame(Mode.SYN_FUN,Mode.ana(sum).of_ap(C,"C"));
    assertSame(Mode.SYN_FUN,Mode.ana(sum).of_ap(C,null));
  }
}
