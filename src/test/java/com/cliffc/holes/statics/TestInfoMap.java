package com.cliffc.holes.statics;

import com.cliffc.holes.Builtins;
import com.cliffc.holes.term.Form;
import com.cliffc.holes.term.Op;
import com.cliffc.holes.term.TB;
import com.cliffc.holes.term.Term;
import com.cliffc.holes.type.Mode;
import com.cliffc.holes.type.Typ;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class TestInfoMap {
  // fun x -> x + true
  private static Term sample( TB tb ) {
    return tb.fun(tb.pvar("x"),tb.binop(Op.PLUS,tb.var("x"),tb.bool(true)));
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingId() {
    InfoMap m = Statics.mk(Builtins.ctx(),sample(new TB()));
    m.info(999);
  }

  @Test
  public void testQueries() {
    Term t = sample(new TB());
    InfoMap m = Statics.mk(Builtins.ctx(),t);
    Term x = t.kid(0), plus = t.kid(1), xuse = plus.kid(0), tru = plus.kid(1);
    assertEquals(Mode.ana(Typ.INT),m.exp_mode(xuse.rep_id()));
    assertSame(Typ.INT,m.exp_type(xuse.rep_id()));
    assertSame(Typ.UNK,m.exp_self_type(xuse.rep_id()));
    assertSame(Typ.UNK,m.pat_type(x.rep_id()));
    assertSame(Typ.UNK,m.pat_self_type(x.rep_id()));
    assertSame(Mode.SYN,m.pat_mode(x.rep_id()));
    assertNotNull(m.pat_ctx(x.rep_id()).lookup_var("x"));
    assertNull(m.exp_ctx(t.rep_id()).lookup_var("x"));
    assertNotNull(m.exp_ctx(xuse.rep_id()).lookup_var("x"));
    // Wrong kind of info answers like a hole
    assertSame(Typ.UNK,m.pat_type(plus.rep_id()));
    assertSame(Mode.SYN,m.exp_mode(x.rep_id()));
    // Errors
    assertArrayEquals(new int[]{tru.rep_id()},m.errors());
    assertTrue(m.is_error(tru.rep_id()));
    assertEquals("Bool is not consistent with Int",((Info.Exp)m.info(tru.rep_id()))._status.msg());
  }

  @Test
  public void testTerms() {
    Term t = sample(new TB());
    InfoMap m = Statics.mk(Builtins.ctx(),t);
    Map<Integer,Term> ts = m.terms();
    assertEquals(5,ts.size());
    assertSame(t,ts.get(t.rep_id()));
    assertEquals(Form.E_VAR,ts.get(t.kid(1).kid(0).rep_id())._form);
    assertSame(t,m.root());
  }

  @Test
  public void testEqualsAndStr() {
    InfoMap m1 = Statics.mk(Builtins.ctx(),sample(new TB()));
    InfoMap m2 = Statics.mk(Builtins.ctx(),sample(new TB()));
    assertNotSame(m1,m2);
    assertEquals(m1,m2);
    assertEquals(m1.hashCode(),m2.hashCode());
    assertEquals(m1.toString(),m2.toString());
    assertTrue(m1.toString().startsWith("1: Pat var Syn Just(?) : ?\n"));
    // Different ids, different maps
    InfoMap m3 = Statics.mk(Builtins.ctx(),sample(new TB(100)));
    assertNotEquals(m1,m3);
  }
}
