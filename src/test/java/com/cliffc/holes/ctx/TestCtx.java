package com.cliffc.holes.ctx;

import com.cliffc.holes.type.Mode;
import com.cliffc.holes.type.Typ;
import com.cliffc.holes.type.TypList;
import com.cliffc.holes.type.TypProd;
import com.cliffc.holes.type.TypVar;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestCtx {
  @Test
  public void testShadow() {
    Ctx c1 = Ctx.EMPTY.extend_var("x",1,Typ.INT);
    Ctx c2 = c1.extend_var("x",2,Typ.BOOL);
    assertSame(Typ.BOOL,c2.lookup_var("x")._typ);
    assertSame(Typ.INT ,c1.lookup_var("x")._typ);
    assertEquals(2,c2.size());
    assertNull(c2.lookup_var("y"));
    // Separate namespaces
    Ctx c3 = c2.extend_tag("x",3,Typ.STR);
    assertSame(Typ.BOOL,c3.lookup_var("x")._typ);
    assertSame(Typ.STR ,c3.lookup_tag("x")._typ);
    assertNull(c3.lookup_tvar("x"));
  }

  @Test
  public void testTVars() {
    Ctx c = Ctx.EMPTY.extend_tvar("T",1);
    assertTrue(c.lookup_tvar("T").is_abstract());
    assertNull(c.lookup_alias("T"));
    c = c.extend_alias("T",2,Typ.INT);
    assertSame(Typ.INT,c.lookup_alias("T"));
    // Joins see through the alias
    assertTrue(c.consistent(TypVar.make("T"),Typ.INT));
    assertNull(c.join(TypVar.make("T"),Typ.BOOL));
    assertEquals(TypVar.make("T"),c.join_all(Typ.UNK,TypVar.make("T"),Typ.INT));
  }

  @Test
  public void testResolveAndSubst() {
    Ctx c = Ctx.EMPTY.extend_alias("A",1,Typ.INT).extend_alias("B",2,TypList.make(Typ.INT));
    // Visible aliases are substituted, except the skipped one
    Typ t = TypProd.make(TypVar.make("A"),TypVar.make("B"));
    assertEquals(TypProd.make(Typ.INT,TypList.make(Typ.INT)),c.resolve(t,null));
    assertEquals(TypProd.make(Typ.INT,TypVar.make("B")),c.resolve(t,"B"));
    // An abstract binder hides an outer alias of the same name
    assertEquals(TypVar.make("A"),c.extend_tvar("A",3).resolve(TypVar.make("A"),null));

    // Bindings made since A keep meaning the old A
    Ctx d = c.extend_var("x",4,TypVar.make("A")).extend_tag("K",5,TypVar.make("B"));
    Ctx e = d.subst(Typ.INT,"A");
    assertSame(Typ.INT,e.lookup_var("x")._typ);
    assertSame(d.lookup_tag("K"),e.lookup_tag("K"));
    assertSame(Typ.INT,e.lookup_alias("A"));
    // Nothing mentions Q
    assertSame(d,d.subst(Typ.BOOL,"Q"));
  }

  @Test
  public void testEquals() {
    Ctx a = Ctx.EMPTY.extend_var("x",1,Typ.INT).extend_tag("A",2,Typ.BOOL);
    Ctx b = Ctx.EMPTY.extend_var("x",1,Typ.INT).extend_tag("A",2,Typ.BOOL);
    assertEquals(a,b);
    assertEquals(a.hashCode(),b.hashCode());
    assertNotEquals(a,Ctx.EMPTY.extend_var("x",1,Typ.INT));
    assertEquals("[tag A:Bool, x:Int]",a.toString());
  }

  @Test
  public void testCoCtx() {
    Ctx before = Ctx.EMPTY.extend_var("y",1,Typ.INT);
    Ctx after = before.extend_var("x",2,Typ.INT);
    CoCtx co = CoCtx.union(CoCtx.singleton("x",10,Mode.SYN),
                           CoCtx.singleton("y",11,Mode.SYN),
                           CoCtx.singleton("x",12,Mode.ana(Typ.INT)));
    assertEquals(2,co.get("x").size());
    assertEquals(12,co.get("x").get(1)._id);
    CoCtx out = CoCtx.mk(before,after,co);
    assertTrue(out.get("x").isEmpty());
    assertEquals(1,out.get("y").size());
    assertSame(CoCtx.EMPTY,CoCtx.union(CoCtx.EMPTY,CoCtx.EMPTY));
    assertSame(co,CoCtx.mk(before,before,co));
  }
}
