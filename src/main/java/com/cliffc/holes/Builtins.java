package com.cliffc.holes;

import com.cliffc.holes.ctx.Ctx;
import com.cliffc.holes.type.*;

import java.util.HashMap;

/** The initial context: primitive functions and constants, the built-in
 *  algebraic types and their constructors.  Built-in bindings have negative
 *  ids, so they never collide with term ids. */
public abstract class Builtins {
  public static final TypSum ORDERING = TypSum.make("LT","EQ","GT");

  // Built-in algebraic types, resolved before any type variable in context
  private static final HashMap<String,Typ> TYPES = new HashMap<>();
  static {
    TYPES.put("Unit",Typ.UNIT);
    TYPES.put("Ordering",ORDERING);
  }

  private static int ID = -1;
  private static final Ctx CTX = build();

  private static Ctx build() {
    Typ I = Typ.INT, F = Typ.FLT, B = Typ.BOOL, S = Typ.STR;
    Ctx c = Ctx.EMPTY;
    c = var(c,"pi"           ,F);
    c = var(c,"infinity"     ,F);
    c = var(c,"nan"          ,F);
    c = var(c,"sqrt"         ,fn(F,F));
    c = var(c,"sin"          ,fn(F,F));
    c = var(c,"cos"          ,fn(F,F));
    c = var(c,"abs"          ,fn(I,I));
    c = var(c,"mod"          ,fn(TypProd.make(I,I),I));
    c = var(c,"int_of_float" ,fn(F,I));
    c = var(c,"float_of_int" ,fn(I,F));
    c = var(c,"string_of_int",fn(I,S));
    c = var(c,"string_length",fn(S,I));
    c = var(c,"string_concat",fn(TypProd.make(S,S),S));
    c = var(c,"is_nan"       ,fn(F,B));
    c = var(c,"int_compare"  ,fn(TypProd.make(I,I),ORDERING));
    for( String tag : ORDERING._tags )
      c = c.extend_tag(tag,ID--,ORDERING);
    return c;
  }
  private static Ctx var( Ctx c, String name, Typ t ) { return c.extend_var(name,ID--,t); }
  private static Typ fn( Typ in, Typ out ) { return TypArrow.make(in,out); }

  public static Ctx ctx() { return CTX; }

  // A built-in algebraic type by name, or null
  public static Typ type( String name ) { return TYPES.get(name); }

  // Names a type pattern may not rebind
  public static boolean is_type_name( String name ) {
    switch( name ) {
    case "Int": case "Float": case "Bool": case "String": return true;
    default: return TYPES.containsKey(name);
    }
  }
}
