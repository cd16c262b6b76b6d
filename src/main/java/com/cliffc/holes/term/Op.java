package com.cliffc.holes.term;

import com.cliffc.holes.type.Typ;

/** Unary and binary operators.  Each fixes its operand and result types;
 *  comparisons yield Bool, arithmetic yields the operand type. */
public enum Op {
  // Int
  NEG    ("-"  ,true ,Typ.INT ,Typ.INT ),
  PLUS   ("+"  ,false,Typ.INT ,Typ.INT ),
  MINUS  ("-"  ,false,Typ.INT ,Typ.INT ),
  TIMES  ("*"  ,false,Typ.INT ,Typ.INT ),
  DIVIDE ("/"  ,false,Typ.INT ,Typ.INT ),
  POWER  ("**" ,false,Typ.INT ,Typ.INT ),
  LT     ("<"  ,false,Typ.INT ,Typ.BOOL),
  LTE    ("<=" ,false,Typ.INT ,Typ.BOOL),
  GT     (">"  ,false,Typ.INT ,Typ.BOOL),
  GTE    (">=" ,false,Typ.INT ,Typ.BOOL),
  EQ     ("==" ,false,Typ.INT ,Typ.BOOL),
  NE     ("!=" ,false,Typ.INT ,Typ.BOOL),
  // Float
  FNEG   ("-." ,true ,Typ.FLT ,Typ.FLT ),
  FPLUS  ("+." ,false,Typ.FLT ,Typ.FLT ),
  FMINUS ("-." ,false,Typ.FLT ,Typ.FLT ),
  FTIMES ("*." ,false,Typ.FLT ,Typ.FLT ),
  FDIVIDE("/." ,false,Typ.FLT ,Typ.FLT ),
  FPOWER ("**.",false,Typ.FLT ,Typ.FLT ),
  FLT    ("<." ,false,Typ.FLT ,Typ.BOOL),
  FLTE   ("<=.",false,Typ.FLT ,Typ.BOOL),
  FGT    (">." ,false,Typ.FLT ,Typ.BOOL),
  FGTE   (">=.",false,Typ.FLT ,Typ.BOOL),
  FEQ    ("==.",false,Typ.FLT ,Typ.BOOL),
  FNE    ("!=.",false,Typ.FLT ,Typ.BOOL),
  // Bool
  NOT    ("!"  ,true ,Typ.BOOL,Typ.BOOL),
  AND    ("&&" ,false,Typ.BOOL,Typ.BOOL),
  OR     ("||" ,false,Typ.BOOL,Typ.BOOL),
  // String
  SEQ    ("$==",false,Typ.STR ,Typ.BOOL),
  CONCAT ("++" ,false,Typ.STR ,Typ.STR );

  public final String _str;
  public final boolean _unary;
  public final Typ _arg, _ret;
  Op( String str, boolean unary, Typ arg, Typ ret ) { _str=str; _unary=unary; _arg=arg; _ret=ret; }
}
