package com.cliffc.holes.term;

import static com.cliffc.holes.term.Sort.*;

/** Syntactic forms, tagged with their Sort.  The statics switch over these
 *  exhaustively; there is no per-form virtual dispatch.
 */
public enum Form {
  // Expressions
  E_INVALID    (EXP,"invalid"), // Unparseable text; constant is the text
  E_EMPTY_HOLE (EXP,"hole"),
  E_MULTI_HOLE (EXP,"multi"),   // Kids of any sort
  E_TRIV       (EXP,"triv"),    // Unit
  E_BOOL       (EXP,"bool"),
  E_INT        (EXP,"int"),
  E_FLOAT      (EXP,"float"),
  E_STRING     (EXP,"string"),
  E_LIST_LIT   (EXP,"list"),
  E_TAG        (EXP,"tag"),     // Constructor
  E_FUN        (EXP,"fun"),     // pat, body
  E_TUPLE      (EXP,"tuple"),
  E_VAR        (EXP,"var"),
  E_LET        (EXP,"let"),     // pat, def, body
  E_TY_ALIAS   (EXP,"type"),    // tpat, typ, body
  E_AP         (EXP,"ap"),      // fun, arg
  E_IF         (EXP,"if"),      // cond, then, else
  E_SEQ        (EXP,"seq"),
  E_TEST       (EXP,"test"),
  E_PARENS     (EXP,"parens"),
  E_CONS       (EXP,"cons"),
  E_LIST_CONCAT(EXP,"concat"),
  E_UN_OP      (EXP,"unop"),    // Constant is the Op
  E_BIN_OP     (EXP,"binop"),   // Constant is the Op
  E_MATCH      (EXP,"case"),    // scrutinee, rules...

  // Match rules
  RULE         (RUL,"rule"),    // pat, exp

  // Patterns
  P_INVALID    (PAT,"invalid"),
  P_EMPTY_HOLE (PAT,"hole"),
  P_MULTI_HOLE (PAT,"multi"),
  P_WILD       (PAT,"wild"),
  P_INT        (PAT,"int"),
  P_FLOAT      (PAT,"float"),
  P_BOOL       (PAT,"bool"),
  P_STRING     (PAT,"string"),
  P_TRIV       (PAT,"triv"),
  P_LIST_LIT   (PAT,"list"),
  P_CONS       (PAT,"cons"),
  P_VAR        (PAT,"var"),
  P_TUPLE      (PAT,"tuple"),
  P_PARENS     (PAT,"parens"),
  P_TAG        (PAT,"tag"),
  P_AP         (PAT,"ap"),      // tag pattern, arg pattern
  P_TYPE_ANN   (PAT,"ann"),     // pat, typ

  // Surface types
  T_INVALID    (TYP,"invalid"),
  T_EMPTY_HOLE (TYP,"hole"),
  T_MULTI_HOLE (TYP,"multi"),
  T_INT        (TYP,"Int"),
  T_FLOAT      (TYP,"Float"),
  T_BOOL       (TYP,"Bool"),
  T_STRING     (TYP,"String"),
  T_LIST       (TYP,"list"),
  T_ARROW      (TYP,"arrow"),
  T_TUPLE      (TYP,"tuple"),
  T_PARENS     (TYP,"parens"),
  T_VAR        (TYP,"var"),
  T_SUM        (TYP,"sum"),     // Kids are TSUM sort

  // Type patterns
  TP_INVALID   (TPAT,"invalid"),
  TP_EMPTY_HOLE(TPAT,"hole"),
  TP_MULTI_HOLE(TPAT,"multi"),
  TP_VAR       (TPAT,"var"),

  // Sum definition entries
  TS_INVALID   (TSUM,"invalid"),
  TS_EMPTY_HOLE(TSUM,"hole"),
  TS_MULTI_HOLE(TSUM,"multi"),
  TS_TAG       (TSUM,"tag"),    // Nullary constructor
  TS_AP        (TSUM,"ap");     // Constructor with a payload type; constant is the tag name

  public final Sort _sort;
  public final String _str;     // Short class name, for printing
  Form( Sort sort, String str ) { _sort=sort; _str=str; }

  // Forms carrying a name as their constant
  public boolean is_named() {
    return switch( this ) {
    case E_TAG, E_VAR, P_VAR, P_TAG, T_VAR, TP_VAR, TS_TAG, TS_AP -> true;
    default -> false;
    };
  }
}
