package com.cliffc.holes.term;

import static com.cliffc.holes.term.Form.*;

/** Term builder.  Hands out fresh ids, unique per builder, starting at 1.
 *  Tuples get one id per comma and multi-holes one per piece, so a node may
 *  own several ids. */
public class TB {
  private int _cnt;
  public TB() { this(1); }
  public TB( int first_id ) { _cnt = first_id; }

  public int next_id() { return _cnt; }
  private int[] ids( int n ) {
    int[] ids = new int[Math.max(1,n)];
    for( int i=0; i<ids.length; i++ ) ids[i] = _cnt++;
    return ids;
  }
  private Term mk ( Form f, Object con, Term... kids ) { return new Term(f,ids(1),con,kids); }
  private Term mkn( Form f, int n, Term... kids ) { return new Term(f,ids(n),null,kids); }

  // Expressions
  public Term hole() { return mk(E_EMPTY_HOLE,null); }
  public Term invalid( String text ) { return mk(E_INVALID,text); }
  public Term multi( Term... kids ) { return mkn(E_MULTI_HOLE,kids.length,kids); }
  public Term triv() { return mk(E_TRIV,null); }
  public Term bool( boolean b ) { return mk(E_BOOL,b); }
  public Term i( long i ) { return mk(E_INT,i); }
  public Term f( double d ) { return mk(E_FLOAT,d); }
  public Term str( String s ) { return mk(E_STRING,s); }
  public Term list( Term... es ) { return mk(E_LIST_LIT,null,es); }
  public Term tag( String name ) { return mk(E_TAG,name); }
  public Term fun( Term pat, Term body ) { return mk(E_FUN,null,pat,body); }
  public Term tuple( Term... es ) { return mkn(E_TUPLE,es.length-1,es); }
  public Term var( String name ) { return mk(E_VAR,name); }
  public Term let( Term pat, Term def, Term body ) { return mk(E_LET,null,pat,def,body); }
  public Term alias( Term tpat, Term def, Term body ) { return mk(E_TY_ALIAS,null,tpat,def,body); }
  public Term ap( Term fun, Term arg ) { return mk(E_AP,null,fun,arg); }
  public Term iff( Term c, Term t, Term f ) { return mk(E_IF,null,c,t,f); }
  public Term seq( Term e1, Term e2 ) { return mk(E_SEQ,null,e1,e2); }
  public Term test( Term e ) { return mk(E_TEST,null,e); }
  public Term parens( Term e ) { return mk(E_PARENS,null,e); }
  public Term cons( Term hd, Term tl ) { return mk(E_CONS,null,hd,tl); }
  public Term concat( Term e1, Term e2 ) { return mk(E_LIST_CONCAT,null,e1,e2); }
  public Term unop( Op op, Term e ) { assert op._unary; return mk(E_UN_OP,op,e); }
  public Term binop( Op op, Term e1, Term e2 ) { assert !op._unary; return mk(E_BIN_OP,op,e1,e2); }
  public Term match( Term scrut, Term... rules ) {
    Term[] kids = new Term[rules.length+1];
    kids[0] = scrut;
    System.arraycopy(rules,0,kids,1,rules.length);
    return mk(E_MATCH,null,kids);
  }
  public Term rule( Term pat, Term body ) { return mk(RULE,null,pat,body); }

  // Patterns
  public Term phole() { return mk(P_EMPTY_HOLE,null); }
  public Term pinvalid( String text ) { return mk(P_INVALID,text); }
  public Term pmulti( Term... kids ) { return mkn(P_MULTI_HOLE,kids.length,kids); }
  public Term pwild() { return mk(P_WILD,null); }
  public Term pint( long i ) { return mk(P_INT,i); }
  public Term pfloat( double d ) { return mk(P_FLOAT,d); }
  public Term pbool( boolean b ) { return mk(P_BOOL,b); }
  public Term pstr( String s ) { return mk(P_STRING,s); }
  public Term ptriv() { return mk(P_TRIV,null); }
  public Term plist( Term... ps ) { return mk(P_LIST_LIT,null,ps); }
  public Term pcons( Term hd, Term tl ) { return mk(P_CONS,null,hd,tl); }
  public Term pvar( String name ) { return mk(P_VAR,name); }
  public Term ptuple( Term... ps ) { return mkn(P_TUPLE,ps.length-1,ps); }
  public Term pparens( Term p ) { return mk(P_PARENS,null,p); }
  public Term ptag( String name ) { return mk(P_TAG,name); }
  public Term pap( Term tag, Term arg ) { return mk(P_AP,null,tag,arg); }
  public Term pann( Term pat, Term typ ) { return mk(P_TYPE_ANN,null,pat,typ); }

  // Surface types
  public Term thole() { return mk(T_EMPTY_HOLE,null); }
  public Term tinvalid( String text ) { return mk(T_INVALID,text); }
  public Term tmulti( Term... kids ) { return mkn(T_MULTI_HOLE,kids.length,kids); }
  public Term tint() { return mk(T_INT,null); }
  public Term tfloat() { return mk(T_FLOAT,null); }
  public Term tbool() { return mk(T_BOOL,null); }
  public Term tstr() { return mk(T_STRING,null); }
  public Term tlist( Term t ) { return mk(T_LIST,null,t); }
  public Term tarrow( Term in, Term out ) { return mk(T_ARROW,null,in,out); }
  public Term ttuple( Term... ts ) { return mkn(T_TUPLE,ts.length-1,ts); }
  public Term tparens( Term t ) { return mk(T_PARENS,null,t); }
  public Term tvar( String name ) { return mk(T_VAR,name); }
  public Term tsum( Term... ts ) { return mkn(T_SUM,ts.length-1,ts); }

  // Type patterns
  public Term tpvar( String name ) { return mk(TP_VAR,name); }
  public Term tphole() { return mk(TP_EMPTY_HOLE,null); }
  public Term tpinvalid( String text ) { return mk(TP_INVALID,text); }
  public Term tpmulti( Term... kids ) { return mkn(TP_MULTI_HOLE,kids.length,kids); }

  // Sum definitions
  public Term stag( String name ) { return mk(TS_TAG,name); }
  public Term sap( String name, Term payload ) { return mk(TS_AP,name,payload); }
  public Term shole() { return mk(TS_EMPTY_HOLE,null); }
  public Term sinvalid( String text ) { return mk(TS_INVALID,text); }
  public Term smulti( Term... kids ) { return mkn(TS_MULTI_HOLE,kids.length,kids); }
}
