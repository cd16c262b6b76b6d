package com.cliffc.holes.term;

import com.cliffc.holes.util.SB;
import com.cliffc.holes.util.Util;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/** An immutable term node.

   A node has a syntactic Form, one or more ids, an optional constant and
   children.  Most nodes have a single id; forms spanning several tokens
   (tuples, multi-holes) carry one id per token, and all of them resolve to
   the same statics.  The constant is the literal value for literals, the
   name for named forms, the Op for operators and the text for invalid nodes.

   Equality is structural, ids included.
*/
public final class Term {
  public final Form _form;
  public final int[] _ids;
  public final Object _con;
  public final Term[] _kids;
  private final int _hash;

  public Term( Form form, int[] ids, Object con, Term... kids ) {
    assert ids.length>0 : "term needs an id";
    _form=form; _ids=ids; _con=con; _kids=kids;
    _hash = Util.mix_hash(Util.mix_hash(form.ordinal(),Arrays.hashCode(ids)),
                          Util.mix_hash(Objects.hashCode(con),Util.hash(kids)));
  }

  public Sort sort() { return _form._sort; }
  public int rep_id() { return _ids[0]; }
  public Term kid( int i ) { return _kids[i]; }
  public int len() { return _kids.length; }
  public String name() { assert _form.is_named(); return (String)_con; }
  public Op op() { return (Op)_con; }
  // Invalid text; blank invalid text is not an error
  public String text() { return (String)_con; }

  // Fold over the tree: 'map' each node, 'reduce' the results of kids
  public <T> T visit( Function<Term,T> map, BinaryOperator<T> reduce ) {
    T rez = map.apply(this);
    for( Term kid : _kids )
      rez = reduce.apply(rez,kid.visit(map,reduce));
    return rez;
  }
  // Every id in the tree
  public int[] all_ids() {
    return visit(t -> t._ids, (a,b) -> {
        int[] c = Arrays.copyOf(a,a.length+b.length);
        System.arraycopy(b,0,c,a.length,b.length);
        return c;
      });
  }

  @Override public int hashCode() { return _hash; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Term t) ) return false;
    return _hash==t._hash && _form==t._form && Arrays.equals(_ids,t._ids) &&
      Objects.equals(_con,t._con) && Arrays.equals(_kids,t._kids);
  }

  @Override public String toString() { return str(new SB()).toString(); }
  // Surface-like syntax, for debugging
  public SB str( SB sb ) {
    switch( _form ) {
    case E_INVALID: case P_INVALID: case T_INVALID: case TP_INVALID: case TS_INVALID:
      return sb.p("invalid(").pq(text()).p(')');
    case E_EMPTY_HOLE: case P_EMPTY_HOLE: case T_EMPTY_HOLE: case TP_EMPTY_HOLE: case TS_EMPTY_HOLE:
      return sb.p('?');
    case E_MULTI_HOLE: case P_MULTI_HOLE: case T_MULTI_HOLE: case TP_MULTI_HOLE: case TS_MULTI_HOLE:
      return kids(sb.p("multi("),", ").p(')');
    case E_TRIV: case P_TRIV: return sb.p("()");
    case E_BOOL: case P_BOOL: case E_INT: case P_INT: return sb.p(_con.toString());
    case E_FLOAT: case P_FLOAT: return sb.p((Double)_con);
    case E_STRING: case P_STRING: return sb.pq((String)_con);
    case E_LIST_LIT: case P_LIST_LIT: return kids(sb.p('['),", ").p(']');
    case E_TUPLE: case P_TUPLE: case T_TUPLE: return kids(sb.p('('),", ").p(')');
    case E_PARENS: case P_PARENS: case T_PARENS: return kid(0).str(sb.p('(')).p(')');
    case E_TAG: case E_VAR: case P_VAR: case P_TAG: case T_VAR: case TP_VAR: case TS_TAG:
      return sb.p(name());
    case E_FUN: return kid(1).str(kid(0).str(sb.p("fun ")).p(" -> "));
    case E_LET: return kid(2).str(kid(1).str(kid(0).str(sb.p("let ")).p(" = ")).p(" in "));
    case E_TY_ALIAS: return kid(2).str(kid(1).str(kid(0).str(sb.p("type ")).p(" = ")).p(" in "));
    case E_AP: case P_AP: return kid(1).str(kid(0).str(sb).p('(')).p(')');
    case E_IF: return kid(2).str(kid(1).str(kid(0).str(sb.p("if ")).p(" then ")).p(" else "));
    case E_SEQ: return kid(1).str(kid(0).str(sb).p("; "));
    case E_TEST: return kid(0).str(sb.p("test ")).p(" end");
    case E_CONS: case P_CONS: return kid(1).str(kid(0).str(sb).p("::"));
    case E_LIST_CONCAT: return kid(1).str(kid(0).str(sb).p(" @ "));
    case E_UN_OP: return kid(0).str(sb.p(op()._str));
    case E_BIN_OP: return kid(1).str(kid(0).str(sb).p(' ').p(op()._str).p(' '));
    case E_MATCH: {
      kid(0).str(sb.p("case "));
      for( int i=1; i<_kids.length; i++ ) kid(i).str(sb.p(' '));
      return sb.p(" end");
    }
    case RULE: return kid(1).str(kid(0).str(sb.p("| ")).p(" => "));
    case P_WILD: return sb.p('_');
    case P_TYPE_ANN: return kid(1).str(kid(0).str(sb).p(" : "));
    case T_INT: case T_FLOAT: case T_BOOL: case T_STRING: return sb.p(_form._str);
    case T_LIST: return kid(0).str(sb.p('[')).p(']');
    case T_ARROW: return kid(1).str(kid(0).str(sb).p(" -> "));
    case T_SUM: return kids(sb,(" + "));
    case TS_AP: return kid(0).str(sb.p(name()).p('(')).p(')');
    default: throw new IllegalStateException("unhandled "+_form);
    }
  }
  private SB kids( SB sb, String sep ) {
    for( Term kid : _kids ) kid.str(sb).p(sep);
    return _kids.length==0 ? sb : sb.unchar(sep.length());
  }
}
