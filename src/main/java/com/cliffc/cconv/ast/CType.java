package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

/** A C type, as handed over by the frontend.
 *
 *  Kinds are a small int discriminant.
 *  Pointers, arrays and functions wrap an inner type; decomposing a type
 *  layer by layer from the outside in gives the shape the constraint
 *  variables mirror.  Types are immutable and compared structurally.
 */
public final class CType {
  public static final byte TBASE=0, TPTR=1, TARY=2, TFUN=3;

  public final byte _kind;
  public final String _base;    // Base spelling, e.g. "int", "struct node", "va_list"
  public final CType _elem;     // Pointee, array element, or function return
  public final int _len;        // Array extent, -1 for unsized
  public final CType[] _args;   // Function parameter types
  public final boolean _varargs;// Function takes "..."
  public final boolean _proto;  // Function has a prototype

  private CType( byte kind, String base, CType elem, int len, CType[] args, boolean varargs, boolean proto ) {
    _kind=kind; _base=base; _elem=elem; _len=len; _args=args; _varargs=varargs; _proto=proto;
  }

  public static final CType VOID  = base("void");
  public static final CType INT   = base("int");
  public static final CType CHAR  = base("char");
  public static final CType LONG  = base("long");
  public static final CType ULONG = base("unsigned long");
  public static final CType VALIST= base("va_list");

  public static CType base( String s ) { return new CType(TBASE,s,null,-1,null,false,false); }
  public CType ptr() { return new CType(TPTR,null,this,-1,null,false,false); }
  public CType ary( int len ) { return new CType(TARY,null,this,len,null,false,false); }
  public CType ary() { return ary(-1); }
  public static CType fun( CType ret, CType... args ) { return new CType(TFUN,null,ret,-1,args,false,true); }
  public static CType fun_varargs( CType ret, CType... args ) { return new CType(TFUN,null,ret,-1,args,true,true); }
  // K&R style "int f();", no prototype
  public static CType fun_noproto( CType ret ) { return new CType(TFUN,null,ret,-1,new CType[0],false,false); }

  public boolean is_ptr() { return _kind==TPTR; }
  public boolean is_ary() { return _kind==TARY; }
  public boolean is_fun() { return _kind==TFUN; }
  public boolean is_ptr_or_ary() { return _kind==TPTR || _kind==TARY; }
  public boolean is_void() { return _kind==TBASE && _base.equals("void"); }
  public boolean is_valist() { return _kind==TBASE && _base.equals("va_list"); }

  // Pointee or element; null for base and function types
  public CType elem() { return is_ptr_or_ary() ? _elem : null; }
  public CType ret() { assert is_fun(); return _elem; }
  public int nargs() { assert is_fun(); return _args.length; }

  // Count of pointer/array layers before reaching a base or function type
  public int depth() {
    int d=0;
    for( CType t=this; t.is_ptr_or_ary(); t=t._elem ) d++;
    return d;
  }
  // Residual type after stripping all pointer/array layers
  public CType strip() {
    CType t=this;
    while( t.is_ptr_or_ary() ) t=t._elem;
    return t;
  }

  /** Structural-shape equality: the same count of pointer/array layers, then
   *  equal residual types.  Arrays and pointers count alike, so an array
   *  decays to a pointer of the same shape. */
  public boolean shape_eq( CType t ) {
    return depth()==t.depth() && strip().residual_eq(t.strip());
  }
  private boolean residual_eq( CType t ) {
    if( _kind != t._kind ) return false;
    if( _kind==TBASE ) return _base.equals(t._base);
    assert _kind==TFUN;
    if( _args.length != t._args.length || _varargs != t._varargs ) return false;
    if( !_elem.shape_eq(t._elem) ) return false;
    for( int i=0; i<_args.length; i++ )
      if( !_args[i].shape_eq(t._args[i]) )
        return false;
    return true;
  }

  // Exact structural equality, including array extents
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof CType t) || _kind!=t._kind ) return false;
    return switch( _kind ) {
    case TBASE -> _base.equals(t._base);
    case TPTR  -> _elem.equals(t._elem);
    case TARY  -> _len==t._len && _elem.equals(t._elem);
    default -> {
      if( _varargs!=t._varargs || _proto!=t._proto || _args.length!=t._args.length || !_elem.equals(t._elem) ) yield false;
      for( int i=0; i<_args.length; i++ )
        if( !_args[i].equals(t._args[i]) )
          yield false;
      yield true;
    }
    };
  }
  @Override public int hashCode() {
    return switch( _kind ) {
    case TBASE -> _base.hashCode();
    case TPTR  -> _elem.hashCode()*7+1;
    case TARY  -> _elem.hashCode()*11+_len;
    default -> {
      int h = _elem.hashCode()*13+_args.length;
      for( CType a : _args ) h = h*31+a.hashCode();
      yield h;
    }
    };
  }

  /** Print in C declarator syntax around {@code d}, which is the declared
   *  name or empty for an abstract type.  The declarator grows inside-out:
   *  pointers prefix a '*', arrays and functions suffix, and a pointer
   *  declarator picks up parens before a suffix binds to it. */
  public SB str( SB sb, String d ) {
    CType t = this;
    while( true ) {
      switch( t._kind ) {
      case TPTR: d = "*"+d; break;
      case TARY: d = paren(d)+"["+(t._len<0 ? "" : Integer.toString(t._len))+"]"; break;
      case TFUN: d = paren(d)+args(new SB().p('('),t).p(')'); break;
      default:
        sb.p(t._base);
        if( !d.isEmpty() ) sb.p(' ').p(d);
        return sb;
      }
      t = t._elem;
    }
  }
  static String paren( String d ) { return d.startsWith("*") ? "("+d+")" : d; }
  private static SB args( SB sb, CType fun ) {
    if( fun._args.length==0 )
      return fun._proto && !fun._varargs ? sb.p("void") : sb;
    for( CType a : fun._args ) a.str(sb,"").p(", ");
    if( fun._varargs ) return sb.p("...");
    return sb.unchar(2);
  }

  @Override public String toString() { return str(new SB(),"").toString(); }
}
