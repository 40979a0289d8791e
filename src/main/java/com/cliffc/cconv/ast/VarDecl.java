package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// Local or global variable, with an optional initializer
public class VarDecl extends Decl {
  public final Expr _init;      // Null if none
  public final boolean _global; // File scope
  public final boolean _extern; // "extern", declares but does not define
  DeclStmt _stmt;               // Enclosing statement, if a local

  public VarDecl( String name, CType type, PSL loc, Expr init ) { this(name,type,loc,init,false,false); }
  public VarDecl( String name, CType type, PSL loc, Expr init, boolean global, boolean extern ) {
    super(name,type,loc);
    _init=init; _global=global; _extern=extern;
    assert !extern || global;
  }
  public static VarDecl global( String name, CType type, PSL loc, Expr init ) { return new VarDecl(name,type,loc,init,true,false); }
  public static VarDecl extern( String name, CType type, PSL loc ) { return new VarDecl(name,type,loc,null,true,true); }

  public DeclStmt stmt() { return _stmt; }
  public boolean defines() { return !_extern; }

  @Override public SB str( SB sb ) {
    if( _extern ) sb.p("extern ");
    return super.str(sb);
  }
  // Declaration plus initializer, as re-emitted for multi-declaration statements
  public SB str_init( SB sb, String type_text ) {
    sb.p(type_text);
    if( _init!=null ) _init.str(sb.p(" = "));
    return sb;
  }
}
