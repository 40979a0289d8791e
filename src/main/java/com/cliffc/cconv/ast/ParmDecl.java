package com.cliffc.cconv.ast;

public class ParmDecl extends Decl {
  public ParmDecl( String name, CType type, PSL loc ) { super(name,type,loc); }
}
