package com.cliffc.cconv.ast;

public class FieldDecl extends Decl {
  public FieldDecl( String name, CType type, PSL loc ) { super(name,type,loc); }
}
