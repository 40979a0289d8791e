package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// A struct or union definition
public class RecordDecl extends Decl {
  public final FieldDecl[] _fields;
  public RecordDecl( String tag, PSL loc, FieldDecl... fields ) {
    super(tag,CType.base(tag),loc);
    _fields = fields;
  }
  @Override public SB str( SB sb ) {
    sb.p(_name).p(" {").nl().ii(1);
    for( FieldDecl f : _fields ) f.str(sb.i()).p(';').nl();
    return sb.di(1).p('}');
  }
}
