package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

// One or more local declarations sharing a statement: "int *a, b = 0;"
public class DeclStmt extends Stmt {
  public final VarDecl[] _decls;
  @Nullable public SrcRange _range; // Extent of the whole statement
  public DeclStmt( VarDecl... decls ) {
    _decls = decls;
    for( VarDecl d : decls ) { assert d._stmt==null; d._stmt = this; }
  }
  public DeclStmt range( int lo, int hi ) { _range = new SrcRange(lo,hi); return this; }
  public boolean single() { return _decls.length==1; }
  @Override public SB str(SB sb) {
    for( VarDecl d : _decls ) d.str_init(sb,d.toString()).p("; ");
    return sb.unchar();
  }
}
