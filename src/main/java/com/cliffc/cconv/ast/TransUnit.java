package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

/** One translation unit: the main file name plus its top-level
 *  declarations, in source order, including those pulled in from headers. */
public class TransUnit {
  public final String _file;
  public final Decl[] _decls;
  public TransUnit( String file, Decl... decls ) { _file=file; _decls=decls; }

  public SB str( SB sb ) {
    for( Decl d : _decls ) {
      d.str(sb);
      if( d instanceof FunDecl fd && fd.has_body() ) fd.body().str(sb.p(' ')).nl();
      else sb.p(';').nl();
    }
    return sb;
  }
  @Override public String toString() { return _file; }
}
