package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Block extends Stmt {
  public final Stmt[] _stmts;
  public Block( Stmt... stmts ) { _stmts = stmts; }
  @Override public SB str(SB sb) {
    sb.p('{').nl().ii(1);
    for( Stmt s : _stmts ) s.str(sb.i()).nl();
    return sb.di(1).i().p('}');
  }
}
