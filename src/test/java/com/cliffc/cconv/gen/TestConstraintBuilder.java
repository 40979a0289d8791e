package com.cliffc.cconv.gen;

import com.cliffc.cconv.Driver;
import com.cliffc.cconv.Options;
import com.cliffc.cconv.Src;
import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import org.junit.Before;
import org.junit.Test;

import static com.cliffc.cconv.Src.*;
import static com.cliffc.cconv.ast.CType.*;
import static org.junit.Assert.*;

public class TestConstraintBuilder {
  private Src _s;
  private Driver _drv;
  private AtomEnv _env;

  @Before public void reset() { _s = new Src("a.c"); }

  private void solve( Decl... ds ) {
    _drv = new Driver(Options.parse(_s._file));
    _drv.generate(_s.unit(ds)).link();
    _env = _drv.solve();
  }
  private String render( Decl d ) { return _drv._info.getVariable(d).render(_env,d._name); }
  private Atom outer( Decl d ) { return _env.get(_drv._info.pvar(d).outer()); }

  private FunDecl malloc() { return _s.fun("malloc",VOID.ptr(),_s.parm("size",ULONG)); }

  // Subscripting makes an array
  @Test public void testSubscript() {
    ParmDecl a = _s.parm("a",INT.ptr());
    FunDecl f = _s.fun("f",INT,a).body(block(new Return(new Subscript(ref(a),new IntLit(0)))));
    solve(f);
    assertEquals(Atom.ARR, outer(a));
    assertEquals("_Array_ptr<int> a", render(a));
  }

  // Arithmetic and increments exclude a single-object pointer
  @Test public void testArith() {
    ParmDecl p = _s.parm("p",INT.ptr()), q = _s.parm("q",CHAR.ptr());
    FunDecl g = _s.fun("g",VOID,p,q).body(block(
      expr(new Unary(Unary.Op.POST_INC,ref(p))),
      expr(new Binary(Binary.Op.ADD_ASSIGN,ref(q),new IntLit(2)))));
    solve(g);
    assertEquals(Atom.ARR, outer(p));
    assertEquals(Atom.ARR, outer(q));
  }

  // A cast to a differently shaped pointer loses both ends
  @Test public void testBadCast() {
    ParmDecl ip = _s.parm("ip",INT.ptr());
    VarDecl c = _s.var("c",CHAR.ptr(),new Cast(CHAR.ptr(),ref(ip)));
    VarDecl d = _s.var("d",INT.ptr(),new Cast(INT.ptr(),ref(ip)));
    FunDecl h = _s.fun("h",VOID,ip).body(block(decl(c),decl(d)));
    solve(h);
    assertEquals(Atom.WILD, outer(ip));
    assertEquals(Atom.WILD, outer(c));
    assertEquals(Atom.WILD, outer(d)); // Same shape, equated with ip
    assertEquals("char *c", render(c));
  }

  // Null is fine; any other integer is not
  @Test public void testConstants() {
    VarDecl z = _s.var("z",INT.ptr(),new IntLit(0));
    VarDecl n = _s.var("n",INT.ptr(),new Cast(INT.ptr(),new IntLit(0x1000)));
    FunDecl f = _s.fun("f",VOID).body(block(decl(z),decl(n)));
    solve(f);
    assertEquals(Atom.PTR , outer(z));
    assertEquals(Atom.WILD, outer(n));
  }

  // void and va_list pointees are never checked
  @Test public void testVoidPtr() {
    VarDecl v = _s.var("v",VOID.ptr());
    VarDecl l = _s.var("l",VALIST.ptr());
    FunDecl f = _s.fun("f",VOID).body(block(decl(v),decl(l)));
    solve(f);
    assertEquals(Atom.WILD, outer(v));
    assertEquals(Atom.WILD, outer(l));
  }

  // Calls through a computed callee lose their arguments
  @Test public void testUnknownCallee() {
    FieldDecl cb = new FieldDecl("cb",fun(INT,INT.ptr()).ptr(),_s.loc());
    RecordDecl rec = new RecordDecl("struct S",_s.loc(),cb);
    ParmDecl s = _s.parm("s",base("struct S").ptr()), p = _s.parm("p",INT.ptr());
    FunDecl k = _s.fun("k",VOID,s,p).body(block(expr(new CallE(new Member(ref(s),cb,true),ref(p)))));
    solve(rec,k);
    assertEquals(Atom.WILD, outer(p));
    assertEquals(Atom.PTR , outer(s));
    assertEquals("_Ptr<int (_Ptr<int>)> cb", render(cb));
  }

  // Extra arguments to a variadic function go Wild
  @Test public void testVarargs() {
    ParmDecl fmt = _s.parm("fmt",CHAR.ptr());
    FunDecl printf = new FunDecl("printf",fun_varargs(INT,CHAR.ptr()),_s.loc(),fmt);
    VarDecl p = _s.var("p",INT.ptr(),new IntLit(0));
    FunDecl f = _s.fun("f",VOID).body(block(decl(p),expr(call(printf,new StrLit("%p"),ref(p)))));
    solve(printf,f);
    assertEquals(Atom.WILD, outer(p));
  }

  // Trusted allocators sized for the pointee keep the pointer checked, and
  // free() does not spoil its argument
  @Test public void testAlloc() {
    FunDecl malloc = malloc();
    FunDecl free = _s.fun("free",VOID,_s.parm("ptr",VOID.ptr()));
    VarDecl p = _s.var("p",INT.ptr(),call(malloc,new SizeOf(INT)));
    VarDecl q = _s.var("q",INT.ptr(),call(malloc,new SizeOf(CHAR)));
    VarDecl r = _s.var("r",INT.ptr(),new Cast(INT.ptr(),call(malloc,new SizeOf(INT))));
    VarDecl w = _s.var("w",CHAR.ptr(),new Cast(CHAR.ptr(),call(malloc,new SizeOf(INT))));
    FunDecl f = _s.fun("f",VOID).body(block(decl(p),decl(q),decl(r),decl(w),expr(call(free,ref(p)))));
    solve(malloc,free,f);
    assertEquals(Atom.PTR , outer(p));
    assertEquals(Atom.WILD, outer(q));
    assertEquals(Atom.PTR , outer(r));
    assertEquals(Atom.WILD, outer(w));
    assertEquals(Atom.WILD, _env.get(_drv._info.fvar(malloc).ret().outer())); // Spoiled by the differently shaped casts
    assertEquals(Atom.PTR , _env.get(_drv._info.fvar(free).param(0).outer()));
    assertEquals("_Ptr<int> p", render(p));
  }

  // Returning an integer spoils the return; returning null does not
  @Test public void testReturn() {
    FunDecl z = _s.fun("z",INT.ptr()).body(block(new Return(new Cast(INT.ptr(),new IntLit(8)))));
    FunDecl y = _s.fun("y",INT.ptr()).body(block(new Return(new IntLit(0))));
    solve(z,y);
    assertEquals(Atom.WILD, _env.get(_drv._info.fvar(z).ret().outer()));
    assertEquals(Atom.PTR , _env.get(_drv._info.fvar(y).ret().outer()));
  }

  // A function pointer shares constraints with the function it holds
  @Test public void testFunPtr() {
    ParmDecl a = _s.parm("a",INT.ptr());
    FunDecl f = _s.fun("f",INT,a).body(block(new Return(new Subscript(ref(a),new IntLit(1)))));
    VarDecl fp = _s.var("fp",fun(INT,INT.ptr()).ptr(),ref(f));
    FunDecl g = _s.fun("g",VOID).body(block(decl(fp)));
    solve(f,g);
    assertEquals("_Ptr<int (_Array_ptr<int>)> fp", render(fp));
  }

  // Assignments and conditionals equate everything they may refer to
  @Test public void testAssign() {
    ParmDecl a = _s.parm("a",INT.ptr()), b = _s.parm("b",INT.ptr()), c = _s.parm("c",INT.ptr());
    VarDecl t = _s.var("t",INT.ptr());
    FunDecl f = _s.fun("f",VOID,a,b,c).body(block(
      decl(t),
      expr(assign(ref(t),new Cond(new IntLit(1),ref(a),new Paren(ref(b))))),
      expr(assign(ref(c),new Cast(INT.ptr(),new IntLit(3)))),
      expr(new Subscript(ref(t),new IntLit(0)))));
    solve(f);
    assertEquals(Atom.ARR , outer(a));
    assertEquals(Atom.ARR , outer(b));
    assertEquals(Atom.ARR , outer(t));
    assertEquals(Atom.WILD, outer(c));
  }

  // An interface annotation stands in for the raw declared type when casts
  // are shape checked, and its ids are not forced Wild
  @Test public void testItypeShape() {
    ParmDecl buf = _s.parm("buf",VOID.ptr()), w = _s.parm("w",VOID.ptr());
    buf.itype(CHAR.ary());
    w.itype(CHAR.ptr());
    VarDecl c = _s.var("c",CHAR.ptr(),new Cast(CHAR.ptr(),ref(buf)));
    VarDecl d = _s.var("d",CHAR.ptr());
    FunDecl f = _s.fun("f",VOID,buf,w).body(block(
      decl(c),
      decl(d),
      expr(assign(ref(d),new Cast(CHAR.ptr(),new Paren(ref(w)))))));
    solve(f);
    assertEquals(Atom.ARR, outer(buf));
    assertEquals(Atom.ARR, outer(c));
    assertEquals(Atom.PTR, outer(w));
    assertEquals(Atom.PTR, outer(d));
    assertEquals("_Ptr<char> d", render(d));
  }

  // A pinned id survives a cast of the wrong shape; the receiver does not
  @Test public void testItypeBadCast() {
    ParmDecl ip = _s.parm("ip",INT.ptr());
    ip.itype(INT.ptr());
    VarDecl c = _s.var("c",CHAR.ptr(),new Cast(CHAR.ptr(),ref(ip)));
    FunDecl h = _s.fun("h",VOID,ip).body(block(decl(c)));
    solve(h);
    assertEquals(Atom.PTR , outer(ip));
    assertEquals(Atom.WILD, outer(c));
  }
}
