package com.cliffc.cconv;

import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.cvar.CVar;
import com.cliffc.cconv.cvar.PVar;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.util.Ary;
import org.junit.Test;

import static com.cliffc.cconv.Src.*;
import static com.cliffc.cconv.ast.CType.*;
import static org.junit.Assert.*;

public class TestProgramInfo {

  private static Atom outer( Driver drv, AtomEnv env, Decl d ) { return env.get(drv._info.pvar(d).outer()); }

  // The same header declaration seen by two units is one variable
  @Test public void testRegistry() {
    Src h = new Src("a.h");
    VarDecl g = new VarDecl("g",INT.ptr(),h.loc(),null,true,true);
    VarDecl g2 = new VarDecl("g",INT.ptr(),g._loc,null,true,true); // Re-parsed in unit 2
    ProgramInfo info = new ProgramInfo(Options.parse("a.c","b.c"));
    info.enterUnit(new TransUnit("a.c",g));
    CVar cv = info.addVariable(g);
    assertSame(cv, info.addVariable(g));
    assertSame(cv, info.getVariable(g));
    info.exitUnit();
    assertNull(info.unit());
    info.enterUnit(new TransUnit("b.c",g2));
    assertSame(cv, info.getVariable(g2)); // Found by location
    assertSame(cv, info.addVariable(g2));
    info.exitUnit();
    // Non-pointers carry nothing
    Src a = new Src("a.c");
    VarDecl i = a.var("i",INT);
    info.enterUnit(a.unit(i));
    assertNull(info.addVariable(i));
    info.exitUnit();
  }

  // Locals, parameters and fields are all visited
  @Test public void testWalk() {
    Src s = new Src("a.c");
    FieldDecl fld = new FieldDecl("next",base("struct L").ptr(),s.loc());
    RecordDecl rec = new RecordDecl("struct L",s.loc(),fld);
    ParmDecl p = s.parm("p",INT.ptr());
    VarDecl x = s.var("x",INT), y = s.var("y",CHAR.ptr());
    FunDecl f = s.fun("f",VOID,p).body(block(decl(x),If.loop(ref(p),new If(ref(p),block(decl(y)),null))));
    Ary<Decl> seen = new Ary<>(Decl.class);
    ProgramInfo.walk_decls(s.unit(rec,f),seen::add);
    assertEquals("{struct L {\n  struct L *next;\n},struct L *next,void f(int *p),int *p,int x,char *y}", seen.toString());
    assertEquals("while( p ) if( p ) {\n}", If.loop(ref(p),new If(ref(p),block(),null)).toString());
  }

  // Expressions resolve to the variables they may refer to
  @Test public void testExprVars() {
    Src s = new Src("a.c");
    ParmDecl pp = s.parm("pp",INT.ptr().ptr());
    ParmDecl q = s.parm("q",INT.ptr());
    FunDecl g = s.fun("g",INT.ptr(),q);
    FunDecl f = s.fun("f",VOID,pp);
    ProgramInfo info = new ProgramInfo(Options.parse("a.c"));
    info.enterUnit(s.unit(g,f));
    info.addVariable(g);
    info.addVariable(f);
    PVar vpp = info.pvar(pp);
    assertNotNull(vpp);
    Ary<CVar> d = info.getVariable(new Unary(Unary.Op.DEREF,ref(pp)));
    assertEquals(1, d.len());
    assertEquals(vpp.id(1), ((PVar)d.at(0)).id(0));
    assertEquals(1, info.getVariable(new Subscript(new Paren(ref(pp)),new IntLit(0))).len());
    assertSame(info.fvar(g).ret(), info.getVariable(call(g,ref(q))).at(0));
    assertSame(info.callee(call(g,ref(q))), info.fvar(g));
    assertTrue(info.getVariable(new Unary(Unary.Op.ADDR_OF,ref(q))).isEmpty());
    assertTrue(info.getVariable(new IntLit(3)).isEmpty());
    Ary<CVar> both = info.getVariable(new Cond(new IntLit(1),ref(q),new Binary(Binary.Op.ADD,ref(q),new IntLit(1))));
    assertEquals(1, both.len()); // Duplicates dropped
    info.exitUnit();
  }

  // Declarations in different units are tied together by name
  @Test public void testLinkFunctions() {
    Src a = new Src("a.c"), b = new Src("b.c");
    ParmDecl pa = a.parm("x",INT.ptr());
    FunDecl proto = a.fun("inc",INT.ptr(),pa);
    ParmDecl pb = b.parm("x",INT.ptr());
    FunDecl def = b.fun("inc",INT.ptr(),pb).body(block(
      expr(new Unary(Unary.Op.PRE_INC,ref(pb))),
      new Return(ref(pb))));
    Driver drv = new Driver(Options.parse("-output-postfix=checked","a.c","b.c"));
    drv.generate(a.unit(proto)).generate(b.unit(def)).link();
    AtomEnv env = drv.solve();
    ProgramInfo info = drv._info;
    assertTrue(info.linked());
    assertEquals(2, info.declarations("inc").len());
    assertSame(info.fvar(def), info.definition("inc"));
    assertNull(info.definition("nope"));
    // Returns are shared; the definition's parameter stays its own
    assertEquals(Atom.ARR, env.get(info.fvar(proto).ret().outer()));
    assertEquals(Atom.ARR, outer(drv,env,pb));
    assertEquals(Atom.PTR, outer(drv,env,pa));
  }

  // Never-defined functions are opaque unless trusted; pinned ids survive
  @Test public void testLinkOpaque() {
    Src a = new Src("a.c");
    ParmDecl x = a.parm("x",INT.ptr());
    FunDecl ext = a.fun("ext",INT.ptr(),x);
    ParmDecl y = a.parm("y",INT.ptr());
    y.itype(INT.ary());
    FunDecl pinned = a.fun("pinned",VOID,y);
    ParmDecl z = a.parm("z",INT.ptr());
    FunDecl known = a.fun("known",VOID,z);
    Options opts = Options.parse("a.c","-trust=known");
    Driver drv = new Driver(opts);
    drv.generate(a.unit(ext,pinned,known)).link();
    AtomEnv env = drv.solve();
    assertEquals(Atom.WILD, outer(drv,env,x));
    assertEquals(Atom.WILD, env.get(drv._info.fvar(ext).ret().outer()));
    assertEquals(Atom.ARR , outer(drv,env,y));
    assertEquals(Atom.PTR , outer(drv,env,z));
  }

  // Prototypes of different arity cannot be trusted
  @Test public void testLinkArity() {
    Src a = new Src("a.c"), b = new Src("b.c");
    ParmDecl p1 = a.parm("p",CHAR.ptr());
    FunDecl f1 = a.fun("f",CHAR.ptr(),p1);
    ParmDecl p2 = b.parm("p",CHAR.ptr()), n2 = b.parm("n",INT);
    FunDecl f2 = b.fun("f",CHAR.ptr(),p2,n2).body(block(new Return(ref(p2))));
    Driver drv = new Driver(Options.parse("-output-postfix=checked","a.c","b.c"));
    drv.generate(a.unit(f1)).generate(b.unit(f2)).link();
    AtomEnv env = drv.solve();
    assertEquals(Atom.WILD, outer(drv,env,p1));
    assertEquals(Atom.WILD, outer(drv,env,p2));
  }

  // Globals are shared by name; extern-only globals are opaque
  @Test public void testLinkGlobals() {
    Src a = new Src("a.c"), b = new Src("b.c");
    VarDecl ga = VarDecl.extern("buf",CHAR.ptr(),a.loc());
    VarDecl gb = VarDecl.global("buf",CHAR.ptr(),b.loc(),null);
    VarDecl ea = VarDecl.extern("env",CHAR.ptr(),a.loc());
    FunDecl use = a.fun("use",CHAR.ptr()).body(block(new Return(new Binary(Binary.Op.ADD,ref(ga),new IntLit(1)))));
    Driver drv = new Driver(Options.parse("-output-postfix=checked","a.c","b.c"));
    drv.generate(a.unit(ga,ea,use)).generate(b.unit(gb)).link();
    AtomEnv env = drv.solve();
    assertEquals(Atom.ARR , outer(drv,env,ga));
    assertEquals(Atom.ARR , outer(drv,env,gb));
    assertEquals(Atom.WILD, outer(drv,env,ea));
  }

  @Test public void testDumpAndStats() {
    Src a = new Src("a.c");
    VarDecl p = a.var("p",INT.ptr(),new IntLit(0));
    VarDecl v = a.var("v",VOID.ptr());
    ParmDecl x = a.parm("x",INT.ptr());
    FunDecl f = a.fun("f",VOID,x).body(block(decl(p,v),expr(new Subscript(ref(x),new IntLit(0)))));
    Driver drv = new Driver(Options.parse("a.c"));
    drv.generate(a.unit(f)).link();
    drv.solve();
    String dump = drv._info.str(new com.cliffc.cconv.util.SB()).toString();
    // x is made with f's signature, before the locals
    assertTrue(dump, dump.contains("a.c:2:1 v : { q_2 } => void *v\n"));
    assertTrue(dump, dump.contains("a.c:3:1 x : { q_0 } => _Array_ptr<int> x\n"));
    assertTrue(dump, dump.contains("Constraints:\n  q_2 == WILD\n  q_0 == ARR\n"));
    assertTrue(dump, dump.endsWith("Environment:\nq_0 = ARR\nq_1 = PTR\nq_2 = WILD\n"));
    java.io.ByteArrayOutputStream bs = new java.io.ByteArrayOutputStream();
    drv._info.print_stats(java.util.List.of("a.c"),new java.io.PrintStream(bs,true));
    assertEquals("a.c: ptr 1 arr 1 wild 1\nSummary: ptr 1 arr 1 wild 1\n", bs.toString());
  }
}
