package com.cliffc.cconv;

import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.cvar.PVar;
import com.cliffc.cconv.rewrite.EditSet;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.util.Ary;
import com.cliffc.cconv.util.SB;
import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;
import org.junit.contrib.java.lang.system.SystemOutRule;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;

import static com.cliffc.cconv.Src.*;
import static com.cliffc.cconv.ast.CType.*;
import static org.junit.Assert.*;

public class TestDriver {
  @Rule public final SystemOutRule sysOut = new SystemOutRule().enableLog().muteForSuccessfulTests();
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();

  // void f(int *x, char *s) { x[1]; int *y = x; char *t = (char *)5; }
  private static TransUnit unit( Src s ) {
    ParmDecl x = s.parm("x",INT.ptr()), str = s.parm("s",CHAR.ptr());
    x.range(7,13);
    VarDecl y = s.var("y",INT.ptr(),ref(x).at(40,41));
    VarDecl t = s.var("t",CHAR.ptr(),new Cast(CHAR.ptr(),new IntLit(5)));
    return s.unit(s.fun("f",VOID,x,str).body(block(expr(new Subscript(ref(x),new IntLit(1))),decl(y),decl(t))));
  }

  // void f(int *x, char *s);  int *g(int *p) { int *r = p; f(p,0); return r; }
  private static TransUnit unitB( Src s ) {
    FunDecl f = s.fun("f",VOID,s.parm("x",INT.ptr()),s.parm("s",CHAR.ptr()));
    ParmDecl p = s.parm("p",INT.ptr());
    VarDecl r = s.var("r",INT.ptr(),ref(p).at(66,67));
    r.range(60,68);
    FunDecl g = s.fun("g",INT.ptr(),p).body(block(decl(r),expr(call(f,ref(p),new IntLit(0))),new Return(ref(r))));
    return s.unit(f,g);
  }
  private static TransUnit[] program() { return new TransUnit[]{unit(new Src("a.c")),unitB(new Src("b.c"))}; }
  private static final String[] TWO = {"-output-postfix=checked","a.c","b.c"};

  // Quiet unless asked
  @Test public void testQuiet() {
    EditSet es = new Driver(Options.parse("a.c")).run(unit(new Src("a.c")));
    assertEquals(1, es.len());
    assertEquals("", sysOut.getLog());
    assertEquals("", sysErr.getLog());
  }

  @Test public void testVerbose() {
    new Driver(Options.parse("-verbose","a.c")).run(unit(new Src("a.c")));
    String err = sysErr.getLog();
    assertTrue(err, err.contains("Analyzing file a.c\n"));
    assertTrue(err, err.contains("Done analyzing a.c\n"));
    assertTrue(err, err.contains("Solving constraints\nConstraints solved\n"));
    assertTrue(err, err.contains("Replacing type of x at a.c:1:1 with _Array_ptr<int> x\n"));
    // s and y have no source extent
    assertTrue(err, err.contains("Cannot rewrite s at a.c:2:1; no source extent\n"));
    assertTrue(err, err.contains("Cannot rewrite y at a.c:3:1; no source extent\n"));
    assertTrue(err, err.contains("Rewriting a.c to stdout, 1 edits\n"));
    assertTrue(err, err.contains("Planned 1 edits, rejected 0\n"));
    assertEquals("", sysOut.getLog());
  }

  @Test public void testDumps() {
    new Driver(Options.parse("-dump-intermediate","-dump-stats","a.c")).run(unit(new Src("a.c")));
    String out = sysOut.getLog();
    assertTrue(out, out.contains("Constraints:\n"));
    assertTrue(out, out.contains("Environment:\n"));
    assertTrue(out, out.endsWith("a.c: ptr 1 arr 2 wild 1\nSummary: ptr 1 arr 2 wild 1\n"));
  }

  // Statistics cover only the named files
  @Test public void testStatsFiles() {
    new Driver(Options.parse("-dump-stats","b.c")).run(unit(new Src("a.c")));
    assertEquals("Summary: ptr 0 arr 0 wild 0\n", sysOut.getLog());
  }

  @Test public void testPhaseOrder() {
    Driver drv = new Driver(Options.parse("a.c"));
    assertEquals(Driver.Phase.GEN, drv.phase());
    assertThrows(IllegalStateException.class, drv::solve);
    assertThrows(IllegalStateException.class, drv::plan);
    drv.generate(unit(new Src("a.c"))).link();
    assertEquals(Driver.Phase.LINK, drv.phase());
    assertThrows(IllegalStateException.class, () -> drv.generate(unit(new Src("b.c"))));
    assertThrows(IllegalStateException.class, drv::link);
    drv.solve();
    assertEquals(Driver.Phase.SOLVE, drv.phase());
    drv.plan();
    assertThrows(IllegalStateException.class, drv::plan);
  }

  // Bad configurations stop before any analysis
  @Test public void testConfigErrors() {
    ConfigException ce = assertThrows(ConfigException.class, () -> new Driver(Options.parse("-verbose","a.c","b.c")));
    assertEquals("If rewriting more than one file, can't output to stdout", ce.getMessage());
    ce = assertThrows(ConfigException.class, () -> new Driver(Options.parse("-verbose")));
    assertEquals("No input files", ce.getMessage());
    assertEquals("", sysErr.getLog());
  }

  // With a postfix, each rewritten file goes to its own output
  @Test public void testOutputNames() {
    Driver drv = new Driver(Options.parse("-verbose","-output-postfix=checked","a.c","b.c"));
    drv.run(program());
    String err = sysErr.getLog();
    assertTrue(err, err.contains("Rewriting a.c to a.checked.c, 1 edits\n"));
    assertTrue(err, err.contains("Rewriting b.c to b.checked.c, 1 edits\n"));
    assertEquals("lib/x.checked.h", drv.output("lib/x.h"));
  }

  // The same input gives the same edits, dumps and statistics every time
  @Test public void testDeterministic() {
    String[] args = {"-output-postfix=checked","-dump-intermediate","-dump-stats","a.c","b.c"};
    ByteArrayOutputStream out1 = new ByteArrayOutputStream(), out2 = new ByteArrayOutputStream();
    EditSet es1 = new Driver(Options.parse(args),new PrintStream(out1,true)).run(program());
    EditSet es2 = new Driver(Options.parse(args),new PrintStream(out2,true)).run(program());
    assertEquals(2, es1.len());
    assertEquals(es1.toString(), es2.toString());
    assertEquals(out1.toString(), out2.toString());
  }

  // Running again over the rewritten program, where each checked declaration
  // now carries its checked type as an interface, sends nothing back to Wild
  @Test public void testSelfFixpoint() {
    TransUnit[] units = program();
    Driver first = new Driver(Options.parse(TWO));
    first.run(units);
    AtomEnv env = first._info.env();
    HashMap<String,CType> itypes = new HashMap<>();
    HashMap<String,String> solved = new HashMap<>();
    for( TransUnit tu : units )
      ProgramInfo.walk_decls(tu, d -> {
        PVar pv = first._info.pvar(d);
        if( pv==null || pv.depth()==0 || pv.has_fv() ) return;
        for( int i=0; i<pv.depth(); i++ )
          if( env.get(pv.id(i))==Atom.WILD ) return;
        itypes.put(d._loc.toString(),checked(d._type,pv,0,env));
        solved.put(d._loc.toString(),atoms(pv,env));
      });
    assertEquals(7, itypes.size()); // All but t
    assertEquals(INT.ary() , itypes.get("a.c:1:1"));
    assertEquals(CHAR.ptr(), itypes.get("a.c:2:1"));

    TransUnit[] again = program();
    Ary<Decl> pinned = new Ary<>(Decl.class);
    for( TransUnit tu : again )
      ProgramInfo.walk_decls(tu, d -> {
        CType t = itypes.get(d._loc.toString());
        if( t!=null ) pinned.add(d.itype(t));
      });
    Driver second = new Driver(Options.parse(TWO));
    second.run(again);
    AtomEnv env2 = second._info.env();
    assertEquals(itypes.size(), pinned.len());
    for( Decl d : pinned )
      assertEquals(d.toString(), solved.get(d._loc.toString()), atoms(second._info.pvar(d),env2));
  }

  // The declared type with each checked pointer layer as its solved shape
  private static CType checked( CType t, PVar pv, int i, AtomEnv env ) {
    if( !t.is_ptr_or_ary() ) return t;
    CType inner = checked(t.elem(),pv,i+1,env);
    return env.get(pv.id(i))==Atom.ARR ? inner.ary() : inner.ptr();
  }
  private static String atoms( PVar pv, AtomEnv env ) {
    SB sb = new SB();
    for( int i=0; i<pv.depth(); i++ ) sb.p(env.get(pv.id(i)).toString()).p(' ');
    return sb.toString();
  }
}
