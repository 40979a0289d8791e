package com.cliffc.cconv.rewrite;

import com.cliffc.cconv.ast.SrcRange;
import com.cliffc.cconv.util.Ary;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.Assert.*;

public class TestEditSet {
  private static Edit decl( String file, int lo, int hi, String text ) {
    return Edit.replace(Edit.Kind.DECL_TYPE,file,new SrcRange(lo,hi),text);
  }

  // Exact duplicates are dropped quietly; the first of two overlapping
  // replacements wins
  @Test public void testAdd() {
    ByteArrayOutputStream bs = new ByteArrayOutputStream();
    EditSet es = new EditSet(new PrintStream(bs,true));
    assertTrue (es.add(decl("a.c",20,26,"_Ptr<int> p")));
    assertFalse(es.add(decl("a.c",20,26,"_Ptr<int> p")));
    assertEquals(0, es.rejected());
    assertFalse(es.add(decl("a.c",24,30,"_Ptr<char> q")));
    assertEquals(1, es.rejected());
    assertTrue(bs.toString().startsWith("Rejecting a.c[24,30) DECL_TYPE \"_Ptr<char> q\"; overlaps a.c[20,26)"));
    // Same range in another file is fine; so is an adjacent range
    assertTrue(es.add(decl("b.c",20,26,"_Ptr<int> p")));
    assertTrue(es.add(decl("a.c",0,20,"_Ptr<int> f(void)")));
    assertEquals(3, es.len());
    assertFalse(es.isEmpty());
  }

  // Wraps may nest; a wrap may not cut into a replacement
  @Test public void testWraps() {
    EditSet es = new EditSet();
    assertTrue (es.add(Edit.wrap("a.c",new SrcRange(40,60),"(int *)","")));
    assertTrue (es.add(Edit.wrap("a.c",new SrcRange(44,50),"/*","*/")));
    assertTrue (es.add(decl("a.c",10,20,"_Ptr<int> p")));
    assertFalse(es.add(Edit.wrap("a.c",new SrcRange(15,25),"(char *)","")));
    assertFalse(es.add(decl("a.c",55,65,"_Ptr<int> q")));
    assertEquals(2, es.rejected());
    assertEquals("a.c[10,20) DECL_TYPE \"_Ptr<int> p\"\n" +
                 "a.c[40,60) EXPR_WRAP (int *)...\n" +
                 "a.c[44,50) EXPR_WRAP /*...*/\n", es.toString());
  }

  // Edits come back in offset order, whatever order they were added
  @Test public void testOrder() {
    EditSet es = new EditSet();
    es.add(decl("b.c",50,60,"x"));
    es.add(decl("a.c",30,40,"y"));
    es.add(decl("b.c",10,20,"z"));
    assertEquals("[a.c, b.c]", es.files().toString());
    Ary<Edit> bs = es.edits("b.c");
    assertEquals(10, bs.at(0)._range._lo);
    assertEquals(50, bs.at(1)._range._lo);
    assertTrue(es.edits("c.c").isEmpty());
    assertTrue(new EditSet().isEmpty());
  }
}
