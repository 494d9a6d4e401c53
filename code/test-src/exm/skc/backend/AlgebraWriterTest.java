package exm.skc.backend;

import static org.junit.Assert.assertEquals;

import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.UnsupportedConstructException;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.IRTree.Expression;

public class AlgebraWriterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Expression expr(String text) throws Exception {
    return new FortranReader().psyirFromExpression(text, new SymbolTable());
  }

  @Test
  public void testOperators() throws Exception {
    AlgebraWriter w = new AlgebraWriter();
    assertEquals("((i + 1) * j)", w.emit(expr("(I + 1) * j")));
    assertEquals("(-x)", w.emit(expr("-x")));
    assertEquals("lt(i, n)", w.emit(expr("i < n")));
    assertEquals("not(flag)", w.emit(expr(".not. flag")));
    assertEquals("max(a, b, c)", w.emit(expr("max(a, b, c)")));
    assertEquals("1.5e0", w.emit(expr("1.5D0")));
  }

  @Test
  public void testIndices() throws Exception {
    AlgebraWriter w = new AlgebraWriter();
    assertEquals("a[(i + 1),j]", w.emit(expr("a(i + 1, j)")));
    assertEquals("s[2]%f%g[k]", w.emit(expr("s(2)%f%g(k)")));
  }

  @Test
  public void testRenames() throws Exception {
    AlgebraWriter w = new AlgebraWriter(
                         Collections.singletonMap("max", "max_1"));
    assertEquals("(max_1 + 1)", w.emit(expr("MAX + 1")));
  }

  @Test
  public void testCharacter() throws Exception {
    exception.expect(UnsupportedConstructException.class);
    new AlgebraWriter().emit(expr("'text'"));
  }
}
