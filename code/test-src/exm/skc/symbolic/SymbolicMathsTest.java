package exm.skc.symbolic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.util.Ternary;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.IRTree.Expression;

public class SymbolicMathsTest {

  private SymbolTable table;
  private AlgebraicMaths maths;

  @Before
  public void setUp() {
    table = new SymbolTable();
    maths = new AlgebraicMaths();
  }

  private Expression expr(String text) throws InvalidSyntaxException {
    return new FortranReader().psyirFromExpression(text, table);
  }

  private boolean equal(String e1, String e2) throws InvalidSyntaxException {
    return maths.equal(expr(e1), expr(e2));
  }

  @Test
  public void testCommutative() throws Exception {
    assertTrue(equal("i + 1", "1 + i"));
    assertTrue(equal("a * b", "b * a"));
    assertFalse(equal("i - 1", "1 - i"));
  }

  @Test
  public void testExpansion() throws Exception {
    assertTrue(equal("2 * (i + 1)", "2 * i + 2"));
    assertTrue(equal("(i + j)**2", "i*i + 2*i*j + j**2"));
    assertTrue(equal("i + j - j", "i"));
    assertFalse(equal("i", "j"));
  }

  @Test
  public void testIndicesCanonical() throws Exception {
    assertTrue(equal("a(i + 1, j)", "a(1 + i, j)"));
    assertFalse(equal("a(i, j)", "a(j, i)"));
    assertTrue(equal("s%data(i + 1)", "s%data(1 + i)"));
    assertFalse(equal("s%data(i)", "t%data(i)"));
  }

  @Test
  public void testFunctions() throws Exception {
    assertTrue(equal("max(i, 1)", "max(1, i)"));
    assertTrue(equal("max(3, 7)", "7"));
    assertTrue(equal("min(3, 7, 5)", "3"));
    assertTrue(equal("mod(7, 3)", "1"));
    assertTrue(equal("mod(-7, 3)", "-1"));
    assertTrue(equal("abs(i + 1)", "abs(1 + i)"));
    assertFalse(equal("abs(i)", "i"));
  }

  @Test
  public void testConstants() throws Exception {
    assertTrue(equal("1.5d0", "3.0 / 2.0"));
    assertTrue(equal(".true.", ".true."));
    assertFalse(equal(".true.", ".false."));
  }

  @Test
  public void testIntegerDivisionTruncates() throws Exception {
    table.declare("i", DataType.INTEGER_TYPE, new Local());
    table.declare("x", DataType.REAL_TYPE, new Local());
    assertFalse("integer division truncates", equal("(i / 2) * 2", "i"));
    assertTrue(equal("i / 2", "i / 2"));
    assertTrue(equal("(i + 1) / 2", "(1 + i) / 2"));
    assertTrue(equal("7 / 2", "3"));
    assertTrue(equal("-7 / 2", "-3"));
    assertTrue("real division is exact", equal("(x / 2) * 2", "x"));
    assertTrue(equal("7.0 / 2", "3.5"));
  }

  @Test
  public void testReservedNames() throws Exception {
    // Variables that share a name with an algebra function
    assertTrue(equal("max + 1", "1 + max"));
    assertFalse(equal("max + 1", "max_1 + 1"));
  }

  @Test
  public void testCharacterFallback() throws Exception {
    assertTrue(equal("'abc'", "'abc'"));
    assertFalse(equal("'abc'", "'abd'"));
  }

  @Test
  public void testNulls() throws Exception {
    assertTrue(maths.equal(null, null));
    assertFalse(maths.equal(expr("i"), null));
    assertFalse(maths.equal(null, expr("i")));
  }

  @Test
  public void testOrdering() throws Exception {
    assertEquals(Ternary.TRUE, maths.greaterThan(expr("i + 2"), expr("i")));
    assertEquals(Ternary.FALSE, maths.greaterThan(expr("i"), expr("i + 1")));
    assertEquals(Ternary.FALSE, maths.greaterThan(expr("i"), expr("i")));
    assertEquals(Ternary.TRUE, maths.greaterEqual(expr("i"), expr("i")));
    assertEquals(Ternary.MAYBE, maths.greaterThan(expr("i"), expr("j")));
    assertEquals(Ternary.MAYBE, maths.greaterEqual(expr("'a'"), expr("1")));
  }

  @Test
  public void testSimpleMaths() throws Exception {
    SimpleMaths simple = new SimpleMaths();
    assertTrue(simple.equal(expr("i + 1"), expr("i + 1")));
    assertFalse("Only structural equality",
                simple.equal(expr("i + 1"), expr("1 + i")));
    assertEquals(Ternary.TRUE, simple.greaterThan(expr("i"), expr("j")));
    assertEquals(Ternary.TRUE, simple.greaterEqual(expr("i"), expr("j")));
    assertTrue(simple.equal(null, null));
  }

  @Test
  public void testSingleton() {
    SymbolicMaths first = SymbolicMaths.get();
    assertSame(first, SymbolicMaths.get());
    assertTrue(first instanceof AlgebraicMaths ||
               first instanceof SimpleMaths);
  }
}
