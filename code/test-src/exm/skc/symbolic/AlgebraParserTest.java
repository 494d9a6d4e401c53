package exm.skc.symbolic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.InvalidSyntaxException;

public class AlgebraParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testConstantFolding() throws Exception {
    Polynomial p = AlgebraParser.parse("(2 + 3) * 4 - 1");
    assertTrue(p.isConstant());
    assertEquals(Rational.of(19), p.getConstant());
    assertEquals("19", p.toString());
  }

  @Test
  public void testRationals() throws Exception {
    Polynomial p = AlgebraParser.parse("1 / 3 + 1 / 6");
    assertEquals(Rational.of(java.math.BigInteger.ONE,
                             java.math.BigInteger.valueOf(2)),
                 p.getConstant());
    assertEquals(AlgebraParser.parse("0.25"), AlgebraParser.parse("1/4"));
    assertEquals(AlgebraParser.parse("2.5e-1"), AlgebraParser.parse("1/4"));
  }

  @Test
  public void testCancellation() throws Exception {
    assertTrue(AlgebraParser.parse("(i + 1)**2 - i**2 - 2*i - 1").isZero());
    assertEquals(AlgebraParser.parse("i*j"), AlgebraParser.parse("j*i"));
  }

  @Test
  public void testOpaqueDivision() throws Exception {
    Polynomial p = AlgebraParser.parse("i / j");
    assertFalse(p.isConstant());
    assertFalse(p.equals(AlgebraParser.parse("j / i")));
  }

  @Test
  public void testPaths() throws Exception {
    assertEquals(AlgebraParser.parse("a[i+1]%b"),
                 AlgebraParser.parse("a[1+i]%b"));
    assertFalse(AlgebraParser.parse("a[i]%b").equals(
                AlgebraParser.parse("a[i]%c")));
  }

  @Test
  public void testReserved() {
    assertTrue(AlgebraParser.isReserved("MAX"));
    assertTrue(AlgebraParser.isReserved("true"));
    assertFalse(AlgebraParser.isReserved("field"));
  }

  @Test
  public void testTrailingInput() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    AlgebraParser.parse("i + 1 )");
  }

  @Test
  public void testMissingOperand() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    AlgebraParser.parse("i +");
  }

  @Test
  public void testIntegerDivision() throws Exception {
    assertEquals(AlgebraParser.parse("3"), AlgebraParser.parse("idiv(7, 2)"));
    assertEquals(AlgebraParser.parse("-3"),
                 AlgebraParser.parse("idiv(-7, 2)"));
    assertFalse(AlgebraParser.parse("i").equals(
                AlgebraParser.parse("idiv(i, 2) * 2")));
  }
}
