package exm.skc.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.ArrayReference;
import exm.skc.ir.tree.IRTree.Routine;

public class SirWriterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String HEADER =
      "subroutine stencil(jpi, jpj, jpk, a, b)\n" +
      "  integer :: jpi, jpj, jpk\n" +
      "  real, dimension(jpi,jpj,jpk) :: a, b\n" +
      "  real :: c\n" +
      "  integer :: ji, jj, jk\n";

  private static Routine routine(String... body) throws Exception {
    StringBuilder src = new StringBuilder(HEADER);
    for (String line: body) {
      src.append(line).append("\n");
    }
    src.append("end subroutine stencil\n");
    return new FortranReader().psyirFromSource(src.toString())
                              .getRoutines().get(0);
  }

  private static String emit(Routine r) throws VisitorError {
    return new SirWriter(false, "  ", 0).emit(r);
  }

  private static ArrayReference array(String text) throws Exception {
    return (ArrayReference)new FortranReader().psyirFromExpression(text,
                                                       new SymbolTable());
  }

  @Test
  public void testKernel() throws Exception {
    String out = emit(routine(
        "do jk = 1, jpk - 1",
        "  do jj = 2, jpj",
        "    do ji = 1, jpi",
        "      a(ji, jj, jk) = b(ji - 1, jj, jk + 1) * c",
        "    end do",
        "  end do",
        "end do"));
    assertTrue(out, out.startsWith("# SKC autogenerated SIR Python\n"));
    assertTrue(out, out.contains("k_interval = make_interval(" +
        "Interval.Start, Interval.End, 0, -1)\n"));
    assertTrue(out, out.contains("IRange=make_interval(Interval.Start, " +
        "Interval.End, 0, 0), JRange=make_interval(Interval.Start, " +
        "Interval.End, 1, 0))\n"));
    assertTrue(out, out.contains(
        "make_field_access_expr(\"b\", [-1, 0, 1])"));
    assertTrue(out, out.contains(
        "[make_field(\"a\", make_field_dimensions_cartesian([1, 1, 1])), " +
        "make_field(\"b\", make_field_dimensions_cartesian([1, 1, 1])), " +
        "make_field(\"c\", make_field_dimensions_cartesian([1, 0, 0]), " +
        "is_temporary=True)]"));
    assertTrue(out, out.endsWith("print (code)"));
  }

  @Test
  public void testNegation() throws Exception {
    String out = emit(routine(
        "do jk = 1, jpk",
        "  do jj = 1, jpj",
        "    do ji = 1, jpi",
        "      a(ji, jj, jk) = -1.0 - c",
        "    end do",
        "  end do",
        "end do"));
    assertTrue(out, out.contains(
        "make_literal_access_expr(\"-1.0\", BuiltinType.Float)"));
    assertTrue(out, out.contains("\"-\""));
  }

  @Test
  public void testNotNested() throws Exception {
    Routine r = routine(
        "do jk = 1, jpk",
        "  c = 0.0",
        "end do");
    exception.expect(VisitorError.class);
    exception.expectMessage("Child of loop should be a single loop.");
    emit(r);
  }

  @Test
  public void testInnerLoopsInBody() throws Exception {
    Routine r = routine(
        "do jk = 1, jpk",
        "  do jj = 1, jpj",
        "    do ji = 1, jpi",
        "      do jk = 1, 2",
        "        c = 0.0",
        "      end do",
        "    end do",
        "  end do",
        "end do");
    exception.expect(VisitorError.class);
    exception.expectMessage("without further loops");
    emit(r);
  }

  @Test
  public void testUnsupportedBound() throws Exception {
    Routine r = routine(
        "do jk = 1, jpk + 1",
        "  do jj = 1, jpj",
        "    do ji = 1, jpi",
        "      c = 0.0",
        "    end do",
        "  end do",
        "end do");
    exception.expect(VisitorError.class);
    exception.expectMessage("Unsupported operator 'ADD' in loop bound");
    emit(r);
  }

  @Test
  public void testStencil() throws Exception {
    assertEquals("[0, 0, 0]", SirWriter.genStencil(array("a(i, j, k)")));
    assertEquals("[1, -2, 0]",
                 SirWriter.genStencil(array("a(i + 1, j - 2)")));
  }

  @Test
  public void testStencilOperator() throws Exception {
    exception.expect(VisitorError.class);
    exception.expectMessage("gen_stencil unsupported stencil operator " +
                            "found 'MUL'");
    SirWriter.genStencil(array("a(i * 2)"));
  }

  @Test
  public void testStencilNonStencil() throws Exception {
    exception.expect(VisitorError.class);
    exception.expectMessage("gen_stencil unsupported (non-stencil) index");
    SirWriter.genStencil(array("a(1)"));
  }

  @Test
  public void testStencilTooManyIndices() throws Exception {
    exception.expect(VisitorError.class);
    exception.expectMessage("gen_stencil expected at most 3 indices but " +
                            "found 4");
    SirWriter.genStencil(array("a(i, j, k, l)"));
  }
}
