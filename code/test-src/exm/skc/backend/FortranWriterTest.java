package exm.skc.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.UnsupportedConstructException;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Directives.ACCLoopDirective;
import exm.skc.ir.tree.Directives.OMPDoDirective;
import exm.skc.ir.tree.Directives.OMPParallelDirective;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;

public class FortranWriterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String KERNEL =
      "subroutine work(n, a)\n" +
      "  integer, intent(in) :: n\n" +
      "  real, dimension(n), intent(inout) :: a\n" +
      "  integer :: i\n" +
      "  do i = 1, n\n" +
      "    a(i) = 2.0 * a(i)\n" +
      "  end do\n" +
      "end subroutine work\n";

  private static FortranWriter writer() {
    return new FortranWriter(false, "  ", 0);
  }

  private static String expr(String text) throws Exception {
    return writer().emit(new FortranReader().psyirFromExpression(text,
                                                       new SymbolTable()));
  }

  @Test
  public void testRoutine() throws Exception {
    Container file = new FortranReader().psyirFromSource(KERNEL);
    assertEquals(
        "subroutine work(n, a)\n" +
        "  integer, intent(in) :: n\n" +
        "  real, dimension(n), intent(inout) :: a\n" +
        "  integer :: i\n" +
        "\n" +
        "  do i = 1, n, 1\n" +
        "    a(i) = 2.0 * a(i)\n" +
        "  enddo\n" +
        "\n" +
        "end subroutine work\n",
        writer().emit(file));
  }

  @Test
  public void testModule() throws Exception {
    String src =
        "module kern_mod\n" +
        "  use kind_params_mod, only: wp\n" +
        "  use field_mod\n" +
        "  implicit none\n" +
        "  integer, parameter, private :: nlev = 10\n" +
        "contains\n" +
        "  subroutine kern(x)\n" +
        "    real(kind=wp), intent(out) :: x\n" +
        "    x = 1.0_wp\n" +
        "  end subroutine kern\n" +
        "end module kern_mod\n";
    String out = writer().emit(new FortranReader().psyirFromSource(src));
    assertTrue(out, out.startsWith("module kern_mod\n"));
    assertTrue(out, out.contains("  use kind_params_mod, only: wp\n"));
    assertTrue(out, out.contains("  use field_mod\n"));
    assertTrue(out, out.contains("  implicit none\n"));
    assertTrue(out, out.contains(
        "  integer, parameter, private :: nlev = 10\n"));
    assertTrue(out, out.contains("\ncontains\n"));
    assertTrue(out, out.contains("    real(kind=wp), intent(out) :: x\n"));
    assertTrue(out, out.contains("    x = 1.0_wp\n"));
    assertTrue(out, out.endsWith("end module kern_mod\n"));
  }

  @Test
  public void testIdempotent() throws Exception {
    String src =
        "subroutine step(n, u, flag)\n" +
        "  integer, intent(in) :: n\n" +
        "  real, dimension(:,:), intent(inout) :: u\n" +
        "  logical :: flag\n" +
        "  integer :: i, j\n" +
        "  do j = 2, n - 1\n" +
        "    do i = 2, n - 1, 2\n" +
        "      if (flag .and. i > j) then\n" +
        "        u(i, j) = -(u(i - 1, j) + u(i + 1, j)) / 2.0\n" +
        "      else\n" +
        "        u(i, j) = max(u(i, j), 0.0)\n" +
        "      end if\n" +
        "    end do\n" +
        "  end do\n" +
        "  call finish(u, n)\n" +
        "  write(*,*) 'done'\n" +
        "end subroutine step\n";
    String first = writer().emit(new FortranReader().psyirFromSource(src));
    String second = writer().emit(new FortranReader().psyirFromSource(
                                                                  first));
    assertEquals(first, second);
    assertTrue(first, first.contains("  write(*,*) 'done'\n"));
    assertTrue(first, first.contains("  call finish(u, n)\n"));
  }

  @Test
  public void testPrecedence() throws Exception {
    assertEquals("a - (b - c)", expr("a - (b - c)"));
    assertEquals("a - b - c", expr("(a - b) - c"));
    assertEquals("a ** b ** c", expr("a ** b ** c"));
    assertEquals("(a ** b) ** c", expr("(a ** b) ** c"));
    assertEquals("(a + b) * c", expr("(a + b) * c"));
    assertEquals("-(a + b)", expr("-(a + b)"));
    assertEquals(".not. (a .and. b)", expr(".not. (a .and. b)"));
    assertEquals("a == b .or. c", expr("a .eq. b .or. c"));
  }

  @Test
  public void testLiteralsAndIntrinsics() throws Exception {
    assertEquals("1.0_wp", expr("1.0_wp"));
    assertEquals(".true.", expr(".TRUE."));
    assertEquals("'it''s'", expr("'it''s'"));
    assertEquals("MAX(a, b)", expr("max(a, b)"));
    assertEquals("MIN(a, b, c)", expr("min(a, b, c)"));
    assertEquals("SQRT(x + 1)", expr("sqrt(x + 1)"));
    assertEquals("s%data(i, j)", expr("s%data(i, j)"));
    assertEquals("s(2)%grid%nx", expr("s(2)%grid%nx"));
  }

  @Test
  public void testDirectives() throws Exception {
    Routine r = new FortranReader().psyirFromSource(KERNEL)
                                   .getRoutines().get(0);
    Loop loop = r.walkList(Loop.class).get(0);
    List<Statement> body = new ArrayList<Statement>();
    loop.detach();
    body.add(loop);
    OMPDoDirective ompDo = OMPDoDirective.create(body, "static", 0, false);
    OMPParallelDirective par = OMPParallelDirective.create(
                                     Arrays.<Statement>asList(ompDo));
    r.addChild(par);
    String out = writer().emit(r);
    assertTrue(out, out.contains(
        "  !$omp parallel default(shared), private(i)\n" +
        "  !$omp do schedule(static)\n" +
        "  do i = 1, n, 1\n"));
    assertTrue(out, out.contains(
        "  enddo\n" +
        "  !$omp end do\n" +
        "  !$omp end parallel\n"));
  }

  @Test
  public void testLoopDirectiveHasNoEnd() throws Exception {
    Routine r = new FortranReader().psyirFromSource(KERNEL)
                                   .getRoutines().get(0);
    Loop loop = r.walkList(Loop.class).get(0);
    loop.detach();
    r.addChild(ACCLoopDirective.create(Arrays.<Statement>asList(loop),
                                       true, 0));
    String out = writer().emit(r);
    assertTrue(out, out.contains("  !$acc loop independent\n  do i"));
    assertTrue(out, !out.contains("end loop"));
  }

  @Test
  public void testUnsupported() throws Exception {
    Node module = new FortranReader().psyirFromSource(
                            "module m\nend module m\n").children().get(0);
    exception.expect(UnsupportedConstructException.class);
    exception.expectMessage("Unsupported node 'Container' found in SirWriter");
    new SirWriter(false, "  ", 0).emit(module);
  }
}
