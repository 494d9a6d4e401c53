package exm.skc.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.analysis.DependencyTools.InOut;
import exm.skc.analysis.DependencyTools.Message;
import exm.skc.analysis.DependencyTools.Severity;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.AlgebraicMaths;

public class DependencyToolsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String HEADER =
      "subroutine work(jpi, jpj, jpk, a, b)\n" +
      "  integer, intent(in) :: jpi, jpj, jpk\n" +
      "  real, dimension(jpi, jpj, jpk), intent(inout) :: a\n" +
      "  real, dimension(jpi, jpj), intent(inout) :: b\n" +
      "  real :: s, t\n" +
      "  integer :: ji, jj, jk\n";

  private static Routine routine(String... body)
      throws InvalidSyntaxException {
    StringBuilder src = new StringBuilder(HEADER);
    for (String line: body) {
      src.append(line).append("\n");
    }
    src.append("end subroutine work\n");
    return new FortranReader(FortranReader.API_NEMO)
                   .psyirFromSource(src.toString()).getRoutines().get(0);
  }

  private static DependencyTools tools() {
    return new DependencyTools(Arrays.asList("lat"), new AlgebraicMaths());
  }

  /** Loop with the given loop variable */
  private static Loop loop(Routine r, String var) {
    for (Loop l: r.walk(Loop.class)) {
      if (l.getVariable().getName().equals(var)) {
        return l;
      }
    }
    throw new AssertionError("No loop over " + var);
  }

  private static List<String> texts(DependencyTools dt) {
    return dt.getAllMessageStrings();
  }

  private static Routine latInsideLon(String... body)
      throws InvalidSyntaxException {
    List<String> lines = new ArrayList<String>();
    lines.add("do ji = 1, jpi");
    lines.add("  do jj = 1, jpj");
    lines.add("    do jk = 1, jpk");
    lines.addAll(Arrays.asList(body));
    lines.add("    end do");
    lines.add("  end do");
    lines.add("end do");
    return routine(lines.toArray(new String[0]));
  }

  @Test
  public void testLatLoopReadOnlyArrays() throws Exception {
    Routine r = latInsideLon(
        "      t = a(ji, jj, jk)",
        "      t = t * 2.0");
    DependencyTools dt = tools();
    assertTrue(texts(dt).toString(),
               dt.canLoopBeParallelised(loop(r, "jj")));
    assertTrue(dt.getAllMessages().isEmpty());
  }

  @Test
  public void testLatLoopWriteWithoutLoopVariable() throws Exception {
    Routine r = latInsideLon(
        "      t = b(ji, jj)",
        "      a(ji, 1, jk) = t");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    assertEquals(Arrays.asList("Warning: Variable 'a' is written to, and " +
                 "does not depend on the loop variable 'jj'."), texts(dt));
  }

  @Test
  public void testWrongLoopType() throws Exception {
    Routine r = latInsideLon("      t = a(ji, jj, jk)", "      t = t");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "ji")));
    assertEquals(Arrays.asList("Info: Loop has wrong loop type 'lon'."),
                 texts(dt));
    assertEquals(Severity.INFO, dt.getAllMessages().get(0).getSeverity());
  }

  @Test
  public void testMessageStringsMatchMessages() throws Exception {
    Routine r = latInsideLon(
        "      t = b(ji, jj)",
        "      a(ji, 1, jk) = t");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    List<Message> messages = dt.getAllMessages();
    List<String> strings = dt.getAllMessageStrings();
    assertEquals(1, messages.size());
    assertEquals(Severity.WARNING, messages.get(0).getSeverity());
    assertEquals("Warning: " + messages.get(0).getText(), strings.get(0));

    // Strings are a snapshot of the last query
    strings.clear();
    assertEquals(1, dt.getAllMessageStrings().size());
  }

  @Test
  public void testNotNested() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj",
        "  b(1, jj) = 0.0",
        "end do");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    assertEquals(Arrays.asList("Info: Not a nested loop."), texts(dt));

    ParallelCheckOptions options =
                      new ParallelCheckOptions().setOnlyNestedLoops(false);
    assertTrue(texts(dt).toString(),
               dt.canLoopBeParallelised(loop(r, "jj"), options));
  }

  @Test
  public void testDifferentIndices() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj - 1",
        "  do ji = 1, jpi",
        "    b(ji, jj) = b(ji, jj + 1)",
        "  end do",
        "end do");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    assertEquals(Arrays.asList("Warning: Variable b is written and is " +
        "accessed using indices jj + 1 and jj and can therefore not be " +
        "parallelised."), texts(dt));
  }

  @Test
  public void testEquivalentIndices() throws Exception {
    Routine r = routine(
        "do jj = 2, jpj",
        "  do ji = 1, jpi",
        "    b(ji, jj - 1 + 1) = b(ji, 1 + jj) + b(ji, jj)",
        "  end do",
        "end do");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));

    r = routine(
        "do jj = 2, jpj",
        "  do ji = 1, jpi",
        "    b(ji, jj - 1 + 1) = 2.0 * b(ji, jj)",
        "  end do",
        "end do");
    assertTrue(texts(dt).toString(),
               dt.canLoopBeParallelised(loop(r, "jj")));
  }

  @Test
  public void testLoopVariableInTwoPositions() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj",
        "  do ji = 1, jpi",
        "    b(ji, jj) = b(jj, ji)",
        "  end do",
        "end do");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    assertEquals(Arrays.asList("Warning: Variable 'b' is using loop " +
        "variable 'jj' in index '(0, 0)' and '(0, 1)'."), texts(dt));
  }

  @Test
  public void testReductionAndCollectAll() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj",
        "  do ji = 1, jpi",
        "    s = s + b(ji, jj)",
        "    t = 1.0",
        "  end do",
        "end do");
    DependencyTools dt = tools();
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj")));
    assertEquals(Arrays.asList("Warning: Variable 's' is read first, " +
        "which indicates a reduction."), texts(dt));

    ParallelCheckOptions all =
                  new ParallelCheckOptions().setTestAllVariables(true);
    assertFalse(dt.canLoopBeParallelised(loop(r, "jj"), all));
    assertEquals(Arrays.asList(
        "Warning: Variable 's' is read first, which indicates a reduction.",
        "Warning: Scalar variable 't' is only written once."), texts(dt));

    ParallelCheckOptions ignoring = new ParallelCheckOptions()
        .ignore(new Signature("s")).ignore(new Signature("t"));
    assertTrue(dt.canLoopBeParallelised(loop(r, "jj"), ignoring));
  }

  @Test
  public void testMessagesClearedPerQuery() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj",
        "  b(1, jj) = 0.0",
        "end do");
    DependencyTools dt = tools();
    dt.canLoopBeParallelised(loop(r, "jj"));
    assertEquals(1, dt.getAllMessages().size());
    dt.getInputParameters(r.children());
    assertTrue(dt.getAllMessages().isEmpty());
  }

  @Test
  public void testInOut() throws Exception {
    Routine r = new FortranReader().psyirFromSource(
        "subroutine s()\nx = 1\ny = x + z\nend subroutine s\n")
        .getRoutines().get(0);
    List<Node> body = r.children();
    DependencyTools dt = tools();
    assertEquals(Arrays.asList("z"), dt.getInputParameters(body));
    assertEquals(Arrays.asList("x", "y"), dt.getOutputParameters(body));
    InOut inOut = dt.getInOutParameters(body);
    assertEquals(Arrays.asList("z"), inOut.getInputs());
    assertEquals(Arrays.asList("x", "y"), inOut.getOutputs());
  }

  @Test
  public void testInOutStructures() throws Exception {
    Routine r = new FortranReader().psyirFromSource(
        "subroutine s()\nfld%data(1) = fld%grid%dx * 2\n" +
        "end subroutine s\n").getRoutines().get(0);
    InOut inOut = tools().getInOutParameters(r.children());
    assertEquals(Arrays.asList("fld%grid%dx"), inOut.getInputs());
    assertEquals(Arrays.asList("fld%data"), inOut.getOutputs());
  }

  @Test
  public void testIsVariableArray() throws Exception {
    Routine r = routine(
        "do jj = 1, jpj",
        "  a = b(1, jj)",
        "end do");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertTrue("From the declaration", DependencyTools.isVariableArray(
        "a", info.get(new Signature("a")), r.getSymbolTable()));
    assertFalse("No declaration", DependencyTools.isVariableArray(
        "a", info.get(new Signature("a")), null));
    assertTrue(DependencyTools.isVariableArray(
        "b", info.get(new Signature("b")), null));
    assertTrue(DependencyTools.isVariableArray(
        "b", info.get(new Signature("b")), null, "jj"));
    assertFalse(DependencyTools.isVariableArray(
        "b", info.get(new Signature("b")), null, "ji"));
    assertFalse(DependencyTools.isVariableArray(
        "s", null, r.getSymbolTable()));

    exception.expect(IllegalArgumentException.class);
    exception.expectMessage("loop variable 'jj' specified, but no access " +
                            "information");
    DependencyTools.isVariableArray("b", null, null, "jj");
  }
}
