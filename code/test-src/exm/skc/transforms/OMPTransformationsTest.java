package exm.skc.transforms;

import static exm.skc.transforms.TransformFixtures.fortran;
import static exm.skc.transforms.TransformFixtures.loop;
import static exm.skc.transforms.TransformFixtures.nemo;
import static exm.skc.transforms.TransformFixtures.twoNests;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.TransformationError;
import exm.skc.ir.tree.Directives.OMPDoDirective;
import exm.skc.ir.tree.Directives.OMPParallelDirective;
import exm.skc.ir.tree.Directives.OMPSingleDirective;
import exm.skc.ir.tree.Directives.OMPTaskloopDirective;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.AlgebraicMaths;
import exm.skc.transforms.OMPTransformations.OMPLoopTrans;
import exm.skc.transforms.OMPTransformations.OMPMasterTrans;
import exm.skc.transforms.OMPTransformations.OMPParallelTrans;
import exm.skc.transforms.OMPTransformations.OMPSingleTrans;
import exm.skc.transforms.OMPTransformations.OMPTaskTrans;
import exm.skc.transforms.OMPTransformations.OMPTaskloopTrans;

public class OMPTransformationsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static OMPLoopTrans loopTrans() {
    return new OMPLoopTrans("static", new AlgebraicMaths());
  }

  /**
   * Apply must fail and leave the tree as it was
   */
  private static void assertFailsUnchanged(Transformation trans, Node target,
      TransformOptions options, String expectedMessage) throws Exception {
    Routine routine = target.ancestor(Routine.class);
    Node before = routine.copy();
    String text = fortran(routine);
    try {
      trans.validate(target, options);
      fail("validate should have raised");
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expectedMessage));
    }
    try {
      trans.apply(target, options);
      fail("apply should have raised");
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expectedMessage));
    }
    assertTrue(routine.structurallyEquals(before));
    assertEquals(text, fortran(routine));
  }

  @Test
  public void testParallelRegion() throws Exception {
    Routine r = twoNests();
    List<Node> both = r.children();
    Statement region = new OMPParallelTrans().apply(both, null);
    assertTrue(region instanceof OMPParallelDirective);
    assertSame(region, r.getChild(0));
    assertEquals(1, r.numChildren());
    String out = fortran(r);
    assertTrue(out, out.contains(
        "  !$omp parallel default(shared), private(ji,jj)\n" +
        "  do jj = 1, jpj, 1\n"));
    assertTrue(out, out.endsWith("  enddo\n  !$omp end parallel\n\n" +
                                 "end subroutine work\n"));
  }

  @Test
  public void testNestedParallel() throws Exception {
    Routine r = twoNests();
    new OMPParallelTrans().apply(r.getChild(0), null);
    Loop inner = loop(r, "ji", 0);
    assertFailsUnchanged(new OMPParallelTrans(), inner, null,
        "Cannot create an OpenMP parallel region inside another OpenMP " +
        "parallel region");
    // And from the outside
    assertFailsUnchanged(new OMPParallelTrans(), r.getChild(0), null,
        "The region already contains an OpenMP parallel region");
  }

  @Test
  public void testCodeBlockExcluded() throws Exception {
    Routine r = nemo("write(*,*) jpi");
    assertFailsUnchanged(new OMPParallelTrans(), r.getChild(0), null,
        "Nodes of type 'CodeBlock' cannot be enclosed by a " +
        "OMPParallelTrans transformation");
  }

  @Test
  public void testNodeListChecks() throws Exception {
    Routine r = nemo("s = 1.0", "t = 2.0", "s = t");
    OMPParallelTrans trans = new OMPParallelTrans();
    try {
      trans.apply(Collections.<Node>emptyList(), null);
      fail();
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "Cannot apply a transformation to an empty list of nodes."));
    }
    try {
      trans.apply(Arrays.asList(r.getChild(0), r.getChild(2)), null);
      fail();
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "Children are not consecutive children of one parent"));
    }
    try {
      trans.apply(Arrays.asList(r.getChild(0), r.getChild(0).getChild(0)),
                  null);
      fail();
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "cannot be enclosed by a OMPParallelTrans transformation"));
    }
    assertEquals(3, r.numChildren());
  }

  @Test
  public void testUnknownOption() throws Exception {
    Routine r = twoNests();
    exception.expect(TransformationError.class);
    exception.expectMessage("OMPParallelTrans: unknown option 'nowait', " +
                            "supported options are []");
    new OMPParallelTrans().apply(r.getChild(0),
                                 new TransformOptions().set("nowait", true));
  }

  @Test
  public void testLoop() throws Exception {
    Routine r = twoNests();
    Loop outer = loop(r, "jj", 0);
    Node result = loopTrans().apply(outer, null);
    assertTrue(result instanceof OMPDoDirective);
    assertSame(result, r.getChild(0));
    assertSame(outer, ((OMPDoDirective)result).getBody().getChild(0));
    String out = fortran(r);
    assertTrue(out, out.contains("  !$omp do schedule(static)\n" +
                                 "  do jj = 1, jpj, 1\n"));
  }

  @Test
  public void testLoopCollapse() throws Exception {
    Routine r = twoNests();
    OMPDoDirective d = (OMPDoDirective)loopTrans().apply(loop(r, "jj", 0),
        new TransformOptions().set(ParallelLoopTrans.COLLAPSE, 2));
    assertEquals(2, d.getCollapse());
    assertEquals("omp do schedule(static), collapse(2)", d.beginText());

    assertFailsUnchanged(loopTrans(), loop(r, "jj", 1),
        new TransformOptions().set(ParallelLoopTrans.COLLAPSE, 3),
        "Cannot apply COLLAPSE(3) clause to a loop nest containing only " +
        "2 loops");
    assertFailsUnchanged(loopTrans(), loop(r, "jj", 1),
        new TransformOptions().set(ParallelLoopTrans.COLLAPSE, 0),
        "The 'collapse' option must be a positive integer but got '0'.");
    assertFailsUnchanged(loopTrans(), loop(r, "jj", 1),
        new TransformOptions().set(ParallelLoopTrans.COLLAPSE, "2"),
        "option 'collapse' must be an integer but got '2' of type String");
  }

  @Test
  public void testLoopDependencies() throws Exception {
    Routine r = nemo(
        "do jj = 1, jpj",
        "  do ji = 1, jpi",
        "    s = s + b(ji, jj)",
        "  end do",
        "end do");
    assertFailsUnchanged(loopTrans(), loop(r, "jj", 0), null,
        "Dependency analysis failed with the following messages:\n" +
        "Warning: Variable 's' is read first, which indicates a reduction.");
    Node forced = loopTrans().apply(loop(r, "jj", 0),
        new TransformOptions().set(ParallelLoopTrans.FORCE, true));
    assertTrue(forced instanceof OMPDoDirective);
  }

  @Test
  public void testLoopTarget() throws Exception {
    Routine r = nemo("s = 1.0");
    assertFailsUnchanged(loopTrans(), r.getChild(0), null,
        "Target of OMPLoopTrans transformation must be a sub-class of " +
        "Loop but got 'Assignment'");
  }

  @Test
  public void testReprod() throws Exception {
    Routine r = twoNests();
    OMPLoopTrans dynamic = new OMPLoopTrans("dynamic", new AlgebraicMaths());
    assertEquals("dynamic", dynamic.getSchedule());
    assertFailsUnchanged(dynamic, loop(r, "jj", 0),
        new TransformOptions().set(OMPLoopTrans.REPROD, true),
        "Reproducible reductions need the 'static' schedule but the " +
        "schedule is 'dynamic'");
    OMPDoDirective d = (OMPDoDirective)loopTrans().apply(loop(r, "jj", 0),
        new TransformOptions().set(OMPLoopTrans.REPROD, true));
    assertTrue(d.isReprod());
  }

  @Test
  public void testBadSchedule() {
    exception.expect(IllegalArgumentException.class);
    exception.expectMessage("but got 'sometimes'");
    new OMPLoopTrans("sometimes", new AlgebraicMaths());
  }

  @Test
  public void testSingleAndMaster() throws Exception {
    Routine r = twoNests();
    OMPSingleDirective single = (OMPSingleDirective)new OMPSingleTrans()
        .apply(r.getChild(0),
               new TransformOptions().set(OMPSingleTrans.NOWAIT, true));
    assertEquals("omp single nowait", single.beginText());

    assertFailsUnchanged(new OMPMasterTrans(), loop(r, "ji", 0), null,
        "are already inside a serial region and cannot be enclosed by " +
        "another one");
    assertFailsUnchanged(new OMPMasterTrans(), single, null,
        "The region already contains a serial region, serial regions " +
        "cannot be nested");

    Node master = new OMPMasterTrans().apply(r.getChild(1), null);
    assertTrue(fortran(master).contains("!$omp master\n"));
  }

  @Test
  public void testTask() throws Exception {
    Routine r = nemo("s = 1.0", "t = 2.0", "write(*,*) s");
    try {
      new OMPTaskTrans().apply(Arrays.asList(r.getChild(0), r.getChild(1)),
                               null);
      fail();
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "Can only be applied to a single statement but got 2"));
    }
    assertFailsUnchanged(new OMPTaskTrans(), r.getChild(2), null,
        "OMPTaskDirective cannot be applied to a region containing a " +
        "code block");
    Node task = new OMPTaskTrans().apply(r.getChild(0), null);
    String out = fortran(r);
    assertTrue(out, out.contains(
        "  !$omp task\n  s = 1.0\n  !$omp end task\n  t = 2.0\n"));
    assertSame(task, r.getChild(0));
  }

  @Test
  public void testTaskloop() throws Exception {
    Routine r = twoNests();
    OMPTaskloopTrans trans = new OMPTaskloopTrans(new AlgebraicMaths());
    OMPTaskloopDirective d = (OMPTaskloopDirective)trans.apply(
        loop(r, "jj", 0), new TransformOptions()
            .set(OMPTaskloopTrans.GRAINSIZE, 32)
            .set(OMPTaskloopTrans.NOGROUP, true));
    assertEquals("omp taskloop grainsize(32), nogroup", d.beginText());

    Loop second = loop(r, "jj", 1);
    assertFailsUnchanged(trans, second, new TransformOptions()
            .set(OMPTaskloopTrans.GRAINSIZE, 32)
            .set(OMPTaskloopTrans.NUM_TASKS, 4),
        "A maximum of one of these may be used");
    assertFailsUnchanged(trans, second,
        new TransformOptions().set(OMPTaskloopTrans.NUM_TASKS, 0),
        "The grainsize and num_tasks options must be positive integers");
    assertFailsUnchanged(trans, second,
        new TransformOptions().set(ParallelLoopTrans.COLLAPSE, 2),
        "The 'collapse' option is not supported for taskloops");
  }
}
