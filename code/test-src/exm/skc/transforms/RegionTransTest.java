package exm.skc.transforms;

import static exm.skc.transforms.TransformFixtures.fortran;
import static exm.skc.transforms.TransformFixtures.twoNests;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.tree.Directives.OMPMasterDirective;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Node;

public class RegionTransTest {

  /**
   * Region whose node can't be built
   */
  private static class UnbuildableRegionTrans extends RegionTrans {
    @Override
    public String getName() {
      return "UnbuildableRegionTrans";
    }

    @Override
    protected List<Class<? extends Node>> excludedNodeTypes() {
      return Collections.emptyList();
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          throw new SKCRuntimeError("cannot build region");
        }
      };
      return Result.ok(w);
    }
  }

  /**
   * Plain master region, built the usual way
   */
  private static class MasterRegionTrans extends UnbuildableRegionTrans {
    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPMasterDirective.create(NO_STATEMENTS);
        }
      };
      return Result.ok(w);
    }
  }

  @Test
  public void testBuildFailureLeavesTreeUnchanged() throws Exception {
    Routine routine = twoNests();
    String before = fortran(routine);
    List<Node> nodes = routine.children();
    try {
      new UnbuildableRegionTrans().apply(nodes, null);
      fail("building the region should fail");
    } catch (SKCRuntimeError e) {
      assertEquals("cannot build region", e.getMessage());
    }
    assertEquals(2, routine.numChildren());
    assertSame(nodes.get(0), routine.getChild(0));
    assertSame(nodes.get(1), routine.getChild(1));
    assertEquals(before, fortran(routine));
  }

  @Test
  public void testStatementsMovedIntoBody() throws Exception {
    Routine routine = twoNests();
    List<Node> nodes = routine.children();
    Statement region = new MasterRegionTrans().apply(nodes, null);
    assertEquals(1, routine.numChildren());
    assertSame(region, routine.getChild(0));
    OMPMasterDirective master = (OMPMasterDirective)region;
    assertEquals(2, master.getBody().numChildren());
    assertSame(nodes.get(0), master.getBody().getChild(0));
    assertSame(nodes.get(1), master.getBody().getChild(1));
    assertTrue(fortran(routine).contains("!$omp master\n"));
  }
}
