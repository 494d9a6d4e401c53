package exm.skc.transforms;

import static exm.skc.transforms.TransformFixtures.HEADER;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.tree.Directives.OMPDoDirective;
import exm.skc.ir.tree.Directives.OMPParallelDirective;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.AlgebraicMaths;
import exm.skc.transforms.OMPTransformations.OMPLoopTrans;
import exm.skc.transforms.OMPTransformations.OMPParallelTrans;

public class TransformationPipelineTest {

  private static final Logger logger = Logging.getSKCLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String SOURCE = HEADER +
      "  s = 0.0\n" +
      "  do jk = 1, jpk\n" +
      "    do jj = 1, jpj\n" +
      "      do ji = 1, jpi\n" +
      "        a(ji, jj, jk) = a(ji, jj, jk) + 1.0\n" +
      "      end do\n" +
      "    end do\n" +
      "  end do\n" +
      "  do jj = 1, jpj\n" +
      "    do ji = 1, jpi\n" +
      "      b(ji, jj) = 2.0\n" +
      "    end do\n" +
      "  end do\n" +
      "end subroutine work\n";

  /**
   * Points the start of every loop at a symbol that isn't declared
   */
  private static class BrokenTrans implements Transformation {
    @Override
    public String getName() {
      return "BrokenTrans";
    }

    @Override
    public Set<String> getOptionNames() {
      return Collections.emptySet();
    }

    @Override
    public void validate(Node node, TransformOptions options) {
    }

    @Override
    public Node apply(Node node, TransformOptions options) {
      Loop loop = (Loop)node;
      loop.setStart(new Reference(
                  new DataSymbol("ghost", DataType.INTEGER_TYPE)));
      return loop;
    }
  }

  private static Container read() throws Exception {
    return new FortranReader(FortranReader.API_NEMO).psyirFromSource(SOURCE);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testSelectors() throws Exception {
    Container file = read();
    Routine work = file.getRoutines().get(0);

    assertEquals(Collections.<Node>singletonList(file),
                 NodeSelector.root().select(file));
    assertEquals(5, NodeSelector.all(Loop.class).select(file).size());

    List<Node> lat = NodeSelector.outermostLoops("lat").select(file);
    assertEquals(2, lat.size());
    assertSame(work.getChild(1), lat.get(0).parent().parent());
    assertSame(work.getChild(2), lat.get(1));
    assertEquals(1, NodeSelector.outermostLoops("levels").select(file).size());
    assertTrue(NodeSelector.outermostLoops("tracers").select(file).isEmpty());

    assertEquals(work.children(), NodeSelector.routineBody("WORK").select(file));
    assertEquals(3, NodeSelector.routineBody(null).select(file).size());
    assertTrue(NodeSelector.routineBody("other").select(file).isEmpty());
    assertEquals("outermost loops of type 'lat'",
                 NodeSelector.outermostLoops("lat").describe());
  }

  @Test
  public void testRun() throws Exception {
    Container file = read();
    Routine work = file.getRoutines().get(0);
    TransformationPipeline pipeline = new TransformationPipeline()
        .addRegion(new OMPParallelTrans(), NodeSelector.routineBody("work"),
                   null)
        .add(new OMPLoopTrans("static", new AlgebraicMaths()),
             NodeSelector.outermostLoops("lat"), null);
    assertEquals(2, pipeline.getSteps().size());
    assertTrue(pipeline.getSteps().get(0).isRegion());
    pipeline.run(logger, file);

    assertEquals(1, work.numChildren());
    OMPParallelDirective par = (OMPParallelDirective)work.getChild(0);
    assertEquals(2, par.walkList(OMPDoDirective.class).size());
    assertEquals("omp parallel default(shared), private(ji,jj,jk,s)",
                 par.beginText());
  }

  @Test
  public void testIROutput() throws Exception {
    Container file = read();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    new TransformationPipeline(out)
        .add(new OMPLoopTrans("static", new AlgebraicMaths()),
             NodeSelector.outermostLoops("lat"), null)
        .add(new OMPLoopTrans("static", new AlgebraicMaths()),
             NodeSelector.outermostLoops("tracers"), null)
        .run(logger, file);
    String text = bytes.toString("UTF-8");
    assertTrue(text, text.startsWith("! Tree after step 1: OMPLoopTrans\n" +
                                     "subroutine work("));
    assertTrue(text, text.contains("!$omp do schedule(static)"));
    // No targets for step 2, so nothing is printed for it
    assertTrue(text, !text.contains("step 2"));
  }

  @Test
  public void testFailingStep() throws Exception {
    Container file = read();
    TransformationPipeline pipeline = new TransformationPipeline()
        .addRegion(new OMPParallelTrans(), NodeSelector.routineBody(null),
                   null)
        .add(new OMPParallelTrans(), NodeSelector.outermostLoops("lat"),
             null);
    try {
      pipeline.run(logger, file);
      fail();
    } catch (TransformationError e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(
          "Transformation Error: OMPParallelTrans: Cannot create an OpenMP "));
    }
    // The first step stays applied
    assertTrue(file.getRoutines().get(0).getChild(0)
                                        instanceof OMPParallelDirective);
  }

  @Test
  public void testValidation() throws Exception {
    Container file = read();
    TransformationPipeline pipeline = new TransformationPipeline()
        .add(new BrokenTrans(), NodeSelector.outermostLoops("levels"), null);
    exception.expect(SKCRuntimeError.class);
    exception.expectMessage("Symbol 'ghost'");
    pipeline.run(logger, file);
  }

  @Test
  public void testNoValidation() throws Exception {
    Settings.set(Settings.VALIDATE_IR, "false");
    Container file = read();
    new TransformationPipeline()
        .add(new BrokenTrans(), NodeSelector.outermostLoops("levels"), null)
        .run(logger, file);
  }

  @Test
  public void testRegionStepNeedsRegionTrans() {
    exception.expect(IllegalArgumentException.class);
    exception.expectMessage("BrokenTrans can't be applied to a region of " +
                            "nodes");
    new TransformationPipeline.Step(new BrokenTrans(), NodeSelector.root(),
                                    null, true);
  }
}
