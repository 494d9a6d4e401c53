package exm.skc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.skc.backend.FortranWriter;
import exm.skc.backend.SirWriter;
import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.exceptions.UnsupportedConstructException;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.symbolic.AlgebraicMaths;
import exm.skc.transforms.NodeSelector;
import exm.skc.transforms.OMPTransformations.OMPLoopTrans;
import exm.skc.transforms.OMPTransformations.OMPParallelTrans;
import exm.skc.transforms.TransformationPipeline;

public class SKCompilerTest {

  private static final Logger logger = Logging.getSKCLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static final String TRACER =
      "subroutine tra_adv(jpi, jpj, jpk, zwx, tmask)\n" +
      "  integer, intent(in) :: jpi, jpj, jpk\n" +
      "  real, dimension(jpi, jpj, jpk), intent(inout) :: zwx\n" +
      "  real, dimension(jpi, jpj, jpk), intent(in) :: tmask\n" +
      "  real :: zdt\n" +
      "  integer :: ji, jj, jk\n" +
      "  do jk = 1, jpk\n" +
      "    do jj = 1, jpj - 1\n" +
      "      do ji = 1, jpi - 1\n" +
      "        zdt = tmask(ji, jj, jk) * 0.5\n" +
      "        zwx(ji, jj, jk) = zdt * zwx(ji, jj, jk)\n" +
      "      end do\n" +
      "    end do\n" +
      "  end do\n" +
      "end subroutine tra_adv\n";

  private static TransformationPipeline openmp() {
    return new TransformationPipeline()
        .add(new OMPParallelTrans(), NodeSelector.outermostLoops("levels"),
             null)
        .add(new OMPLoopTrans("static", new AlgebraicMaths()),
             NodeSelector.outermostLoops("lat"), null);
  }

  @Test
  public void testCompile() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    assertEquals("nemo", skc.getApi());
    String out = skc.compile(TRACER, openmp(),
                             new FortranWriter(false, "  ", 0));
    assertTrue(out, out.contains(
        "  !$omp parallel default(shared), private(ji,jj,jk,zdt)\n" +
        "  do jk = 1, jpk, 1\n" +
        "    !$omp do schedule(static)\n" +
        "    do jj = 1, jpj - 1, 1\n"));
    assertTrue(out, out.contains(
        "    enddo\n" +
        "    !$omp end do\n" +
        "  enddo\n" +
        "  !$omp end parallel\n"));
  }

  @Test
  public void testOutputReadsBack() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    FortranWriter writer = new FortranWriter(false, "  ", 0);
    String once = skc.compile(TRACER, new TransformationPipeline(), writer);
    Container again = skc.lower(once);
    assertEquals(once, skc.emit(again, writer));
  }

  @Test
  public void testNoLoopTypesWithoutNemo() throws Exception {
    // Loops have no type, so no step finds targets
    SKCompiler skc = new SKCompiler("", logger);
    String out = skc.compile(TRACER, openmp(),
                             new FortranWriter(false, "  ", 0));
    assertTrue(out, !out.contains("!$omp"));
  }

  @Test
  public void testTransformFails() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    Container root = skc.lower(TRACER);
    TransformationPipeline pipeline = openmp()
        .add(new OMPParallelTrans(), NodeSelector.outermostLoops("lat"),
             null);
    exception.expect(TransformationError.class);
    exception.expectMessage("Cannot create an OpenMP parallel region " +
                            "inside another OpenMP parallel region");
    skc.transform(root, pipeline);
  }

  @Test
  public void testSir() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    String out = skc.compile(TRACER, new TransformationPipeline(),
                             new SirWriter(false, "  ", 0));
    assertTrue(out, out.contains("zwx"));
  }

  @Test
  public void testSirRejectsDirectives() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    exception.expect(UnsupportedConstructException.class);
    skc.compile(TRACER, openmp(), new SirWriter(false, "  ", 0));
  }

  @Test
  public void testSyntaxError() throws Exception {
    SKCompiler skc = new SKCompiler(FortranReader.API_NEMO, logger);
    exception.expect(InvalidSyntaxException.class);
    skc.lower("subroutine broken()\n  x = (1 + \nend subroutine broken\n");
  }

  @Test
  public void testLogFileFromSettings() throws Exception {
    File log = tmp.newFile("skc.log");
    Settings.set(Settings.LOG_FILE, log.getPath());
    Level level = logger.getLevel();
    try {
      SKCompiler skc = new SKCompiler(FortranReader.API_NEMO);
      skc.compile(TRACER, openmp(), new FortranWriter());
      String text = FileUtils.readFileToString(log, StandardCharsets.UTF_8);
      assertTrue(text, text.contains("SKC starting"));
      assertTrue(text, text.contains("Running 2 transformation step(s)"));
    } finally {
      removeFileAppender(log);
      logger.setLevel(level);
    }
  }

  @Test
  public void testLogFileSetUpOnce() throws Exception {
    File log = tmp.newFile("skc.log");
    Settings.set(Settings.LOG_FILE, log.getPath());
    Level level = logger.getLevel();
    try {
      new SKCompiler(FortranReader.API_NEMO)
          .lower("subroutine first()\nend subroutine first\n");
      new SKCompiler(FortranReader.API_NEMO)
          .lower("subroutine second()\nend subroutine second\n");
      assertEquals(1, countFileAppenders(log));
      String text = FileUtils.readFileToString(log, StandardCharsets.UTF_8);
      assertEquals(text, 2, StringUtils.countMatches(text, "Lowered 1 routine(s)"));
    } finally {
      removeFileAppender(log);
      logger.setLevel(level);
    }
  }

  private static int countFileAppenders(File log) {
    int count = 0;
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      Object appender = appenders.nextElement();
      if (appender instanceof FileAppender &&
          log.getPath().equals(((FileAppender)appender).getFile())) {
        count++;
      }
    }
    return count;
  }

  private static void removeFileAppender(File log) {
    FileAppender appender = Logging.fileAppender(logger, log.getPath());
    if (appender != null) {
      logger.removeAppender(appender);
      appender.close();
    }
  }
}
