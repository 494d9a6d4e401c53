package exm.skc.transforms;

import exm.skc.backend.FortranWriter;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;

/**
 * Trees for transformation tests
 */
class TransformFixtures {

  static final String HEADER =
      "subroutine work(jpi, jpj, jpk, a, b)\n" +
      "  integer, intent(in) :: jpi, jpj, jpk\n" +
      "  real, dimension(jpi, jpj, jpk), intent(inout) :: a\n" +
      "  real, dimension(jpi, jpj), intent(inout) :: b\n" +
      "  real :: s, t\n" +
      "  integer :: ji, jj, jk\n";

  /**
   * Routine "work" read with the nemo API, so loops over ji, jj and jk
   * get types lon, lat and levels
   */
  static Routine nemo(String... body) throws InvalidSyntaxException {
    StringBuilder src = new StringBuilder(HEADER);
    for (String line: body) {
      src.append(line).append("\n");
    }
    src.append("end subroutine work\n");
    return new FortranReader(FortranReader.API_NEMO)
                  .psyirFromSource(src.toString()).getRoutines().get(0);
  }

  /**
   * Two independent lat-lon loop nests
   */
  static Routine twoNests() throws InvalidSyntaxException {
    return nemo(
        "do jj = 1, jpj",
        "  do ji = 1, jpi",
        "    b(ji, jj) = 0.0",
        "  end do",
        "end do",
        "do jj = 1, jpj",
        "  do ji = 1, jpi",
        "    b(ji, jj) = b(ji, jj) + 1.0",
        "  end do",
        "end do");
  }

  static Loop loop(Node root, String var, int n) {
    int found = 0;
    for (Loop l: root.walk(Loop.class)) {
      if (l.getVariable().getName().equals(var) && found++ == n) {
        return l;
      }
    }
    throw new AssertionError("No loop " + n + " over " + var);
  }

  static String fortran(Node node) throws VisitorError {
    return new FortranWriter(false, "  ", 0).emit(node);
  }
}
