package exm.skc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.symbols.ContainerSymbol;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.ExtentKind;
import exm.skc.ir.symbols.DataType.StructureRef;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolInterface.Argument;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

public class FortranReaderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String MODULE =
      "module kern_mod\n" +
      "  use kind_params_mod, only: wp\n" +
      "  use field_mod, only: r2d_field\n" +
      "  implicit none\n" +
      "  private\n" +
      "  integer, parameter :: nlev = 10\n" +
      "  public :: kern\n" +
      "contains\n" +
      "  subroutine kern(n, fld, x, y)\n" +
      "    integer, intent(in) :: n\n" +
      "    type(r2d_field), intent(inout) :: fld\n" +
      "    real(kind=wp), dimension(n, 0:nlev), intent(out) :: x\n" +
      "    real(wp), allocatable, dimension(:) :: tmp\n" +
      "    integer :: i\n" +
      "    ! a comment\n" +
      "    do i = 1, n\n" +
      "      x(i, 0) = fld%data(i, 1) + &\n" +
      "                1.0_wp\n" +
      "    end do\n" +
      "    y = 0; call update(fld)\n" +
      "  end subroutine kern\n" +
      "end module kern_mod\n";

  private static Routine routine(String api, String... body)
      throws InvalidSyntaxException {
    StringBuilder src = new StringBuilder("subroutine work()\n");
    for (String line: body) {
      src.append(line).append("\n");
    }
    src.append("end subroutine work\n");
    return new FortranReader(api).psyirFromSource(src.toString())
                                 .getRoutines().get(0);
  }

  @Test
  public void testModuleStructure() throws Exception {
    Container file = new FortranReader().psyirFromSource(MODULE);
    assertTrue(file.isFile());
    assertEquals(1, file.numChildren());
    Container module = (Container)file.children().get(0);
    assertEquals("kern_mod", module.getName());
    Routine kern = module.findRoutine("KERN");
    assertEquals("kern", kern.getName());
    assertFalse(kern.isProgram());

    SymbolTable modTable = module.getSymbolTable();
    assertTrue(modTable.lookup("kind_params_mod") instanceof ContainerSymbol);
    DataSymbol nlev = (DataSymbol)modTable.lookup("nlev");
    assertTrue(nlev.isConstant());
    assertEquals("10", ((Literal)nlev.getConstantValue()).getValue());
  }

  @Test
  public void testDeclarations() throws Exception {
    Container file = new FortranReader().psyirFromSource(MODULE);
    Routine kern = file.walkList(Routine.class).get(0);
    SymbolTable table = kern.getSymbolTable();

    List<DataSymbol> args = table.getArgumentList();
    assertEquals(4, args.size());
    assertEquals("n", args.get(0).getName());
    assertEquals(AccessType.READ,
                 ((Argument)args.get(0).getInterface()).getAccess());
    assertEquals(AccessType.READWRITE,
                 ((Argument)args.get(1).getInterface()).getAccess());
    assertEquals(AccessType.WRITE,
                 ((Argument)args.get(2).getInterface()).getAccess());
    assertEquals("Undeclared argument", AccessType.UNKNOWN,
                 ((Argument)args.get(3).getInterface()).getAccess());
    assertEquals(DataType.DEFERRED_TYPE, args.get(3).getDatatype());

    DataSymbol fld = args.get(1);
    assertTrue(fld.getDatatype() instanceof StructureRef);
    assertEquals("r2d_field",
                 ((StructureRef)fld.getDatatype()).getTypeName());

    DataSymbol x = args.get(2);
    assertTrue(x.getDatatype() instanceof ArrayType);
    assertEquals(2, x.getShape().size());
    assertEquals(ExtentKind.BOUNDS, x.getShape().get(1).getKind());

    DataSymbol tmp = (DataSymbol)table.lookup("tmp");
    assertTrue(tmp.isLocal());
    assertEquals(ExtentKind.DEFERRED, tmp.getShape().get(0).getKind());

    // Resolved through the module's import
    Symbol wp = table.lookup("wp");
    assertTrue(wp instanceof DataSymbol);
    assertTrue(wp.isImport());
  }

  @Test
  public void testStatements() throws Exception {
    Container file = new FortranReader().psyirFromSource(MODULE);
    Routine kern = file.walkList(Routine.class).get(0);
    List<Node> stmts = kern.children();
    assertEquals(3, stmts.size());
    Loop loop = (Loop)stmts.get(0);
    assertEquals("i", loop.getVariable().getName());
    assertEquals("", loop.getLoopType());
    assertTrue("Continuation joined",
               loop.getBody().children().get(0) instanceof Assignment);
    assertTrue(stmts.get(1) instanceof Assignment);
    Call call = (Call)stmts.get(2);
    RoutineSymbol update = call.getRoutine();
    assertEquals("update", update.getName());
    assertTrue(update.isUnresolved());
  }

  @Test
  public void testNemoLoopTypes() throws Exception {
    Routine r = routine(FortranReader.API_NEMO,
        "do jk = 1, jpk",
        "  do jj = 1, jpj",
        "    do ji = 1, jpi",
        "      a(ji, jj, jk) = 0",
        "    end do",
        "  end do",
        "end do",
        "do n = 1, 3",
        "end do");
    List<Loop> loops = r.walkList(Loop.class);
    assertEquals("levels", loops.get(0).getLoopType());
    assertEquals("lat", loops.get(1).getLoopType());
    assertEquals("lon", loops.get(2).getLoopType());
    assertEquals("", loops.get(3).getLoopType());
    assertEquals("Loop types only with the nemo API", "",
        routine("", "do ji = 1, n", "end do")
            .walkList(Loop.class).get(0).getLoopType());
  }

  @Test
  public void testIfForms() throws Exception {
    Routine r = routine("",
        "if (a > 0) b = 1",
        "if (a > 1) then",
        "  b = 2",
        "else if (a > 2) then",
        "  b = 3",
        "else",
        "  b = 4",
        "end if");
    List<Node> stmts = r.children();
    assertEquals(2, stmts.size());
    IfBlock single = (IfBlock)stmts.get(0);
    assertFalse(single.hasElse());
    assertNull(single.getElseBody());
    IfBlock block = (IfBlock)stmts.get(1);
    IfBlock nested = (IfBlock)block.getElseBody().children().get(0);
    assertTrue(nested.hasElse());
    assertEquals(3, r.walkList(IfBlock.class).size());
  }

  @Test
  public void testCodeBlocks() throws Exception {
    Routine r = routine("",
        "write(*,*) 'x = ', x",
        "a = f(:)",
        "return");
    for (Node n: r.children()) {
      assertTrue(n.describe(), n instanceof CodeBlock);
    }
    assertEquals(Arrays.asList("write(*,*) 'x = ', x"),
                 ((CodeBlock)r.children().get(0)).getLines());
  }

  @Test
  public void testProgram() throws Exception {
    Container file = new FortranReader().psyirFromSource(
        "program main\n  call run()\nend program main\n");
    Routine main = file.getRoutines().get(0);
    assertTrue(main.isProgram());
    assertTrue(main.getSymbolTable().getArgumentList().isEmpty());
  }

  @Test
  public void testUndeclaredNamesShareSymbol() throws Exception {
    Routine r = routine("", "a = b", "b = a");
    Assignment first = (Assignment)r.children().get(0);
    Assignment second = (Assignment)r.children().get(1);
    assertSame(first.getLhs().getSymbol(),
               second.getRhs().referencedSymbols().get(0));
    assertTrue(first.getLhs().getSymbol().isUnresolved());
  }

  @Test
  public void testBadUnit() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("line 1: Expected module, program or " +
                            "subroutine but found 'x = 1'");
    new FortranReader().psyirFromSource("x = 1\n");
  }

  @Test
  public void testWhileLoop() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Only counted do loops are supported");
    routine("", "do while (x > 0)", "end do");
  }

  @Test
  public void testMissingEnd() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Unexpected end of source, expected 'end do'");
    new FortranReader().psyirFromSource(
        "subroutine s()\ndo i = 1, n\n  x = i\n");
  }

  @Test
  public void testRenamedUse() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Renaming in use statements is not supported");
    new FortranReader().psyirFromSource(
        "subroutine s()\nuse m, only: a => b\nend subroutine s\n");
  }

  @Test
  public void testDeclaredTwice() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("line 3: 'a' is declared twice");
    new FortranReader().psyirFromSource(
        "subroutine s()\ninteger :: a\nreal :: a\nend subroutine s\n");
  }

  @Test
  public void testSplitLines() {
    SourceLines lines = new SourceLines(
        "a = 1 ! note\n\nb = '!;' ; c = 2\nd = &\n  & 3\n");
    assertEquals("a = 1", lines.next().text);
    SourceLines.Line b = lines.next();
    assertEquals("b = '!;'", b.text);
    assertEquals(3, b.lineNum);
    assertEquals("c = 2", lines.next().text);
    SourceLines.Line d = lines.next();
    assertEquals("d = 3", d.text);
    assertEquals(4, d.lineNum);
    assertFalse(lines.hasNext());
  }

  @Test
  public void testSplitTopLevel() {
    assertEquals(Arrays.asList("a(1, 2)", "'x,y'", "b"),
                 SourceLines.splitTopLevel("a(1, 2), 'x,y', b", ','));
    assertTrue(SourceLines.splitTopLevel("  ", ',').isEmpty());
  }
}
