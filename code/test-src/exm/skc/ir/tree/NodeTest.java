package exm.skc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.Logging;
import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Extent;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.ArrayReference;
import exm.skc.ir.tree.Expressions.BinaryOperation;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.IfBlock;

public class NodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private Routine routine;
  private DataSymbol i, n, a;
  private Loop loop;
  private Assignment body;

  /**
   * do i = 1, n
   *   a(i) = a(i) + 1
   * enddo
   */
  @Before
  public void buildTree() {
    routine = new Routine("work");
    SymbolTable table = routine.getSymbolTable();
    i = table.declare("i", DataType.INTEGER_TYPE, new Local());
    n = table.declare("n", DataType.INTEGER_TYPE, new Local());
    a = table.declare("a", new ArrayType(DataType.REAL_TYPE,
                  Arrays.asList(Extent.DEFERRED)), new Local());
    body = Assignment.create(elem(a, i),
        BinaryOperation.create(BinaryOperation.Operator.ADD, elem(a, i),
                               Literal.intLiteral(1)));
    loop = Loop.create(i, Literal.intLiteral(1), new Reference(n),
                       Literal.intLiteral(1),
                       Collections.singletonList(body));
    routine.addChild(loop);
  }

  private static ArrayReference elem(DataSymbol arr, DataSymbol index) {
    return ArrayReference.create(arr,
        Collections.<Expression>singletonList(new Reference(index)));
  }

  @Test
  public void testNavigation() {
    assertSame(routine, loop.parent());
    assertSame(loop.getBody(), body.parent());
    assertSame(routine, body.root());
    assertSame(loop, body.ancestor(Loop.class));
    assertNull("ancestor excludes the node itself", loop.ancestor(Loop.class));
    assertTrue(body.isDescendantOf(routine));
    assertFalse(routine.isDescendantOf(body));
    assertSame(routine.getSymbolTable(), body.scope());
    assertEquals(0, loop.position());
    assertEquals(Loop.STOP, loop.getStop().position());
  }

  @Test
  public void testWalkIsPreOrder() {
    List<Reference> refs = routine.walkList(Reference.class);
    List<String> names = new ArrayList<String>();
    for (Reference r: refs) {
      names.add(r.getName());
    }
    assertEquals(Arrays.asList("n", "a", "i", "a", "i"), names);
    assertEquals("walk includes the starting node", loop,
                 loop.walkList(Loop.class).get(0));
  }

  @Test
  public void testInsertAndDetach() {
    Assignment init = Assignment.create(new Reference(n),
                                        Literal.intLiteral(10));
    routine.insertChild(0, init);
    assertEquals(2, routine.numChildren());
    assertSame(init, routine.getChild(0));
    assertEquals(1, loop.position());

    init.detach();
    assertNull(init.parent());
    assertEquals(1, routine.numChildren());
    assertEquals(0, loop.position());
  }

  @Test
  public void testDetachRequiredChild() {
    Node before = routine.copy();
    Schedule loopBody = loop.getBody();
    try {
      loopBody.detach();
      throw new AssertionError("detaching a loop body should fail");
    } catch (InvalidTreeException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
          "Can't detach 'Schedule' (child 3) from 'Loop'"));
    }
    assertSame(loop, loopBody.parent());
    assertEquals(4, loop.numChildren());
    assertTrue(routine.structurallyEquals(before));
    assertNull(routine.checkComplete());
  }

  @Test
  public void testDetachAssignmentRhs() {
    exception.expect(InvalidTreeException.class);
    exception.expectMessage("from 'Assignment'");
    body.getRhs().detach();
  }

  @Test
  public void testDetachOptionalElse() {
    Assignment thenStmt = Assignment.create(new Reference(n),
                                            Literal.intLiteral(1));
    Assignment elseStmt = Assignment.create(new Reference(n),
                                            Literal.intLiteral(2));
    IfBlock ifBlock = IfBlock.create(
        BinaryOperation.create(BinaryOperation.Operator.GT, new Reference(n),
                               Literal.intLiteral(0)),
        Collections.<Statement>singletonList(thenStmt),
        Collections.<Statement>singletonList(elseStmt));
    routine.addChild(ifBlock);
    ifBlock.getElseBody().detach();
    assertEquals(2, ifBlock.numChildren());
    assertNull(ifBlock.checkComplete());
  }

  @Test
  public void testInsertNotOrphan() {
    exception.expect(InvalidTreeException.class);
    exception.expectMessage("not an orphan");
    routine.addChild(body);
  }

  @Test
  public void testInsertWrongKind() {
    exception.expect(InvalidTreeException.class);
    routine.addChild(Literal.intLiteral(3));
  }

  @Test
  public void testInsertOutOfRange() {
    exception.expect(InvalidTreeException.class);
    routine.insertChild(5, Assignment.create(new Reference(n),
                                             Literal.intLiteral(1)));
  }

  @Test
  public void testCycle() {
    Schedule s = new Schedule();
    IfBlock ifb = IfBlock.create(new Literal("true", DataType.BOOLEAN_TYPE),
                                 Collections.<Statement>emptyList());
    s.addChild(ifb);
    exception.expect(InvalidTreeException.class);
    ifb.getIfBody().addChild(s);
  }

  @Test
  public void testReplaceWith() {
    Expression oldStop = loop.getStop();
    Literal newStop = Literal.intLiteral(100);
    oldStop.replaceWith(newStop);
    assertSame(newStop, loop.getStop());
    assertNull(oldStop.parent());
  }

  @Test
  public void testReplaceRoot() {
    exception.expect(InvalidTreeException.class);
    routine.replaceWith(new Routine("other"));
  }

  @Test
  public void testReplaceWithWrongKind() {
    exception.expect(InvalidTreeException.class);
    loop.getStop().replaceWith(new Schedule());
  }

  @Test
  public void testCopyIsIndependent() {
    Loop copy = (Loop)loop.copy();
    assertNull(copy.parent());
    assertTrue(copy.structurallyEquals(loop));
    copy.getStop().replaceWith(Literal.intLiteral(5));
    assertFalse(copy.structurallyEquals(loop));
    assertTrue("Original unchanged", loop.getStop() instanceof Reference);
  }

  @Test
  public void testCopyRoutineRebindsSymbols() {
    Routine copy = (Routine)routine.copy();
    assertNotSame(routine.getSymbolTable(), copy.getSymbolTable());
    DataSymbol aCopy = (DataSymbol)copy.getSymbolTable().lookup("a");
    assertNotSame(a, aCopy);
    for (Reference r: copy.walk(Reference.class)) {
      assertSame("References in the copy use the copied symbols",
                 copy.getSymbolTable().lookup(r.getName()), r.getSymbol());
    }
    Loop loopCopy = copy.walkList(Loop.class).get(0);
    assertSame(copy.getSymbolTable().lookup("i"), loopCopy.getVariable());
    Validator.validate(Logging.getSKCLogger(), copy);
  }

  @Test
  public void testStructurallyEquals() {
    Expression e1 = BinaryOperation.create(BinaryOperation.Operator.ADD,
        new Reference(n), Literal.intLiteral(1));
    Expression e2 = BinaryOperation.create(BinaryOperation.Operator.ADD,
        new Reference(n), Literal.intLiteral(1));
    Expression e3 = BinaryOperation.create(BinaryOperation.Operator.SUB,
        new Reference(n), Literal.intLiteral(1));
    assertTrue(e1.structurallyEquals(e2));
    assertFalse(e1.structurallyEquals(e3));
    assertFalse(e1.structurallyEquals(null));
  }

  @Test
  public void testFactoryChecksArity() {
    exception.expect(InvalidTreeException.class);
    ArrayReference.create(a, Collections.<Expression>emptyList());
  }

  @Test
  public void testReferencedSymbols() {
    assertEquals(Arrays.asList(i), loop.referencedSymbols());
    assertEquals(Arrays.asList(a), body.getLhs().referencedSymbols());
  }

  @Test
  public void testValidatorAcceptsTree() {
    Validator.validate(Logging.getSKCLogger(), routine);
  }

  @Test
  public void testValidatorRejectsForeignSymbol() {
    DataSymbol stranger = new DataSymbol("n", DataType.INTEGER_TYPE);
    loop.getStop().replaceWith(new Reference(stranger));
    exception.expect(SKCRuntimeError.class);
    exception.expectMessage("not the symbol visible in scope");
    Validator.validate(Logging.getSKCLogger(), routine);
  }

  @Test
  public void testValidatorRejectsUndeclared() {
    DataSymbol stranger = new DataSymbol("m", DataType.INTEGER_TYPE);
    loop.getStop().replaceWith(new Reference(stranger));
    exception.expect(SKCRuntimeError.class);
    exception.expectMessage("is not in scope");
    Validator.validate(Logging.getSKCLogger(), routine);
  }
}
