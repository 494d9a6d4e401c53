package exm.skc.ir.access;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Statements.Call;

public class VariablesAccessInfoTest {

  private static Routine lower(String... body) throws InvalidSyntaxException {
    StringBuilder src = new StringBuilder("subroutine work()\n");
    for (String line: body) {
      src.append(line).append("\n");
    }
    src.append("end subroutine work\n");
    return new FortranReader().psyirFromSource(src.toString())
                              .getRoutines().get(0);
  }

  private static List<String> names(VariablesAccessInfo info) {
    List<String> result = new ArrayList<String>();
    for (Signature sig: info.getAllSignatures()) {
      result.add(sig.toString());
    }
    return result;
  }

  private static List<AccessType> types(VariablesAccessInfo info,
                                        String sig) {
    List<AccessType> result = new ArrayList<AccessType>();
    for (AccessInfo a: info.get(new Signature(sig)).getAllAccesses()) {
      result.add(a.getAccessType());
    }
    return result;
  }

  @Test
  public void testAssignmentOrder() throws Exception {
    Routine r = lower("a = b + c");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals("Right hand side is read before the write",
                 Arrays.asList("b", "c", "a"), names(info));
    assertTrue(info.isWritten(new Signature("a")));
    assertFalse(info.isRead(new Signature("a")));
    assertTrue(info.get(new Signature("b")).isReadOnly());
  }

  @Test
  public void testIndexReadsBeforeWrite() throws Exception {
    Routine r = lower("a(i) = 0");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList("i", "a"), names(info));
    SingleVariableAccessInfo a = info.get(new Signature("a"));
    assertTrue(a.isArray());
    assertEquals(1, a.get(0).getIndices().size());
  }

  @Test
  public void testLoop() throws Exception {
    Routine r = lower("do i = 1, n", "  a(i) = a(i) + 1", "end do");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList("n", "i", "a"), names(info));
    assertEquals(Arrays.asList(AccessType.WRITE, AccessType.READ,
        AccessType.READ, AccessType.READ), types(info, "i"));
    assertEquals(Arrays.asList(AccessType.READ, AccessType.WRITE),
                 types(info, "a"));
  }

  @Test
  public void testLocationsAdvancePerStatement() throws Exception {
    Routine r = lower("x = 1", "y = x");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    SingleVariableAccessInfo x = info.get(new Signature("x"));
    assertTrue(x.get(0).getLocation() < x.get(1).getLocation());
  }

  @Test
  public void testIfConditionFirst() throws Exception {
    Routine r = lower("if (flag) then", "  a = 1", "else", "  b = 2",
                      "end if");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList("flag", "a", "b"), names(info));
  }

  @Test
  public void testStructureSignatures() throws Exception {
    Routine r = lower("s%a = s%b + t%c(1)%d");
    VariablesAccessInfo info = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList("s%b", "t%c%d", "s%a"), names(info));
    assertTrue(new Signature("s%b").equals(Signature.parse("s%b")));
    assertTrue(info.get(Signature.parse("t%c%d")).isArray());
    assertEquals("s", Signature.parse("s%b").getVarName());
    assertTrue(Signature.parse("s%b").isStructure());
  }

  @Test
  public void testCallArgumentAccesses() throws Exception {
    Routine r = lower("call kern(x, y, z + 1)");
    Call call = r.walkList(Call.class).get(0);
    VariablesAccessInfo undeclared = new VariablesAccessInfo(r);
    assertEquals(AccessType.UNKNOWN,
        undeclared.get(new Signature("x")).get(0).getAccessType());
    assertTrue("Unknown counts as a write",
               undeclared.isWritten(new Signature("x")));

    RoutineSymbol kern = call.getRoutine();
    kern.setArgumentAccesses(Arrays.asList(AccessType.READ,
                                           AccessType.WRITE));
    VariablesAccessInfo declared = new VariablesAccessInfo(r);
    assertEquals(Arrays.asList(AccessType.READ), types(declared, "x"));
    assertEquals(Arrays.asList(AccessType.WRITE), types(declared, "y"));
    assertEquals("Expression arguments are read",
                 Arrays.asList(AccessType.READ), types(declared, "z"));
  }

  @Test
  public void testMissing() throws Exception {
    VariablesAccessInfo info = new VariablesAccessInfo(lower("a = 1"));
    assertNull(info.get(new Signature("b")));
    assertFalse(info.has(new Signature("b")));
    assertFalse(info.isEmpty());
  }

  @Test
  public void testMerge() throws Exception {
    VariablesAccessInfo first = new VariablesAccessInfo(lower("a = 1"));
    VariablesAccessInfo second = new VariablesAccessInfo(lower("b = a"));
    first.merge(second);
    assertEquals(Arrays.asList("a", "b"), names(first));
    assertEquals(Arrays.asList(AccessType.WRITE, AccessType.READ),
                 types(first, "a"));
    SingleVariableAccessInfo a = first.get(new Signature("a"));
    assertTrue(a.get(0).getLocation() < a.get(1).getLocation());
  }
}
