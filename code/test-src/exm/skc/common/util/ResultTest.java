package exm.skc.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.common.exceptions.TransformationError;

public class ResultTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testOk() throws Exception {
    Result<String, TransformationError> r = Result.ok("x");
    assertTrue(r.isOk());
    assertEquals("x", r.get());
    assertEquals("x", r.getOrThrow());
    assertNull(r.getError());
    assertEquals("Ok(x)", r.toString());
  }

  @Test
  public void testError() {
    TransformationError e = new TransformationError("T", "broken");
    Result<String, TransformationError> r = Result.error(e);
    assertFalse(r.isOk());
    assertSame(e, r.getError());
    assertEquals("Error(Transformation Error: T: broken)", r.toString());
    try {
      r.getOrThrow();
    } catch (TransformationError thrown) {
      assertSame(e, thrown);
    }
    Result<Integer, TransformationError> other = r.propagate();
    assertSame(e, other.getError());

    exception.expect(SKCRuntimeError.class);
    exception.expectMessage("Result holds error: Transformation Error: T: " +
                            "broken");
    r.get();
  }

  @Test
  public void testPropagateOk() {
    exception.expect(SKCRuntimeError.class);
    exception.expectMessage("Cannot propagate successful result");
    Result.<String, TransformationError>ok("x").propagate();
  }

  @Test
  public void testTernary() {
    assertEquals(Ternary.TRUE, Ternary.fromBoolean(true));
    assertEquals(Ternary.MAYBE, Ternary.MAYBE.not());
    assertEquals(Ternary.FALSE, Ternary.TRUE.not());
    assertEquals(Ternary.FALSE, Ternary.MAYBE.and(Ternary.FALSE));
    assertEquals(Ternary.MAYBE, Ternary.MAYBE.and(Ternary.TRUE));
    assertEquals(Ternary.TRUE, Ternary.MAYBE.or(Ternary.TRUE));
    assertEquals(Ternary.FALSE, Ternary.FALSE.or(Ternary.FALSE));
    assertTrue(Ternary.TRUE.isTrue());
    assertFalse(Ternary.MAYBE.isFalse());
  }
}
