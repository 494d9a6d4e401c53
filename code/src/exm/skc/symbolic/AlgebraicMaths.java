/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.skc.symbolic;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import exm.skc.backend.AlgebraWriter;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.common.util.Ternary;
import exm.skc.ir.tree.Expressions.Member;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.Expression;

/**
 * Exact comparisons: both expressions are written as algebra, parsed
 * into canonical polynomials and subtracted.
 *
 * Expressions the algebra can't represent, e.g. character literals,
 * are compared structurally.
 */
public class AlgebraicMaths extends SymbolicMaths {
  private final SimpleMaths fallback = new SimpleMaths();

  /**
   * @return true if the algebraic engine is enabled
   */
  public static boolean isAvailable() {
    return Settings.getBooleanUnchecked(Settings.SYMBOLIC_ALGEBRA);
  }

  @Override
  public String getName() {
    return "algebraic";
  }

  @Override
  public boolean equal(Expression e1, Expression e2) {
    if (e1 == null || e2 == null) {
      return e1 == e2;
    }
    Polynomial diff = difference(e1, e2);
    if (diff == null) {
      return fallback.equal(e1, e2);
    }
    return diff.isZero();
  }

  @Override
  public Ternary greaterThan(Expression e1, Expression e2) {
    Polynomial diff = difference(e1, e2);
    if (diff == null || !diff.isConstant()) {
      return Ternary.MAYBE;
    }
    return Ternary.fromBoolean(diff.getConstant().signum() > 0);
  }

  @Override
  public Ternary greaterEqual(Expression e1, Expression e2) {
    Polynomial diff = difference(e1, e2);
    if (diff == null || !diff.isConstant()) {
      return Ternary.MAYBE;
    }
    return Ternary.fromBoolean(diff.getConstant().signum() >= 0);
  }

  /**
   * @return e1 - e2, or null if either can't be written as algebra
   */
  private Polynomial difference(Expression e1, Expression e2) {
    if (e1 == null || e2 == null) {
      return null;
    }
    Map<String, String> renames = reservedNameRenames(e1, e2);
    AlgebraWriter writer = new AlgebraWriter(renames);
    String text1, text2;
    try {
      text1 = writer.emit(e1);
      text2 = writer.emit(e2);
    } catch (VisitorError e) {
      logger.debug("Comparing structurally: " + e.getMessage());
      return null;
    }
    try {
      Polynomial p1 = AlgebraParser.parse(text1);
      Polynomial p2 = AlgebraParser.parse(text2);
      if (logger.isTraceEnabled()) {
        logger.trace("Algebra: " + text1 + " => " + p1 + "; " +
                     text2 + " => " + p2);
      }
      return p1.subtract(p2);
    } catch (InvalidSyntaxException e) {
      throw new SKCRuntimeError("Could not read back algebra: " +
                                e.getMessage(), e);
    }
  }

  /**
   * Variables and members that clash with algebra function names get a
   * fresh name, the same one in both expressions.
   */
  static Map<String, String> reservedNameRenames(Expression... exprs) {
    Set<String> used = new HashSet<String>();
    for (Expression e: exprs) {
      for (Reference ref: e.walk(Reference.class)) {
        used.add(ref.getName().toLowerCase());
      }
      for (Member m: e.walk(Member.class)) {
        used.add(m.getName().toLowerCase());
      }
    }
    Map<String, String> renames = new HashMap<String, String>();
    for (String name: used) {
      if (AlgebraParser.isReserved(name)) {
        int i = 1;
        String candidate = name + "_" + i;
        while (used.contains(candidate) ||
               renames.containsValue(candidate)) {
          i++;
          candidate = name + "_" + i;
        }
        renames.put(name, candidate);
      }
    }
    return renames;
  }
}
