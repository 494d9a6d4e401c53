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

import org.apache.log4j.Logger;

import exm.skc.common.Logging;
import exm.skc.common.util.Ternary;
import exm.skc.ir.tree.IRTree.Expression;

/**
 * Decides equivalence and ordering of expressions.
 *
 * Analyses take an instance in their constructor.  {@link #get()} gives
 * the default: the algebraic engine if it is enabled, otherwise the
 * structural fallback.  The choice is made once per process.
 */
public abstract class SymbolicMaths {
  protected static final Logger logger = Logging.getSKCLogger();

  private static SymbolicMaths instance = null;

  public static synchronized SymbolicMaths get() {
    if (instance == null) {
      if (AlgebraicMaths.isAvailable()) {
        instance = new AlgebraicMaths();
      } else {
        instance = new SimpleMaths();
      }
      logger.debug("Symbolic maths engine: " + instance.getName());
    }
    return instance;
  }

  public abstract String getName();

  /**
   * @return true if the expressions always have the same value.  If
   *         either is null, true only if both are.
   */
  public abstract boolean equal(Expression e1, Expression e2);

  /**
   * @return whether e1 > e2 for all values of the variables
   */
  public abstract Ternary greaterThan(Expression e1, Expression e2);

  /**
   * @return whether e1 >= e2 for all values of the variables
   */
  public abstract Ternary greaterEqual(Expression e1, Expression e2);
}
