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

import exm.skc.common.util.Ternary;
import exm.skc.ir.tree.IRTree.Expression;

/**
 * Fallback when the algebraic engine is disabled: expressions are
 * equal only if the trees are the same, and orderings can't be
 * disproved.
 */
public class SimpleMaths extends SymbolicMaths {

  @Override
  public String getName() {
    return "simple";
  }

  @Override
  public boolean equal(Expression e1, Expression e2) {
    if (e1 == null || e2 == null) {
      return e1 == e2;
    }
    return e1.structurallyEquals(e2);
  }

  @Override
  public Ternary greaterThan(Expression e1, Expression e2) {
    return Ternary.TRUE;
  }

  @Override
  public Ternary greaterEqual(Expression e1, Expression e2) {
    return Ternary.TRUE;
  }
}
