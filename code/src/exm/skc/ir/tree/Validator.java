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
package exm.skc.ir.tree;

import java.util.List;

import org.apache.log4j.Logger;

import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Loops.Loop;

/**
 * Perform some sanity checks on the IR:
 * - Check parent links are consistent with child lists
 * - Check every node has a complete set of valid children
 * - Check symbols referenced are the ones visible in scope
 * - Check loop variables are scalars
 */
public class Validator {

  public static void validate(Logger logger, Node root) {
    int count = 0;
    for (Node n: root.walk(Node.class)) {
      checkParentLinks(n);
      checkComplete(n);
      checkSymbols(n);
      if (n instanceof Loop) {
        checkLoopVariable((Loop)n);
      }
      count++;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Validated " + count + " nodes under " + root.describe());
    }
  }

  private static void checkParentLinks(Node n) {
    List<Node> children = n.children();
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      if (child.parent() != n) {
        throw new SKCRuntimeError("Parent link of " + child.describe() +
            " is " + child.parent() + " but expected " + n.describe());
      }
      if (child.position() != i) {
        throw new SKCRuntimeError(child.describe() + " thinks it is at " +
            "position " + child.position() + " of " + n.describe() +
            " but is at " + i);
      }
    }
  }

  private static void checkComplete(Node n) {
    String problem = n.checkComplete();
    if (problem != null) {
      throw new SKCRuntimeError("Invalid node " + n.describe() + ": " +
                                problem);
    }
  }

  private static void checkSymbols(Node n) {
    SymbolTable table = n.scope();
    if (table == null) {
      // Detached from any scope: nothing to check against
      return;
    }
    for (Symbol sym: n.referencedSymbols()) {
      Symbol found = table.find(sym.getName());
      if (found == null) {
        throw new SKCRuntimeError("Symbol '" + sym.getName() + "' used in "
            + n.describe() + " is not in scope");
      }
      if (found != sym) {
        throw new SKCRuntimeError("Symbol '" + sym.getName() + "' used in "
            + n.describe() + " is not the symbol visible in scope: " +
            sym + " vs. " + found);
      }
    }
  }

  private static void checkLoopVariable(Loop loop) {
    if (loop.getVariable().isArray()) {
      throw new SKCRuntimeError("Loop variable '" +
          loop.getVariable().getName() + "' is an array");
    }
  }
}
