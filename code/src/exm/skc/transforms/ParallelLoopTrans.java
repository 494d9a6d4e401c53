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
package exm.skc.transforms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.skc.analysis.DependencyTools;
import exm.skc.analysis.ParallelCheckOptions;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.SymbolicMaths;

/**
 * Wraps a single loop in a directive that shares its iterations out.
 * Unless the force option is set, dependency analysis must agree that
 * the iterations are independent.
 */
public abstract class ParallelLoopTrans extends BaseTransformation {

  public static final String COLLAPSE = "collapse";
  public static final String FORCE = "force";

  private final SymbolicMaths maths;

  protected ParallelLoopTrans(SymbolicMaths maths, String... extraOptions) {
    super(withCommonOptions(extraOptions));
    this.maths = maths;
  }

  private static String[] withCommonOptions(String... extraOptions) {
    List<String> all = new ArrayList<String>(Arrays.asList(extraOptions));
    all.add(COLLAPSE);
    all.add(FORCE);
    return all.toArray(new String[all.size()]);
  }

  /**
   * Loop specific checks and option parsing
   * @param collapse number of loops to collapse, 0 for no clause
   */
  protected abstract Result<Wrapper, TransformationError> prepare(Loop loop,
                                   int collapse, TransformOptions options);

  @Override
  public void validate(Node node, TransformOptions options)
                                          throws TransformationError {
    plan(node, checkOptions(options)).getOrThrow();
  }

  @Override
  public Statement apply(Node node, TransformOptions options)
                                          throws TransformationError {
    Wrapper wrapper = plan(node, checkOptions(options)).getOrThrow();
    List<Statement> region = new ArrayList<Statement>();
    region.add((Loop)node);
    return replace(region, wrapper);
  }

  private Result<Wrapper, TransformationError> plan(Node node,
                                                    TransformOptions options) {
    if (!(node instanceof Loop)) {
      return fail("Target of " + getName() + " transformation must be a " +
                  "sub-class of Loop but got '" + node.typeName() + "'");
    }
    Loop loop = (Loop)node;
    if (!(loop.parent() instanceof Schedule)) {
      return fail("Loop must be in a Schedule to be transformed");
    }

    int collapse;
    boolean force;
    try {
      collapse = options.getInt(getName(), COLLAPSE, 0);
      force = options.getBoolean(getName(), FORCE, false);
    } catch (TransformationError e) {
      return Result.error(e);
    }
    if (options.has(COLLAPSE)) {
      if (collapse < 1) {
        return fail("The 'collapse' option must be a positive integer " +
                    "but got '" + collapse + "'.");
      }
      int depth = nestDepth(loop);
      if (collapse > depth) {
        return fail("Cannot apply COLLAPSE(" + collapse + ") clause to a " +
                    "loop nest containing only " + depth + " loops");
      }
    }

    if (!force) {
      DependencyTools tools = new DependencyTools(
            Collections.singletonList(loop.getLoopType()), maths);
      if (!tools.canLoopBeParallelised(loop,
                new ParallelCheckOptions().setOnlyNestedLoops(false))) {
        return fail("Dependency analysis failed with the following " +
            "messages:\n" + StringUtils.join(tools.getAllMessageStrings(), "\n"));
      }
    }
    return prepare(loop, collapse, options);
  }

  /**
   * @return number of perfectly nested loops starting at loop
   */
  static int nestDepth(Loop loop) {
    int depth = 1;
    Loop inner = loop.getSingleNestedLoop();
    while (inner != null) {
      depth++;
      inner = inner.getSingleNestedLoop();
    }
    return depth;
  }
}
