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
import java.util.Collections;
import java.util.List;

import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Node;

/**
 * Encloses a list of consecutive sibling statements in a new node,
 * usually a directive.  Subclasses say which nodes may not appear in
 * the region and check where the region may go.
 */
public abstract class RegionTrans extends BaseTransformation {

  protected RegionTrans(String... optionNames) {
    super(optionNames);
  }

  /**
   * @return types of node that may not be inside the region
   */
  protected abstract List<Class<? extends Node>> excludedNodeTypes();

  /**
   * Region specific checks, run after the generic ones.  Must read
   * all options so that building the region can't fail.
   * @param nodes statements of the region, in order
   */
  protected abstract Result<Wrapper, TransformationError> prepare(
          List<Statement> nodes, TransformOptions options);

  @Override
  public void validate(Node node, TransformOptions options)
                                            throws TransformationError {
    validate(Collections.singletonList(node), options);
  }

  public void validate(List<? extends Node> nodes, TransformOptions options)
                                            throws TransformationError {
    plan(nodes, checkOptions(options)).getOrThrow();
  }

  @Override
  public Statement apply(Node node, TransformOptions options)
                                            throws TransformationError {
    return apply(Collections.singletonList(node), options);
  }

  /**
   * @return the node enclosing the region
   */
  public Statement apply(List<? extends Node> nodes,
                         TransformOptions options)
                                            throws TransformationError {
    Plan plan = plan(nodes, checkOptions(options)).getOrThrow();
    beforeReplace(plan.wrapper);
    return replace(plan.nodes, plan.wrapper);
  }

  /**
   * Called by apply after all checks have passed and before the tree is
   * changed.  Work with side effects outside the tree goes here so that
   * it doesn't happen on validation.
   * @param wrapper as returned by prepare
   */
  protected void beforeReplace(Wrapper wrapper) throws TransformationError {
    // Nothing by default
  }

  private static class Plan {
    final List<Statement> nodes;
    final Wrapper wrapper;

    Plan(List<Statement> nodes, Wrapper wrapper) {
      this.nodes = nodes;
      this.wrapper = wrapper;
    }
  }

  private Result<Plan, TransformationError> plan(List<? extends Node> nodes,
                                                 TransformOptions options) {
    Result<List<Statement>, TransformationError> region =
                                              checkNodeList(nodes);
    if (!region.isOk()) {
      return region.propagate();
    }
    List<Statement> stmts = region.get();
    Result<Wrapper, TransformationError> wrapper = prepare(stmts, options);
    if (!wrapper.isOk()) {
      return wrapper.propagate();
    }
    return Result.ok(new Plan(stmts, wrapper.get()));
  }

  /**
   * Nodes must be non-empty consecutive siblings in a schedule, in
   * order, without any excluded nodes inside
   */
  private Result<List<Statement>, TransformationError> checkNodeList(
                                            List<? extends Node> nodes) {
    if (nodes.isEmpty()) {
      return fail("Cannot apply a transformation to an empty list of " +
                  "nodes.");
    }
    List<Statement> result = new ArrayList<Statement>();
    Node parent = nodes.get(0).parent();
    for (Node n: nodes) {
      if (!(n instanceof Statement)) {
        return fail("Nodes of type '" + n.typeName() +
            "' cannot be enclosed by a " + getName() + " transformation");
      }
      if (n.parent() == null || n.parent() != parent) {
        return fail("Error in " + getName() + " transformation: supplied " +
                    "nodes are not children of the same parent.");
      }
      result.add((Statement)n);
    }
    if (!(parent instanceof Schedule)) {
      return fail("Error in " + getName() + " transformation: supplied " +
          "nodes must be in a Schedule but their parent is a '" +
          parent.typeName() + "'.");
    }
    for (int i = 1; i < result.size(); i++) {
      if (result.get(i).position() != result.get(i - 1).position() + 1) {
        return fail("Children are not consecutive children of one " +
                    "parent: " + result.get(i - 1).describe() + " and " +
                    result.get(i).describe());
      }
    }
    for (Statement s: result) {
      for (Node inner: s.walk(Node.class)) {
        for (Class<? extends Node> excluded: excludedNodeTypes()) {
          if (excluded.isInstance(inner)) {
            return fail("Nodes of type '" + inner.typeName() +
                "' cannot be enclosed by a " + getName() +
                " transformation");
          }
        }
      }
    }
    return Result.ok(result);
  }
}
