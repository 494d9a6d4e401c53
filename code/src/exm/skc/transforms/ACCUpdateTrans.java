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
import java.util.List;
import java.util.Set;

import exm.skc.analysis.DependencyTools;
import exm.skc.analysis.DependencyTools.InOut;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.access.Signature;
import exm.skc.ir.tree.Directives.ACCEnterDataDirective;
import exm.skc.ir.tree.Directives.ACCUpdateDirective;
import exm.skc.ir.tree.Directives.ACCUpdateDirective.Direction;
import exm.skc.ir.tree.Directives.Family;
import exm.skc.ir.tree.Directives.RegionDirective;
import exm.skc.ir.tree.Directives.RegionType;
import exm.skc.ir.tree.Expressions.BinaryOperation;
import exm.skc.ir.tree.Expressions.NaryOperation;
import exm.skc.ir.tree.Expressions.UnaryOperation;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

/**
 * Keeps host copies of data up to date around code that runs outside
 * OpenACC regions.  Host code is bracketed by "acc update host" for what it
 * reads and "acc update device" for what it writes.  A call is treated as a
 * possible device region since we can't see inside it.
 */
public class ACCUpdateTrans extends BaseTransformation {
  public static final String CONDITIONAL = "conditional";

  /**
   * A directive to insert next to a child of a schedule
   */
  private static class Insertion {
    final Node anchor;
    final boolean after;
    final ACCUpdateDirective directive;

    Insertion(Node anchor, boolean after, ACCUpdateDirective directive) {
      this.anchor = anchor;
      this.after = after;
      this.directive = directive;
    }
  }

  private final Set<String> loopVariables;

  public ACCUpdateTrans() {
    super(CONDITIONAL);
    loopVariables = Settings.getMappingUnchecked(
                          Settings.NEMO_LOOP_TYPE_MAPPING).keySet();
  }

  @Override
  public String getName() {
    return "ACCUpdateTrans";
  }

  @Override
  public void validate(Node node, TransformOptions options)
                                          throws TransformationError {
    plan(node, checkOptions(options)).getOrThrow();
  }

  @Override
  public Node apply(Node node, TransformOptions options)
                                          throws TransformationError {
    List<Insertion> insertions = plan(node,
                                      checkOptions(options)).getOrThrow();
    for (Insertion ins: insertions) {
      int pos = ins.anchor.position();
      ins.anchor.parent().insertChild(ins.after ? pos + 1 : pos,
                                      ins.directive);
      logger.debug(getName() + ": " + ins.directive.describe() +
          (ins.after ? " after " : " before ") + ins.anchor.describe());
    }
    return node;
  }

  private Result<List<Insertion>, TransformationError> plan(Node node,
                                              TransformOptions options) {
    if (!(node instanceof Schedule)) {
      return fail("Expected a Schedule but got a node of type '" +
                  node.typeName() + "'");
    }
    boolean conditional;
    try {
      conditional = options.getBoolean(getName(), CONDITIONAL, false);
    } catch (TransformationError e) {
      return Result.error(e);
    }
    List<Insertion> insertions = new ArrayList<Insertion>();
    Result<Void, TransformationError> r = addUpdates((Schedule)node,
                                          conditional, insertions);
    if (!r.isOk()) {
      return r.propagate();
    }
    return Result.ok(insertions);
  }

  private Result<Void, TransformationError> addUpdates(Schedule sched,
                      boolean conditional, List<Insertion> insertions) {
    List<Node> hostNodes = new ArrayList<Node>();
    for (Node child: sched.children()) {
      if (child instanceof ACCEnterDataDirective) {
        continue;
      }
      if (!containsDeviceRegion(child)) {
        hostNodes.add(child);
        continue;
      }
      Result<Void, TransformationError> r;
      if (!hostNodes.isEmpty()) {
        r = bracket(hostNodes, conditional, insertions);
        if (!r.isOk()) {
          return r;
        }
        hostNodes = new ArrayList<Node>();
      }

      if (child instanceof Call) {
        r = checkCallArguments((Call)child);
      } else if (child instanceof IfBlock) {
        IfBlock ifBlock = (IfBlock)child;
        r = bracket(Arrays.<Node>asList(ifBlock.getCondition()),
                    conditional, insertions);
        if (r.isOk()) {
          r = addUpdates(ifBlock.getIfBody(), conditional, insertions);
        }
        if (r.isOk() && ifBlock.hasElse()) {
          r = addUpdates(ifBlock.getElseBody(), conditional, insertions);
        }
      } else if (child instanceof Loop) {
        Loop loop = (Loop)child;
        r = bracket(Arrays.<Node>asList(loop.getStart(), loop.getStop(),
                    loop.getStep()), conditional, insertions);
        if (r.isOk()) {
          r = addUpdates(loop.getBody(), conditional, insertions);
        }
      } else {
        r = Result.ok(null);
      }
      if (!r.isOk()) {
        return r;
      }
    }
    if (!hostNodes.isEmpty()) {
      return bracket(hostNodes, conditional, insertions);
    }
    return Result.ok(null);
  }

  private static boolean containsDeviceRegion(Node node) {
    if (!node.walkList(Call.class).isEmpty()) {
      return true;
    }
    for (RegionDirective d: node.walk(RegionDirective.class)) {
      if (d.family() == Family.ACC &&
          d.regionType() == RegionType.PARALLEL) {
        return true;
      }
    }
    return false;
  }

  /**
   * Arguments of a call may only involve array bound queries, anything
   * else may need computing on the host.
   */
  private Result<Void, TransformationError> checkCallArguments(Call call) {
    boolean other = !call.walkList(UnaryOperation.class).isEmpty() ||
                    !call.walkList(NaryOperation.class).isEmpty();
    for (BinaryOperation op: call.walk(BinaryOperation.class)) {
      if (op.getOperator() != BinaryOperation.Operator.LBOUND &&
          op.getOperator() != BinaryOperation.Operator.UBOUND) {
        other = true;
      }
    }
    if (other) {
      return fail("Call arguments may only contain LBOUND and UBOUND " +
          "operations but found other operations in " + call.describe());
    }
    return Result.ok(null);
  }

  /**
   * Plan updates before and after nodes executed on the host
   * @param nodes consecutive, all below the same schedule
   */
  private Result<Void, TransformationError> bracket(List<Node> nodes,
                    boolean conditional, List<Insertion> insertions) {
    InOut inOut = new DependencyTools().getInOutParameters(nodes);
    Result<List<Signature>, TransformationError> inputs =
                                        updatable(inOut.getInputs());
    if (!inputs.isOk()) {
      return inputs.propagate();
    }
    Result<List<Signature>, TransformationError> outputs =
                                        updatable(inOut.getOutputs());
    if (!outputs.isOk()) {
      return outputs.propagate();
    }
    if (!inputs.get().isEmpty()) {
      insertions.add(new Insertion(scheduleChild(nodes.get(0)), false,
          new ACCUpdateDirective(Direction.HOST, inputs.get(), conditional)));
    }
    if (!outputs.get().isEmpty()) {
      insertions.add(new Insertion(scheduleChild(nodes.get(nodes.size() - 1)),
          true,
          new ACCUpdateDirective(Direction.DEVICE, outputs.get(),
                                 conditional)));
    }
    return Result.ok(null);
  }

  private Result<List<Signature>, TransformationError> updatable(
                                                  List<String> paths) {
    List<Signature> result = new ArrayList<Signature>();
    for (String path: paths) {
      Signature sig = Signature.parse(path);
      if (sig.isStructure()) {
        return fail("Updating the structure access '" + path +
                    "' is not supported");
      }
      if (loopVariables.contains(sig.getVarName().toLowerCase())) {
        continue;
      }
      result.add(sig);
    }
    return Result.ok(result);
  }

  /**
   * @return node itself, or the ancestor of node that is a statement in
   *        a schedule
   */
  private static Node scheduleChild(Node node) {
    Node n = node;
    while (!(n.parent() instanceof Schedule)) {
      n = n.parent();
    }
    return n;
  }
}
