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
package exm.skc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.skc.backend.FortranWriter;
import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessInfo;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.SingleVariableAccessInfo;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.SymbolicMaths;

/**
 * Dependency analysis on top of the variable access information:
 * whether a loop can be parallelised, and which variables a region
 * reads from and writes to its surroundings.
 *
 * Every public query starts by clearing the messages of the previous
 * one; the messages explain why a query came out negative.
 */
public class DependencyTools {

  private static final Logger logger = Logging.getSKCLogger();

  public static enum Severity {
    INFO("Info"),
    WARNING("Warning"),
    ERROR("Error");

    private final String prefix;

    private Severity(String prefix) {
      this.prefix = prefix;
    }

    public String getPrefix() {
      return prefix;
    }
  }

  public static class Message {
    private final Severity severity;
    private final String text;

    public Message(Severity severity, String text) {
      this.severity = severity;
      this.text = text;
    }

    public Severity getSeverity() {
      return severity;
    }

    public String getText() {
      return text;
    }

    @Override
    public String toString() {
      return severity.getPrefix() + ": " + text;
    }
  }

  private final List<String> loopTypesToParallelise;
  private final SymbolicMaths maths;
  private final List<Message> messages = new ArrayList<Message>();

  /**
   * Loop types from {@link Settings#PARALLEL_LOOP_TYPES}, default
   * equivalence engine
   */
  public DependencyTools() {
    this(Settings.getList(Settings.PARALLEL_LOOP_TYPES),
         SymbolicMaths.get());
  }

  public DependencyTools(List<String> loopTypesToParallelise) {
    this(loopTypesToParallelise, SymbolicMaths.get());
  }

  /**
   * @param loopTypesToParallelise loop types that are considered for
   *      parallelisation
   * @param maths decides whether two index expressions are equal
   */
  public DependencyTools(List<String> loopTypesToParallelise,
                         SymbolicMaths maths) {
    this.loopTypesToParallelise = new ArrayList<String>(
                                            loopTypesToParallelise);
    this.maths = maths;
  }

  public List<String> getLoopTypesToParallelise() {
    return Collections.unmodifiableList(loopTypesToParallelise);
  }

  public SymbolicMaths getMaths() {
    return maths;
  }

  /**
   * @return messages from the last query
   */
  public List<Message> getAllMessages() {
    return Collections.unmodifiableList(new ArrayList<Message>(messages));
  }

  /**
   * @return messages from the last query as text, each formatted as
   *      "{@literal <Severity>: <text>}", e.g. "Warning: Variable 'a' ..."
   */
  public List<String> getAllMessageStrings() {
    List<String> result = new ArrayList<String>(messages.size());
    for (Message m: messages) {
      result.add(m.toString());
    }
    return result;
  }

  private void clearMessages() {
    messages.clear();
  }

  private void addMessage(Severity severity, String text) {
    Message m = new Message(severity, text);
    logger.trace("DependencyTools: " + m);
    messages.add(m);
  }

  /**
   * Filter applied before looking at any variable.  Subclasses can
   * change what makes a loop worth parallelising.
   */
  protected boolean isLoopSuitableForParallel(Loop loop,
                                              boolean onlyNestedLoops) {
    if (onlyNestedLoops && loop.walkList(Loop.class).size() == 1) {
      addMessage(Severity.INFO, "Not a nested loop.");
      return false;
    }
    if (!loopTypesToParallelise.contains(loop.getLoopType())) {
      addMessage(Severity.INFO, "Loop has wrong loop type '" +
                 loop.getLoopType() + "'.");
      return false;
    }
    return true;
  }

  /**
   * An array that is written can be parallelised along the loop variable
   * if the loop variable appears in exactly one index position, and the
   * index expressions in that position are all equal.  A written array
   * whose indices don't use the loop variable is rejected even if
   * all iterations write the same value.
   *
   * @param loopVariable name of the variable the loop is parallelised
   *      over
   * @param info accesses to one variable
   */
  public boolean isArrayParallelisable(String loopVariable,
                                       SingleVariableAccessInfo info) {
    clearMessages();
    return checkArray(loopVariable, info);
  }

  private boolean checkArray(String loopVariable,
                             SingleVariableAccessInfo info) {
    if (info.isReadOnly()) {
      return true;
    }
    Signature loopSig = new Signature(loopVariable);
    int[] found = null;
    List<Expression> loopIndices = new ArrayList<Expression>();
    for (AccessInfo access: info.getAllAccesses()) {
      List<List<Expression>> indices = access.getIndices();
      for (int component = 0; component < indices.size(); component++) {
        List<Expression> dims = indices.get(component);
        for (int dim = 0; dim < dims.size(); dim++) {
          Expression index = dims.get(dim);
          if (!new VariablesAccessInfo(index).has(loopSig)) {
            continue;
          }
          if (found != null && (found[0] != component || found[1] != dim)) {
            addMessage(Severity.WARNING, "Variable '" + info.getVarName() +
                "' is using loop variable '" + loopVariable +
                "' in index '" + indexPair(found[0], found[1]) +
                "' and '" + indexPair(component, dim) + "'.");
            return false;
          }
          found = new int[] {component, dim};
          loopIndices.add(index);
        }
      }
    }

    if (loopIndices.isEmpty()) {
      addMessage(Severity.WARNING, "Variable '" + info.getVarName() +
          "' is written to, and does not depend on the loop variable '" +
          loopVariable + "'.");
      return false;
    }

    Expression first = loopIndices.get(0);
    for (Expression index: loopIndices.subList(1, loopIndices.size())) {
      if (!maths.equal(first, index)) {
        addMessage(Severity.WARNING, "Variable " + info.getVarName() +
            " is written and is accessed using indices " + fortran(first) +
            " and " + fortran(index) +
            " and can therefore not be parallelised.");
        return false;
      }
    }
    return true;
  }

  private static String indexPair(int component, int dim) {
    return "(" + component + ", " + dim + ")";
  }

  private static String fortran(Expression e) {
    try {
      return new FortranWriter().emit(e);
    } catch (VisitorError ex) {
      return e.describe();
    }
  }

  /**
   * A scalar is safe if it is only read, or if it is written before it
   * is read.  Being read first indicates a reduction, which isn't
   * supported.
   */
  public boolean isScalarParallelisable(SingleVariableAccessInfo info) {
    clearMessages();
    return checkScalar(info);
  }

  private boolean checkScalar(SingleVariableAccessInfo info) {
    if (info.isReadOnly()) {
      return true;
    }
    if (info.size() == 1) {
      addMessage(Severity.WARNING, "Scalar variable '" + info.getVarName() +
                 "' is only written once.");
      return false;
    }
    if (info.get(0).getAccessType() == AccessType.WRITE) {
      return true;
    }
    addMessage(Severity.WARNING, "Variable '" + info.getVarName() +
               "' is read first, which indicates a reduction.");
    return false;
  }

  /**
   * Decide whether a variable is an array.  Accesses with indices
   * decide first.  Whole array accesses like a = b + 1 have no indices,
   * so the declaration is used if there is no indexed access.
   *
   * @param varName
   * @param info accesses to the variable, may be null
   * @param table table to look up the declaration, may be null
   * @param loopVariable if not null, an access only counts as an
   *      array access if one of its indices uses this variable
   * @return false if neither source says it's an array
   * @throws IllegalArgumentException if loopVariable is given without
   *      access information
   */
  public static boolean isVariableArray(String varName,
        SingleVariableAccessInfo info, SymbolTable table,
        String loopVariable) {
    if (loopVariable != null && info == null) {
      throw new IllegalArgumentException("isVariableArray: loop variable '"
          + loopVariable + "' specified, but no access information.");
    }
    if (info != null && info.isArray()) {
      if (loopVariable == null) {
        return true;
      }
      Signature loopSig = new Signature(loopVariable);
      for (AccessInfo access: info.getAllAccesses()) {
        for (List<Expression> dims: access.getIndices()) {
          for (Expression index: dims) {
            if (new VariablesAccessInfo(index).has(loopSig)) {
              return true;
            }
          }
        }
      }
      return false;
    }
    if (table == null) {
      return false;
    }
    Symbol sym = table.find(varName);
    return sym instanceof DataSymbol && ((DataSymbol)sym).isArray();
  }

  public static boolean isVariableArray(String varName,
        SingleVariableAccessInfo info, SymbolTable table) {
    return isVariableArray(varName, info, table, null);
  }

  public boolean canLoopBeParallelised(Loop loop) {
    return canLoopBeParallelised(loop, new ParallelCheckOptions());
  }

  /**
   * Check whether a loop can be run in parallel over the loop variable.
   * Variables of the loop and of the loops nested inside it are skipped.
   */
  public boolean canLoopBeParallelised(Loop loop,
                                       ParallelCheckOptions options) {
    clearMessages();
    String loopVariable = options.getLoopVariable();
    if (loopVariable == null) {
      loopVariable = loop.getVariable().getName();
    }

    if (!isLoopSuitableForParallel(loop, options.isOnlyNestedLoops())) {
      return false;
    }

    VariablesAccessInfo accesses = options.getAccesses();
    if (accesses == null) {
      accesses = new VariablesAccessInfo(loop);
    }

    Set<Signature> loopVars = new HashSet<Signature>();
    for (Loop l: loop.walk(Loop.class)) {
      loopVars.add(new Signature(l.getVariable().getName()));
    }
    SymbolTable table = loop.scope();

    boolean result = true;
    for (Signature signature: accesses.getAllSignatures()) {
      if (loopVars.contains(signature) ||
          options.getSignaturesToIgnore().contains(signature)) {
        continue;
      }
      SingleVariableAccessInfo info = accesses.get(signature);
      boolean parallelisable;
      if (isVariableArray(signature.getVarName(), info, table)) {
        parallelisable = checkArray(loopVariable, info);
      } else {
        parallelisable = checkScalar(info);
      }
      if (!parallelisable) {
        if (!options.isTestAllVariables()) {
          return false;
        }
        result = false;
      }
    }
    return result;
  }

  /**
   * @return signatures of variables whose first access is not a write,
   *    in order of first access
   */
  public List<String> getInputParameters(List<? extends Node> nodes) {
    return getInputParameters(new VariablesAccessInfo(nodes));
  }

  public List<String> getInputParameters(VariablesAccessInfo accesses) {
    clearMessages();
    List<String> inputs = new ArrayList<String>();
    for (Signature signature: accesses.getAllSignatures()) {
      AccessInfo first = accesses.get(signature).get(0);
      if (first.getAccessType() != AccessType.WRITE) {
        inputs.add(signature.toString());
      }
    }
    return inputs;
  }

  /**
   * @return signatures of variables that may be written, in order of
   *    first access
   */
  public List<String> getOutputParameters(List<? extends Node> nodes) {
    return getOutputParameters(new VariablesAccessInfo(nodes));
  }

  public List<String> getOutputParameters(VariablesAccessInfo accesses) {
    clearMessages();
    List<String> outputs = new ArrayList<String>();
    for (Signature signature: accesses.getAllSignatures()) {
      if (accesses.isWritten(signature)) {
        outputs.add(signature.toString());
      }
    }
    return outputs;
  }

  /**
   * Inputs and outputs from a single pass over the nodes
   */
  public InOut getInOutParameters(List<? extends Node> nodes) {
    VariablesAccessInfo accesses = new VariablesAccessInfo(nodes);
    List<String> inputs = getInputParameters(accesses);
    List<String> outputs = getOutputParameters(accesses);
    return new InOut(inputs, outputs);
  }

  public static class InOut {
    private final List<String> inputs;
    private final List<String> outputs;

    public InOut(List<String> inputs, List<String> outputs) {
      this.inputs = Collections.unmodifiableList(inputs);
      this.outputs = Collections.unmodifiableList(outputs);
    }

    public List<String> getInputs() {
      return inputs;
    }

    public List<String> getOutputs() {
      return outputs;
    }

    @Override
    public String toString() {
      return "inputs: " + inputs + " outputs: " + outputs;
    }
  }
}
