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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;

public class Loops {

  /**
   * Counted do loop.  Children are [start, stop, step, body].
   */
  public static class Loop extends Statement {
    public static final int START = 0;
    public static final int STOP = 1;
    public static final int STEP = 2;
    public static final int BODY = 3;

    private DataSymbol variable;

    /** Domain tag, e.g. "lat", used by parallelisation policy */
    private String loopType;

    public Loop(DataSymbol variable, String loopType) {
      assert(variable != null);
      this.variable = variable;
      this.loopType = loopType == null ? "" : loopType;
    }

    public static Loop create(DataSymbol variable, Expression start,
          Expression stop, Expression step, List<? extends Statement> body) {
      return create(variable, start, stop, step, body, "");
    }

    public static Loop create(DataSymbol variable, Expression start,
          Expression stop, Expression step, List<? extends Statement> body,
          String loopType) {
      Loop loop = new Loop(variable, loopType);
      loop.fill(start, stop, step, body);
      return loop;
    }

    protected void fill(Expression start, Expression stop, Expression step,
                        List<? extends Statement> body) {
      addChild(start);
      addChild(stop);
      addChild(step);
      addChild(Schedule.create(body));
    }

    public DataSymbol getVariable() {
      return variable;
    }

    public void setVariable(DataSymbol variable) {
      assert(variable != null);
      this.variable = variable;
    }

    public String getLoopType() {
      return loopType;
    }

    public void setLoopType(String loopType) {
      this.loopType = loopType;
    }

    public Expression getStart() {
      return (Expression)getChild(START);
    }

    public Expression getStop() {
      return (Expression)getChild(STOP);
    }

    public Expression getStep() {
      return (Expression)getChild(STEP);
    }

    public Schedule getBody() {
      return (Schedule)getChild(BODY);
    }

    public void setStart(Expression start) {
      getStart().replaceWith(start);
    }

    public void setStop(Expression stop) {
      getStop().replaceWith(stop);
    }

    public void setStep(Expression step) {
      getStep().replaceWith(step);
    }

    /**
     * @return the loop if the body is exactly one loop, otherwise null
     */
    public Loop getSingleNestedLoop() {
      List<Node> stmts = getBody().children();
      if (stmts.size() == 1 && stmts.get(0) instanceof Loop) {
        return (Loop)stmts.get(0);
      }
      return null;
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
      getStart().referenceAccesses(info);
      getStop().referenceAccesses(info);
      getStep().referenceAccesses(info);
      Signature var = new Signature(variable.getName());
      info.addAccess(var, AccessType.WRITE, this);
      info.addAccess(var, AccessType.READ, this);
      info.nextLocation();
      getBody().referenceAccesses(info);
    }

    @Override
    public List<Symbol> referencedSymbols() {
      return Collections.<Symbol>singletonList(variable);
    }

    @Override
    public void rebindSymbols(Map<Symbol, Symbol> remap) {
      Symbol newSym = remap.get(variable);
      if (newSym != null) {
        variable = (DataSymbol)newSym;
      }
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LOOP;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitLoop(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      switch (position) {
        case START:
        case STOP:
        case STEP:
          return child instanceof Expression;
        case BODY:
          return Schedule.isBody(child);
        default:
          return false;
      }
    }

    @Override
    protected int minChildren() {
      return 4;
    }

    @Override
    protected int maxChildren() {
      return 4;
    }

    @Override
    protected String childrenFormat() {
      return "Expression, Expression, Expression, Schedule";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Loop(variable, loopType);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      Loop o = (Loop)other;
      return variable.nameMatches(o.variable.getName()) &&
             loopType.equals(o.loopType);
    }

    @Override
    public String describe() {
      return "Loop[variable:'" + variable.getName() + "', type:'" +
             loopType + "']";
    }
  }

  /**
   * Loop over one dimension of a grid, with the information needed to
   * compute its bounds from the grid properties
   */
  public static class GridLoop extends Loop {
    /** e.g. go_cu, go_every */
    private final String fieldSpace;
    /** e.g. go_all_pts, go_internal_pts */
    private final String iterationSpace;
    /** e.g. go_offset_ne */
    private final String indexOffset;

    public GridLoop(DataSymbol variable, String loopType, String fieldSpace,
                    String iterationSpace, String indexOffset) {
      super(variable, loopType);
      this.fieldSpace = fieldSpace;
      this.iterationSpace = iterationSpace;
      this.indexOffset = indexOffset;
    }

    public static GridLoop create(DataSymbol variable, String loopType,
          String fieldSpace, String iterationSpace, String indexOffset,
          Expression start, Expression stop, Expression step,
          List<? extends Statement> body) {
      GridLoop loop = new GridLoop(variable, loopType, fieldSpace,
                                   iterationSpace, indexOffset);
      loop.fill(start, stop, step, body);
      return loop;
    }

    public String getFieldSpace() {
      return fieldSpace;
    }

    public String getIterationSpace() {
      return iterationSpace;
    }

    public String getIndexOffset() {
      return indexOffset;
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new GridLoop(getVariable(), getLoopType(), fieldSpace,
                          iterationSpace, indexOffset);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      GridLoop o = (GridLoop)other;
      return super.sameAttributes(other) &&
             fieldSpace.equals(o.fieldSpace) &&
             iterationSpace.equals(o.iterationSpace) &&
             indexOffset.equals(o.indexOffset);
    }

    @Override
    public String describe() {
      return "GridLoop[variable:'" + getVariable().getName() + "', type:'" +
             getLoopType() + "', field_space:'" + fieldSpace + "', it_space:'"
             + iterationSpace + "']";
    }
  }
}
