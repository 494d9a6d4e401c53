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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;

public class Statements {

  /**
   * lhs = rhs
   */
  public static class Assignment extends Statement {

    public Assignment() {
    }

    public static Assignment create(Reference lhs, Expression rhs) {
      Assignment a = new Assignment();
      a.addChild(lhs);
      a.addChild(rhs);
      return a;
    }

    public Reference getLhs() {
      return (Reference)getChild(0);
    }

    public Expression getRhs() {
      return (Expression)getChild(1);
    }

    /**
     * @return true if the lhs is an array element or section
     */
    public boolean isArrayAssignment() {
      return hasIndices(getLhs());
    }

    private static boolean hasIndices(Reference ref) {
      List<List<Expression>> indices = new ArrayList<List<Expression>>();
      ref.getSignatureAndIndices(indices);
      for (List<Expression> component: indices) {
        if (!component.isEmpty()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
      // The rhs is evaluated before the lhs is written
      getRhs().referenceAccesses(info);
      getLhs().referenceAccesses(info, AccessType.WRITE);
      info.nextLocation();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGNMENT;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitAssignment(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      switch (position) {
        case 0:
          return child instanceof Reference;
        case 1:
          return child instanceof Expression;
        default:
          return false;
      }
    }

    @Override
    protected int minChildren() {
      return 2;
    }

    @Override
    protected int maxChildren() {
      return 2;
    }

    @Override
    protected String childrenFormat() {
      return "Reference, Expression";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Assignment();
    }
  }

  /**
   * Call to a subroutine.  Children are the arguments.
   */
  public static class Call extends Statement {
    private RoutineSymbol routine;

    public Call(RoutineSymbol routine) {
      assert(routine != null);
      this.routine = routine;
    }

    public static Call create(RoutineSymbol routine,
                              List<? extends Expression> args) {
      Call c = new Call(routine);
      for (Expression arg: args) {
        c.addChild(arg);
      }
      return c;
    }

    public RoutineSymbol getRoutine() {
      return routine;
    }

    public List<Expression> getArguments() {
      List<Expression> result = new ArrayList<Expression>();
      for (Node child: children()) {
        result.add((Expression)child);
      }
      return result;
    }

    /**
     * Reference arguments are accessed as the routine declares, or
     * UNKNOWN if it doesn't.  Other arguments are only read.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
      List<Node> args = children();
      for (int i = 0; i < args.size(); i++) {
        Node arg = args.get(i);
        if (arg instanceof Reference) {
          ((Reference)arg).referenceAccesses(info,
                                    routine.getArgumentAccess(i));
        } else {
          arg.referenceAccesses(info);
        }
      }
      info.nextLocation();
    }

    @Override
    public List<Symbol> referencedSymbols() {
      return Collections.<Symbol>singletonList(routine);
    }

    @Override
    public void rebindSymbols(Map<Symbol, Symbol> remap) {
      Symbol newSym = remap.get(routine);
      if (newSym != null) {
        routine = (RoutineSymbol)newSym;
      }
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CALL;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitCall(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Expression;
    }

    @Override
    protected String childrenFormat() {
      return "[Expression]*";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Call(routine);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return routine.nameMatches(((Call)other).routine.getName());
    }

    @Override
    public String describe() {
      return "Call[name='" + routine.getName() + "']";
    }
  }

  /**
   * if (condition) then if-body [else else-body]
   */
  public static class IfBlock extends Statement {

    public IfBlock() {
    }

    public static IfBlock create(Expression condition,
                                 List<? extends Statement> ifBody) {
      return create(condition, ifBody, null);
    }

    /**
     * @param elseBody null for no else branch
     */
    public static IfBlock create(Expression condition,
                                 List<? extends Statement> ifBody,
                                 List<? extends Statement> elseBody) {
      IfBlock ifb = new IfBlock();
      ifb.addChild(condition);
      ifb.addChild(Schedule.create(ifBody));
      if (elseBody != null) {
        ifb.addChild(Schedule.create(elseBody));
      }
      return ifb;
    }

    public Expression getCondition() {
      return (Expression)getChild(0);
    }

    public Schedule getIfBody() {
      return (Schedule)getChild(1);
    }

    public boolean hasElse() {
      return numChildren() > 2;
    }

    /**
     * @return else body, or null
     */
    public Schedule getElseBody() {
      return hasElse() ? (Schedule)getChild(2) : null;
    }

    /**
     * Add an else branch to an if block without one
     */
    public Schedule addElseBody() {
      if (hasElse()) {
        throw new InvalidTreeException("If block already has an else body");
      }
      Schedule s = new Schedule();
      addChild(s);
      return s;
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
      getCondition().referenceAccesses(info);
      info.nextLocation();
      getIfBody().referenceAccesses(info);
      if (hasElse()) {
        getElseBody().referenceAccesses(info);
      }
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IF_BLOCK;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitIfBlock(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      switch (position) {
        case 0:
          return child instanceof Expression;
        case 1:
        case 2:
          return Schedule.isBody(child);
        default:
          return false;
      }
    }

    @Override
    protected int minChildren() {
      return 2;
    }

    @Override
    protected int maxChildren() {
      return 3;
    }

    @Override
    protected String childrenFormat() {
      return "Expression, Schedule [, Schedule]";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new IfBlock();
    }
  }
}
