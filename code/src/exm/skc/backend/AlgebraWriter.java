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
package exm.skc.backend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Intrinsic;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.tree.Directives.ExtractNode;
import exm.skc.ir.tree.Directives.RegionDirective;
import exm.skc.ir.tree.Directives.StandaloneDirective;
import exm.skc.ir.tree.Expressions.ArrayReference;
import exm.skc.ir.tree.Expressions.BinaryOperation;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Member;
import exm.skc.ir.tree.Expressions.NaryOperation;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.Expressions.StructureReference;
import exm.skc.ir.tree.Expressions.UnaryOperation;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

/**
 * Writes expressions in the text form read by the symbolic engine.
 *
 * Array and member indices are written in square brackets, so round
 * brackets only follow function names.  Every operation is fully
 * parenthesised.  Operators without an arithmetic meaning become
 * functions named after the operator, e.g. lt(a, b).  Division of two
 * integer expressions truncates, so it is written as idiv(a, b) rather
 * than a / b.  Names are written in lower case, after applying the
 * renames given to the constructor.
 */
public class AlgebraWriter extends CodeWriter {
  private final Map<String, String> renames;

  public AlgebraWriter() {
    this(Collections.<String, String>emptyMap());
  }

  /**
   * @param renames lower case name to the name to write instead
   */
  public AlgebraWriter(Map<String, String> renames) {
    super(false, "", 0);
    this.renames = renames;
  }

  @Override
  public String getName() {
    return "AlgebraWriter";
  }

  private String name(String n) {
    String lower = n.toLowerCase();
    String renamed = renames.get(lower);
    return renamed != null ? renamed : lower;
  }

  private String indices(List<Expression> exprs) throws VisitorError {
    if (exprs.isEmpty()) {
      return "";
    }
    List<String> parts = new ArrayList<String>();
    for (Expression e: exprs) {
      parts.add(e.accept(this));
    }
    return "[" + StringUtils.join(parts, ",") + "]";
  }

  private String function(String fn, List<Expression> args)
                                                    throws VisitorError {
    List<String> parts = new ArrayList<String>();
    for (Expression e: args) {
      parts.add(e.accept(this));
    }
    return fn + "(" + StringUtils.join(parts, ", ") + ")";
  }

  @Override
  public String visitLiteral(Literal node) throws VisitorError {
    switch (node.getDatatype().getIntrinsic()) {
      case REAL:
        return node.getValue().toLowerCase().replace('d', 'e');
      case CHARACTER:
        return unsupported(node);
      default:
        return node.getValue().toLowerCase();
    }
  }

  @Override
  public String visitReference(Reference node) throws VisitorError {
    return name(node.getName());
  }

  @Override
  public String visitArrayReference(ArrayReference node)
                                                    throws VisitorError {
    return name(node.getName()) + indices(node.getIndices());
  }

  @Override
  public String visitStructureReference(StructureReference node)
                                                    throws VisitorError {
    return name(node.getName()) + indices(node.getIndices()) + "%" +
           node.getMember().accept(this);
  }

  @Override
  public String visitMember(Member node) throws VisitorError {
    String result = name(node.getName()) + indices(node.getIndices());
    Member inner = node.getInner();
    if (inner != null) {
      result += "%" + inner.accept(this);
    }
    return result;
  }

  @Override
  public String visitUnaryOperation(UnaryOperation node)
                                                    throws VisitorError {
    String operand = node.getOperand().accept(this);
    switch (node.getOperator()) {
      case MINUS:
        return "(-" + operand + ")";
      case PLUS:
        return "(+" + operand + ")";
      default:
        return node.getOperator().toString().toLowerCase() +
               "(" + operand + ")";
    }
  }

  @Override
  public String visitBinaryOperation(BinaryOperation node)
                                                    throws VisitorError {
    String op;
    switch (node.getOperator()) {
      case ADD:
        op = "+";
        break;
      case SUB:
        op = "-";
        break;
      case MUL:
        op = "*";
        break;
      case DIV:
        if (isInteger(node.getLhs()) && isInteger(node.getRhs())) {
          return function("idiv", Arrays.asList(node.getLhs(),
                                                node.getRhs()));
        }
        op = "/";
        break;
      case POW:
        op = "**";
        break;
      default:
        List<Expression> args = new ArrayList<Expression>();
        args.add(node.getLhs());
        args.add(node.getRhs());
        return function(node.getOperator().toString().toLowerCase(), args);
    }
    return "(" + node.getLhs().accept(this) + " " + op + " " +
           node.getRhs().accept(this) + ")";
  }

  /**
   * @return true if e is known to have integer type
   */
  static boolean isInteger(Expression e) {
    if (e instanceof Literal) {
      return ((Literal)e).getDatatype().getIntrinsic() == Intrinsic.INTEGER;
    } else if (e instanceof StructureReference) {
      // Type of the member isn't known here
      return false;
    } else if (e instanceof Reference) {
      Symbol sym = ((Reference)e).getSymbol();
      if (!(sym instanceof DataSymbol)) {
        return false;
      }
      DataType type = ((DataSymbol)sym).getDatatype();
      if (type instanceof ArrayType && e instanceof ArrayReference) {
        type = ((ArrayType)type).getElementType();
      }
      return type instanceof ScalarType &&
          ((ScalarType)type).getIntrinsic() == Intrinsic.INTEGER;
    } else if (e instanceof UnaryOperation) {
      UnaryOperation u = (UnaryOperation)e;
      switch (u.getOperator()) {
        case MINUS:
        case PLUS:
          return isInteger(u.getOperand());
        case INT:
        case NINT:
        case FLOOR:
        case CEILING:
          return true;
        default:
          return false;
      }
    } else if (e instanceof BinaryOperation) {
      BinaryOperation b = (BinaryOperation)e;
      switch (b.getOperator()) {
        case ADD:
        case SUB:
        case MUL:
        case DIV:
        case MOD:
        case MAX:
        case MIN:
          return isInteger(b.getLhs()) && isInteger(b.getRhs());
        default:
          return false;
      }
    }
    return false;
  }

  @Override
  public String visitNaryOperation(NaryOperation node) throws VisitorError {
    return function(node.getOperator().toString().toLowerCase(),
                    node.getOperands());
  }

  @Override
  public String visitAssignment(Assignment node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitLoop(Loop node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitIfBlock(IfBlock node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitCall(Call node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitSchedule(Schedule node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitRegionDirective(RegionDirective node)
                                                    throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitStandaloneDirective(StandaloneDirective node)
                                                    throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitExtractNode(ExtractNode node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitCodeBlock(CodeBlock node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitRoutine(Routine node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitContainer(Container node) throws VisitorError {
    return unsupported(node);
  }
}
