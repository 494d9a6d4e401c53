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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.symbols.DataSymbol;
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
 * Writes a routine made of triply nested loops as a Python script that
 * builds the stencil in the Dawn SIR format.
 *
 * Each outer loop becomes a vertical region; the loops must be nested
 * k (outer), j, i (inner) with the computation in the innermost body.
 * Fields and scalars used are declared once at the end, in the order
 * first seen.
 */
public class SirWriter extends CodeWriter {

  private final Map<String, Reference> fields =
                                new LinkedHashMap<String, Reference>();
  private final Map<String, Reference> scalars =
                                new LinkedHashMap<String, Reference>();

  public SirWriter() {
    super();
  }

  public SirWriter(boolean skipNodes, String indentString,
                   int initialDepth) {
    super(skipNodes, indentString, initialDepth);
  }

  @Override
  public String getName() {
    return "SirWriter";
  }

  /**
   * Stencil offsets of an array access, e.g. a(i-1,j,k) gives
   * "[-1, 0, 0]"
   */
  public static String genStencil(ArrayReference node) throws VisitorError {
    List<Expression> indices = node.getIndices();
    if (indices.size() > 3) {
      throw new VisitorError("gen_stencil expected at most 3 indices but " +
                             "found " + indices.size() + " in '" +
                             node.getName() + "'.");
    }
    String[] dims = {"0", "0", "0"};
    for (int i = 0; i < indices.size(); i++) {
      Expression index = indices.get(i);
      if (index instanceof Reference && index.numChildren() == 0) {
        dims[i] = "0";
      } else if (index instanceof BinaryOperation) {
        BinaryOperation op = (BinaryOperation)index;
        if (op.getLhs() instanceof Reference &&
            op.getRhs() instanceof Literal) {
          String value = ((Literal)op.getRhs()).getValue();
          if (op.getOperator() == BinaryOperation.Operator.SUB) {
            dims[i] = "-" + value;
          } else if (op.getOperator() == BinaryOperation.Operator.ADD) {
            dims[i] = value;
          } else {
            throw new VisitorError("gen_stencil unsupported stencil " +
                "operator found '" + op.getOperator() + "'. Expecting '+' " +
                "or '-'.");
          }
        } else {
          throw new VisitorError("gen_stencil unsupported stencil index " +
                                 "found '" + index + "'.");
        }
      } else {
        throw new VisitorError("gen_stencil unsupported (non-stencil) " +
                               "index found '" + index + "'.");
      }
    }
    return "[" + StringUtils.join(dims, ", ") + "]";
  }

  @Override
  public String visitContainer(Container node) throws VisitorError {
    if (node.isFile()) {
      return emitChildren(node);
    }
    return unsupported(node);
  }

  @Override
  public String visitRoutine(Routine node) throws VisitorError {
    fields.clear();
    scalars.clear();

    StringBuilder sb = new StringBuilder();
    sb.append("# SKC autogenerated SIR Python\n\n");
    sb.append("from dawn4py.serialization.utils import *\n");
    sb.append("from dawn4py.serialization.AST import Interval, " +
              "VerticalRegion, BuiltinType\n");
    sb.append("from dawn4py.serialization import AST\n");
    sb.append("import dawn4py\n\n");
    sb.append("vertical_region_fns = []\n");
    sb.append("stencil_name = \"skc\"\n");
    sb.append(emitChildren(node));
    sb.append("\n");

    String ind = indent();
    String one = indent() + getIndentString();
    String two = one + getIndentString();
    sb.append(ind).append("sir = make_sir(stencil_name+\".cpp\", " +
              "AST.GridType.Value(\"Cartesian\"), [\n");
    sb.append(one).append("make_stencil(\n");
    sb.append(two).append("stencil_name,\n");
    sb.append(two).append("make_ast(vertical_region_fns),\n");
    sb.append(two).append("[");
    sb.append(StringUtils.join(genFieldDecls(), ", "));
    sb.append("]\n");
    sb.append(one).append(")\n");
    sb.append(ind).append("])\n");
    sb.append("# code = dawn4py.compile(sir, " +
              "backend=dawn4py.CodeGenBackend.CXXNaive)\n");
    sb.append("code = dawn4py.compile(sir, " +
              "backend=dawn4py.CodeGenBackend.CUDA)\n");
    sb.append("# code = dawn4py.compile(sir, " +
              "backend=dawn4py.CodeGenBackend.GridTools)\n");
    sb.append("print (code)");
    return sb.toString();
  }

  private List<String> genFieldDecls() throws VisitorError {
    List<String> decls = new ArrayList<String>();
    for (Map.Entry<String, Reference> e: fields.entrySet()) {
      String dims;
      switch (rank(e.getValue())) {
        case 3:
          dims = "[1, 1, 1]";
          break;
        case 2:
          dims = "[1, 1, 0]";
          break;
        case 1:
          dims = "[0, 0, 1]";
          break;
        default:
          throw new VisitorError("Unexpected number of dimensions for " +
                                 "field '" + e.getKey() + "'");
      }
      decls.add("make_field(\"" + e.getKey() +
                "\", make_field_dimensions_cartesian(" + dims + ")" +
                temporary(e.getValue().getSymbol()) + ")");
    }
    for (Map.Entry<String, Reference> e: scalars.entrySet()) {
      decls.add("make_field(\"" + e.getKey() +
                "\", make_field_dimensions_cartesian([1, 0, 0])" +
                temporary(e.getValue().getSymbol()) + ")");
    }
    return decls;
  }

  private static int rank(Reference ref) {
    Symbol sym = ref.getSymbol();
    if (sym instanceof DataSymbol && ((DataSymbol)sym).isArray()) {
      return ((DataSymbol)sym).getShape().size();
    }
    return ref.numChildren();
  }

  private static String temporary(Symbol sym) {
    return sym.isLocal() ? ", is_temporary=True" : "";
  }

  /**
   * Outermost loop of a k, j, i nest
   */
  @Override
  public String visitLoop(Loop kLoop) throws VisitorError {
    Loop jLoop = kLoop.getSingleNestedLoop();
    if (jLoop == null) {
      throw new VisitorError("Child of loop should be a single loop.");
    }
    Loop iLoop = jLoop.getSingleNestedLoop();
    if (iLoop == null) {
      throw new VisitorError("Child of child of loop should be a single " +
                             "loop.");
    }
    Schedule body = iLoop.getBody();
    if (body.isEmpty() || !body.walkList(Loop.class).isEmpty()) {
      throw new VisitorError("Child of child of child of loop should be " +
                             "computation without further loops.");
    }

    StringBuilder sb = new StringBuilder();
    String ind = indent();
    sb.append(ind).append("k_interval = ")
      .append(makeInterval(kLoop, "jpk")).append("\n");
    sb.append(ind).append("body_ast = make_ast([\n");
    increaseDepth();
    String stmts = body.accept(this);
    decreaseDepth();
    sb.append(StringUtils.stripEnd(stmts, ",\n")).append("\n");
    sb.append(ind).append("])\n");
    sb.append(ind).append("vertical_region_fns.append(" +
        "make_vertical_region_decl_stmt(body_ast, k_interval, " +
        "VerticalRegion.Forward, IRange=").append(makeInterval(iLoop, "jpi"))
      .append(", JRange=").append(makeInterval(jLoop, "jpj")).append("))\n");
    return sb.toString();
  }

  /**
   * Loop bounds relative to the start or the end of the dimension,
   * where upperBoundName is the size of the dimension
   */
  private static String makeInterval(Loop loop, String upperBoundName)
                                                      throws VisitorError {
    String lowerStr, upperStr;
    int lowerOffset, upperOffset;
    Expression start = loop.getStart();
    if (start instanceof Literal) {
      lowerStr = "Interval.Start";
      lowerOffset = boundValue((Literal)start) - 1;
    } else {
      lowerStr = "Interval.End";
      lowerOffset = boundNameOffset(start, upperBoundName);
    }
    Expression stop = loop.getStop();
    if (stop instanceof Literal) {
      upperStr = Integer.toString(boundValue((Literal)stop));
      upperOffset = 0;
    } else {
      upperStr = "Interval.End";
      upperOffset = boundNameOffset(stop, upperBoundName);
    }
    return "make_interval(" + lowerStr + ", " + upperStr + ", " +
           lowerOffset + ", " + upperOffset + ")";
  }

  private static int boundValue(Literal lit) throws VisitorError {
    try {
      return Integer.parseInt(lit.getValue());
    } catch (NumberFormatException e) {
      throw new VisitorError("Loop bound '" + lit.getValue() +
                             "' is not an integer");
    }
  }

  /**
   * @return offset of expr from name, for expr of the form
   *         name or name - literal
   */
  private static int boundNameOffset(Expression expr, String name)
                                                      throws VisitorError {
    if (expr instanceof Reference && expr.numChildren() == 0 &&
        ((Reference)expr).getName().equalsIgnoreCase(name)) {
      return 0;
    }
    if (expr instanceof BinaryOperation) {
      BinaryOperation op = (BinaryOperation)expr;
      if (op.getLhs() instanceof Reference &&
          ((Reference)op.getLhs()).getName().equalsIgnoreCase(name)) {
        if (op.getOperator() == BinaryOperation.Operator.SUB &&
            op.getRhs() instanceof Literal) {
          return -boundValue((Literal)op.getRhs());
        }
        throw new VisitorError("Unsupported operator '" + op.getOperator() +
            "' in loop bound, expected '" + name + " - <literal>'");
      }
    }
    throw new VisitorError("Unsupported loop bound '" + expr +
        "', expected a literal, '" + name + "' or '" + name +
        " - <literal>'");
  }

  @Override
  public String visitSchedule(Schedule node) throws VisitorError {
    return emitChildren(node);
  }

  @Override
  public String visitAssignment(Assignment node) throws VisitorError {
    String ind = indent();
    increaseDepth();
    String lhs = node.getLhs().accept(this);
    String rhs = node.getRhs().accept(this);
    decreaseDepth();
    return ind + "make_assignment_stmt(\n" + lhs + ",\n" + rhs + ",\n" +
           ind + getIndentString() + "\"=\"),\n";
  }

  @Override
  public String visitIfBlock(IfBlock node) throws VisitorError {
    String cond = node.getCondition().accept(this).trim();
    String thenStmts = StringUtils.stripEnd(
                          node.getIfBody().accept(this).trim(), ",\n");
    String elsePart = "None";
    if (node.hasElse()) {
      elsePart = "make_block_stmt([" + StringUtils.stripEnd(
          node.getElseBody().accept(this).trim(), ",\n") + "])";
    }
    return indent() + "make_if_stmt(make_expr_stmt(" + cond + "), " +
           "make_block_stmt([" + thenStmts + "]), " + elsePart + "),\n";
  }

  @Override
  public String visitBinaryOperation(BinaryOperation node)
                                                    throws VisitorError {
    String op = sirOperator(node.getOperator());
    if (op == null) {
      throw new VisitorError("Unsupported operator '" + node.getOperator() +
                             "' found in " + getName() + ".");
    }
    String ind = indent();
    increaseDepth();
    String lhs = node.getLhs().accept(this);
    String rhs = node.getRhs().accept(this);
    decreaseDepth();
    return ind + "make_binary_operator(\n" + lhs + ",\n" +
           ind + getIndentString() + "\"" + op + "\",\n" + rhs + "\n" +
           ind + getIndentString() + ")";
  }

  private static String sirOperator(BinaryOperation.Operator op) {
    switch (op) {
      case ADD: return "+";
      case SUB: return "-";
      case MUL: return "*";
      case DIV: return "/";
      case POW: return "**";
      case EQ: return "==";
      case NE: return "!=";
      case LE: return "<=";
      case LT: return "<";
      case GE: return ">=";
      case GT: return ">";
      case AND: return "&&";
      case OR: return "||";
      default: return null;
    }
  }

  /**
   * Only negation is supported.  Negated literals are folded, anything
   * else is multiplied by -1.0.
   */
  @Override
  public String visitUnaryOperation(UnaryOperation node)
                                                    throws VisitorError {
    if (node.getOperator() != UnaryOperation.Operator.MINUS) {
      throw new VisitorError("Unsupported operator '" + node.getOperator() +
                             "' found in " + getName() + ".");
    }
    Expression operand = node.getOperand();
    if (operand instanceof Literal) {
      Literal lit = (Literal)operand;
      return indent() + "make_literal_access_expr(\"-" + lit.getValue() +
             "\", " + sirType(lit) + ")";
    }
    String ind = indent();
    increaseDepth();
    String minusOne = indent() +
                "make_literal_access_expr(\"-1.0\", BuiltinType.Float)";
    String times = indent() + "\"*\"";
    String rhs = operand.accept(this);
    decreaseDepth();
    return ind + "make_binary_operator(\n" + minusOne + ",\n" + times +
           ",\n" + rhs + ")";
  }

  @Override
  public String visitLiteral(Literal node) throws VisitorError {
    return indent() + "make_literal_access_expr(\"" + node.getValue() +
           "\", " + sirType(node) + ")";
  }

  private static String sirType(Literal lit) throws VisitorError {
    switch (lit.getDatatype().getIntrinsic()) {
      case REAL:
        return "BuiltinType.Float";
      case INTEGER:
        return "BuiltinType.Integer";
      default:
        throw new VisitorError("Type '" + lit.getDatatype() +
                               "' has no representation in the SIR backend.");
    }
  }

  @Override
  public String visitReference(Reference node) throws VisitorError {
    if (!scalars.containsKey(node.getName())) {
      scalars.put(node.getName(), node);
    }
    return indent() + "make_field_access_expr(\"" + node.getName() + "\")";
  }

  @Override
  public String visitArrayReference(ArrayReference node)
                                                    throws VisitorError {
    String stencil = genStencil(node);
    if (!fields.containsKey(node.getName())) {
      fields.put(node.getName(), node);
    }
    return indent() + "make_field_access_expr(\"" + node.getName() +
           "\", " + stencil + ")";
  }

  @Override
  public String visitStructureReference(StructureReference node)
                                                    throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitMember(Member node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitNaryOperation(NaryOperation node) throws VisitorError {
    return unsupported(node);
  }

  @Override
  public String visitCall(Call node) throws VisitorError {
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
}
