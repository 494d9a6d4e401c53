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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.symbols.ContainerSymbol;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Extent;
import exm.skc.ir.symbols.DataType.ExtentKind;
import exm.skc.ir.symbols.DataType.Precision;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.DataType.StructureRef;
import exm.skc.ir.symbols.DataTypeSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.Symbol.Visibility;
import exm.skc.ir.symbols.SymbolInterface;
import exm.skc.ir.symbols.SymbolTable;
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
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

/**
 * Writes free-form Fortran.  The output can be read back by
 * {@link exm.skc.frontend.FortranReader}.
 */
public class FortranWriter extends CodeWriter {

  /** Operator precedence, higher binds tighter */
  private static final int PREC_OR = 1;
  private static final int PREC_AND = 2;
  private static final int PREC_NOT = 3;
  private static final int PREC_COMPARE = 4;
  private static final int PREC_ADD = 5;
  private static final int PREC_MUL = 6;
  private static final int PREC_POW = 7;
  private static final int PREC_ATOM = 10;

  public FortranWriter() {
    super();
  }

  public FortranWriter(boolean skipNodes, String indentString,
                       int initialDepth) {
    super(skipNodes, indentString, initialDepth);
  }

  @Override
  public String getName() {
    return "FortranWriter";
  }

  /* ---- program units ---- */

  @Override
  public String visitContainer(Container node) throws VisitorError {
    if (node.isFile()) {
      return emitChildren(node);
    }
    StringBuilder sb = new StringBuilder();
    sb.append(indent()).append("module ").append(node.getName()).append("\n");
    increaseDepth();
    sb.append(genDeclarations(node.getSymbolTable(), true));
    decreaseDepth();
    if (node.numChildren() > 0) {
      sb.append("\n");
      sb.append(indent()).append("contains\n");
      increaseDepth();
      sb.append(emitChildren(node));
      decreaseDepth();
      sb.append("\n");
    }
    sb.append(indent()).append("end module ").append(node.getName());
    sb.append("\n");
    return sb.toString();
  }

  @Override
  public String visitRoutine(Routine node) throws VisitorError {
    StringBuilder sb = new StringBuilder();
    String unit = node.isProgram() ? "program" : "subroutine";
    sb.append(indent()).append(unit).append(" ").append(node.getName());
    if (!node.isProgram()) {
      List<String> args = new ArrayList<String>();
      for (DataSymbol arg: node.getSymbolTable().getArgumentList()) {
        args.add(arg.getName());
      }
      sb.append("(").append(StringUtils.join(args, ", ")).append(")");
    }
    sb.append("\n");
    increaseDepth();
    sb.append(genDeclarations(node.getSymbolTable(), false));
    sb.append("\n");
    sb.append(emitChildren(node));
    decreaseDepth();
    sb.append("\n");
    sb.append(indent()).append("end ").append(unit).append(" ");
    sb.append(node.getName()).append("\n");
    return sb.toString();
  }

  /**
   * use statements, then type definitions, then parameters, then the
   * other variables.  Imported and unresolved symbols are not declared.
   */
  private String genDeclarations(SymbolTable table, boolean isModule)
                                                    throws VisitorError {
    StringBuilder sb = new StringBuilder();
    for (ContainerSymbol c: table.getContainerSymbols()) {
      sb.append(genUse(table, c));
    }
    if (isModule) {
      sb.append(indent()).append("implicit none\n");
    }
    for (DataTypeSymbol t: table.getDataTypeSymbols()) {
      if (t.isLocal()) {
        sb.append(indent()).append("type :: ").append(t.getName())
          .append("\n");
        sb.append(indent()).append("end type ").append(t.getName())
          .append("\n");
      }
    }
    List<DataSymbol> params = new ArrayList<DataSymbol>();
    List<DataSymbol> others = new ArrayList<DataSymbol>();
    for (DataSymbol d: table.getDataSymbols()) {
      if (d.isImport() || d.isUnresolved()) {
        continue;
      }
      if (d.isConstant()) {
        params.add(d);
      } else {
        others.add(d);
      }
    }
    for (DataSymbol d: params) {
      sb.append(genVarDecl(d, isModule));
    }
    for (DataSymbol d: others) {
      sb.append(genVarDecl(d, isModule));
    }
    return sb.toString();
  }

  private String genUse(SymbolTable table, ContainerSymbol c) {
    List<String> names = new ArrayList<String>();
    for (Symbol s: table.getImports(c)) {
      names.add(s.getName());
    }
    StringBuilder sb = new StringBuilder();
    if (c.hasWildcardImport()) {
      sb.append(indent()).append("use ").append(c.getName()).append("\n");
    }
    if (!names.isEmpty() || !c.hasWildcardImport()) {
      sb.append(indent()).append("use ").append(c.getName())
        .append(", only: ").append(StringUtils.join(names, ", "))
        .append("\n");
    }
    return sb.toString();
  }

  /**
   * @return declaration line for a variable, e.g.
   *   "real, dimension(:,:), intent(inout) :: a"
   */
  public String genVarDecl(DataSymbol sym, boolean inModule)
                                                    throws VisitorError {
    StringBuilder sb = new StringBuilder();
    sb.append(indent());
    DataType type = sym.getDatatype();
    DataType baseType = type;
    if (type instanceof ArrayType) {
      baseType = ((ArrayType)type).getElementType();
    }
    sb.append(genTypeName(sym, baseType));
    if (type instanceof ArrayType) {
      List<String> dims = new ArrayList<String>();
      boolean allocatable = false;
      for (Extent e: ((ArrayType)type).getShape()) {
        dims.add(genExtent(e));
        if (e.getKind() == ExtentKind.DEFERRED) {
          allocatable = true;
        }
      }
      if (allocatable) {
        sb.append(", allocatable");
      }
      sb.append(", dimension(").append(StringUtils.join(dims, ",")).append(")");
    }
    if (sym.isArgument()) {
      AccessType access = ((SymbolInterface.Argument)sym.getInterface())
                                                          .getAccess();
      switch (access) {
        case READ:
          sb.append(", intent(in)");
          break;
        case WRITE:
          sb.append(", intent(out)");
          break;
        case READWRITE:
          sb.append(", intent(inout)");
          break;
        default:
          break;
      }
    }
    if (sym.isConstant()) {
      sb.append(", parameter");
    }
    if (inModule && sym.getVisibility() == Visibility.PRIVATE) {
      sb.append(", private");
    }
    sb.append(" :: ").append(sym.getName());
    if (sym.isConstant()) {
      sb.append(" = ").append(sym.getConstantValue().accept(this));
    }
    sb.append("\n");
    return sb.toString();
  }

  private String genTypeName(DataSymbol sym, DataType type)
                                                    throws VisitorError {
    if (type instanceof StructureRef) {
      return "type(" + ((StructureRef)type).getTypeName() + ")";
    } else if (!(type instanceof ScalarType)) {
      throw new VisitorError("Can't declare '" + sym.getName() +
                             "' with type " + type);
    }
    ScalarType st = (ScalarType)type;
    String name;
    switch (st.getIntrinsic()) {
      case INTEGER:
        name = "integer";
        break;
      case REAL:
        if (st.getPrecision() == Precision.DOUBLE) {
          return "double precision";
        }
        name = "real";
        break;
      case BOOLEAN:
        name = "logical";
        break;
      case CHARACTER:
        name = "character";
        break;
      default:
        throw new VisitorError("Unknown intrinsic " + st.getIntrinsic());
    }
    if (st.getKind() != null) {
      name += "(kind=" + st.getKind() + ")";
    } else if (st.getKindSymbol() != null) {
      name += "(kind=" + st.getKindSymbol().getName() + ")";
    }
    return name;
  }

  private String genExtent(Extent e) throws VisitorError {
    if (e.getKind() != ExtentKind.BOUNDS) {
      return ":";
    }
    Expression lower = e.getLower();
    String upper = e.getUpper().accept(this);
    if (lower instanceof Literal && ((Literal)lower).getValue().equals("1")) {
      return upper;
    }
    return lower.accept(this) + ":" + upper;
  }

  /* ---- statements ---- */

  @Override
  public String visitSchedule(Schedule node) throws VisitorError {
    return emitChildren(node);
  }

  @Override
  public String visitAssignment(Assignment node) throws VisitorError {
    return indent() + node.getLhs().accept(this) + " = " +
           node.getRhs().accept(this) + "\n";
  }

  @Override
  public String visitLoop(Loop node) throws VisitorError {
    StringBuilder sb = new StringBuilder();
    sb.append(indent()).append("do ").append(node.getVariable().getName())
      .append(" = ").append(node.getStart().accept(this))
      .append(", ").append(node.getStop().accept(this))
      .append(", ").append(node.getStep().accept(this)).append("\n");
    increaseDepth();
    sb.append(node.getBody().accept(this));
    decreaseDepth();
    sb.append(indent()).append("enddo\n");
    return sb.toString();
  }

  @Override
  public String visitIfBlock(IfBlock node) throws VisitorError {
    StringBuilder sb = new StringBuilder();
    sb.append(indent()).append("if (")
      .append(node.getCondition().accept(this)).append(") then\n");
    increaseDepth();
    sb.append(node.getIfBody().accept(this));
    decreaseDepth();
    if (node.hasElse()) {
      sb.append(indent()).append("else\n");
      increaseDepth();
      sb.append(node.getElseBody().accept(this));
      decreaseDepth();
    }
    sb.append(indent()).append("end if\n");
    return sb.toString();
  }

  @Override
  public String visitCall(Call node) throws VisitorError {
    return indent() + "call " + node.getRoutine().getName() + "(" +
           joinArgs(node.getArguments()) + ")\n";
  }

  @Override
  public String visitCodeBlock(CodeBlock node) throws VisitorError {
    StringBuilder sb = new StringBuilder();
    for (String line: node.getLines()) {
      sb.append(indent()).append(line.trim()).append("\n");
    }
    return sb.toString();
  }

  @Override
  public String visitRegionDirective(RegionDirective node)
                                                    throws VisitorError {
    StringBuilder sb = new StringBuilder();
    sb.append(indent()).append("!$").append(node.beginText()).append("\n");
    sb.append(node.getBody().accept(this));
    if (node.endText() != null) {
      sb.append(indent()).append("!$").append(node.endText()).append("\n");
    }
    return sb.toString();
  }

  @Override
  public String visitStandaloneDirective(StandaloneDirective node)
                                                    throws VisitorError {
    return indent() + "!$" + node.text() + "\n";
  }

  /**
   * Calls into the PSyData object around the region: declare and
   * provide the inputs, run the region, then provide the outputs.
   */
  @Override
  public String visitExtractNode(ExtractNode node) throws VisitorError {
    String obj = node.getDataSymbol().getName();
    List<String> inputs = node.getInputs();
    List<String> outputs = node.getOutputs();
    String postfix = node.getPostfix();
    StringBuilder sb = new StringBuilder();
    sb.append(psyDataCall(obj, "PreStart", "\"" + node.getModuleName() +
        "\", \"" + node.getRegionName() + "\", " + inputs.size() + ", " +
        outputs.size()));
    for (String in: inputs) {
      sb.append(psyDataCall(obj, "PreDeclareVariable",
                            "\"" + in + "\", " + in));
    }
    for (String out: outputs) {
      sb.append(psyDataCall(obj, "PreDeclareVariable",
                            "\"" + out + postfix + "\", " + out));
    }
    sb.append(psyDataCall(obj, "PreEndDeclaration", null));
    for (String in: inputs) {
      sb.append(psyDataCall(obj, "ProvideVariable", "\"" + in + "\", " + in));
    }
    sb.append(psyDataCall(obj, "PreEnd", null));
    sb.append(node.getBody().accept(this));
    sb.append(psyDataCall(obj, "PostStart", null));
    for (String out: outputs) {
      sb.append(psyDataCall(obj, "ProvideVariable",
                            "\"" + out + postfix + "\", " + out));
    }
    sb.append(psyDataCall(obj, "PostEnd", null));
    return sb.toString();
  }

  private String psyDataCall(String obj, String method, String args) {
    String call = indent() + "CALL " + obj + "%" + method;
    if (args != null) {
      call += "(" + args + ")";
    }
    return call + "\n";
  }

  /* ---- expressions ---- */

  @Override
  public String visitLiteral(Literal node) throws VisitorError {
    ScalarType type = node.getDatatype();
    String value;
    switch (type.getIntrinsic()) {
      case BOOLEAN:
        value = "." + node.getValue() + ".";
        break;
      case CHARACTER:
        return "'" + node.getValue().replace("'", "''") + "'";
      default:
        value = node.getValue();
    }
    if (type.getKind() != null) {
      value += "_" + type.getKind();
    } else if (type.getKindSymbol() != null) {
      value += "_" + type.getKindSymbol().getName();
    }
    return value;
  }

  @Override
  public String visitReference(Reference node) throws VisitorError {
    return node.getName();
  }

  @Override
  public String visitArrayReference(ArrayReference node)
                                                    throws VisitorError {
    return node.getName() + "(" + joinArgs(node.getIndices()) + ")";
  }

  @Override
  public String visitStructureReference(StructureReference node)
                                                    throws VisitorError {
    String result = node.getName();
    if (!node.getIndices().isEmpty()) {
      result += "(" + joinArgs(node.getIndices()) + ")";
    }
    return result + "%" + node.getMember().accept(this);
  }

  @Override
  public String visitMember(Member node) throws VisitorError {
    String result = node.getName();
    if (node.isArray()) {
      result += "(" + joinArgs(node.getIndices()) + ")";
    }
    if (node.getInner() != null) {
      result += "%" + node.getInner().accept(this);
    }
    return result;
  }

  @Override
  public String visitUnaryOperation(UnaryOperation node)
                                                    throws VisitorError {
    Expression operand = node.getOperand();
    switch (node.getOperator()) {
      case MINUS:
        return "-" + wrap(operand, precedence(operand) <= PREC_ADD);
      case PLUS:
        return "+" + wrap(operand, precedence(operand) <= PREC_ADD);
      case NOT:
        return ".not. " + wrap(operand, precedence(operand) < PREC_NOT);
      default:
        return node.getOperator().toString() + "(" +
               operand.accept(this) + ")";
    }
  }

  @Override
  public String visitBinaryOperation(BinaryOperation node)
                                                    throws VisitorError {
    String op = binaryOperatorText(node.getOperator());
    if (op == null) {
      // Intrinsic function
      List<Expression> args = new ArrayList<Expression>();
      args.add(node.getLhs());
      args.add(node.getRhs());
      return node.getOperator().toString() + "(" + joinArgs(args) + ")";
    }
    int prec = precedence(node);
    int lhsPrec = precedence(node.getLhs());
    int rhsPrec = precedence(node.getRhs());
    boolean rightAssoc = node.getOperator() == BinaryOperation.Operator.POW;
    boolean lhsParens = rightAssoc ? lhsPrec <= prec : lhsPrec < prec;
    boolean rhsParens = rightAssoc ? rhsPrec < prec : rhsPrec <= prec;
    return wrap(node.getLhs(), lhsParens) + " " + op + " " +
           wrap(node.getRhs(), rhsParens);
  }

  @Override
  public String visitNaryOperation(NaryOperation node) throws VisitorError {
    return node.getOperator().toString() + "(" +
           joinArgs(node.getOperands()) + ")";
  }

  private String wrap(Expression e, boolean parens) throws VisitorError {
    String text = e.accept(this);
    return parens ? "(" + text + ")" : text;
  }

  private String joinArgs(List<Expression> args) throws VisitorError {
    List<String> parts = new ArrayList<String>();
    for (Expression e: args) {
      parts.add(e.accept(this));
    }
    return StringUtils.join(parts, ", ");
  }

  /**
   * @return Fortran operator, or null if written as a function
   */
  private static String binaryOperatorText(BinaryOperation.Operator op) {
    switch (op) {
      case ADD: return "+";
      case SUB: return "-";
      case MUL: return "*";
      case DIV: return "/";
      case POW: return "**";
      case EQ: return "==";
      case NE: return "/=";
      case LT: return "<";
      case LE: return "<=";
      case GT: return ">";
      case GE: return ">=";
      case AND: return ".and.";
      case OR: return ".or.";
      default: return null;
    }
  }

  private static int precedence(Node e) {
    if (e instanceof BinaryOperation) {
      switch (((BinaryOperation)e).getOperator()) {
        case OR:
          return PREC_OR;
        case AND:
          return PREC_AND;
        case EQ:
        case NE:
        case LT:
        case LE:
        case GT:
        case GE:
          return PREC_COMPARE;
        case ADD:
        case SUB:
          return PREC_ADD;
        case MUL:
        case DIV:
          return PREC_MUL;
        case POW:
          return PREC_POW;
        default:
          return PREC_ATOM;
      }
    } else if (e instanceof UnaryOperation) {
      switch (((UnaryOperation)e).getOperator()) {
        case MINUS:
        case PLUS:
          return PREC_ADD;
        case NOT:
          return PREC_NOT;
        default:
          return PREC_ATOM;
      }
    }
    return PREC_ATOM;
  }
}
