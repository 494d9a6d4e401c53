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
import java.util.regex.Pattern;

import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.Intrinsic;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.tree.IRTree.Expression;

/**
 * Expression nodes
 */
public class Expressions {

  public static class Literal extends Expression {
    private static final Pattern INTEGER_VALUE = Pattern.compile("[0-9]+");
    private static final Pattern REAL_VALUE = Pattern.compile(
        "([0-9]+\\.?[0-9]*|\\.[0-9]+)([eEdD][+-]?[0-9]+)?");

    private final String value;
    private final ScalarType datatype;

    /**
     * @param value textual value, without sign or kind
     * @param datatype
     */
    public Literal(String value, ScalarType datatype) {
      this.datatype = datatype;
      this.value = checkValue(value, datatype);
    }

    public static Literal intLiteral(long value) {
      if (value < 0) {
        throw new InvalidTreeException("Literal values are unsigned, got " +
                                       value);
      }
      return new Literal(Long.toString(value), DataType.INTEGER_TYPE);
    }

    private static String checkValue(String value, ScalarType datatype) {
      Intrinsic intrinsic = datatype.getIntrinsic();
      switch (intrinsic) {
        case INTEGER:
          if (!INTEGER_VALUE.matcher(value).matches()) {
            throw new InvalidTreeException("Integer literal must be a " +
                          "sequence of digits but found '" + value + "'");
          }
          return value;
        case REAL:
          if (!REAL_VALUE.matcher(value).matches()) {
            throw new InvalidTreeException("Real literal has invalid " +
                                           "format '" + value + "'");
          }
          return value;
        case BOOLEAN:
          String lower = value.toLowerCase();
          if (!lower.equals("true") && !lower.equals("false")) {
            throw new InvalidTreeException("Boolean literal must be true " +
                                       "or false but found '" + value + "'");
          }
          return lower;
        default:
          return value;
      }
    }

    public String getValue() {
      return value;
    }

    public ScalarType getDatatype() {
      return datatype;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LITERAL;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitLiteral(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return false;
    }

    @Override
    protected int maxChildren() {
      return 0;
    }

    @Override
    protected String childrenFormat() {
      return "<LeafNode>";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Literal(value, datatype);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      Literal o = (Literal)other;
      return value.equals(o.value) && datatype.equals(o.datatype);
    }

    @Override
    public String describe() {
      return "Literal[value:'" + value + "', " + datatype + "]";
    }
  }

  /**
   * Use of a symbol
   */
  public static class Reference extends Expression {
    private Symbol symbol;

    public Reference(Symbol symbol) {
      assert(symbol != null);
      this.symbol = symbol;
    }

    public Symbol getSymbol() {
      return symbol;
    }

    public void setSymbol(Symbol symbol) {
      assert(symbol != null);
      this.symbol = symbol;
    }

    public String getName() {
      return symbol.getName();
    }

    /**
     * @param indices filled with the index expressions of each component
     *                of the signature
     * @return signature of the accessed variable
     */
    public Signature getSignatureAndIndices(List<List<Expression>> indices) {
      indices.add(Collections.<Expression>emptyList());
      return new Signature(symbol.getName());
    }

    public Signature getSignature() {
      return getSignatureAndIndices(new ArrayList<List<Expression>>());
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
      referenceAccesses(info, AccessType.READ);
    }

    /**
     * Record access with the given type.  Reads of index expressions
     * come first.
     */
    public void referenceAccesses(VariablesAccessInfo info, AccessType type) {
      List<List<Expression>> indices = new ArrayList<List<Expression>>();
      Signature sig = getSignatureAndIndices(indices);
      for (List<Expression> component: indices) {
        for (Expression index: component) {
          index.referenceAccesses(info);
        }
      }
      info.addAccess(sig, type, this, indices);
    }

    @Override
    public List<Symbol> referencedSymbols() {
      return Collections.singletonList(symbol);
    }

    @Override
    public void rebindSymbols(Map<Symbol, Symbol> remap) {
      Symbol newSym = remap.get(symbol);
      if (newSym != null) {
        symbol = newSym;
      }
    }

    @Override
    public NodeKind kind() {
      return NodeKind.REFERENCE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitReference(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return false;
    }

    @Override
    protected int maxChildren() {
      return 0;
    }

    @Override
    protected String childrenFormat() {
      return "<LeafNode>";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Reference(symbol);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return symbol.nameMatches(((Reference)other).symbol.getName());
    }

    @Override
    public String describe() {
      return "Reference[name:'" + symbol.getName() + "']";
    }
  }

  /**
   * Array element access; children are the index expressions
   */
  public static class ArrayReference extends Reference {

    public ArrayReference(Symbol symbol) {
      super(symbol);
    }

    public static ArrayReference create(Symbol symbol,
                                        List<? extends Expression> indices) {
      if (indices.isEmpty()) {
        throw new InvalidTreeException("Array reference to '" +
                      symbol.getName() + "' needs at least one index");
      }
      ArrayReference ref = new ArrayReference(symbol);
      for (Expression index: indices) {
        ref.addChild(index);
      }
      return ref;
    }

    public List<Expression> getIndices() {
      List<Expression> result = new ArrayList<Expression>();
      for (Node child: children()) {
        result.add((Expression)child);
      }
      return result;
    }

    @Override
    public Signature getSignatureAndIndices(List<List<Expression>> indices) {
      indices.add(getIndices());
      return new Signature(getSymbol().getName());
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ARRAY_REFERENCE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitArrayReference(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Expression;
    }

    @Override
    protected int minChildren() {
      return 1;
    }

    @Override
    protected int maxChildren() {
      return Integer.MAX_VALUE;
    }

    @Override
    protected String childrenFormat() {
      return "[Expression]+";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ArrayReference(getSymbol());
    }

    @Override
    public String describe() {
      return "ArrayReference[name:'" + getName() + "']";
    }
  }

  /**
   * Check children of the form [Expression]* Member?, i.e. indices
   * optionally followed by a member access
   */
  private static String checkIndicesThenMember(Node node,
                                               List<Node> candidate) {
    for (int i = 0; i < candidate.size(); i++) {
      Node child = candidate.get(i);
      boolean last = (i == candidate.size() - 1);
      boolean ok = child instanceof Expression ||
                   (child instanceof Member && last);
      if (!ok) {
        return "Item '" + child.typeName() + "' can't be child " + i +
               " of '" + node.typeName() + "'. The valid format is: '" +
               node.childrenFormat() + "'.";
      }
    }
    return null;
  }

  /**
   * Access to a component of a derived type variable, e.g. a(i)%b%c.
   * Children are the indices of the base variable, if it's an array of
   * structures, followed by the member accessed.
   */
  public static class StructureReference extends Reference {

    public StructureReference(Symbol symbol) {
      super(symbol);
    }

    /**
     * @param symbol base variable
     * @param members names of members accessed, outermost first
     */
    public static StructureReference create(Symbol symbol,
                                            List<String> members) {
      return create(symbol, Collections.<Expression>emptyList(),
                    Member.chain(members));
    }

    public static StructureReference create(Symbol symbol,
                  List<? extends Expression> indices, Member member) {
      StructureReference ref = new StructureReference(symbol);
      for (Expression index: indices) {
        ref.addChild(index);
      }
      ref.addChild(member);
      return ref;
    }

    public Member getMember() {
      Node last = getChild(numChildren() - 1);
      return (Member)last;
    }

    /**
     * @return indices of the base variable
     */
    public List<Expression> getIndices() {
      List<Expression> result = new ArrayList<Expression>();
      for (Node child: children()) {
        if (child instanceof Expression) {
          result.add((Expression)child);
        }
      }
      return result;
    }

    @Override
    public Signature getSignatureAndIndices(List<List<Expression>> indices) {
      List<String> components = new ArrayList<String>();
      components.add(getSymbol().getName());
      indices.add(getIndices());
      Member m = getMember();
      while (m != null) {
        components.add(m.getName());
        indices.add(m.getIndices());
        m = m.getInner();
      }
      return new Signature(components);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRUCTURE_REFERENCE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitStructureReference(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Expression || child instanceof Member;
    }

    @Override
    protected String checkChildren(List<Node> candidate) {
      return checkIndicesThenMember(this, candidate);
    }

    @Override
    public String checkComplete() {
      if (numChildren() == 0 ||
          !(getChild(numChildren() - 1) instanceof Member)) {
        return "StructureReference to '" + getName() + "' has no member";
      }
      return super.checkComplete();
    }

    @Override
    protected int maxChildren() {
      return Integer.MAX_VALUE;
    }

    @Override
    protected String childrenFormat() {
      return "[Expression]*, Member";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new StructureReference(getSymbol());
    }

    @Override
    public String describe() {
      return "StructureReference[name:'" + getName() + "']";
    }
  }

  /**
   * Component of a structure access.  Children are the indices of this
   * component, if it is an array, followed by the next member if there
   * is one.
   */
  public static class Member extends Node {
    private final String name;

    public Member(String name) {
      this.name = name;
    }

    public static Member create(String name,
                    List<? extends Expression> indices, Member inner) {
      Member m = new Member(name);
      for (Expression index: indices) {
        m.addChild(index);
      }
      if (inner != null) {
        m.addChild(inner);
      }
      return m;
    }

    /**
     * @param names component names, outermost first
     * @return member chain without indices
     */
    public static Member chain(List<String> names) {
      if (names.isEmpty()) {
        throw new InvalidTreeException("Structure access needs a member");
      }
      Member inner = null;
      for (int i = names.size() - 1; i >= 0; i--) {
        inner = Member.create(names.get(i),
                              Collections.<Expression>emptyList(), inner);
      }
      return inner;
    }

    public String getName() {
      return name;
    }

    /**
     * @return next member in the chain, or null
     */
    public Member getInner() {
      if (numChildren() > 0) {
        Node last = getChild(numChildren() - 1);
        if (last instanceof Member) {
          return (Member)last;
        }
      }
      return null;
    }

    public List<Expression> getIndices() {
      List<Expression> result = new ArrayList<Expression>();
      for (Node child: children()) {
        if (child instanceof Expression) {
          result.add((Expression)child);
        }
      }
      return result;
    }

    public boolean isArray() {
      return !getIndices().isEmpty();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.MEMBER;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitMember(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Expression || child instanceof Member;
    }

    @Override
    protected String checkChildren(List<Node> candidate) {
      return checkIndicesThenMember(this, candidate);
    }

    @Override
    protected String childrenFormat() {
      return "[Expression]*, [Member]?";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Member(name);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return name.equalsIgnoreCase(((Member)other).name);
    }

    @Override
    public String describe() {
      return "Member[name:'" + name + "']";
    }
  }

  public static class UnaryOperation extends Expression {
    public static enum Operator {
      MINUS, PLUS, NOT, ABS, SQRT, EXP, LOG, LOG10, SIN, COS, TAN,
      REAL, INT, NINT, FLOOR, CEILING, SUM;
    }

    private final Operator operator;

    public UnaryOperation(Operator operator) {
      this.operator = operator;
    }

    public static UnaryOperation create(Operator operator,
                                        Expression operand) {
      UnaryOperation op = new UnaryOperation(operator);
      op.addChild(operand);
      return op;
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getOperand() {
      return (Expression)getChild(0);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNARY_OPERATION;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitUnaryOperation(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return position == 0 && child instanceof Expression;
    }

    @Override
    protected int minChildren() {
      return 1;
    }

    @Override
    protected int maxChildren() {
      return 1;
    }

    @Override
    protected String childrenFormat() {
      return "Expression";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new UnaryOperation(operator);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return operator == ((UnaryOperation)other).operator;
    }

    @Override
    public String describe() {
      return "UnaryOperation[operator:'" + operator + "']";
    }
  }

  public static class BinaryOperation extends Expression {
    public static enum Operator {
      ADD, SUB, MUL, DIV, POW,
      EQ, NE, LT, LE, GT, GE,
      AND, OR,
      MOD, MAX, MIN, SIGN,
      LBOUND, UBOUND, SIZE;
    }

    private final Operator operator;

    public BinaryOperation(Operator operator) {
      this.operator = operator;
    }

    public static BinaryOperation create(Operator operator, Expression lhs,
                                         Expression rhs) {
      BinaryOperation op = new BinaryOperation(operator);
      op.addChild(lhs);
      op.addChild(rhs);
      return op;
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getLhs() {
      return (Expression)getChild(0);
    }

    public Expression getRhs() {
      return (Expression)getChild(1);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BINARY_OPERATION;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitBinaryOperation(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return position < 2 && child instanceof Expression;
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
      return "Expression, Expression";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new BinaryOperation(operator);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return operator == ((BinaryOperation)other).operator;
    }

    @Override
    public String describe() {
      return "BinaryOperation[operator:'" + operator + "']";
    }
  }

  /**
   * Operation with any number of operands, e.g. max(a, b, c)
   */
  public static class NaryOperation extends Expression {
    public static enum Operator {
      MAX, MIN;
    }

    private final Operator operator;

    public NaryOperation(Operator operator) {
      this.operator = operator;
    }

    public static NaryOperation create(Operator operator,
                                       List<? extends Expression> operands) {
      NaryOperation op = new NaryOperation(operator);
      for (Expression e: operands) {
        op.addChild(e);
      }
      return op;
    }

    public Operator getOperator() {
      return operator;
    }

    public List<Expression> getOperands() {
      List<Expression> result = new ArrayList<Expression>();
      for (Node child: children()) {
        result.add((Expression)child);
      }
      return result;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.NARY_OPERATION;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitNaryOperation(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Expression;
    }

    @Override
    protected int minChildren() {
      return 1;
    }

    @Override
    protected String childrenFormat() {
      return "[Expression]+";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new NaryOperation(operator);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return operator == ((NaryOperation)other).operator;
    }

    @Override
    public String describe() {
      return "NaryOperation[operator:'" + operator + "']";
    }
  }
}
