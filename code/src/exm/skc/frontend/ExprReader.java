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
package exm.skc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.Intrinsic;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.ArrayReference;
import exm.skc.ir.tree.Expressions.BinaryOperation;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Member;
import exm.skc.ir.tree.Expressions.NaryOperation;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.Expressions.StructureReference;
import exm.skc.ir.tree.Expressions.UnaryOperation;
import exm.skc.ir.tree.IRTree.Expression;

/**
 * Lowers a Fortran expression to IR expression nodes.
 *
 * Operator precedence, loosest first: .or., .and., .not., relational
 * operators, additive operators (including a leading sign), * and /,
 * then ** which groups to the right.
 */
class ExprReader {

  private static enum TokenType {
    NAME,
    INTEGER,
    REAL,
    STRING,
    LOGICAL,
    OP,
    END;
  }

  private static class Token {
    final TokenType type;
    final String text;
    /** Kind suffix of a numeric literal, or null */
    final String kind;

    Token(TokenType type, String text, String kind) {
      this.type = type;
      this.text = text;
      this.kind = kind;
    }

    boolean is(String op) {
      return type == TokenType.OP && text.equals(op);
    }

    @Override
    public String toString() {
      return type == TokenType.END ? "end of expression" : "'" + text + "'";
    }
  }

  private static final Pattern DOT_OPERATOR = Pattern.compile(
      "\\.(and|or|not|eq|ne|lt|le|gt|ge|eqv|neqv|true|false)\\.",
      Pattern.CASE_INSENSITIVE);

  private static final Map<String, String> DOT_TO_SYMBOL =
                                          new HashMap<String, String>();
  static {
    DOT_TO_SYMBOL.put(".eq.", "==");
    DOT_TO_SYMBOL.put(".ne.", "/=");
    DOT_TO_SYMBOL.put(".lt.", "<");
    DOT_TO_SYMBOL.put(".le.", "<=");
    DOT_TO_SYMBOL.put(".gt.", ">");
    DOT_TO_SYMBOL.put(".ge.", ">=");
  }

  private static final Map<String, BinaryOperation.Operator> RELATIONAL =
                new HashMap<String, BinaryOperation.Operator>();
  static {
    RELATIONAL.put("==", BinaryOperation.Operator.EQ);
    RELATIONAL.put("/=", BinaryOperation.Operator.NE);
    RELATIONAL.put("<", BinaryOperation.Operator.LT);
    RELATIONAL.put("<=", BinaryOperation.Operator.LE);
    RELATIONAL.put(">", BinaryOperation.Operator.GT);
    RELATIONAL.put(">=", BinaryOperation.Operator.GE);
  }

  private static final Set<String> UNARY_INTRINSICS = new HashSet<String>(
      Arrays.asList("abs", "sqrt", "exp", "log", "log10", "sin", "cos",
                    "tan", "real", "int", "nint", "floor", "ceiling",
                    "sum"));

  private static final Set<String> BINARY_INTRINSICS = new HashSet<String>(
      Arrays.asList("mod", "sign", "lbound", "ubound", "size", "max",
                    "min"));

  private final SymbolTable table;
  private List<Token> tokens;
  private int pos;

  ExprReader(SymbolTable table) {
    this.table = table;
  }

  static boolean isIntrinsic(String name) {
    String lower = name.toLowerCase();
    return UNARY_INTRINSICS.contains(lower) ||
           BINARY_INTRINSICS.contains(lower);
  }

  Expression parse(String text) throws InvalidSyntaxException {
    tokens = tokenize(text);
    pos = 0;
    Expression result;
    try {
      result = orExpr();
    } catch (InvalidTreeException e) {
      throw new InvalidSyntaxException("Invalid expression '" + text +
                                       "': " + e.getMessage());
    }
    if (peek().type != TokenType.END) {
      throw new InvalidSyntaxException("Unexpected " + peek() +
                                       " in expression '" + text + "'");
    }
    return result;
  }

  Reference parseReference(String text) throws InvalidSyntaxException {
    Expression e = parse(text);
    if (!(e instanceof Reference)) {
      throw new InvalidSyntaxException("Expected a variable but found '" +
                                       text + "'");
    }
    return (Reference)e;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    return tokens.get(pos++);
  }

  private boolean accept(String op) {
    if (peek().is(op)) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(String op) throws InvalidSyntaxException {
    if (!accept(op)) {
      throw new InvalidSyntaxException("Expected '" + op + "' but found " +
                                       peek());
    }
  }

  private Expression orExpr() throws InvalidSyntaxException {
    Expression e = andExpr();
    while (accept(".or.")) {
      e = BinaryOperation.create(BinaryOperation.Operator.OR, e, andExpr());
    }
    return e;
  }

  private Expression andExpr() throws InvalidSyntaxException {
    Expression e = notExpr();
    while (accept(".and.")) {
      e = BinaryOperation.create(BinaryOperation.Operator.AND, e, notExpr());
    }
    return e;
  }

  private Expression notExpr() throws InvalidSyntaxException {
    if (accept(".not.")) {
      return UnaryOperation.create(UnaryOperation.Operator.NOT, notExpr());
    }
    return relExpr();
  }

  private Expression relExpr() throws InvalidSyntaxException {
    Expression lhs = addExpr();
    Token t = peek();
    if (t.type == TokenType.OP && RELATIONAL.containsKey(t.text)) {
      next();
      return BinaryOperation.create(RELATIONAL.get(t.text), lhs, addExpr());
    }
    return lhs;
  }

  private Expression addExpr() throws InvalidSyntaxException {
    Expression e;
    if (accept("-")) {
      e = UnaryOperation.create(UnaryOperation.Operator.MINUS, mulExpr());
    } else if (accept("+")) {
      e = UnaryOperation.create(UnaryOperation.Operator.PLUS, mulExpr());
    } else {
      e = mulExpr();
    }
    while (true) {
      if (accept("+")) {
        e = BinaryOperation.create(BinaryOperation.Operator.ADD, e,
                                   mulExpr());
      } else if (accept("-")) {
        e = BinaryOperation.create(BinaryOperation.Operator.SUB, e,
                                   mulExpr());
      } else {
        return e;
      }
    }
  }

  private Expression mulExpr() throws InvalidSyntaxException {
    Expression e = powExpr();
    while (true) {
      if (accept("*")) {
        e = BinaryOperation.create(BinaryOperation.Operator.MUL, e,
                                   powExpr());
      } else if (accept("/")) {
        e = BinaryOperation.create(BinaryOperation.Operator.DIV, e,
                                   powExpr());
      } else {
        return e;
      }
    }
  }

  private Expression powExpr() throws InvalidSyntaxException {
    Expression base = signedPrimary();
    if (accept("**")) {
      return BinaryOperation.create(BinaryOperation.Operator.POW, base,
                                    powExpr());
    }
    return base;
  }

  /**
   * Signs aren't allowed after another operator in standard Fortran,
   * but compilers accept e.g. a * -b
   */
  private Expression signedPrimary() throws InvalidSyntaxException {
    if (accept("-")) {
      return UnaryOperation.create(UnaryOperation.Operator.MINUS, powExpr());
    } else if (accept("+")) {
      return UnaryOperation.create(UnaryOperation.Operator.PLUS, powExpr());
    }
    return primary();
  }

  private Expression primary() throws InvalidSyntaxException {
    Token t = next();
    switch (t.type) {
      case INTEGER:
        return new Literal(t.text, literalType(Intrinsic.INTEGER, t));
      case REAL:
        return new Literal(t.text, literalType(Intrinsic.REAL, t));
      case LOGICAL:
        return new Literal(t.text, DataType.BOOLEAN_TYPE);
      case STRING:
        return new Literal(t.text, DataType.CHARACTER_TYPE);
      case NAME:
        return nameExpr(t.text);
      case OP:
        if (t.is("(")) {
          Expression e = orExpr();
          expect(")");
          return e;
        }
        break;
      default:
        break;
    }
    throw new InvalidSyntaxException("Unexpected " + t + " in expression");
  }

  private ScalarType literalType(Intrinsic intrinsic, Token t)
      throws InvalidSyntaxException {
    if (t.kind == null) {
      if (intrinsic == Intrinsic.REAL &&
          t.text.toLowerCase().indexOf('d') >= 0) {
        return DataType.REAL_DOUBLE_TYPE;
      }
      return intrinsic == Intrinsic.REAL ? DataType.REAL_TYPE
                                         : DataType.INTEGER_TYPE;
    }
    if (Character.isDigit(t.kind.charAt(0))) {
      return new ScalarType(intrinsic, Integer.parseInt(t.kind));
    }
    DataSymbol kindSymbol = SymbolResolver.data(table, t.kind,
                                                DataType.INTEGER_TYPE);
    return new ScalarType(intrinsic, kindSymbol);
  }

  private Expression nameExpr(String name) throws InvalidSyntaxException {
    if (peek().is("(") && isIntrinsic(name) &&
        !(table.find(name) instanceof DataSymbol)) {
      return intrinsic(name, argList());
    }

    List<Expression> indices = new ArrayList<Expression>();
    if (peek().is("(")) {
      indices = argList();
      if (indices.isEmpty()) {
        throw new InvalidSyntaxException("Function calls are not " +
                                         "supported: '" + name + "()'");
      }
    }
    Symbol symbol = SymbolResolver.reference(table, name);

    if (!peek().is("%")) {
      if (indices.isEmpty()) {
        return new Reference(symbol);
      }
      return ArrayReference.create(symbol, indices);
    }

    List<String> memberNames = new ArrayList<String>();
    List<List<Expression>> memberIndices = new ArrayList<List<Expression>>();
    while (accept("%")) {
      Token member = next();
      if (member.type != TokenType.NAME) {
        throw new InvalidSyntaxException("Expected structure member name "
                                         + "but found " + member);
      }
      memberNames.add(member.text);
      memberIndices.add(peek().is("(") ? argList()
                                       : new ArrayList<Expression>());
    }
    Member inner = null;
    for (int i = memberNames.size() - 1; i >= 0; i--) {
      inner = Member.create(memberNames.get(i), memberIndices.get(i), inner);
    }
    return StructureReference.create(symbol, indices, inner);
  }

  private List<Expression> argList() throws InvalidSyntaxException {
    expect("(");
    List<Expression> args = new ArrayList<Expression>();
    if (accept(")")) {
      return args;
    }
    do {
      if (peek().is(":")) {
        throw new InvalidSyntaxException("Array ranges are not supported");
      }
      args.add(orExpr());
    } while (accept(","));
    expect(")");
    return args;
  }

  private Expression intrinsic(String name, List<Expression> args)
      throws InvalidSyntaxException {
    String lower = name.toLowerCase();
    if (UNARY_INTRINSICS.contains(lower)) {
      checkArgCount(name, args, 1);
      return UnaryOperation.create(
          UnaryOperation.Operator.valueOf(lower.toUpperCase()), args.get(0));
    }
    if ((lower.equals("max") || lower.equals("min")) && args.size() > 2) {
      return NaryOperation.create(
          NaryOperation.Operator.valueOf(lower.toUpperCase()), args);
    }
    checkArgCount(name, args, 2);
    return BinaryOperation.create(
        BinaryOperation.Operator.valueOf(lower.toUpperCase()),
        args.get(0), args.get(1));
  }

  private static void checkArgCount(String name, List<Expression> args,
                                    int expected)
      throws InvalidSyntaxException {
    if (args.size() != expected) {
      throw new InvalidSyntaxException("Intrinsic " + name.toUpperCase() +
          " with " + args.size() + " arguments is not supported, " +
          "expected " + expected);
    }
  }

  private static List<Token> tokenize(String text)
      throws InvalidSyntaxException {
    List<Token> result = new ArrayList<Token>();
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isDigit(c) ||
          (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
        i = number(text, i, result);
      } else if (Character.isLetter(c)) {
        int start = i;
        while (i < n && (Character.isLetterOrDigit(text.charAt(i)) ||
                         text.charAt(i) == '_')) {
          i++;
        }
        result.add(new Token(TokenType.NAME,
                             text.substring(start, i).toLowerCase(), null));
      } else if (c == '\'' || c == '"') {
        i = string(text, i, result);
      } else if (c == '.') {
        Matcher m = DOT_OPERATOR.matcher(text);
        m.region(i, n);
        if (!m.lookingAt()) {
          throw new InvalidSyntaxException("Unknown operator at '" +
                                           text.substring(i) + "'");
        }
        String op = m.group().toLowerCase();
        i = m.end();
        if (op.equals(".true.") || op.equals(".false.")) {
          result.add(new Token(TokenType.LOGICAL,
                               op.substring(1, op.length() - 1), null));
        } else if (op.equals(".eqv.") || op.equals(".neqv.")) {
          throw new InvalidSyntaxException("Operator " + op +
                                           " is not supported");
        } else if (DOT_TO_SYMBOL.containsKey(op)) {
          result.add(new Token(TokenType.OP, DOT_TO_SYMBOL.get(op), null));
        } else {
          result.add(new Token(TokenType.OP, op, null));
        }
      } else {
        String two = i + 1 < n ? text.substring(i, i + 2) : "";
        if (two.equals("**") || two.equals("==") || two.equals("/=") ||
            two.equals("<=") || two.equals(">=")) {
          result.add(new Token(TokenType.OP, two, null));
          i += 2;
        } else if ("+-*/<>(),%:".indexOf(c) >= 0) {
          result.add(new Token(TokenType.OP, String.valueOf(c), null));
          i++;
        } else {
          throw new InvalidSyntaxException("Unexpected character '" + c +
                                           "' in expression '" + text + "'");
        }
      }
    }
    result.add(new Token(TokenType.END, "", null));
    return result;
  }

  private static int number(String text, int start, List<Token> out) {
    int n = text.length();
    int i = start;
    boolean real = false;
    while (i < n && Character.isDigit(text.charAt(i))) {
      i++;
    }
    if (i < n && text.charAt(i) == '.' &&
        !DOT_OPERATOR.matcher(text.substring(i)).lookingAt()) {
      real = true;
      i++;
      while (i < n && Character.isDigit(text.charAt(i))) {
        i++;
      }
    }
    if (i < n && "eEdD".indexOf(text.charAt(i)) >= 0) {
      int j = i + 1;
      if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
        j++;
      }
      if (j < n && Character.isDigit(text.charAt(j))) {
        real = true;
        i = j;
        while (i < n && Character.isDigit(text.charAt(i))) {
          i++;
        }
      }
    }
    String value = text.substring(start, i);
    String kind = null;
    if (i < n && text.charAt(i) == '_') {
      int kindStart = ++i;
      while (i < n && (Character.isLetterOrDigit(text.charAt(i)) ||
                       text.charAt(i) == '_')) {
        i++;
      }
      kind = text.substring(kindStart, i).toLowerCase();
    }
    out.add(new Token(real ? TokenType.REAL : TokenType.INTEGER, value,
                      kind));
    return i;
  }

  private static int string(String text, int start, List<Token> out)
      throws InvalidSyntaxException {
    char quote = text.charAt(start);
    StringBuilder value = new StringBuilder();
    int i = start + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == quote) {
        if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
          value.append(quote);
          i += 2;
          continue;
        }
        out.add(new Token(TokenType.STRING, value.toString(), null));
        return i + 1;
      }
      value.append(c);
      i++;
    }
    throw new InvalidSyntaxException("Unterminated string in '" + text + "'");
  }
}
