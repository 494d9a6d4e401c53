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
package exm.skc.symbolic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.exceptions.InvalidSyntaxException;

/**
 * Parses the text written by {@link exm.skc.backend.AlgebraWriter} into
 * a canonical {@link Polynomial}.
 *
 * Grammar:
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := factor (('*' | '/') factor)*
 *   factor  := ('+' | '-') factor | power
 *   power   := primary ('**' factor)?
 *   primary := number | '(' expr ')' | function '(' args ')'
 *            | constant | path
 *   path    := name index? ('%' name index?)*
 *   index   := '[' expr (',' expr)* ']'
 * </pre>
 *
 * max, min, mod and idiv (integer division, truncating towards zero)
 * are evaluated when their arguments are constant.
 * Anything without an arithmetic meaning becomes an atom whose text is
 * built from the canonical forms of its parts, so two atoms are the
 * same exactly when their parts are equal.
 */
public class AlgebraParser {

  /** Names that are always followed by an argument list */
  public static final Set<String> FUNCTIONS = Collections.unmodifiableSet(
      new HashSet<String>(Arrays.asList(
          "max", "min", "mod", "sign", "abs", "sqrt", "exp", "log", "log10",
          "sin", "cos", "tan", "real", "int", "nint", "floor", "ceiling",
          "sum", "not", "and", "or", "eq", "ne", "lt", "le", "gt", "ge",
          "lbound", "ubound", "size", "pow", "div", "idiv")));

  public static final Set<String> CONSTANTS = Collections.unmodifiableSet(
      new HashSet<String>(Arrays.asList("true", "false")));

  /** Largest integer power expanded into a product */
  private static final int MAX_EXPANDED_POWER = 32;

  private final String text;
  private int pos;

  private AlgebraParser(String text) {
    this.text = text;
    this.pos = 0;
  }

  /**
   * @return true if a variable with this name must be renamed before
   *         being written for the parser
   */
  public static boolean isReserved(String name) {
    String lower = name.toLowerCase();
    return FUNCTIONS.contains(lower) || CONSTANTS.contains(lower);
  }

  public static Polynomial parse(String text) throws InvalidSyntaxException {
    AlgebraParser p = new AlgebraParser(text);
    Polynomial result = p.expr();
    p.skipSpace();
    if (p.pos < text.length()) {
      throw p.error("Unexpected '" + text.charAt(p.pos) + "'");
    }
    return result;
  }

  private InvalidSyntaxException error(String msg) {
    return new InvalidSyntaxException(msg + " at position " + pos +
                                      " in '" + text + "'");
  }

  private void skipSpace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private boolean lookingAt(String token) {
    skipSpace();
    return text.startsWith(token, pos);
  }

  private boolean accept(String token) {
    if (lookingAt(token)) {
      pos += token.length();
      return true;
    }
    return false;
  }

  private void expect(String token) throws InvalidSyntaxException {
    if (!accept(token)) {
      throw error("Expected '" + token + "'");
    }
  }

  private Polynomial expr() throws InvalidSyntaxException {
    Polynomial result = term();
    while (true) {
      if (accept("+")) {
        result = result.add(term());
      } else if (accept("-")) {
        result = result.subtract(term());
      } else {
        return result;
      }
    }
  }

  private Polynomial term() throws InvalidSyntaxException {
    Polynomial result = factor();
    while (true) {
      if (lookingAt("**")) {
        // Belongs to power, not a product
        return result;
      } else if (accept("*")) {
        result = result.multiply(factor());
      } else if (accept("/")) {
        result = divide(result, factor());
      } else {
        return result;
      }
    }
  }

  private Polynomial factor() throws InvalidSyntaxException {
    if (accept("-")) {
      return factor().negate();
    } else if (accept("+")) {
      return factor();
    }
    return power();
  }

  private Polynomial power() throws InvalidSyntaxException {
    Polynomial base = primary();
    if (accept("**")) {
      return pow(base, factor());
    }
    return base;
  }

  private Polynomial primary() throws InvalidSyntaxException {
    skipSpace();
    if (pos >= text.length()) {
      throw error("Unexpected end of expression");
    }
    char c = text.charAt(pos);
    if (accept("(")) {
      Polynomial inner = expr();
      expect(")");
      return inner;
    } else if (Character.isDigit(c) || c == '.') {
      return number();
    } else if (Character.isLetter(c) || c == '_') {
      String name = name();
      if (FUNCTIONS.contains(name)) {
        expect("(");
        List<Polynomial> args = new ArrayList<Polynomial>();
        if (!accept(")")) {
          args.add(expr());
          while (accept(",")) {
            args.add(expr());
          }
          expect(")");
        }
        return function(name, args);
      } else if (CONSTANTS.contains(name)) {
        return Polynomial.atom(name);
      }
      return path(name);
    }
    throw error("Unexpected '" + c + "'");
  }

  private String name() {
    int start = pos;
    while (pos < text.length() &&
           (Character.isLetterOrDigit(text.charAt(pos)) ||
            text.charAt(pos) == '_')) {
      pos++;
    }
    return text.substring(start, pos);
  }

  private Polynomial number() throws InvalidSyntaxException {
    int start = pos;
    while (pos < text.length() &&
           (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
      pos++;
    }
    if (pos < text.length() && text.charAt(pos) == 'e') {
      pos++;
      if (pos < text.length() &&
          (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
        pos++;
      }
      while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
        pos++;
      }
    }
    String num = text.substring(start, pos);
    try {
      return Polynomial.constant(Rational.parse(num));
    } catch (NumberFormatException e) {
      throw error("Invalid number '" + num + "'");
    }
  }

  /**
   * Variable or structure access, e.g. a[i]%b%c[j+1]
   */
  private Polynomial path(String first) throws InvalidSyntaxException {
    StringBuilder atom = new StringBuilder(first);
    index(atom);
    while (accept("%")) {
      skipSpace();
      String member = name();
      if (member.length() == 0) {
        throw error("Expected member name");
      }
      atom.append('%').append(member);
      index(atom);
    }
    return Polynomial.atom(atom.toString());
  }

  private void index(StringBuilder atom) throws InvalidSyntaxException {
    if (!accept("[")) {
      return;
    }
    List<String> indices = new ArrayList<String>();
    indices.add(expr().toString());
    while (accept(",")) {
      indices.add(expr().toString());
    }
    expect("]");
    atom.append('[').append(StringUtils.join(indices, ", ")).append(']');
  }

  private static Polynomial divide(Polynomial num, Polynomial den) {
    if (den.isConstant() && !den.getConstant().isZero()) {
      return num.multiply(Polynomial.constant(den.getConstant().reciprocal()));
    }
    return opaque("div", Arrays.asList(num, den));
  }

  private static Polynomial pow(Polynomial base, Polynomial exp) {
    if (exp.isConstant() && exp.getConstant().isInteger()) {
      BigInteger n = exp.getConstant().getNumerator();
      if (n.signum() >= 0 && n.intValue() <= MAX_EXPANDED_POWER &&
          n.bitLength() < 31) {
        return base.pow(n.intValue());
      }
      if (n.signum() < 0 && n.negate().bitLength() < 31 &&
          n.negate().intValue() <= MAX_EXPANDED_POWER &&
          base.isConstant() && !base.getConstant().isZero()) {
        Rational recip = base.getConstant().reciprocal();
        return Polynomial.constant(recip).pow(n.negate().intValue());
      }
    }
    return opaque("pow", Arrays.asList(base, exp));
  }

  private Polynomial function(String name, List<Polynomial> args)
                                          throws InvalidSyntaxException {
    if (name.equals("max") || name.equals("min")) {
      if (args.isEmpty()) {
        throw error(name + " needs arguments");
      }
      return maxMin(name.equals("max"), args);
    } else if (name.equals("mod")) {
      if (args.size() != 2) {
        throw error("mod needs two arguments");
      }
      return mod(args.get(0), args.get(1));
    } else if (name.equals("idiv")) {
      if (args.size() != 2) {
        throw error("idiv needs two arguments");
      }
      return intDivide(args.get(0), args.get(1));
    }
    return opaque(name, args);
  }

  /**
   * Fold constant arguments.  Order and duplicates of the rest don't
   * matter.
   */
  private static Polynomial maxMin(boolean isMax, List<Polynomial> args) {
    Rational constant = null;
    TreeSet<String> others = new TreeSet<String>();
    Polynomial lastOther = null;
    for (Polynomial arg: args) {
      if (arg.isConstant()) {
        Rational v = arg.getConstant();
        if (constant == null) {
          constant = v;
        } else {
          constant = isMax ? constant.max(v) : constant.min(v);
        }
      } else {
        others.add(arg.toString());
        lastOther = arg;
      }
    }
    if (others.isEmpty()) {
      return Polynomial.constant(constant);
    } else if (others.size() == 1 && constant == null) {
      return lastOther;
    }
    List<String> parts = new ArrayList<String>(others);
    if (constant != null) {
      parts.add(constant.toString());
    }
    return Polynomial.atom((isMax ? "max" : "min") + "(" +
                           StringUtils.join(parts, "; ") + ")");
  }

  /**
   * Fortran mod: result has the sign of the first argument
   */
  private static Polynomial mod(Polynomial a, Polynomial p) {
    if (a.isConstant() && p.isConstant() &&
        a.getConstant().isInteger() && p.getConstant().isInteger() &&
        !p.getConstant().isZero()) {
      Rational av = a.getConstant();
      Rational pv = p.getConstant();
      Rational quotient = av.multiply(pv.reciprocal()).truncate();
      return Polynomial.constant(av.subtract(quotient.multiply(pv)));
    }
    return opaque("mod", Arrays.asList(a, p));
  }

  private static Polynomial intDivide(Polynomial a, Polynomial b) {
    if (a.isConstant() && b.isConstant() &&
        a.getConstant().isInteger() && b.getConstant().isInteger() &&
        !b.getConstant().isZero()) {
      return Polynomial.constant(
          a.getConstant().multiply(b.getConstant().reciprocal()).truncate());
    }
    return opaque("idiv", Arrays.asList(a, b));
  }

  private static Polynomial opaque(String name, List<Polynomial> args) {
    List<String> parts = new ArrayList<String>();
    for (Polynomial arg: args) {
      parts.add(arg.toString());
    }
    return Polynomial.atom(name + "(" + StringUtils.join(parts, "; ") + ")");
  }
}
