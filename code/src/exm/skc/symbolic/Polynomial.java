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

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Polynomial with rational coefficients in canonical form: terms with
 * zero coefficient are dropped and terms are kept in a fixed order, so
 * equal polynomials have equal string forms.
 */
public final class Polynomial {
  public static final Polynomial ZERO =
      new Polynomial(new TreeMap<Monomial, Rational>());

  private final SortedMap<Monomial, Rational> terms;

  private Polynomial(SortedMap<Monomial, Rational> terms) {
    this.terms = terms;
  }

  public static Polynomial constant(Rational value) {
    TreeMap<Monomial, Rational> terms = new TreeMap<Monomial, Rational>();
    if (!value.isZero()) {
      terms.put(Monomial.ONE, value);
    }
    return new Polynomial(terms);
  }

  public static Polynomial atom(String atom) {
    TreeMap<Monomial, Rational> terms = new TreeMap<Monomial, Rational>();
    terms.put(Monomial.atom(atom), Rational.ONE);
    return new Polynomial(terms);
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  public boolean isConstant() {
    return terms.isEmpty() ||
          (terms.size() == 1 && terms.firstKey().isConstant());
  }

  /**
   * @return value of a constant polynomial
   * @throws IllegalStateException if not constant
   */
  public Rational getConstant() {
    if (!isConstant()) {
      throw new IllegalStateException(this + " is not constant");
    }
    return terms.isEmpty() ? Rational.ZERO : terms.get(Monomial.ONE);
  }

  public Polynomial add(Polynomial o) {
    TreeMap<Monomial, Rational> result =
                          new TreeMap<Monomial, Rational>(terms);
    for (Map.Entry<Monomial, Rational> e: o.terms.entrySet()) {
      addTerm(result, e.getKey(), e.getValue());
    }
    return new Polynomial(result);
  }

  public Polynomial negate() {
    TreeMap<Monomial, Rational> result = new TreeMap<Monomial, Rational>();
    for (Map.Entry<Monomial, Rational> e: terms.entrySet()) {
      result.put(e.getKey(), e.getValue().negate());
    }
    return new Polynomial(result);
  }

  public Polynomial subtract(Polynomial o) {
    return add(o.negate());
  }

  public Polynomial multiply(Polynomial o) {
    TreeMap<Monomial, Rational> result = new TreeMap<Monomial, Rational>();
    for (Map.Entry<Monomial, Rational> a: terms.entrySet()) {
      for (Map.Entry<Monomial, Rational> b: o.terms.entrySet()) {
        addTerm(result, a.getKey().multiply(b.getKey()),
                a.getValue().multiply(b.getValue()));
      }
    }
    return new Polynomial(result);
  }

  public Polynomial pow(int n) {
    assert(n >= 0);
    Polynomial result = constant(Rational.ONE);
    for (int i = 0; i < n; i++) {
      result = result.multiply(this);
    }
    return result;
  }

  private static void addTerm(TreeMap<Monomial, Rational> terms,
                              Monomial m, Rational coeff) {
    Rational prev = terms.get(m);
    Rational sum = prev == null ? coeff : prev.add(coeff);
    if (sum.isZero()) {
      terms.remove(m);
    } else {
      terms.put(m, sum);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Polynomial && terms.equals(((Polynomial)o).terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  /**
   * Canonical form, e.g. "2*i + -1*j + 3"
   */
  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Monomial, Rational> e: terms.entrySet()) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      if (e.getKey().isConstant()) {
        sb.append(e.getValue());
      } else {
        sb.append(e.getValue()).append('*').append(e.getKey());
      }
    }
    return sb.toString();
  }
}
