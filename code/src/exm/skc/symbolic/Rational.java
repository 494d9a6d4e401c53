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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact rational number, always in lowest terms with a positive
 * denominator
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO,
                                                   BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE,
                                                  BigInteger.ONE);

  private final BigInteger num;
  private final BigInteger den;

  private Rational(BigInteger num, BigInteger den) {
    this.num = num;
    this.den = den;
  }

  public static Rational of(long value) {
    return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static Rational of(BigInteger num, BigInteger den) {
    if (den.signum() == 0) {
      throw new ArithmeticException("Zero denominator");
    }
    if (den.signum() < 0) {
      num = num.negate();
      den = den.negate();
    }
    BigInteger gcd = num.gcd(den);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      num = num.divide(gcd);
      den = den.divide(gcd);
    }
    return new Rational(num, den);
  }

  /**
   * Parse a decimal literal, e.g. 12, 1.5, 3.14e-2.  The value is exact.
   * @throws NumberFormatException
   */
  public static Rational parse(String text) {
    BigDecimal d = new BigDecimal(text);
    BigInteger unscaled = d.unscaledValue();
    int scale = d.scale();
    if (scale <= 0) {
      return of(unscaled.multiply(BigInteger.TEN.pow(-scale)),
                BigInteger.ONE);
    }
    return of(unscaled, BigInteger.TEN.pow(scale));
  }

  public BigInteger getNumerator() {
    return num;
  }

  public BigInteger getDenominator() {
    return den;
  }

  public boolean isZero() {
    return num.signum() == 0;
  }

  public boolean isInteger() {
    return den.equals(BigInteger.ONE);
  }

  public int signum() {
    return num.signum();
  }

  public Rational add(Rational o) {
    return of(num.multiply(o.den).add(o.num.multiply(den)),
              den.multiply(o.den));
  }

  public Rational subtract(Rational o) {
    return add(o.negate());
  }

  public Rational multiply(Rational o) {
    return of(num.multiply(o.num), den.multiply(o.den));
  }

  public Rational negate() {
    return new Rational(num.negate(), den);
  }

  /**
   * @throws ArithmeticException if zero
   */
  public Rational reciprocal() {
    return of(den, num);
  }

  /**
   * Truncating integer division, as Fortran does for integers
   */
  public Rational truncate() {
    return new Rational(num.divide(den), BigInteger.ONE);
  }

  public Rational max(Rational o) {
    return compareTo(o) >= 0 ? this : o;
  }

  public Rational min(Rational o) {
    return compareTo(o) <= 0 ? this : o;
  }

  @Override
  public int compareTo(Rational o) {
    return num.multiply(o.den).compareTo(o.num.multiply(den));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Rational)) {
      return false;
    }
    Rational r = (Rational)o;
    return num.equals(r.num) && den.equals(r.den);
  }

  @Override
  public int hashCode() {
    return num.hashCode() * 31 + den.hashCode();
  }

  @Override
  public String toString() {
    if (isInteger()) {
      return num.toString();
    }
    return num + "/" + den;
  }
}
