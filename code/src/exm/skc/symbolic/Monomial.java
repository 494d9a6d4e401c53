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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Product of atoms raised to positive powers.  Atoms are canonical
 * strings: variable names, structure paths or opaque function
 * applications.
 */
public final class Monomial implements Comparable<Monomial> {
  public static final Monomial ONE =
      new Monomial(new TreeMap<String, Integer>());

  private final SortedMap<String, Integer> powers;
  private final int degree;

  private Monomial(SortedMap<String, Integer> powers) {
    this.powers = Collections.unmodifiableSortedMap(powers);
    int d = 0;
    for (int p: powers.values()) {
      d += p;
    }
    this.degree = d;
  }

  public static Monomial atom(String atom) {
    TreeMap<String, Integer> powers = new TreeMap<String, Integer>();
    powers.put(atom, 1);
    return new Monomial(powers);
  }

  public boolean isConstant() {
    return powers.isEmpty();
  }

  public int getDegree() {
    return degree;
  }

  public Monomial multiply(Monomial o) {
    TreeMap<String, Integer> result = new TreeMap<String, Integer>(powers);
    for (Map.Entry<String, Integer> e: o.powers.entrySet()) {
      Integer prev = result.get(e.getKey());
      result.put(e.getKey(), prev == null ? e.getValue()
                                          : prev + e.getValue());
    }
    return new Monomial(result);
  }

  /**
   * Higher degree first, then by atoms
   */
  @Override
  public int compareTo(Monomial o) {
    if (degree != o.degree) {
      return degree > o.degree ? -1 : 1;
    }
    return toString().compareTo(o.toString());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Monomial && powers.equals(((Monomial)o).powers);
  }

  @Override
  public int hashCode() {
    return powers.hashCode();
  }

  @Override
  public String toString() {
    if (powers.isEmpty()) {
      return "1";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Integer> e: powers.entrySet()) {
      if (sb.length() > 0) {
        sb.append('*');
      }
      sb.append(e.getKey());
      if (e.getValue() != 1) {
        sb.append('^').append(e.getValue());
      }
    }
    return sb.toString();
  }
}
