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
package exm.skc.ir.access;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Access path of a variable, e.g. a%b%c for a(i)%b%c(j).  Array indices
 * are not part of the signature.  Components are compared without
 * regard to case.
 */
public class Signature implements Comparable<Signature> {
  public static final String SEPARATOR = "%";

  private final List<String> components;

  public Signature(String varName) {
    this(Collections.singletonList(varName));
  }

  public Signature(List<String> components) {
    if (components.isEmpty()) {
      throw new IllegalArgumentException("Signature needs a component");
    }
    List<String> lower = new ArrayList<String>(components.size());
    for (String c: components) {
      lower.add(c.toLowerCase());
    }
    this.components = Collections.unmodifiableList(lower);
  }

  /**
   * @param path components separated by %
   */
  public static Signature parse(String path) {
    return new Signature(Arrays.asList(path.split(SEPARATOR)));
  }

  /**
   * @return name of the base variable
   */
  public String getVarName() {
    return components.get(0);
  }

  public List<String> getComponents() {
    return components;
  }

  public boolean isStructure() {
    return components.size() > 1;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Signature)) {
      return false;
    }
    return components.equals(((Signature)o).components);
  }

  @Override
  public int hashCode() {
    return components.hashCode();
  }

  @Override
  public int compareTo(Signature o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public String toString() {
    return StringUtils.join(components, SEPARATOR);
  }
}
