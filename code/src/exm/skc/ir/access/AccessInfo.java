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
import java.util.Collections;
import java.util.List;

import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.Node;

/**
 * One access to a variable.
 */
public class AccessInfo {
  private final AccessType accessType;
  private final int location;
  private final Node node;
  /** Index expressions for each component of the signature */
  private final List<List<Expression>> indices;

  public AccessInfo(AccessType accessType, int location, Node node,
                    List<List<Expression>> indices) {
    this.accessType = accessType;
    this.location = location;
    this.node = node;
    List<List<Expression>> copy = new ArrayList<List<Expression>>();
    for (List<Expression> component: indices) {
      copy.add(Collections.unmodifiableList(
                    new ArrayList<Expression>(component)));
    }
    this.indices = Collections.unmodifiableList(copy);
  }

  public AccessType getAccessType() {
    return accessType;
  }

  /**
   * @return position in execution order among all accesses collected
   *         together with this one
   */
  public int getLocation() {
    return location;
  }

  public Node getNode() {
    return node;
  }

  /**
   * @return per signature component, per dimension index expressions
   */
  public List<List<Expression>> getIndices() {
    return indices;
  }

  public boolean isArrayAccess() {
    for (List<Expression> component: indices) {
      if (!component.isEmpty()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return accessType + "@" + location;
  }
}
