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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.Node;

/**
 * Accesses to every variable used by a list of nodes, collected in the
 * order they execute.  Signatures are kept in order of first access.
 */
public class VariablesAccessInfo {
  private final Map<Signature, SingleVariableAccessInfo> varInfo =
          new LinkedHashMap<Signature, SingleVariableAccessInfo>();

  private int location = 0;

  public VariablesAccessInfo() {
  }

  public VariablesAccessInfo(Node node) {
    this(Collections.singletonList(node));
  }

  public VariablesAccessInfo(List<? extends Node> nodes) {
    for (Node n: nodes) {
      n.referenceAccesses(this);
    }
  }

  /**
   * @return location that the next access will get
   */
  public int getLocation() {
    return location;
  }

  /**
   * Move on to next statement
   */
  public void nextLocation() {
    location++;
  }

  public void addAccess(Signature signature, AccessType type, Node node) {
    addAccess(signature, type, node,
              Collections.<List<Expression>>emptyList());
  }

  /**
   * @param signature
   * @param type
   * @param node the node performing the access
   * @param indices index expressions per signature component
   */
  public void addAccess(Signature signature, AccessType type, Node node,
                        List<List<Expression>> indices) {
    SingleVariableAccessInfo info = varInfo.get(signature);
    if (info == null) {
      info = new SingleVariableAccessInfo(signature);
      varInfo.put(signature, info);
    }
    info.addAccess(new AccessInfo(type, location, node, indices));
  }

  /**
   * Append accesses from another collection, after the ones in this
   */
  public void merge(VariablesAccessInfo other) {
    int base = location;
    int maxLocation = 0;
    for (SingleVariableAccessInfo info: other.varInfo.values()) {
      for (AccessInfo a: info.getAllAccesses()) {
        SingleVariableAccessInfo mine = varInfo.get(info.getSignature());
        if (mine == null) {
          mine = new SingleVariableAccessInfo(info.getSignature());
          varInfo.put(info.getSignature(), mine);
        }
        mine.addAccess(new AccessInfo(a.getAccessType(),
                      base + a.getLocation(), a.getNode(), a.getIndices()));
        maxLocation = Math.max(maxLocation, a.getLocation());
      }
    }
    location = base + maxLocation + 1;
  }

  public List<Signature> getAllSignatures() {
    return new ArrayList<Signature>(varInfo.keySet());
  }

  public boolean has(Signature signature) {
    return varInfo.containsKey(signature);
  }

  /**
   * @return info for signature, or null if not accessed
   */
  public SingleVariableAccessInfo get(Signature signature) {
    return varInfo.get(signature);
  }

  public boolean isWritten(Signature signature) {
    SingleVariableAccessInfo info = varInfo.get(signature);
    return info != null && info.isWritten();
  }

  public boolean isRead(Signature signature) {
    SingleVariableAccessInfo info = varInfo.get(signature);
    return info != null && info.isRead();
  }

  public boolean isEmpty() {
    return varInfo.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (SingleVariableAccessInfo info: varInfo.values()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(info.getSignature()).append(": ");
      if (info.isReadOnly()) {
        sb.append("READ");
      } else if (info.isRead()) {
        sb.append("READ+WRITE");
      } else {
        sb.append("WRITE");
      }
    }
    return sb.toString();
  }
}
