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

/**
 * All accesses to one signature, in execution order
 */
public class SingleVariableAccessInfo {
  private final Signature signature;
  private final List<AccessInfo> accesses = new ArrayList<AccessInfo>();

  public SingleVariableAccessInfo(Signature signature) {
    this.signature = signature;
  }

  public Signature getSignature() {
    return signature;
  }

  public String getVarName() {
    return signature.toString();
  }

  void addAccess(AccessInfo access) {
    accesses.add(access);
  }

  public List<AccessInfo> getAllAccesses() {
    return Collections.unmodifiableList(accesses);
  }

  public AccessInfo get(int i) {
    return accesses.get(i);
  }

  public int size() {
    return accesses.size();
  }

  public boolean isReadOnly() {
    for (AccessInfo a: accesses) {
      if (a.getAccessType() != AccessType.READ) {
        return false;
      }
    }
    return true;
  }

  public boolean isWritten() {
    for (AccessInfo a: accesses) {
      if (a.getAccessType().isWrite()) {
        return true;
      }
    }
    return false;
  }

  public boolean isRead() {
    for (AccessInfo a: accesses) {
      if (a.getAccessType().isRead()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return true if any access used an index
   */
  public boolean isArray() {
    for (AccessInfo a: accesses) {
      if (a.isArrayAccess()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return signature + ":" + accesses;
  }
}
