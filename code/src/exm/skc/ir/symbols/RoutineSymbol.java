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
package exm.skc.ir.symbols;

import java.util.ArrayList;
import java.util.List;

import exm.skc.ir.access.AccessType;
import exm.skc.ir.symbols.SymbolInterface.Local;

/**
 * Symbol for a subroutine.  May carry the declared access of each
 * argument, which call sites use in dependency analysis.
 */
public class RoutineSymbol extends TypedSymbol {

  /** Null if not known */
  private List<AccessType> argumentAccesses;

  public RoutineSymbol(String name) {
    this(name, Visibility.PUBLIC, new Local());
  }

  public RoutineSymbol(String name, Visibility visibility,
                       SymbolInterface iface) {
    super(name, DataType.NO_TYPE, visibility, iface);
  }

  public boolean hasArgumentAccesses() {
    return argumentAccesses != null;
  }

  public void setArgumentAccesses(List<AccessType> accesses) {
    this.argumentAccesses = accesses == null ? null :
                            new ArrayList<AccessType>(accesses);
  }

  /**
   * @param position
   * @return declared access of argument, or UNKNOWN if not declared
   */
  public AccessType getArgumentAccess(int position) {
    if (argumentAccesses == null || position >= argumentAccesses.size()) {
      return AccessType.UNKNOWN;
    }
    return argumentAccesses.get(position);
  }

  @Override
  public RoutineSymbol copy() {
    RoutineSymbol copy = new RoutineSymbol(getName(), getVisibility(),
                                           getInterface().copy());
    copy.setArgumentAccesses(argumentAccesses);
    return copy;
  }

  @Override
  protected String describe() {
    return "RoutineSymbol";
  }
}
