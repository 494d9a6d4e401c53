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

import exm.skc.common.exceptions.SymbolError.UnresolvableImport;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.tree.IRTree.Container;

/**
 * Reference to an external module.  The module itself is looked up
 * lazily, through a {@link ModuleManager}.
 */
public class ContainerSymbol extends Symbol {
  /** True if everything public in the module is imported */
  private boolean wildcardImport;

  public ContainerSymbol(String name) {
    this(name, false);
  }

  public ContainerSymbol(String name, boolean wildcardImport) {
    super(name, Visibility.PUBLIC, new Local());
    this.wildcardImport = wildcardImport;
  }

  public boolean hasWildcardImport() {
    return wildcardImport;
  }

  public void setWildcardImport(boolean wildcardImport) {
    this.wildcardImport = wildcardImport;
  }

  /**
   * @param modules
   * @return the module
   * @throws UnresolvableImport if the module is unknown
   */
  public Container getContainer(ModuleManager modules) {
    Container c = modules.find(getName());
    if (c == null) {
      throw new UnresolvableImport("Module '" + getName() +
                                   "' could not be found");
    }
    return c;
  }

  @Override
  public ContainerSymbol copy() {
    ContainerSymbol copy = new ContainerSymbol(getName(), wildcardImport);
    copy.setVisibility(getVisibility());
    copy.setInterface(getInterface().copy());
    return copy;
  }

  @Override
  protected String describe() {
    return "ContainerSymbol" + (wildcardImport ? "(wildcard)" : "");
  }
}
