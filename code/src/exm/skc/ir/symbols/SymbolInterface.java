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

import java.util.Map;

import exm.skc.ir.access.AccessType;

/**
 * Describes how the value of a symbol arrives in the scope that
 * declares it.
 */
public abstract class SymbolInterface {

  public abstract SymbolInterface copy();

  /**
   * @param remap
   * @return copy with symbol references replaced according to remap
   */
  public SymbolInterface remap(Map<Symbol, Symbol> remap) {
    return copy();
  }

  /**
   * Defined in this scope
   */
  public static class Local extends SymbolInterface {
    @Override
    public SymbolInterface copy() {
      return new Local();
    }

    @Override
    public String toString() {
      return "Local";
    }
  }

  /**
   * Name was seen but where it comes from is not known
   */
  public static class Unresolved extends SymbolInterface {
    @Override
    public SymbolInterface copy() {
      return new Unresolved();
    }

    @Override
    public String toString() {
      return "Unresolved";
    }
  }

  /**
   * Routine argument.  Access is UNKNOWN until someone who knows sets it;
   * analysis treats UNKNOWN as read and write.
   */
  public static class Argument extends SymbolInterface {
    private AccessType access;

    public Argument() {
      this(AccessType.UNKNOWN);
    }

    public Argument(AccessType access) {
      assert(access != null);
      this.access = access;
    }

    public AccessType getAccess() {
      return access;
    }

    public void setAccess(AccessType access) {
      assert(access != null);
      this.access = access;
    }

    @Override
    public SymbolInterface copy() {
      return new Argument(access);
    }

    @Override
    public String toString() {
      return "Argument(access=" + access + ")";
    }
  }

  /**
   * Imported from an external module
   */
  public static class Import extends SymbolInterface {
    private final ContainerSymbol container;

    public Import(ContainerSymbol container) {
      assert(container != null);
      this.container = container;
    }

    public ContainerSymbol getContainer() {
      return container;
    }

    @Override
    public SymbolInterface copy() {
      return new Import(container);
    }

    @Override
    public SymbolInterface remap(Map<Symbol, Symbol> remap) {
      Symbol newContainer = remap.get(container);
      if (newContainer != null) {
        return new Import((ContainerSymbol)newContainer);
      }
      return copy();
    }

    @Override
    public String toString() {
      return "Import(container='" + container.getName() + "')";
    }
  }
}
