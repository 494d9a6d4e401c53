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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.Logging;
import exm.skc.common.exceptions.SymbolError.UnresolvableImport;
import exm.skc.ir.symbols.SymbolInterface.Argument;
import exm.skc.ir.symbols.SymbolInterface.Import;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolInterface.Unresolved;
import exm.skc.ir.tree.IRTree.Container;

/**
 * A named entity in a symbol table.  Names are compared without
 * regard to case.
 */
public class Symbol {

  public static enum Visibility {
    PUBLIC,
    PRIVATE;
  }

  private final String name;
  private Visibility visibility;
  private SymbolInterface iface;

  public Symbol(String name) {
    this(name, Visibility.PUBLIC, new Local());
  }

  public Symbol(String name, Visibility visibility, SymbolInterface iface) {
    if (name == null || name.length() == 0) {
      throw new IllegalArgumentException("Symbol name must be non-empty");
    }
    assert(visibility != null);
    assert(iface != null);
    this.name = name;
    this.visibility = visibility;
    this.iface = iface;
  }

  public String getName() {
    return name;
  }

  /**
   * @param other
   * @return true if other has the same name ignoring case
   */
  public boolean nameMatches(String other) {
    return name.equalsIgnoreCase(other);
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public void setVisibility(Visibility visibility) {
    assert(visibility != null);
    this.visibility = visibility;
  }

  public SymbolInterface getInterface() {
    return iface;
  }

  public void setInterface(SymbolInterface iface) {
    assert(iface != null);
    this.iface = iface;
  }

  public boolean isLocal() {
    return iface instanceof Local;
  }

  public boolean isArgument() {
    return iface instanceof Argument;
  }

  public boolean isImport() {
    return iface instanceof Import;
  }

  public boolean isUnresolved() {
    return iface instanceof Unresolved;
  }

  /**
   * @return independent copy.  Symbols referenced by this one
   *         (e.g. the container of an import) are shared, not copied.
   */
  public Symbol copy() {
    return new Symbol(name, visibility, iface.copy());
  }

  /**
   * Redirect references to other symbols, used after copying a table
   * @param remap
   */
  void remapReferences(Map<Symbol, Symbol> remap) {
    iface = iface.remap(remap);
  }

  /**
   * @return other symbols this symbol's declaration uses, not counting
   *         the module it is imported from
   */
  public List<Symbol> referencedSymbols() {
    return Collections.emptyList();
  }

  public Symbol resolveDeferred() {
    return resolveDeferred(ModuleManager.get());
  }

  /**
   * If this symbol is imported, find the public symbol of the same
   * name in the module it comes from.
   * @param modules where to look up modules
   * @return a copy of the external symbol with this symbol's interface
   *         and visibility, or this symbol if it isn't imported
   * @throws UnresolvableImport if the module can't supply the name,
   *         or the modules import it from each other in a cycle
   */
  public Symbol resolveDeferred(ModuleManager modules) {
    return resolveDeferred(modules, new ArrayList<String>());
  }

  /**
   * @param visited names of modules already searched for this name,
   *        in order
   */
  private Symbol resolveDeferred(ModuleManager modules,
                                 List<String> visited) {
    if (!isImport()) {
      return this;
    }
    ContainerSymbol csym = ((Import)iface).getContainer();
    String module = csym.getName().toLowerCase();
    if (visited.contains(module)) {
      visited.add(module);
      throw new UnresolvableImport("Cyclic import of '" + name + "': " +
                                   StringUtils.join(visited, " -> "));
    }
    visited.add(module);
    Container container = csym.getContainer(modules);
    Symbol external = container.getSymbolTable().findLocal(name);
    if (external == null) {
      throw new UnresolvableImport("Module '" + csym.getName() +
          "' does not contain the symbol '" + name + "'");
    }
    if (external.getVisibility() != Visibility.PUBLIC) {
      throw new UnresolvableImport("Symbol '" + name + "' in module '" +
          csym.getName() + "' is private and can't be imported");
    }
    // Module may in turn import it from elsewhere
    external = external.resolveDeferred(modules, visited);

    Symbol resolved = external.copy();
    resolved.setInterface(iface.copy());
    resolved.setVisibility(visibility);
    Logging.getSKCLogger().trace("Resolved import of " + name + " from " +
                                 csym.getName() + " to " + resolved);
    return resolved;
  }

  /**
   * @return description of the symbol's type, used in toString
   */
  protected String describe() {
    return "Symbol";
  }

  @Override
  public String toString() {
    return name + ": " + describe() + "<" + iface + ">";
  }
}
