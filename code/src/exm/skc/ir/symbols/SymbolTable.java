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
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.skc.common.exceptions.SymbolError.InUse;
import exm.skc.common.exceptions.SymbolError.NameCollision;
import exm.skc.common.exceptions.SymbolError.NotFound;
import exm.skc.ir.symbols.Symbol.Visibility;
import exm.skc.ir.symbols.SymbolInterface.Argument;
import exm.skc.ir.symbols.SymbolInterface.Import;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.ScopingNode;

/**
 * Symbols declared in one scope.  Each table is owned by the node that
 * introduces the scope; outer scopes are found through that node's
 * ancestors.
 *
 * Iteration order is declaration order, so that generated declarations
 * are deterministic.
 */
public class SymbolTable {

  /** Keyed by lower case name */
  private final LinkedHashMap<String, Symbol> symbols =
                          new LinkedHashMap<String, Symbol>();

  private final List<DataSymbol> argumentList = new ArrayList<DataSymbol>();

  /** Names handed out by newUniqueName that aren't declared (yet) */
  private final Set<String> reservedNames = new HashSet<String>();

  /** Next suffix to try for each root passed to newUniqueName */
  private final Map<String, Integer> nameCounters =
                          new HashMap<String, Integer>();

  private Node node = null;

  public SymbolTable() {
  }

  /**
   * @return node owning this table, or null if not attached
   */
  public Node getNode() {
    return node;
  }

  /**
   * Called by the scoping node when it takes ownership
   * @param owner
   */
  public void attach(ScopingNode owner) {
    if (this.node != null && this.node != owner) {
      throw new IllegalStateException("Symbol table already owned by " +
                                      this.node);
    }
    this.node = (Node)owner;
  }

  /**
   * @return table of nearest enclosing scope, or null if outermost
   */
  public SymbolTable getParentTable() {
    if (node == null || node.parent() == null) {
      return null;
    }
    return node.parent().scope();
  }

  private String describe() {
    if (node == null) {
      return "detached symbol table";
    }
    return "symbol table of " + node.describe();
  }

  private static String key(String name) {
    return name.toLowerCase();
  }

  /**
   * Declare a new variable in this scope
   * @throws NameCollision if name is already declared here
   */
  public DataSymbol declare(String name, DataType type,
                            SymbolInterface iface) {
    return add(new DataSymbol(name, type, iface));
  }

  /**
   * @param symbol
   * @return the symbol
   * @throws NameCollision if name is already declared here
   */
  public <S extends Symbol> S add(S symbol) {
    String k = key(symbol.getName());
    if (symbols.containsKey(k)) {
      throw new NameCollision(symbol.getName(), describe());
    }
    symbols.put(k, symbol);
    reservedNames.remove(k);
    return symbol;
  }

  /**
   * @param root
   * @return root if not used in this table, otherwise root_1, root_2, ...
   *         Never returns the same name twice.
   */
  public String newUniqueName(String root) {
    String rootKey = key(root);
    if (isFree(rootKey)) {
      reservedNames.add(rootKey);
      return root;
    }
    Integer next = nameCounters.get(rootKey);
    int i = (next == null) ? 1 : next;
    String candidate = root + "_" + i;
    while (!isFree(key(candidate))) {
      i++;
      candidate = root + "_" + i;
    }
    nameCounters.put(rootKey, i + 1);
    reservedNames.add(key(candidate));
    return candidate;
  }

  private boolean isFree(String key) {
    return !symbols.containsKey(key) && !reservedNames.contains(key);
  }

  /**
   * Declare variable with a name based on root that is unique in
   * this table
   */
  public DataSymbol newSymbol(String root, DataType type,
                              SymbolInterface iface) {
    return declare(newUniqueName(root), type, iface);
  }

  /**
   * Look up in this scope and then enclosing scopes
   * @throws NotFound if not declared anywhere
   */
  public Symbol lookup(String name) {
    Symbol s = find(name);
    if (s == null) {
      throw NotFound.fromName(name, describe());
    }
    return s;
  }

  /**
   * As {@link #lookup(String)} but only matches symbols with the given
   * visibility
   */
  public Symbol lookup(String name, Visibility visibility) {
    SymbolTable table = this;
    while (table != null) {
      Symbol s = table.findLocal(name);
      if (s != null && s.getVisibility() == visibility) {
        return s;
      }
      table = table.getParentTable();
    }
    throw new NotFound("Could not find " + visibility.toString().toLowerCase()
        + " symbol '" + name + "' in " + describe() + " or any outer scope");
  }

  /**
   * @return symbol from this or an enclosing scope, or null
   */
  public Symbol find(String name) {
    SymbolTable table = this;
    while (table != null) {
      Symbol s = table.findLocal(name);
      if (s != null) {
        return s;
      }
      table = table.getParentTable();
    }
    return null;
  }

  /**
   * @return symbol declared in this scope, or null
   */
  public Symbol findLocal(String name) {
    return symbols.get(key(name));
  }

  /**
   * @throws NotFound if not declared in this scope
   */
  public Symbol lookupLocal(String name) {
    Symbol s = findLocal(name);
    if (s == null) {
      throw new NotFound("Could not find '" + name + "' in " + describe());
    }
    return s;
  }

  public boolean containsLocal(String name) {
    return symbols.containsKey(key(name));
  }

  /**
   * Remove a symbol from this table.
   * @throws NotFound if the symbol isn't in this table
   * @throws InUse if a node in this scope still refers to it
   */
  public void remove(Symbol symbol) {
    String k = key(symbol.getName());
    if (symbols.get(k) != symbol) {
      throw new NotFound("Can't remove '" + symbol.getName() + "' from " +
                         describe() + ": not declared there");
    }
    if (node != null) {
      for (Node n: node.walk(Node.class)) {
        if (n.referencedSymbols().contains(symbol)) {
          throw new InUse("Can't remove '" + symbol.getName() + "' from " +
                          describe() + ": still referenced by " +
                          n.describe());
        }
      }
    }
    if (symbol instanceof ContainerSymbol) {
      List<Symbol> imports = getImports((ContainerSymbol)symbol);
      if (!imports.isEmpty()) {
        throw new InUse("Can't remove module '" + symbol.getName() +
                        "': symbols are imported from it: " + imports);
      }
    }
    for (SymbolTable table: tablesInScope()) {
      for (Symbol other: table.symbols.values()) {
        if (other != symbol && other.referencedSymbols().contains(symbol)) {
          throw new InUse("Can't remove '" + symbol.getName() + "' from " +
              describe() + ": still used in the declaration of '" +
              other.getName() + "'");
        }
      }
    }
    symbols.remove(k);
    argumentList.remove(symbol);
  }

  /**
   * @return this table and the tables of scopes nested in it
   */
  private List<SymbolTable> tablesInScope() {
    List<SymbolTable> result = new ArrayList<SymbolTable>();
    result.add(this);
    if (node != null) {
      for (ScopingNode scope: node.walk(ScopingNode.class)) {
        SymbolTable t = scope.getSymbolTable();
        if (t != this) {
          result.add(t);
        }
      }
    }
    return result;
  }

  public List<Symbol> getSymbols() {
    return Collections.unmodifiableList(
                    new ArrayList<Symbol>(symbols.values()));
  }

  public List<DataSymbol> getDataSymbols() {
    return getSymbolsOfType(DataSymbol.class);
  }

  public List<ContainerSymbol> getContainerSymbols() {
    return getSymbolsOfType(ContainerSymbol.class);
  }

  public List<RoutineSymbol> getRoutineSymbols() {
    return getSymbolsOfType(RoutineSymbol.class);
  }

  public List<DataTypeSymbol> getDataTypeSymbols() {
    return getSymbolsOfType(DataTypeSymbol.class);
  }

  public <S extends Symbol> List<S> getSymbolsOfType(Class<S> cls) {
    List<S> result = new ArrayList<S>();
    for (Symbol s: symbols.values()) {
      if (cls.isInstance(s)) {
        result.add(cls.cast(s));
      }
    }
    return result;
  }

  /**
   * @return symbols imported from the given module
   */
  public List<Symbol> getImports(ContainerSymbol container) {
    List<Symbol> result = new ArrayList<Symbol>();
    for (Symbol s: symbols.values()) {
      if (s.isImport() &&
          ((Import)s.getInterface()).getContainer() == container) {
        result.add(s);
      }
    }
    return result;
  }

  public List<DataSymbol> getArgumentList() {
    return Collections.unmodifiableList(argumentList);
  }

  /**
   * @param args arguments in order.  Each must be declared in this
   *        table with an argument interface.
   */
  public void setArgumentList(List<DataSymbol> args) {
    for (DataSymbol arg: args) {
      if (findLocal(arg.getName()) != arg) {
        throw new NotFound("Argument '" + arg.getName() +
                           "' is not declared in " + describe());
      }
      if (!arg.isArgument()) {
        throw new IllegalArgumentException("Symbol '" + arg.getName() +
            "' is in the argument list but has interface " +
            arg.getInterface());
      }
    }
    argumentList.clear();
    argumentList.addAll(args);
  }

  /**
   * Mark unresolved symbols that are public in a wildcard-imported
   * module as imported from it.
   * @param modules
   * @return number of symbols resolved
   */
  public int resolveImports(ModuleManager modules) {
    int resolved = 0;
    for (ContainerSymbol csym: getContainerSymbols()) {
      if (!csym.hasWildcardImport() || modules.find(csym.getName()) == null) {
        continue;
      }
      SymbolTable external = csym.getContainer(modules).getSymbolTable();
      for (Symbol s: symbols.values()) {
        if (!s.isUnresolved()) {
          continue;
        }
        Symbol ext = external.findLocal(s.getName());
        if (ext != null && ext.getVisibility() == Visibility.PUBLIC) {
          s.setInterface(new Import(csym));
          resolved++;
        }
      }
    }
    return resolved;
  }

  /**
   * Copy this table, with fresh symbols that refer to each other
   * rather than to the symbols of this table.
   * @param remap filled with mapping from old to new symbols
   * @return the copy, not attached to any node
   */
  public SymbolTable deepCopy(Map<Symbol, Symbol> remap) {
    SymbolTable copy = new SymbolTable();
    Map<Symbol, Symbol> local = new IdentityHashMap<Symbol, Symbol>();
    for (Symbol s: symbols.values()) {
      Symbol sCopy = s.copy();
      local.put(s, sCopy);
      copy.add(sCopy);
    }
    for (Symbol sCopy: copy.symbols.values()) {
      sCopy.remapReferences(local);
    }
    for (DataSymbol arg: argumentList) {
      copy.argumentList.add((DataSymbol)local.get(arg));
    }
    copy.reservedNames.addAll(reservedNames);
    copy.nameCounters.putAll(nameCounters);
    remap.putAll(local);
    return copy;
  }

  /**
   * Redirect references from symbols in this table to symbols in remap,
   * e.g. kind parameters declared in an enclosing scope that was copied
   * along with this one.
   */
  public void remapReferences(Map<Symbol, Symbol> remap) {
    for (Symbol s: symbols.values()) {
      s.remapReferences(remap);
    }
  }

  public SymbolTable deepCopy() {
    return deepCopy(new IdentityHashMap<Symbol, Symbol>());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Symbol Table");
    if (node != null) {
      sb.append(" of ").append(node.describe());
    }
    sb.append(":\n");
    for (Symbol s: symbols.values()) {
      sb.append(s.toString()).append("\n");
    }
    return sb.toString();
  }
}
